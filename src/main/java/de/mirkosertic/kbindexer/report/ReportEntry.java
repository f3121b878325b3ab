package de.mirkosertic.kbindexer.report;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Report form of a keyword index entry. Organizational entries carry no search sequence.
 */
public record ReportEntry(
        String label,
        String displayName,
        @Nullable List<String> searchSequence,
        @Nullable String error,
        long resultCount,
        List<ReportResult> results,
        List<ReportEntry> children
) {
}
