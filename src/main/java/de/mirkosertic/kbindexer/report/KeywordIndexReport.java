package de.mirkosertic.kbindexer.report;

import java.time.Instant;
import java.util.List;

/**
 * Root of the JSON report written at the end of a run.
 */
public record KeywordIndexReport(
        Instant generatedAt,
        String version,
        List<String> files,
        List<String> warnings,
        RunSummary statistics,
        List<ReportEntry> entries
) {
}
