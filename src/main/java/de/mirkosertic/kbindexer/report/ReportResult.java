package de.mirkosertic.kbindexer.report;

import java.util.List;

/**
 * One search result as written to the report.
 *
 * @param link path of the file relative to the report, with the node's fragment when the format has one
 */
public record ReportResult(
        String file,
        String nodeId,
        String text,
        String kind,
        List<String> pathLabels,
        List<String> searchPath,
        String matchedContent,
        String link
) {
}
