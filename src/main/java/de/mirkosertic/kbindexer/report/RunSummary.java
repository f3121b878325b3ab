package de.mirkosertic.kbindexer.report;

import de.mirkosertic.kbindexer.indexing.IndexingStatistics;

public record RunSummary(
        long filesFound,
        long filesParsed,
        long filesFailed,
        long nodesLoaded,
        long queriesRun,
        long queriesFailed,
        long resultsFound,
        long elapsedTimeMs
) {
    public static RunSummary of(final IndexingStatistics statistics) {
        return new RunSummary(
                statistics.filesFound(),
                statistics.filesParsed(),
                statistics.filesFailed(),
                statistics.nodesLoaded(),
                statistics.queriesRun(),
                statistics.queriesFailed(),
                statistics.resultsFound(),
                statistics.elapsedTimeMs()
        );
    }
}
