package de.mirkosertic.kbindexer.indexing;

/**
 * Snapshot of one indexing run.
 */
public record IndexingStatistics(
        long filesFound,
        long filesWithAdapter,
        long filesParsed,
        long filesFailed,
        long nodesLoaded,
        long queriesRun,
        long queriesFailed,
        long resultsFound,
        long startTimeMs,
        long endTimeMs
) {
    public long elapsedTimeMs() {
        return endTimeMs - startTimeMs;
    }

    public double filesPerSecond() {
        final long elapsedMs = elapsedTimeMs();
        if (elapsedMs == 0) return 0;
        return (double) filesParsed / (elapsedMs / 1000.0);
    }
}
