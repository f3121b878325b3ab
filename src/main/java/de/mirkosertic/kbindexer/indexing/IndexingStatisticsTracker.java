package de.mirkosertic.kbindexer.indexing;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts what an indexing run did. Thread-safe; trees are loaded from several threads.
 */
public class IndexingStatisticsTracker {

    private final AtomicLong filesFound = new AtomicLong(0);
    private final AtomicLong filesWithAdapter = new AtomicLong(0);
    private final AtomicLong filesParsed = new AtomicLong(0);
    private final AtomicLong filesFailed = new AtomicLong(0);
    private final AtomicLong nodesLoaded = new AtomicLong(0);
    private final AtomicLong queriesRun = new AtomicLong(0);
    private final AtomicLong queriesFailed = new AtomicLong(0);
    private final AtomicLong resultsFound = new AtomicLong(0);

    private volatile long startTime = System.currentTimeMillis();

    public void reset() {
        filesFound.set(0);
        filesWithAdapter.set(0);
        filesParsed.set(0);
        filesFailed.set(0);
        nodesLoaded.set(0);
        queriesRun.set(0);
        queriesFailed.set(0);
        resultsFound.set(0);
        startTime = System.currentTimeMillis();
    }

    public void setFilesFound(final long count) {
        filesFound.set(count);
    }

    public void setFilesWithAdapter(final long count) {
        filesWithAdapter.set(count);
    }

    public void recordFileParsed(final long nodeCount) {
        filesParsed.incrementAndGet();
        nodesLoaded.addAndGet(nodeCount);
    }

    public void recordFileFailed() {
        filesFailed.incrementAndGet();
    }

    public void recordQuery(final long resultCount) {
        queriesRun.incrementAndGet();
        resultsFound.addAndGet(resultCount);
    }

    public void recordQueryFailed() {
        queriesRun.incrementAndGet();
        queriesFailed.incrementAndGet();
    }

    public IndexingStatistics snapshot() {
        return new IndexingStatistics(
                filesFound.get(),
                filesWithAdapter.get(),
                filesParsed.get(),
                filesFailed.get(),
                nodesLoaded.get(),
                queriesRun.get(),
                queriesFailed.get(),
                resultsFound.get(),
                startTime,
                System.currentTimeMillis());
    }
}
