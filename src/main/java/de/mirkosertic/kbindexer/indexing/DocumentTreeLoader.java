package de.mirkosertic.kbindexer.indexing;

import de.mirkosertic.kbindexer.adapter.FormatAdapter;
import de.mirkosertic.kbindexer.model.DocumentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Parses every document of a run up front, in parallel. With caching adapters the trees are then
 * held for the queries that follow; a file that fails here is counted and later skipped by the
 * search engine.
 */
public class DocumentTreeLoader {

    private static final Logger logger = LoggerFactory.getLogger(DocumentTreeLoader.class);

    private final IndexingExecutorService executor;
    private final IndexingStatisticsTracker statisticsTracker;

    public DocumentTreeLoader(final IndexingExecutorService executor, final IndexingStatisticsTracker statisticsTracker) {
        this.executor = executor;
        this.statisticsTracker = statisticsTracker;
    }

    /**
     * @return root nodes per successfully parsed file, in the order of {@code adapters}
     */
    public Map<Path, List<DocumentNode>> loadAll(final Map<Path, ? extends FormatAdapter> adapters) {
        final Map<Path, Future<List<DocumentNode>>> futures = new LinkedHashMap<>();
        for (final Map.Entry<Path, ? extends FormatAdapter> entry : adapters.entrySet()) {
            final Path file = entry.getKey();
            final FormatAdapter adapter = entry.getValue();
            futures.put(file, executor.submit(() -> adapter.rootNodes(file)));
        }

        final Map<Path, List<DocumentNode>> trees = new LinkedHashMap<>();
        for (final Map.Entry<Path, Future<List<DocumentNode>>> entry : futures.entrySet()) {
            final Path file = entry.getKey();
            try {
                final List<DocumentNode> roots = entry.getValue().get();
                trees.put(file, roots);
                statisticsTracker.recordFileParsed(countNodes(roots));
            } catch (final ExecutionException e) {
                statisticsTracker.recordFileFailed();
                final Throwable cause = e.getCause();
                if (cause instanceof IOException) {
                    logger.warn("Cannot load document {}: {}", file, cause.getMessage());
                } else {
                    logger.error("Unexpected error loading document {}", file, cause);
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while loading document trees", e);
            }
        }

        logger.info("Loaded {} document trees, {} failed", trees.size(), futures.size() - trees.size());
        return trees;
    }

    private static long countNodes(final List<DocumentNode> roots) {
        long count = 0;
        for (final DocumentNode root : roots) {
            count += 1 + root.descendants().size();
        }
        return count;
    }
}
