package de.mirkosertic.kbindexer.indexing;

import de.mirkosertic.kbindexer.adapter.FormatAdapter;
import de.mirkosertic.kbindexer.keywords.KeywordEntry;
import de.mirkosertic.kbindexer.search.HierarchicalSearchEngine;
import de.mirkosertic.kbindexer.search.InvalidKeywordPatternException;
import de.mirkosertic.kbindexer.search.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the keyword index: one search per leaf of the keyword hierarchy, results arranged like
 * the keyword files arrange the queries.
 */
public class KeywordIndexService {

    private static final Logger logger = LoggerFactory.getLogger(KeywordIndexService.class);

    private final HierarchicalSearchEngine searchEngine;
    private final IndexingStatisticsTracker statisticsTracker;

    public KeywordIndexService(final HierarchicalSearchEngine searchEngine, final IndexingStatisticsTracker statisticsTracker) {
        this.searchEngine = searchEngine;
        this.statisticsTracker = statisticsTracker;
    }

    public List<KeywordIndexEntry> buildIndex(final List<KeywordEntry> entries,
                                              final List<Path> files,
                                              final Map<Path, ? extends FormatAdapter> adapters) {
        final List<KeywordIndexEntry> index = new ArrayList<>(entries.size());
        for (final KeywordEntry entry : entries) {
            index.add(buildEntry(entry, files, adapters));
        }
        return index;
    }

    private KeywordIndexEntry buildEntry(final KeywordEntry entry,
                                         final List<Path> files,
                                         final Map<Path, ? extends FormatAdapter> adapters) {
        if (!entry.isLeaf()) {
            final List<KeywordIndexEntry> children = new ArrayList<>(entry.getChildren().size());
            for (final KeywordEntry child : entry.getChildren()) {
                children.add(buildEntry(child, files, adapters));
            }
            return new KeywordIndexEntry(entry.getText(), entry.displayName(), null, Map.of(), null, children);
        }

        final List<String> sequence = entry.searchSequence();
        try {
            final Map<Path, List<SearchResult>> results = searchEngine.searchSequence(files, sequence, adapters);
            final long resultCount = results.values().stream().mapToLong(List::size).sum();
            statisticsTracker.recordQuery(resultCount);
            logger.debug("Query '{}' (line {}) found {} results in {} files",
                    entry.getText(), entry.getLineNumber(), resultCount, results.size());
            return new KeywordIndexEntry(entry.getText(), entry.displayName(), sequence, results, null, List.of());
        } catch (final InvalidKeywordPatternException e) {
            statisticsTracker.recordQueryFailed();
            logger.warn("Skipping query '{}' at line {}: {}", entry.getText(), entry.getLineNumber(), e.getMessage());
            return new KeywordIndexEntry(entry.getText(), entry.displayName(), sequence, Map.of(), e.getMessage(), List.of());
        }
    }
}
