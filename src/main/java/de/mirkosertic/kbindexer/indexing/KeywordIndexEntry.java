package de.mirkosertic.kbindexer.indexing;

import de.mirkosertic.kbindexer.search.SearchResult;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node of the keyword index: mirrors a keyword file entry and, for leaves, carries the results
 * of its query or the reason the query failed.
 *
 * @param label          the keyword file line
 * @param displayName    label with {@code :} shown as arrows
 * @param searchSequence terms of the query, null for organizational entries
 * @param results        results per file in search order, empty when nothing matched or the entry is organizational
 * @param error          why the query failed, null on success
 * @param children       entries below this one
 */
public record KeywordIndexEntry(
        String label,
        String displayName,
        @Nullable List<String> searchSequence,
        Map<Path, List<SearchResult>> results,
        @Nullable String error,
        List<KeywordIndexEntry> children
) {
    public KeywordIndexEntry {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        children = List.copyOf(children);
    }

    public boolean isQuery() {
        return searchSequence != null;
    }

    /**
     * Results of this entry and all entries below it.
     */
    public long totalResultCount() {
        long count = 0;
        for (final List<SearchResult> fileResults : results.values()) {
            count += fileResults.size();
        }
        for (final KeywordIndexEntry child : children) {
            count += child.totalResultCount();
        }
        return count;
    }
}
