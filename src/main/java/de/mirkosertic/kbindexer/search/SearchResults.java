package de.mirkosertic.kbindexer.search;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Sorting, filtering and de-duplication of engine output for reporting.
 */
public final class SearchResults {

    public enum SortKey {
        /** Keep the engine's order: files as given, nodes in document order. */
        DOCUMENT_ORDER,
        FILE_PATH,
        NODE_TEXT,
        SEARCH_PATH
    }

    private record NodeKey(Path file, String nodeId) {
    }

    private SearchResults() {
    }

    public static List<SearchResult> flatten(final Map<Path, List<SearchResult>> resultsByFile) {
        final List<SearchResult> flattened = new ArrayList<>();
        for (final List<SearchResult> fileResults : resultsByFile.values()) {
            flattened.addAll(fileResults);
        }
        return flattened;
    }

    /**
     * Stable sort by the given key; ties are broken by file path and node text.
     */
    public static List<SearchResult> sort(final List<SearchResult> results, final SortKey sortKey) {
        final Comparator<SearchResult> byFile = Comparator.comparing(result -> result.file().toString());
        final Comparator<SearchResult> byText = Comparator.comparing(result -> result.node().getText());
        final Comparator<SearchResult> comparator = switch (sortKey) {
            case DOCUMENT_ORDER -> null;
            case FILE_PATH -> byFile.thenComparing(byText);
            case NODE_TEXT -> byText.thenComparing(byFile);
            case SEARCH_PATH -> Comparator.<SearchResult>comparingInt(result -> result.searchPath().size())
                    .thenComparing(byFile)
                    .thenComparing(byText);
        };
        final List<SearchResult> sorted = new ArrayList<>(results);
        if (comparator != null) {
            sorted.sort(comparator);
        }
        return sorted;
    }

    public static List<SearchResult> filterByExtension(final List<SearchResult> results, final Collection<String> extensions) {
        return results.stream()
                .filter(result -> {
                    final String name = result.file().toString().toLowerCase(Locale.ROOT);
                    return extensions.stream().anyMatch(extension -> name.endsWith(extension.toLowerCase(Locale.ROOT)));
                })
                .toList();
    }

    /**
     * Drops results pointing at a node already reported for the same file, keeping the first.
     */
    public static List<SearchResult> deduplicate(final List<SearchResult> results) {
        final Set<NodeKey> seen = new HashSet<>();
        final List<SearchResult> deduplicated = new ArrayList<>();
        for (final SearchResult result : results) {
            if (seen.add(new NodeKey(result.file(), result.node().getId()))) {
                deduplicated.add(result);
            }
        }
        return deduplicated;
    }
}
