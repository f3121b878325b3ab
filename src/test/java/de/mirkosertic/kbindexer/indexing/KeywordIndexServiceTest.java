package de.mirkosertic.kbindexer.indexing;

import de.mirkosertic.kbindexer.adapter.InMemoryFormatAdapter;
import de.mirkosertic.kbindexer.keywords.KeywordEntry;
import de.mirkosertic.kbindexer.keywords.KeywordFileParser;
import de.mirkosertic.kbindexer.model.DocumentNode;
import de.mirkosertic.kbindexer.search.HierarchicalSearchEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static de.mirkosertic.kbindexer.adapter.InMemoryFormatAdapter.node;
import static de.mirkosertic.kbindexer.adapter.InMemoryFormatAdapter.tree;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("KeywordIndexService Tests")
class KeywordIndexServiceTest {

    private static final Path GUIDE = Path.of("guide.mm");

    private final IndexingStatisticsTracker tracker = new IndexingStatisticsTracker();
    private final KeywordIndexService service = new KeywordIndexService(new HierarchicalSearchEngine(), tracker);

    private InMemoryFormatAdapter adapter;
    private DocumentNode definition;

    @BeforeEach
    void setUp() {
        definition = node("A1a", "Example1", "async definition one");
        final DocumentNode root = tree(node("R", "Guide", "Guide"),
                tree(node("A", "Functions", "function basics"),
                        tree(node("A1", "Async", "async function advanced"), definition)));
        adapter = new InMemoryFormatAdapter().add(GUIDE, root);
    }

    private List<KeywordIndexEntry> build(final String... keywordLines) {
        final List<KeywordEntry> entries = new KeywordFileParser().parseLines(List.of(keywordLines));
        return service.buildIndex(entries, List.of(GUIDE), Map.of(GUIDE, adapter));
    }

    @Test
    @DisplayName("Index mirrors the keyword hierarchy and runs one query per leaf")
    void mirrorsHierarchy() {
        final List<KeywordIndexEntry> index = build(
                "Programming",
                "\tfunction:async:definition",
                "\tnothing_here",
                "basics");

        assertThat(index).extracting(KeywordIndexEntry::label).containsExactly("Programming", "basics");

        final KeywordIndexEntry programming = index.get(0);
        assertThat(programming.isQuery()).isFalse();
        assertThat(programming.results()).isEmpty();
        assertThat(programming.children()).hasSize(2);
        assertThat(programming.totalResultCount()).isEqualTo(1);

        final KeywordIndexEntry query = programming.children().get(0);
        assertThat(query.searchSequence()).containsExactly("function", "async", "definition");
        assertThat(query.displayName()).isEqualTo("function → async → definition");
        assertThat(query.results().get(GUIDE)).extracting(result -> result.node()).containsExactly(definition);

        final KeywordIndexEntry empty = programming.children().get(1);
        assertThat(empty.results()).isEmpty();
        assertThat(empty.error()).isNull();

        assertThat(tracker.snapshot().queriesRun()).isEqualTo(3);
        assertThat(tracker.snapshot().resultsFound()).isEqualTo(2);
    }

    @Test
    @DisplayName("Malformed pattern is recorded and siblings still run")
    void malformedPatternDoesNotStopSiblings() {
        final List<KeywordIndexEntry> index = build(
                "Broken",
                "\tfunction:(unclosed",
                "\tasync");

        final KeywordIndexEntry broken = index.get(0).children().get(0);
        assertThat(broken.error()).contains("(unclosed");
        assertThat(broken.results()).isEmpty();

        final KeywordIndexEntry sibling = index.get(0).children().get(1);
        assertThat(sibling.error()).isNull();
        assertThat(sibling.totalResultCount()).isEqualTo(2);

        assertThat(tracker.snapshot().queriesFailed()).isEqualTo(1);
    }
}
