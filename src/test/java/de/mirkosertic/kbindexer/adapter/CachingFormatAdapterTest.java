package de.mirkosertic.kbindexer.adapter;

import de.mirkosertic.kbindexer.model.DocumentNode;
import de.mirkosertic.kbindexer.search.KeywordPatterns;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("CachingFormatAdapter Tests")
class CachingFormatAdapterTest {

    private static final Path FILE = Path.of("ideas.mm");

    private FormatAdapter delegate;
    private CachingFormatAdapter cachingAdapter;

    @BeforeEach
    void setUp() {
        delegate = mock(FormatAdapter.class);
        cachingAdapter = new CachingFormatAdapter(delegate, 100);
    }

    @Test
    @DisplayName("Parses a file once and returns the same tree afterwards")
    void parsesOnce() throws IOException {
        final DocumentNode root = new DocumentNode("root", "Root");
        when(delegate.rootNodes(FILE)).thenReturn(List.of(root));

        final List<DocumentNode> first = cachingAdapter.rootNodes(FILE);
        final List<DocumentNode> second = cachingAdapter.rootNodes(FILE);

        assertThat(first).containsExactly(root);
        assertThat(second.get(0)).isSameAs(root);
        verify(delegate, times(1)).rootNodes(FILE);
        assertThat(cachingAdapter.getStats().hitCount()).isEqualTo(1);
        assertThat(cachingAdapter.getCachedDocumentCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("A failed parse is remembered and rethrown")
    void failureIsMemoized() throws IOException {
        final DocumentParseException failure = new DocumentParseException(FILE, "Malformed mind map XML");
        when(delegate.rootNodes(FILE)).thenThrow(failure);

        assertThatThrownBy(() -> cachingAdapter.rootNodes(FILE)).isSameAs(failure);
        assertThatThrownBy(() -> cachingAdapter.rootNodes(FILE)).isSameAs(failure);
        verify(delegate, times(1)).rootNodes(FILE);
    }

    @Test
    @DisplayName("Clearing the cache parses again")
    void clearParsesAgain() throws IOException {
        when(delegate.rootNodes(FILE)).thenReturn(List.of(new DocumentNode("root", "Root")));

        cachingAdapter.rootNodes(FILE);
        cachingAdapter.clear();
        cachingAdapter.rootNodes(FILE);

        verify(delegate, times(2)).rootNodes(FILE);
    }

    @Test
    @DisplayName("Search, content and identity calls go to the delegate")
    void delegatesEverythingElse() {
        final DocumentNode node = new DocumentNode("n", "content");
        final Pattern pattern = KeywordPatterns.raw("content");
        when(delegate.name()).thenReturn("freeplane");
        when(delegate.canHandle(FILE)).thenReturn(true);
        when(delegate.nodeContent(node)).thenReturn("content");
        when(delegate.subtreeSearch(any(), any(), anyBoolean())).thenReturn(List.of(node));
        when(delegate.linkFragment(node)).thenReturn("n");

        assertThat(cachingAdapter.name()).isEqualTo("freeplane");
        assertThat(cachingAdapter.canHandle(FILE)).isTrue();
        assertThat(cachingAdapter.nodeContent(node)).isEqualTo("content");
        assertThat(cachingAdapter.subtreeSearch(node, pattern, false)).containsExactly(node);
        assertThat(cachingAdapter.linkFragment(node)).isEqualTo("n");

        verify(delegate).subtreeSearch(node, pattern, false);
    }
}
