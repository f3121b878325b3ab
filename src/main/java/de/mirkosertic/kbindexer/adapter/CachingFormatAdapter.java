package de.mirkosertic.kbindexer.adapter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import de.mirkosertic.kbindexer.model.DocumentNode;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses every file once per indexing run and hands out the same tree to every query.
 *
 * <p>A failed parse is remembered as well, so a broken file costs one attempt per run and keeps
 * failing the same way. Everything except {@link #rootNodes(Path)} goes straight to the delegate,
 * including {@link #subtreeSearch(DocumentNode, Pattern, boolean)}, so format specific search
 * behaviour is preserved.</p>
 *
 * <p>Thread-safe; trees may be loaded from several threads.</p>
 */
public class CachingFormatAdapter implements FormatAdapter {

    private record ParsedDocument(List<DocumentNode> roots, @Nullable IOException failure) {
    }

    private final FormatAdapter delegate;
    private final Cache<Path, ParsedDocument> cache;

    public CachingFormatAdapter(final FormatAdapter delegate, final long maximumSize) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    @Override
    public String name() {
        return delegate.name();
    }

    @Override
    public boolean canHandle(final Path file) {
        return delegate.canHandle(file);
    }

    @Override
    public List<DocumentNode> rootNodes(final Path file) throws IOException {
        final ParsedDocument parsed = cache.get(file, this::parse);
        if (parsed.failure() != null) {
            throw parsed.failure();
        }
        return parsed.roots();
    }

    private ParsedDocument parse(final Path file) {
        try {
            return new ParsedDocument(List.copyOf(delegate.rootNodes(file)), null);
        } catch (final IOException e) {
            return new ParsedDocument(List.of(), e);
        }
    }

    @Override
    public String nodeContent(final DocumentNode node) {
        return delegate.nodeContent(node);
    }

    @Override
    public List<DocumentNode> childNodes(final DocumentNode node) {
        return delegate.childNodes(node);
    }

    @Override
    public List<DocumentNode> subtreeSearch(final DocumentNode node, final Pattern pattern, final boolean includeDescendants) {
        return delegate.subtreeSearch(node, pattern, includeDescendants);
    }

    @Override
    public @Nullable String linkFragment(final DocumentNode node) {
        return delegate.linkFragment(node);
    }

    public FormatAdapter getDelegate() {
        return delegate;
    }

    public CacheStats getStats() {
        return cache.stats();
    }

    public long getCachedDocumentCount() {
        return cache.estimatedSize();
    }

    /**
     * Drops all trees; called when the run that built them is finished.
     */
    public void clear() {
        cache.invalidateAll();
    }
}
