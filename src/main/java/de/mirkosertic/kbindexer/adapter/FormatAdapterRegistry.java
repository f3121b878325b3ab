package de.mirkosertic.kbindexer.adapter;

import de.mirkosertic.kbindexer.config.ApplicationConfig;
import de.mirkosertic.kbindexer.config.FileTypeConfig;
import de.mirkosertic.kbindexer.config.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The adapters of one indexing run, in configuration order. Built once and passed to whoever
 * needs to pick an adapter for a file.
 */
public class FormatAdapterRegistry {

    private static final Logger logger = LoggerFactory.getLogger(FormatAdapterRegistry.class);

    private final List<FormatAdapter> adapters;

    public FormatAdapterRegistry(final List<? extends FormatAdapter> adapters) {
        this.adapters = List.copyOf(adapters);
    }

    /**
     * One adapter per configured file type.
     *
     * @throws InvalidConfigurationException if a file type names an unknown handler
     */
    public static FormatAdapterRegistry fromConfig(final ApplicationConfig config) {
        final List<FormatAdapter> adapters = new ArrayList<>();
        for (final FileTypeConfig fileType : config.getFileTypes()) {
            adapters.add(createAdapter(fileType));
        }
        return new FormatAdapterRegistry(adapters);
    }

    static FormatAdapter createAdapter(final FileTypeConfig fileType) {
        return switch (fileType.handler().toLowerCase(Locale.ROOT)) {
            case "freeplane", "freeplanehandler" -> new FreeplaneAdapter(fileType);
            case "markdown", "markdownhandler" -> new MarkdownAdapter(fileType);
            default -> throw new InvalidConfigurationException(
                    "Unknown handler '" + fileType.handler() + "' for file type '" + fileType.name() + "'");
        };
    }

    /**
     * Same adapters, each wrapped so that a file is parsed at most once.
     */
    public FormatAdapterRegistry withTreeCache(final long maximumSize) {
        final List<FormatAdapter> cached = new ArrayList<>(adapters.size());
        for (final FormatAdapter adapter : adapters) {
            cached.add(adapter instanceof CachingFormatAdapter ? adapter : new CachingFormatAdapter(adapter, maximumSize));
        }
        return new FormatAdapterRegistry(cached);
    }

    /**
     * The first adapter, in configuration order, that can handle the file.
     */
    public Optional<FormatAdapter> adapterFor(final Path file) {
        for (final FormatAdapter adapter : adapters) {
            if (adapter.canHandle(file)) {
                return Optional.of(adapter);
            }
        }
        return Optional.empty();
    }

    /**
     * File to adapter map in the order of {@code files}; files nobody can handle are left out.
     */
    public Map<Path, FormatAdapter> adaptersFor(final List<Path> files) {
        final Map<Path, FormatAdapter> result = new LinkedHashMap<>();
        for (final Path file : files) {
            final Optional<FormatAdapter> adapter = adapterFor(file);
            if (adapter.isPresent()) {
                result.put(file, adapter.get());
            } else {
                logger.debug("No adapter for file: {}", file);
            }
        }
        logger.info("Found adapters for {} of {} files", result.size(), files.size());
        return result;
    }

    public List<FormatAdapter> getAdapters() {
        return adapters;
    }

    /**
     * Releases cached trees of all caching adapters.
     */
    public void clearCaches() {
        for (final FormatAdapter adapter : adapters) {
            if (adapter instanceof CachingFormatAdapter caching) {
                caching.clear();
            }
        }
    }
}
