package de.mirkosertic.kbindexer.crawler;

import de.mirkosertic.kbindexer.config.ApplicationConfig;
import de.mirkosertic.kbindexer.config.FileTypeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Finds the documents of a run. The returned order is the file order of every search.
 */
public class DocumentDiscoveryService {

    private static final Logger logger = LoggerFactory.getLogger(DocumentDiscoveryService.class);

    private final List<String> includeDirectories;
    private final FilePatternMatcher matcher;

    public DocumentDiscoveryService(final ApplicationConfig config) {
        this(config.getIncludeDirectories(), extensionsOf(config.getFileTypes()), config.getExcludePatterns());
    }

    public DocumentDiscoveryService(final List<String> includeDirectories,
                                    final List<String> extensions,
                                    final List<String> excludePatterns) {
        this.includeDirectories = List.copyOf(includeDirectories);
        this.matcher = new FilePatternMatcher(extensions, excludePatterns);
    }

    /**
     * @return absolute, normalized paths without duplicates, sorted lexicographically
     */
    public List<Path> discover() {
        final Set<Path> files = new TreeSet<>();
        for (final String directory : includeDirectories) {
            final Path dirPath = Paths.get(directory).toAbsolutePath().normalize();

            if (Files.isRegularFile(dirPath)) {
                if (matcher.shouldInclude(dirPath)) {
                    files.add(dirPath);
                } else {
                    logger.debug("Skipping {}: no configured file type or excluded", dirPath);
                }
                continue;
            }

            if (!Files.isDirectory(dirPath)) {
                logger.warn("Include path does not exist: {}", directory);
                continue;
            }

            final int before = files.size();
            try (final Stream<Path> paths = Files.walk(dirPath)) {
                paths.filter(Files::isRegularFile)
                        .filter(matcher::shouldInclude)
                        .map(path -> path.toAbsolutePath().normalize())
                        .forEach(files::add);
            } catch (final IOException | UncheckedIOException e) {
                logger.error("Error scanning directory: {}", directory, e);
            }
            logger.info("Found {} documents in {}", files.size() - before, dirPath);
        }
        return List.copyOf(files);
    }

    static List<String> extensionsOf(final List<FileTypeConfig> fileTypes) {
        return fileTypes.stream()
                .flatMap(fileType -> fileType.extensions().stream())
                .distinct()
                .toList();
    }
}
