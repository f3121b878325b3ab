package de.mirkosertic.kbindexer.crawler;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Locale;

public class FilePatternMatcher {

    private final List<String> extensions;
    private final List<PathMatcher> excludeMatchers;

    /**
     * @param extensions      accepted file name suffixes including the dot, compared case-insensitively
     * @param excludePatterns glob patterns matched against the absolute path
     */
    public FilePatternMatcher(final List<String> extensions, final List<String> excludePatterns) {
        this.extensions = extensions.stream()
                .map(extension -> extension.toLowerCase(Locale.ROOT))
                .toList();
        this.excludeMatchers = excludePatterns.stream()
                .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
                .toList();
    }

    public boolean shouldInclude(final Path file) {
        final Path absolute = file.toAbsolutePath().normalize();
        for (final PathMatcher excludeMatcher : excludeMatchers) {
            if (excludeMatcher.matches(absolute)) {
                return false;
            }
        }

        final Path fileName = absolute.getFileName();
        if (fileName == null) {
            return false;
        }
        final String name = fileName.toString().toLowerCase(Locale.ROOT);
        for (final String extension : extensions) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
