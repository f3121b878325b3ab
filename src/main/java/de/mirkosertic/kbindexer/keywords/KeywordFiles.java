package de.mirkosertic.kbindexer.keywords;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Entries of several keyword files, with the warnings collected while reading them.
 * A file that cannot be read becomes a warning; the other files are still loaded.
 */
public record KeywordFiles(List<KeywordEntry> entries, List<String> warnings) {

    private static final Logger logger = LoggerFactory.getLogger(KeywordFiles.class);

    public KeywordFiles {
        entries = List.copyOf(entries);
        warnings = List.copyOf(warnings);
    }

    public static KeywordFiles load(final List<Path> keywordFiles, final KeywordFileParser parser) {
        final List<KeywordEntry> entries = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();

        for (final Path file : keywordFiles) {
            try {
                final List<KeywordEntry> fileEntries = parser.parseFile(file);
                entries.addAll(fileEntries);
                for (final String warning : parser.validateStructure(fileEntries)) {
                    warnings.add(file + ": " + warning);
                }
                logger.info("Loaded {} root entries from keyword file {}", fileEntries.size(), file);
            } catch (final IOException e) {
                logger.warn("Error loading keyword file {}: {}", file, e.getMessage());
                warnings.add("Error loading " + file + ": " + e.getMessage());
            }
        }

        for (final String warning : warnings) {
            logger.warn("Keyword file warning: {}", warning);
        }
        return new KeywordFiles(entries, warnings);
    }
}
