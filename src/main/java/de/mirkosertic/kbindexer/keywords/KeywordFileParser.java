package de.mirkosertic.kbindexer.keywords;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses tab indented keyword files.
 *
 * <pre>
 * # comment
 * Programming Concepts
 * 	Functions
 * 		function:definition
 * 		async:function
 * </pre>
 *
 * A tab is one level, four spaces count as one tab. Blank lines and lines starting with
 * {@code #} are ignored.
 */
public class KeywordFileParser {

    private static final Logger logger = LoggerFactory.getLogger(KeywordFileParser.class);

    public static final String DIRECT_SEARCHES = "Direct Searches";

    static final int DEEP_NESTING_WARNING_DEPTH = 7;

    /**
     * @throws NoSuchFileException if the file does not exist
     * @throws IOException if the file cannot be read
     */
    public List<KeywordEntry> parseFile(final Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "Keyword file not found");
        }
        final List<KeywordEntry> entries = parseLines(Files.readAllLines(file, StandardCharsets.UTF_8));
        logger.debug("Parsed {} root entries from {}", entries.size(), file);
        return entries;
    }

    public List<KeywordEntry> parseLines(final List<String> lines) {
        final List<KeywordEntry> roots = new ArrayList<>();
        final Deque<KeywordEntry> stack = new ArrayDeque<>();

        int lineNumber = 0;
        for (final String line : lines) {
            lineNumber++;
            final String content = line.strip();
            if (content.isEmpty() || content.startsWith("#")) {
                continue;
            }

            final int level = indentationLevel(line);
            while (!stack.isEmpty() && stack.peek().getLevel() >= level) {
                stack.pop();
            }

            final KeywordEntry entry = new KeywordEntry(content, level, lineNumber);
            if (stack.isEmpty()) {
                roots.add(entry);
            } else {
                stack.peek().addChild(entry);
            }
            stack.push(entry);
        }
        return roots;
    }

    static int indentationLevel(final String line) {
        double level = 0;
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (c == '\t') {
                level += 1;
            } else if (c == ' ') {
                level += 0.25;
            } else {
                break;
            }
        }
        return (int) level;
    }

    /**
     * Structural problems worth reporting; none of them stops indexing.
     */
    public List<String> validateStructure(final List<KeywordEntry> entries) {
        final List<String> warnings = new ArrayList<>();
        for (final KeywordEntry entry : entries) {
            validateEntry(entry, 1, warnings);
        }
        return warnings;
    }

    private void validateEntry(final KeywordEntry entry, final int depth, final List<String> warnings) {
        if (entry.getText().isBlank()) {
            warnings.add("Empty entry at line " + entry.getLineNumber());
        }
        if (!entry.isLeaf() && entry.getText().contains(":")) {
            warnings.add("Non-leaf entry contains colon at line " + entry.getLineNumber() + ": " + entry.getText());
        }
        // an empty term compiles to a pattern that matches almost every node
        if (entry.isLeaf() && !entry.getText().isBlank() && entry.searchSequence().stream().anyMatch(String::isEmpty)) {
            warnings.add("Empty search term at line " + entry.getLineNumber() + ": " + entry.getText());
        }
        // Reported once per branch, where it crosses the threshold
        if (depth == DEEP_NESTING_WARNING_DEPTH) {
            warnings.add("Very deep nesting (level " + depth + ") at line " + entry.getLineNumber());
        }
        for (final KeywordEntry child : entry.getChildren()) {
            validateEntry(child, depth + 1, warnings);
        }
    }

    /**
     * Sequences grouped by top-level category. Top-level leaves share the
     * {@value #DIRECT_SEARCHES} category.
     */
    public static Map<String, List<List<String>>> sequencesByCategory(final List<KeywordEntry> entries) {
        final Map<String, List<List<String>>> byCategory = new LinkedHashMap<>();
        for (final KeywordEntry entry : entries) {
            final String category = entry.isLeaf() ? DIRECT_SEARCHES : entry.getText();
            final List<List<String>> sequences = entry.searchSequences();
            if (!sequences.isEmpty()) {
                byCategory.computeIfAbsent(category, key -> new ArrayList<>()).addAll(sequences);
            }
        }
        return byCategory;
    }

    public static List<List<String>> flattenSearchSequences(final List<KeywordEntry> entries) {
        final List<List<String>> sequences = new ArrayList<>();
        for (final KeywordEntry entry : entries) {
            sequences.addAll(entry.searchSequences());
        }
        return sequences;
    }
}
