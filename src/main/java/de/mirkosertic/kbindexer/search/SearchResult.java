package de.mirkosertic.kbindexer.search;

import de.mirkosertic.kbindexer.model.DocumentNode;

import java.nio.file.Path;
import java.util.List;

/**
 * A node that survived every term of a keyword sequence.
 *
 * @param file           file the node was found in
 * @param node           the matching node
 * @param matchedContent the node content the last term was matched against
 * @param searchPath     the terms that led to this node, anchor term first
 */
public record SearchResult(Path file, DocumentNode node, String matchedContent, List<String> searchPath) {

    public SearchResult {
        searchPath = List.copyOf(searchPath);
    }

    @Override
    public String toString() {
        return file + ": " + node.getText() + " (Path: " + String.join(" -> ", searchPath) + ")";
    }
}
