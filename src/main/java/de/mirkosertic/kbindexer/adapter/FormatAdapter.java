package de.mirkosertic.kbindexer.adapter;

import de.mirkosertic.kbindexer.model.DocumentNode;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Per-format capability the search engine works through: turns a file into document trees and
 * searches node content.
 *
 * <p>{@link #subtreeSearch(DocumentNode, Pattern, boolean)} has two modes and every implementation
 * must keep them exactly, otherwise multi-term narrowing gives different results:</p>
 * <ul>
 *   <li><b>collect</b> ({@code includeDescendants = true}): the node itself if it matches, then each
 *   child's collect results in child order. Nothing is skipped.</li>
 *   <li><b>narrow</b> ({@code includeDescendants = false}): {@code [node]} if the node matches, without
 *   looking at its children. Otherwise the children are tried in document order and the first one
 *   whose narrow search yields anything wins; later siblings are never examined.</li>
 * </ul>
 */
public interface FormatAdapter {

    /**
     * Configured name of the file type this adapter serves.
     */
    String name();

    boolean canHandle(Path file);

    /**
     * Parses the file into its top-level nodes.
     *
     * @throws DocumentParseException if the file content is malformed
     * @throws IOException if the file cannot be read
     */
    List<DocumentNode> rootNodes(Path file) throws IOException;

    /**
     * Text the search patterns are matched against.
     */
    String nodeContent(DocumentNode node);

    default List<DocumentNode> childNodes(final DocumentNode node) {
        return node.getChildren();
    }

    default List<DocumentNode> subtreeSearch(final DocumentNode node, final Pattern pattern, final boolean includeDescendants) {
        final boolean selfMatches = pattern.matcher(nodeContent(node)).find();
        if (!includeDescendants) {
            if (selfMatches) {
                return List.of(node);
            }
            for (final DocumentNode child : childNodes(node)) {
                final List<DocumentNode> childMatches = subtreeSearch(child, pattern, false);
                if (!childMatches.isEmpty()) {
                    return childMatches;
                }
            }
            return List.of();
        }

        final List<DocumentNode> matches = new ArrayList<>();
        if (selfMatches) {
            matches.add(node);
        }
        for (final DocumentNode child : childNodes(node)) {
            matches.addAll(subtreeSearch(child, pattern, true));
        }
        return matches;
    }

    /**
     * Fragment identifying the node inside its file for links, or null when the format has none.
     */
    default @Nullable String linkFragment(final DocumentNode node) {
        return null;
    }
}
