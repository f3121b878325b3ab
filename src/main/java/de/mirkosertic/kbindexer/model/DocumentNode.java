package de.mirkosertic.kbindexer.model;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One structural unit of a parsed document: a mind-map node, a Markdown heading or a list item.
 *
 * <p>Children are kept in document order. The parent link is a plain back-reference that is only
 * ever written by {@link #addChild(DocumentNode)}; the children list is the owning edge.</p>
 *
 * <p>Equality is identity. Two nodes with the same id in different documents are different nodes.</p>
 */
public class DocumentNode {

    private final String id;
    private final String content;
    private final String text;
    private final @Nullable Path fileOwner;
    private final NodeKind kind;
    private final Map<String, Object> metadata;
    private final List<DocumentNode> children = new ArrayList<>();
    private @Nullable DocumentNode parent;

    public DocumentNode(final String id, final String content) {
        this(id, content, null, null, NodeKind.GENERIC, Map.of());
    }

    public DocumentNode(final String id,
                        final String content,
                        final @Nullable String text,
                        final @Nullable Path fileOwner,
                        final NodeKind kind,
                        final Map<String, Object> metadata) {
        this.id = id;
        this.content = content == null ? "" : content;
        this.text = text == null || text.isEmpty() ? this.content : text;
        this.fileOwner = fileOwner;
        this.kind = kind;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Appends {@code child} as the last child of this node and points its parent link here.
     *
     * @throws IllegalStateException if the child already has a parent
     * @throws IllegalArgumentException if the child is this node or one of its ancestors
     */
    public void addChild(final DocumentNode child) {
        if (child.parent != null) {
            throw new IllegalStateException("Node " + child.id + " already has parent " + child.parent.id);
        }
        for (DocumentNode current = this; current != null; current = current.parent) {
            if (current == child) {
                throw new IllegalArgumentException("Adding node " + child.id + " to " + id + " would create a cycle");
            }
        }
        child.parent = this;
        children.add(child);
    }

    /**
     * All nodes below this one in pre-order, excluding this node.
     */
    public List<DocumentNode> descendants() {
        final List<DocumentNode> result = new ArrayList<>();
        collectDescendants(this, result);
        return result;
    }

    private static void collectDescendants(final DocumentNode node, final List<DocumentNode> result) {
        for (final DocumentNode child : node.children) {
            result.add(child);
            collectDescendants(child, result);
        }
    }

    public List<DocumentNode> childrenOfKind(final NodeKind nodeKind) {
        return children.stream()
                .filter(child -> child.kind == nodeKind)
                .toList();
    }

    /**
     * The {@code text} of every node from the root down to this node, root first. Empty texts stay
     * empty.
     */
    public List<String> pathLabels() {
        final List<String> labels = new ArrayList<>();
        for (DocumentNode current = this; current != null; current = current.parent) {
            labels.add(current.text);
        }
        Collections.reverse(labels);
        return labels;
    }

    public String getId() {
        return id;
    }

    public String getContent() {
        return content;
    }

    public String getText() {
        return text;
    }

    public @Nullable Path getFileOwner() {
        return fileOwner;
    }

    public NodeKind getKind() {
        return kind;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public @Nullable Object metadata(final String key) {
        return metadata.get(key);
    }

    public @Nullable DocumentNode getParent() {
        return parent;
    }

    public List<DocumentNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String toString() {
        return kind + "[" + id + ": " + text + "]";
    }
}
