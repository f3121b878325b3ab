package de.mirkosertic.kbindexer.model;

/**
 * Role of a {@link DocumentNode} inside its document.
 */
public enum NodeKind {
    GENERIC,
    MINDMAP_NODE,
    HEADING,
    LIST_ITEM
}
