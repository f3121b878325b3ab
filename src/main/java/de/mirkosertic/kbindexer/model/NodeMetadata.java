package de.mirkosertic.kbindexer.model;

/**
 * Well-known keys of the {@link DocumentNode} metadata bag.
 */
public final class NodeMetadata {

    public static final String HEADING_LEVEL = "heading_level";
    public static final String LIST_LEVEL = "list_level";
    public static final String LINE_NUMBER = "line_number";
    public static final String RICH_CONTENT = "richcontent";
    public static final String NOTE = "note";
    public static final String CREATED = "created";
    public static final String MODIFIED = "modified";
    public static final String ATTRIBUTES = "attributes";

    private NodeMetadata() {
        // Constants only
    }
}
