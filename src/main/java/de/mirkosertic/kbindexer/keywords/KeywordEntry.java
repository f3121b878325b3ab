package de.mirkosertic.kbindexer.keywords;

import de.mirkosertic.kbindexer.search.KeywordSequences;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One line of a keyword file. Entries with children are organizational categories; leaves are
 * queries whose text is a colon separated keyword sequence.
 */
public class KeywordEntry {

    private final String text;
    private final int level;
    private final int lineNumber;
    private final List<KeywordEntry> children = new ArrayList<>();
    private @Nullable KeywordEntry parent;

    public KeywordEntry(final String text, final int level, final int lineNumber) {
        this.text = text;
        this.level = level;
        this.lineNumber = lineNumber;
    }

    public void addChild(final KeywordEntry child) {
        child.parent = this;
        children.add(child);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * The terms of this leaf.
     *
     * @throws IllegalStateException if this entry is organizational
     */
    public List<String> searchSequence() {
        if (!isLeaf()) {
            throw new IllegalStateException("Entry '" + text + "' at line " + lineNumber + " is not a leaf");
        }
        return KeywordSequences.parse(text);
    }

    /**
     * The sequence of this leaf, or the sequences of all leaves below this entry in file order.
     */
    public List<List<String>> searchSequences() {
        final List<List<String>> sequences = new ArrayList<>();
        if (isLeaf()) {
            sequences.add(searchSequence());
        } else {
            for (final KeywordEntry child : children) {
                sequences.addAll(child.searchSequences());
            }
        }
        return sequences;
    }

    public String displayName() {
        return text.replace(KeywordSequences.SEPARATOR, " → ");
    }

    public String getText() {
        return text;
    }

    public int getLevel() {
        return level;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public List<KeywordEntry> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public @Nullable KeywordEntry getParent() {
        return parent;
    }

    @Override
    public String toString() {
        return "KeywordEntry[" + text + " @" + lineNumber + "]";
    }
}
