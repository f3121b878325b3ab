package de.mirkosertic.kbindexer.search;

import java.util.ArrayList;
import java.util.List;

/**
 * Colon separated keyword sequences as written in keyword files, e.g. {@code python:function:async}.
 * A term can therefore never contain a colon itself.
 */
public final class KeywordSequences {

    public static final String SEPARATOR = ":";

    private KeywordSequences() {
    }

    public static List<String> parse(final String sequence) {
        final List<String> terms = new ArrayList<>();
        for (final String term : sequence.split(SEPARATOR, -1)) {
            terms.add(term.strip());
        }
        return terms;
    }

    public static String join(final List<String> terms) {
        return String.join(SEPARATOR, terms);
    }
}
