package de.mirkosertic.kbindexer.search;

import java.util.regex.PatternSyntaxException;

/**
 * A keyword term given in raw (regular expression) mode does not compile.
 * Fails the query it belongs to; sibling queries are unaffected.
 */
public class InvalidKeywordPatternException extends IllegalArgumentException {

    private final String term;

    public InvalidKeywordPatternException(final String term, final PatternSyntaxException cause) {
        super("Invalid keyword pattern '" + term + "': " + cause.getDescription(), cause);
        this.term = term;
    }

    public String getTerm() {
        return term;
    }
}
