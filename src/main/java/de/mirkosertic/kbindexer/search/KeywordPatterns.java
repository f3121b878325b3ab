package de.mirkosertic.kbindexer.search;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles keyword terms into case-insensitive, word-bounded matchers.
 *
 * <ul>
 *   <li>{@link #literal(String)} escapes the term and picks each boundary from the term's edge
 *       character: {@code \b} next to a word character, whitespace-or-edge otherwise, so that
 *       terms like {@code C++} or {@code #todo} still match as whole tokens.</li>
 *   <li>{@link #raw(String)} takes the term as regular expression syntax and wraps it as
 *       {@code \b(?:term)\b}. The search engine compiles every term this way.</li>
 * </ul>
 */
public final class KeywordPatterns {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    private static final String WORD_BOUNDARY = "\\b";
    private static final String LEFT_WHITESPACE_BOUNDARY = "(?<!\\S)";
    private static final String RIGHT_WHITESPACE_BOUNDARY = "(?!\\S)";

    private KeywordPatterns() {
    }

    public static Pattern literal(final String term) {
        final String left = !term.isEmpty() && isWordChar(term.codePointAt(0))
                ? WORD_BOUNDARY : LEFT_WHITESPACE_BOUNDARY;
        final String right = !term.isEmpty() && isWordChar(term.codePointBefore(term.length()))
                ? WORD_BOUNDARY : RIGHT_WHITESPACE_BOUNDARY;
        return Pattern.compile(left + Pattern.quote(term) + right, FLAGS);
    }

    /**
     * @throws InvalidKeywordPatternException if the term is not valid regular expression syntax
     */
    public static Pattern raw(final String term) {
        try {
            return Pattern.compile(WORD_BOUNDARY + "(?:" + term + ")" + WORD_BOUNDARY, FLAGS);
        } catch (final PatternSyntaxException e) {
            throw new InvalidKeywordPatternException(term, e);
        }
    }

    private static boolean isWordChar(final int codePoint) {
        return Character.isLetterOrDigit(codePoint) || codePoint == '_';
    }
}
