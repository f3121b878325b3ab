package de.mirkosertic.kbindexer.util;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans text taken from mind-map attributes, HTML note bodies and Markdown lines before it
 * becomes searchable node content.
 *
 * <p>Removes characters that never carry meaning in a search (NUL, C0 controls other than
 * tab/newline/carriage return, zero-width characters, byte order marks, U+FFFD), decodes
 * HTML entities that survived XML parsing, and collapses whitespace.</p>
 */
public final class TextCleaner {

    private static final Pattern INVALID_CHARS = Pattern.compile(
            "[\u0000-\u0008\u000B\u000C\u000E-\u001F\u200B\u200C\u200D\uFEFF\uFFFD]");

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private static final Pattern ENTITY = Pattern.compile("&(#[xX][0-9a-fA-F]+|#[0-9]+|[a-zA-Z]+);");

    private static final Map<String, String> NAMED_ENTITIES = Map.of(
            "amp", "&",
            "lt", "<",
            "gt", ">",
            "quot", "\"",
            "apos", "'",
            "nbsp", " ");

    private TextCleaner() {
    }

    /**
     * Removes invalid characters, decodes entities, collapses whitespace runs to one space and trims.
     *
     * @param text the text to clean, may be null
     * @return the cleaned text, or an empty string for null input
     */
    public static String clean(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        final String decoded = decodeEntities(INVALID_CHARS.matcher(text).replaceAll(""));
        return WHITESPACE_RUN.matcher(decoded).replaceAll(" ").trim();
    }

    /**
     * Decodes numeric ({@code &#123;}, {@code &#x7B;}) and common named HTML entities.
     * Unknown entities are left untouched.
     */
    public static String decodeEntities(final String text) {
        if (text.indexOf('&') < 0) {
            return text;
        }
        final Matcher matcher = ENTITY.matcher(text);
        final StringBuilder result = new StringBuilder(text.length());
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolveEntity(matcher.group(1), matcher.group())));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String resolveEntity(final String body, final String original) {
        if (body.charAt(0) != '#') {
            return NAMED_ENTITIES.getOrDefault(body.toLowerCase(Locale.ROOT), original);
        }
        try {
            final int codePoint = body.length() > 1 && (body.charAt(1) == 'x' || body.charAt(1) == 'X')
                    ? Integer.parseInt(body.substring(2), 16)
                    : Integer.parseInt(body.substring(1));
            if (!Character.isValidCodePoint(codePoint)) {
                return original;
            }
            // &#xa; encodes a line break inside attributes
            return Character.isWhitespace(codePoint) ? " " : new String(Character.toChars(codePoint));
        } catch (final NumberFormatException e) {
            return original;
        }
    }

    /**
     * Joins the non-blank parts with single spaces.
     */
    public static String join(final String... parts) {
        final StringBuilder result = new StringBuilder();
        for (final String part : parts) {
            if (part == null || part.isBlank()) {
                continue;
            }
            if (result.length() > 0) {
                result.append(' ');
            }
            result.append(part.trim());
        }
        return result.toString();
    }
}
