package io.domesday.landholders;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * The per-field cleaning rules applied to raw landholder rows. All are pure and null-tolerant.
 */
public final class FieldCleaners {
    /** Compared after lower-casing. */
    static final Set<String> NULL_SENTINELS = Set.of("", "null", "undefined");

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}]+");
    private static final String QUOTES = "\"\u201C\u201D";

    private FieldCleaners() {
    }

    /**
     * Strip surrounding whitespace and straight or curly double quotes, and turn typographic single
     * quotes into a plain apostrophe.
     */
    public static String trimQuoted(String value) {
        if (value == null) return null;
        int start = 0;
        int end = value.length();
        while (start < end && isTrimmable(value.charAt(start))) start++;
        while (end > start && isTrimmable(value.charAt(end - 1))) end--;
        return value.substring(start, end)
                .replace('\u2018', '\'')
                .replace('\u2019', '\'');
    }

    /**
     * Map pseudo-null text ({@code ""}, {@code null}, {@code undefined}, any case) to {@code null}.
     * Everything else is returned untouched, whitespace-only text included.
     */
    public static String nullSentinel(String value) {
        if (value == null) return null;
        if (NULL_SENTINELS.contains(value.toLowerCase(Locale.ROOT))) return null;
        return value;
    }

    /** Collapse whitespace runs to a single space and drop leading and trailing whitespace. */
    public static String collapseWhitespace(String value) {
        if (value == null) return null;
        return WHITESPACE.matcher(value).replaceAll(" ").strip();
    }

    private static boolean isTrimmable(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || QUOTES.indexOf(c) >= 0;
    }
}
