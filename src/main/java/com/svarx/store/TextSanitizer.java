package com.svarx.store;

import java.util.regex.Pattern;

/**
 * Normalizes user text before storage: quoted-reply content is dropped and whitespace collapsed.
 */
public final class TextSanitizer {
    private static final Pattern QUOTED = Pattern.compile("^[ \\t]*>.*$", Pattern.MULTILINE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextSanitizer() {
    }

    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String withoutQuotes = QUOTED.matcher(value.strip()).replaceAll("");
        return WHITESPACE.matcher(withoutQuotes).replaceAll(" ").strip();
    }

    public static String truncate(String value, int maxChars) {
        if (value == null) {
            return "";
        }
        return value.length() <= maxChars ? value : value.substring(0, maxChars);
    }
}
