package com.record.dedup.rules;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Canonicalizes free-text field values for comparison.
 *
 * <p>Steps: lowercase, NFKD decomposition, removal of non-spacing marks,
 * lowercase again, removal of everything that is not a letter, digit or
 * whitespace, whitespace collapsing and trimming. Missing values (null, NaN)
 * normalize to the empty string.</p>
 *
 * <p>The result only contains lowercase letters, digits and single spaces, so
 * {@code normalize(normalize(x)).equals(normalize(x))} holds for every input.</p>
 */
public final class TextNormalizer {

    private TextNormalizer() {
    }

    /**
     * Normalizes any field value. Non-string values are converted with
     * {@link String#valueOf(Object)}.
     */
    public static String normalize(Object value) {
        if (value == null || isNaN(value)) {
            return "";
        }
        return normalize(String.valueOf(value));
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String decomposed = Normalizer.normalize(text.toLowerCase(Locale.ROOT), Normalizer.Form.NFKD);
        // compatibility forms such as modifier capitals decompose to upper case
        String lowered = decomposed.toLowerCase(Locale.ROOT);

        StringBuilder result = new StringBuilder(lowered.length());
        boolean pendingSpace = false;
        int i = 0;
        while (i < lowered.length()) {
            int cp = lowered.codePointAt(i);
            i += Character.charCount(cp);

            if (Character.isWhitespace(cp) || Character.isSpaceChar(cp)) {
                pendingSpace = result.length() > 0;
            } else if (Character.isLetterOrDigit(cp)) {
                if (pendingSpace) {
                    result.append(' ');
                    pendingSpace = false;
                }
                result.appendCodePoint(cp);
            }
            // marks and punctuation are dropped
        }
        return result.toString();
    }

    /**
     * Checks whether two values are equal after normalization.
     */
    public static boolean areEquivalent(Object first, Object second) {
        return normalize(first).equals(normalize(second));
    }

    private static boolean isNaN(Object value) {
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        return false;
    }
}
