package com.sceneit.engine.util;

/**
 * Normalisation applied to every piece of user-entered text before validation.
 */
public final class TextInput {
    private TextInput() {
        // Utility class
    }

    /**
     * Strips leading and trailing whitespace and collapses each internal run of
     * whitespace into a single space.
     * <p>
     * {@code "Scott Pilgrim      vs.\n The World"} becomes
     * {@code "Scott Pilgrim vs. The World"}.
     */
    public static String normalize(String input) {
        if (input == null)
            return "";
        StringBuilder sb = new StringBuilder(input.length());
        boolean pendingSpace = false;
        for (int i = 0; i < input.length();) {
            int cp = input.codePointAt(i);
            i += Character.charCount(cp);
            if (Character.isWhitespace(cp) || Character.isSpaceChar(cp)) {
                pendingSpace = sb.length() > 0;
                continue;
            }
            if (pendingSpace) {
                sb.append(' ');
                pendingSpace = false;
            }
            sb.appendCodePoint(cp);
        }
        return sb.toString();
    }

    public static boolean containsControlChars(String text) {
        return text.codePoints().anyMatch(Character::isISOControl);
    }

    public static int length(String text) {
        return text.codePointCount(0, text.length());
    }
}
