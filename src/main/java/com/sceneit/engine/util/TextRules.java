package com.sceneit.engine.util;

import com.sceneit.engine.io.SceneItConfig;
import com.sceneit.engine.model.TextValidationException;
import com.sceneit.engine.model.TextValidationException.Problem;

/**
 * Validation limits for user-entered text, plus the checks that enforce them.
 *
 * All checks run on {@link TextInput#normalize normalised} text and return it.
 */
public final class TextRules {
    private static final TextRules DEFAULTS = from(SceneItConfig.defaults());

    private final int maxTitleLength;
    private final int maxNameLength;

    private TextRules(int maxTitleLength, int maxNameLength) {
        if (maxTitleLength <= 0 || maxNameLength <= 0)
            throw new IllegalArgumentException(
                    "Length limits must be positive: title=" + maxTitleLength + ", name=" + maxNameLength);
        this.maxTitleLength = maxTitleLength;
        this.maxNameLength = maxNameLength;
    }

    public static TextRules defaults() {
        return DEFAULTS;
    }

    public static TextRules from(SceneItConfig config) {
        return new TextRules(config.getMaxTitleLength(), config.getMaxNameLength());
    }

    public int maxTitleLength() {
        return maxTitleLength;
    }

    public int maxNameLength() {
        return maxNameLength;
    }

    /** Non-empty, no control characters. */
    public String requireText(String field, String input) {
        String text = requireNonEmpty(field, input);
        if (TextInput.containsControlChars(text))
            throw new TextValidationException(field, Problem.CONTROL_CHARS, "must not contain control characters");
        return text;
    }

    /** Non-empty only. */
    public String requireNonEmpty(String field, String input) {
        String text = TextInput.normalize(input);
        if (text.isEmpty())
            throw new TextValidationException(field, Problem.EMPTY, "must not be empty");
        return text;
    }

    public String requireTitle(String field, String input) {
        return requireBounded(field, input, maxTitleLength);
    }

    public String requireName(String field, String input) {
        return requireBounded(field, input, maxNameLength);
    }

    private String requireBounded(String field, String input, int max) {
        String text = requireNonEmpty(field, input);
        if (TextInput.length(text) > max)
            throw new TextValidationException(field, Problem.TOO_LONG, "must be at most " + max + " characters");
        if (TextInput.containsControlChars(text))
            throw new TextValidationException(field, Problem.CONTROL_CHARS, "must not contain control characters");
        return text;
    }
}
