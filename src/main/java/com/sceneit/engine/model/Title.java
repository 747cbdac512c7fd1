package com.sceneit.engine.model;

import com.sceneit.engine.util.TextRules;

import lombok.EqualsAndHashCode;

/**
 * Title of a story. Whitespace-normalised, non-empty, bounded in length and free
 * of control characters.
 */
@EqualsAndHashCode
public final class Title {
    private final String value;

    private Title(String value) {
        this.value = value;
    }

    public static Title of(String input) {
        return of(input, TextRules.defaults());
    }

    public static Title of(String input, TextRules rules) {
        return new Title(rules.requireTitle("title", input));
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
