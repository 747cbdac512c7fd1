package com.sceneit.engine.model;

import com.sceneit.engine.util.TextRules;

import lombok.EqualsAndHashCode;

/** Short synopsis of a story. Non-empty, no control characters. */
@EqualsAndHashCode
public final class Summary {
    private final String value;

    private Summary(String value) {
        this.value = value;
    }

    public static Summary of(String input) {
        return new Summary(TextRules.defaults().requireText("summary", input));
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
