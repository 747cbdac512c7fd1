package com.sceneit.engine.model;

import com.sceneit.engine.util.TextRules;

import lombok.EqualsAndHashCode;

@EqualsAndHashCode
public final class AuthorName {
    private final String value;

    private AuthorName(String value) {
        this.value = value;
    }

    public static AuthorName of(String input) {
        return of(input, TextRules.defaults());
    }

    public static AuthorName of(String input, TextRules rules) {
        return new AuthorName(rules.requireName("authorName", input));
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
