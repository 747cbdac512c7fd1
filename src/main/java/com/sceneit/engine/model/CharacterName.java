package com.sceneit.engine.model;

import com.sceneit.engine.util.TextRules;

import lombok.EqualsAndHashCode;

@EqualsAndHashCode
public final class CharacterName {
    private final String value;

    private CharacterName(String value) {
        this.value = value;
    }

    public static CharacterName of(String input) {
        return of(input, TextRules.defaults());
    }

    public static CharacterName of(String input, TextRules rules) {
        return new CharacterName(rules.requireName("characterName", input));
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
