package com.sceneit.engine.model.element;

import com.sceneit.engine.util.TextRules;

import lombok.EqualsAndHashCode;

/** Delivery direction such as "(beat)" or "(whispering)". Only emptiness is checked. */
@EqualsAndHashCode
public final class Parenthetical implements DialogueBlock {
    private final String text;

    private Parenthetical(String text) {
        this.text = text;
    }

    public static Parenthetical of(String input) {
        return new Parenthetical(TextRules.defaults().requireNonEmpty("parenthetical", input));
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return "(" + text + ")";
    }
}
