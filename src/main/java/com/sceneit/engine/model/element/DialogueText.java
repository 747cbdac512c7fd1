package com.sceneit.engine.model.element;

import com.sceneit.engine.util.TextRules;

import lombok.EqualsAndHashCode;

@EqualsAndHashCode
public final class DialogueText implements DialogueBlock {
    private final String text;

    private DialogueText(String text) {
        this.text = text;
    }

    public static DialogueText of(String input) {
        return new DialogueText(TextRules.defaults().requireText("dialogueText", input));
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
