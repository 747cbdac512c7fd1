package com.sceneit.engine.model.element;

import com.sceneit.engine.util.TextRules;

import lombok.EqualsAndHashCode;

/** Descriptive action line. */
@EqualsAndHashCode
public final class SceneAction implements SceneElement {
    private final String text;

    private SceneAction(String text) {
        this.text = text;
    }

    public static SceneAction of(String input) {
        return new SceneAction(TextRules.defaults().requireText("sceneAction", input));
    }

    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
