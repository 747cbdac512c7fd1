package com.sceneit.engine.model.element;

import com.sceneit.engine.util.TextRules;

import lombok.EqualsAndHashCode;

/** Where a scene takes place, e.g. "JOE'S DINER". */
@EqualsAndHashCode
public final class SceneLocation {
    private final String value;

    private SceneLocation(String value) {
        this.value = value;
    }

    public static SceneLocation of(String input) {
        return new SceneLocation(TextRules.defaults().requireText("sceneLocation", input));
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
