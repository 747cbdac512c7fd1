package com.sceneit.engine.model;

import com.sceneit.engine.util.TextRules;

import lombok.EqualsAndHashCode;

/** Free-text note attached to a revision. Non-empty, no control characters. */
@EqualsAndHashCode
public final class RevisionNote {
    private final String value;

    private RevisionNote(String value) {
        this.value = value;
    }

    public static RevisionNote of(String input) {
        return new RevisionNote(TextRules.defaults().requireText("revisionNote", input));
    }

    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
