package com.sceneit.engine.model;

import com.sceneit.engine.api.HasMetadata;
import com.sceneit.engine.api.Id;

import java.util.Objects;

/** A character appearing in the story; dialogue refers to it by id. */
public final class Character implements HasMetadata {
    private final Id<Character> id = Id.random();
    private final CharacterName name;
    private final Metadata metadata = new Metadata();

    public Character(CharacterName name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Id<Character> id() {
        return id;
    }

    public CharacterName name() {
        return name;
    }

    @Override
    public Metadata metadata() {
        return metadata;
    }
}
