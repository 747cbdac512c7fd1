package com.sceneit.engine.model;

import com.sceneit.engine.api.HasMetadata;
import com.sceneit.engine.api.Id;

import java.util.Objects;

/**
 * Author of a storyboard. Only the display name for now.
 */
public final class Author implements HasMetadata {
    private final Id<Author> id = Id.random();
    private final AuthorName name;
    private final Metadata metadata = new Metadata();

    public Author(AuthorName name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public Id<Author> id() {
        return id;
    }

    public AuthorName name() {
        return name;
    }

    @Override
    public Metadata metadata() {
        return metadata;
    }
}
