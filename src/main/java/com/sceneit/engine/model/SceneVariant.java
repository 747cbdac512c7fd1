package com.sceneit.engine.model;

import com.sceneit.engine.api.HasMetadata;
import com.sceneit.engine.api.Id;
import com.sceneit.engine.model.element.SceneElement;
import com.sceneit.engine.model.element.SceneHeading;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One draft of a scene: an optional heading followed by an ordered run of
 * action beats and dialogue.
 */
public final class SceneVariant implements HasMetadata {
    private final Id<SceneVariant> id = Id.random();
    private SceneHeading heading;
    private final List<SceneElement> elements = new ArrayList<>();
    private final Metadata metadata = new Metadata();

    public Id<SceneVariant> id() {
        return id;
    }

    public Optional<SceneHeading> heading() {
        return Optional.ofNullable(heading);
    }

    public void setHeading(SceneHeading heading) {
        this.heading = heading;
        touch();
    }

    public void addElement(SceneElement element) {
        elements.add(Objects.requireNonNull(element, "element"));
        touch();
    }

    public List<SceneElement> elements() {
        return Collections.unmodifiableList(elements);
    }

    @Override
    public Metadata metadata() {
        return metadata;
    }
}
