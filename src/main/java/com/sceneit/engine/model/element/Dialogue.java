package com.sceneit.engine.model.element;

import com.sceneit.engine.api.HasMetadata;
import com.sceneit.engine.api.Id;
import com.sceneit.engine.model.Character;
import com.sceneit.engine.model.Metadata;
import com.sceneit.engine.model.Scene;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A character's speech within a scene. Speaker and scene are held by id; the
 * character may since have been removed from the storyboard.
 */
public final class Dialogue implements SceneElement, HasMetadata {
    private final Id<Dialogue> id = Id.random();
    private final Id<Scene> scene;
    private final Id<Character> speaker;
    private final List<DialogueBlock> content = new ArrayList<>();
    private final Metadata metadata = new Metadata();

    public Dialogue(Id<Scene> scene, Id<Character> speaker) {
        this.scene = Objects.requireNonNull(scene, "scene");
        this.speaker = Objects.requireNonNull(speaker, "speaker");
    }

    public Id<Dialogue> id() {
        return id;
    }

    public Id<Scene> scene() {
        return scene;
    }

    public Id<Character> speaker() {
        return speaker;
    }

    public Dialogue addBlock(DialogueBlock block) {
        content.add(Objects.requireNonNull(block, "block"));
        touch();
        return this;
    }

    public List<DialogueBlock> content() {
        return Collections.unmodifiableList(content);
    }

    @Override
    public Metadata metadata() {
        return metadata;
    }
}
