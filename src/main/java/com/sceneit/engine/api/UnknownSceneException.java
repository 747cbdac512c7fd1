package com.sceneit.engine.api;

import com.sceneit.engine.model.Scene;

import java.util.List;

/**
 * Thrown when a scene identifier is not present in the storyboard's scene bank.
 */
public final class UnknownSceneException extends StoryboardException {
    private final Id<Scene> scene;

    public UnknownSceneException(Id<Scene> scene) {
        super(Reason.UNKNOWN_SCENE, "Unknown scene: " + scene);
        this.scene = scene;
    }

    public Id<Scene> scene() {
        return scene;
    }

    @Override
    public List<Id<Scene>> scenes() {
        return List.of(scene);
    }
}
