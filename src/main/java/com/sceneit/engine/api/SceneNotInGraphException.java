package com.sceneit.engine.api;

import com.sceneit.engine.model.Scene;

import java.util.List;

/**
 * Thrown when a scene identifier is not a member of the scene graph.
 */
public final class SceneNotInGraphException extends StoryboardException {
    private final Id<Scene> scene;

    public SceneNotInGraphException(Id<Scene> scene) {
        super(Reason.SCENE_NOT_IN_GRAPH, "Scene not in graph: " + scene);
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
