package com.sceneit.engine.api;

import com.sceneit.engine.model.Scene;

import java.util.List;

/**
 * Thrown when moving {@code scene} under {@code dest} would close a loop, i.e.
 * {@code dest} is already reachable from {@code scene}.
 */
public final class CycleDetectedException extends StoryboardException {
    private final Id<Scene> scene;
    private final Id<Scene> dest;

    public CycleDetectedException(Id<Scene> scene, Id<Scene> dest) {
        super(Reason.CYCLE_DETECTED,
                "Cycle detected! Moving scene " + scene + " under " + dest + " would make it its own descendant");
        this.scene = scene;
        this.dest = dest;
    }

    public Id<Scene> scene() {
        return scene;
    }

    public Id<Scene> dest() {
        return dest;
    }

    @Override
    public List<Id<Scene>> scenes() {
        return List.of(scene, dest);
    }
}
