package com.sceneit.engine.api;

import com.sceneit.engine.model.Scene;

import java.util.List;

/**
 * Thrown when a move names a parent that does not currently lead to the moved
 * scene, so there is no edge to reparent.
 */
public final class InvalidMoveException extends StoryboardException {
    private final Id<Scene> scene;
    private final Id<Scene> from;
    private final Id<Scene> dest;

    public InvalidMoveException(Id<Scene> scene, Id<Scene> from, Id<Scene> dest) {
        super(Reason.INVALID_MOVE,
                "Invalid move: scene " + scene + " is not a successor of " + from + " (destination " + dest + ")");
        this.scene = scene;
        this.from = from;
        this.dest = dest;
    }

    public Id<Scene> scene() {
        return scene;
    }

    public Id<Scene> from() {
        return from;
    }

    public Id<Scene> dest() {
        return dest;
    }

    @Override
    public List<Id<Scene>> scenes() {
        return List.of(scene, from, dest);
    }
}
