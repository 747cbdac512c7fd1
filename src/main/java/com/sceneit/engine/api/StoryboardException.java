package com.sceneit.engine.api;

import com.sceneit.engine.model.Scene;

import java.util.List;

/**
 * Base of all recoverable structural-edit failures.
 *
 * A failed operation leaves both the scene graph and the storyboard exactly as
 * they were before the call. Callers are expected to surface {@link #reason()}
 * and {@link #scenes()} rather than a generic message.
 */
public abstract class StoryboardException extends RuntimeException {

    public enum Reason {
        /** Identifier absent from the storyboard's content store. */
        UNKNOWN_SCENE,
        /** Identifier absent from the scene graph. */
        SCENE_NOT_IN_GRAPH,
        /** The moved scene is not a successor of the claimed parent. */
        INVALID_MOVE,
        /** The move would make a scene its own descendant. */
        CYCLE_DETECTED
    }

    private final Reason reason;

    protected StoryboardException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    /** Identifiers involved in the failure, in the order they appear in the message. */
    public abstract List<Id<Scene>> scenes();
}
