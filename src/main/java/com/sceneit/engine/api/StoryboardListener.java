package com.sceneit.engine.api;

/**
 * Observer for structural changes applied to a storyboard.
 *
 * Callbacks run synchronously on the thread that issued the structural command,
 * after the storyboard has finished its own bookkeeping. Keep them light.
 */
public interface StoryboardListener {

    /**
     * Called once per applied structural update, after affected scenes were
     * touched.
     *
     * @param update The change notification produced by the scene graph.
     */
    void onUpdate(StoryboardUpdate update);

    /**
     * Called when a structural command was rejected. The exception is still
     * thrown to the caller afterwards.
     *
     * @param error The rejection.
     */
    default void onRejected(StoryboardException error) {
    }
}
