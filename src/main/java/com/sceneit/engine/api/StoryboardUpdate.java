package com.sceneit.engine.api;

import com.sceneit.engine.model.Scene;

import java.util.List;

/**
 * Change notification describing a completed structural mutation of a scene
 * graph.
 *
 * The graph produces these values instead of calling back into its owner, so it
 * stays free of any dependency on content or metadata. The owner decides how to
 * react (touching metadata, refreshing views, ...).
 *
 * One variant per graph operation kind.
 */
public sealed interface StoryboardUpdate permits
        StoryboardUpdate.SceneAdded,
        StoryboardUpdate.SceneSetAsRoot,
        StoryboardUpdate.LinkedScenes,
        StoryboardUpdate.Moved,
        StoryboardUpdate.SceneDeleted,
        StoryboardUpdate.EdgeDeleted {

    /**
     * Every scene identifier the mutation refers to, in a fixed order. These are
     * the scenes whose metadata the owner touches.
     */
    List<Id<Scene>> affectedScenes();

    record SceneAdded(Id<Scene> scene) implements StoryboardUpdate {
        @Override
        public List<Id<Scene>> affectedScenes() {
            return List.of(scene);
        }
    }

    record SceneSetAsRoot(Id<Scene> scene) implements StoryboardUpdate {
        @Override
        public List<Id<Scene>> affectedScenes() {
            return List.of(scene);
        }
    }

    record LinkedScenes(Id<Scene> from, Id<Scene> dest) implements StoryboardUpdate {
        @Override
        public List<Id<Scene>> affectedScenes() {
            return List.of(from, dest);
        }
    }

    /** {@code from} and {@code dest} are equal for a same-parent move. */
    record Moved(Id<Scene> scene, Id<Scene> from, Id<Scene> dest) implements StoryboardUpdate {
        @Override
        public List<Id<Scene>> affectedScenes() {
            return List.of(scene, from, dest);
        }
    }

    record SceneDeleted(Id<Scene> scene) implements StoryboardUpdate {
        @Override
        public List<Id<Scene>> affectedScenes() {
            return List.of(scene);
        }
    }

    record EdgeDeleted(Id<Scene> from, Id<Scene> dest) implements StoryboardUpdate {
        @Override
        public List<Id<Scene>> affectedScenes() {
            return List.of(from, dest);
        }
    }
}
