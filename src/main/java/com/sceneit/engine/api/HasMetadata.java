package com.sceneit.engine.api;

import com.sceneit.engine.model.Metadata;

/**
 * Implemented by every entity that carries revision {@link Metadata}.
 */
public interface HasMetadata {

    Metadata metadata();

    /**
     * Marks the entity as modified: bumps the last-modified timestamp and
     * increments the version counter.
     */
    default void touch() {
        metadata().touch();
    }
}
