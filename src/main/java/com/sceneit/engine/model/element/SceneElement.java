package com.sceneit.engine.model.element;

/**
 * A single beat in a scene variant's body.
 */
public sealed interface SceneElement permits SceneAction, Dialogue {
}
