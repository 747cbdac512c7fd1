package com.sceneit.engine.model.element;

import java.util.Objects;

/**
 * Slug line of a scene: camera placement, location and time of day.
 */
public record SceneHeading(CameraLocation cameraLocation, SceneLocation location, SceneTimeOfDay timeOfDay) {

    public SceneHeading {
        Objects.requireNonNull(cameraLocation, "cameraLocation");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(timeOfDay, "timeOfDay");
    }

    /** Renders as {@code INT. JOE'S DINER - NIGHT}. */
    @Override
    public String toString() {
        return cameraLocation.slug() + " " + location + " - " + timeOfDay;
    }
}
