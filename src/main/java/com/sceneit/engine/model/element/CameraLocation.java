package com.sceneit.engine.model.element;

public enum CameraLocation {
    INTERIOR("INT."),
    EXTERIOR("EXT.");

    private final String slug;

    CameraLocation(String slug) {
        this.slug = slug;
    }

    public String slug() {
        return slug;
    }
}
