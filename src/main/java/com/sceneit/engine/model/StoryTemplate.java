package com.sceneit.engine.model;

/**
 * Script format a storyboard follows. Determines formatting and structural
 * expectations; selecting one does not modify scene data.
 */
public enum StoryTemplate {
    TELEPLAY,
    SCREENPLAY,
    HALF_HOUR_SITCOM,
    NOVEL
}
