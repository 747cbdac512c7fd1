package com.sceneit.engine.model.element;

public enum SceneTimeOfDay {
    MORNING,
    DAWN,
    DAY,
    DUSK,
    EVENING,
    NIGHT,
    LATER,
    CONTINUOUS
}
