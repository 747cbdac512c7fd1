package com.sceneit.engine.util;

import com.sceneit.engine.api.StoryboardException;
import com.sceneit.engine.api.StoryboardListener;
import com.sceneit.engine.api.StoryboardUpdate;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Audit trail of structural edits: applied updates at INFO, rejections at WARN.
 * Also counts both, for quick inspection in tests and demos.
 */
public final class LoggingStoryboardListener implements StoryboardListener {
    private static final Logger log = LogManager.getLogger(LoggingStoryboardListener.class);

    private long applied;
    private long rejected;

    @Override
    public void onUpdate(StoryboardUpdate update) {
        applied++;
        log.info("Storyboard update #{}: {}", applied, update);
    }

    @Override
    public void onRejected(StoryboardException error) {
        rejected++;
        log.warn("Storyboard edit rejected ({}): {}", error.reason(), error.getMessage());
    }

    public long appliedCount() {
        return applied;
    }

    public long rejectedCount() {
        return rejected;
    }
}
