package com.sceneit.engine.util;

import com.sceneit.engine.api.StoryboardException;
import com.sceneit.engine.api.StoryboardListener;
import com.sceneit.engine.api.StoryboardUpdate;

import java.util.Arrays;

/**
 * Fans each callback out to several {@link StoryboardListener}s, in the order
 * they were added.
 */
public class CompositeStoryboardListener implements StoryboardListener {
    private StoryboardListener[] listeners = new StoryboardListener[0];

    public CompositeStoryboardListener add(StoryboardListener listener) {
        StoryboardListener[] old = listeners;
        StoryboardListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
        return this;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onUpdate(StoryboardUpdate update) {
        for (StoryboardListener l : listeners)
            l.onUpdate(update);
    }

    @Override
    public void onRejected(StoryboardException error) {
        for (StoryboardListener l : listeners)
            l.onRejected(error);
    }
}
