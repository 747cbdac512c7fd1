package com.sceneit.engine.util;

import com.sceneit.engine.api.Id;
import com.sceneit.engine.api.StoryboardException;
import com.sceneit.engine.api.StoryboardListener;
import com.sceneit.engine.api.StoryboardUpdate;
import com.sceneit.engine.api.UnknownSceneException;
import com.sceneit.engine.model.Scene;
import com.sceneit.engine.storyboard.Storyboard;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class CompositeStoryboardListenerTest {

    @Test
    public void testFansOutInOrder() {
        List<String> calls = new ArrayList<>();
        CompositeStoryboardListener composite = new CompositeStoryboardListener()
                .add(u -> calls.add("first"))
                .add(u -> calls.add("second"));

        composite.onUpdate(new StoryboardUpdate.SceneAdded(Id.random()));

        assertEquals(2, composite.size());
        assertEquals(List.of("first", "second"), calls);
    }

    @Test
    public void testRejectionsReachEveryListener() {
        List<StoryboardException> seen = new ArrayList<>();
        StoryboardListener recorder = new StoryboardListener() {
            @Override
            public void onUpdate(StoryboardUpdate update) {
            }

            @Override
            public void onRejected(StoryboardException error) {
                seen.add(error);
            }
        };
        CompositeStoryboardListener composite = new CompositeStoryboardListener().add(recorder).add(recorder);

        composite.onRejected(new UnknownSceneException(Id.random()));

        assertEquals(2, seen.size());
    }

    @Test
    public void testLoggingListenerCounts() {
        LoggingStoryboardListener logging = new LoggingStoryboardListener();
        Storyboard board = new Storyboard();
        board.setListener(new CompositeStoryboardListener().add(logging));

        Scene a = new Scene();
        Scene b = new Scene();
        board.addScene(a);
        board.addScene(b);
        board.linkScenes(a.id(), b.id());
        try {
            board.linkScenes(a.id(), Id.random());
            fail("Should have thrown UnknownSceneException");
        } catch (UnknownSceneException expected) {
            // counted below
        }

        assertEquals(3, logging.appliedCount());
        assertEquals(1, logging.rejectedCount());
    }
}
