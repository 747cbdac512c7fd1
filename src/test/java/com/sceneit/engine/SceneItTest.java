package com.sceneit.engine;

import com.sceneit.engine.model.CharacterName;
import com.sceneit.engine.model.Scene;
import com.sceneit.engine.model.TextValidationException;
import com.sceneit.engine.model.Title;
import com.sceneit.engine.storyboard.Storyboard;
import com.sceneit.engine.wiring.StoryboardSession;
import org.junit.Test;

import static org.junit.Assert.*;

public class SceneItTest {

    @Test
    public void testStoryboardUsesClassPathConfig() {
        Storyboard board = SceneIt.storyboard();
        assertEquals("Working Title", board.displayTitle());
    }

    @Test
    public void testConfiguredTitleLimitApplies() {
        // classpath sceneit.json sets maxTitleLength to 40
        Storyboard board = SceneIt.storyboard();
        assertEquals(40, board.textRules().maxTitleLength());
        assertEquals(40, Title.of("x".repeat(40), board.textRules()).value().length());

        try {
            Title.of("x".repeat(60), board.textRules());
            fail("Should have thrown TextValidationException");
        } catch (TextValidationException e) {
            assertEquals(TextValidationException.Problem.TOO_LONG, e.problem());
        }
        assertEquals("Ramona", CharacterName.of("Ramona", board.textRules()).value());
    }

    @Test
    public void testOpenSessionUsesConfiguredRingBuffer() {
        Storyboard board = SceneIt.storyboard();
        try (StoryboardSession session = SceneIt.openSession(board, null)) {
            assertEquals(64, session.bufferSize());
        }
    }

    @Test
    public void testOpenSessionWithDefaultCallback() {
        Storyboard board = SceneIt.storyboard();
        Scene a = new Scene();
        board.addScene(a);

        try (StoryboardSession session = SceneIt.openSession(board, null)) {
            session.setSceneAsRoot(a.id());
            assertSame(board, session.storyboard());
        }
        assertTrue(board.isRoot(a.id()));
    }

    @Test
    public void testDemoRuns() {
        StoryboardDemo.main(new String[0]);
    }
}
