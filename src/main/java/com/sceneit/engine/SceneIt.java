package com.sceneit.engine;

import com.sceneit.engine.io.SceneItConfig;
import com.sceneit.engine.storyboard.Storyboard;
import com.sceneit.engine.wiring.StoryboardCommandHandler;
import com.sceneit.engine.wiring.StoryboardSession;

/**
 * SceneIt: narrative structure core for screenwriting and storyboarding.
 *
 * <h2>Model</h2>
 * <p>
 * A story is a {@link Storyboard}: a bank of scenes plus a directed graph over
 * scene ids describing what can come next.
 * <ul>
 * <li><b>Scenes</b> hold content: alternate drafts, headings, action and
 * dialogue.</li>
 * <li><b>Edges</b> are possible transitions; a scene may branch to several
 * next scenes.</li>
 * <li><b>Roots</b> are story entry points. Scenes no root leads to are
 * reported as standalone.</li>
 * </ul>
 *
 * <h3>Structural edits</h3>
 * <p>
 * Link, unlink, move and delete go through the storyboard, which keeps the
 * graph free of dangling references and refuses moves that would form a loop.
 * Each applied edit touches the revision metadata of the scenes it affects.
 */
public final class SceneIt {

    private SceneIt() {
        // Prevent instantiation of utility class
    }

    /**
     * Creates an empty storyboard configured from {@code sceneit.json} on the
     * class path, or with defaults if there is none.
     */
    public static Storyboard storyboard() {
        return new Storyboard(SceneItConfig.load());
    }

    public static Storyboard storyboard(SceneItConfig config) {
        return new Storyboard(config);
    }

    /**
     * Opens a single-writer session: from now on only the session's consumer
     * thread mutates {@code storyboard}. The ring buffer is sized from the
     * storyboard's configuration.
     */
    public static StoryboardSession openSession(Storyboard storyboard,
            StoryboardCommandHandler.CommandOutcomeCallback callback) {
        return new StoryboardSession(storyboard, callback, storyboard.config());
    }
}
