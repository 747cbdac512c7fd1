package com.sceneit.engine;

import com.sceneit.engine.api.StoryboardException;
import com.sceneit.engine.model.Author;
import com.sceneit.engine.model.AuthorName;
import com.sceneit.engine.model.Scene;
import com.sceneit.engine.model.SceneVariant;
import com.sceneit.engine.model.StoryTemplate;
import com.sceneit.engine.model.Title;
import com.sceneit.engine.model.element.CameraLocation;
import com.sceneit.engine.model.element.SceneAction;
import com.sceneit.engine.model.element.SceneHeading;
import com.sceneit.engine.model.element.SceneLocation;
import com.sceneit.engine.model.element.SceneTimeOfDay;
import com.sceneit.engine.storyboard.Storyboard;
import com.sceneit.engine.util.LoggingStoryboardListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Walk-through of a small branching story: builds it, edits its structure and
 * prints the outline.
 */
public class StoryboardDemo {
    private static final Logger log = LogManager.getLogger(StoryboardDemo.class);

    public static void main(String[] args) {
        Storyboard board = SceneIt.storyboard();
        board.setListener(new LoggingStoryboardListener());
        board.updateTitle(Title.of("  The   Long  Night ", board.textRules()));
        board.updateTemplate(StoryTemplate.SCREENPLAY);
        board.addAuthor(new Author(AuthorName.of("J. Doe", board.textRules())));

        Scene opening = scene(CameraLocation.EXTERIOR, "HIGHWAY", SceneTimeOfDay.DUSK, "A car idles on the shoulder.");
        Scene diner = scene(CameraLocation.INTERIOR, "JOE'S DINER", SceneTimeOfDay.NIGHT, "Rain on the windows.");
        Scene motel = scene(CameraLocation.EXTERIOR, "MOTEL", SceneTimeOfDay.NIGHT, "A neon sign flickers.");
        Scene dawn = scene(CameraLocation.EXTERIOR, "HIGHWAY", SceneTimeOfDay.DAWN, "The car is gone.");
        for (Scene s : new Scene[] { opening, diner, motel, dawn })
            board.addScene(s);

        board.setSceneAsRoot(opening.id());
        board.linkScenes(opening.id(), diner.id());
        board.linkScenes(opening.id(), motel.id());
        board.linkScenes(diner.id(), dawn.id());

        log.info("Outline of '{}':\n{}", board.displayTitle(), board.printOutline(null));

        // dawn now follows the motel branch; moving the motel under dawn would loop
        board.moveScene(dawn.id(), diner.id(), motel.id());

        try {
            board.moveScene(motel.id(), opening.id(), dawn.id());
        } catch (StoryboardException e) {
            log.info("Refused as expected: {} {}", e.reason(), e.scenes());
        }

        board.unlinkScenes(opening.id(), diner.id());
        log.info("Standalone scenes: {}", board.standaloneScenes());
        log.info("Outline after edits:\n{}", board.printOutline(null));
    }

    private static Scene scene(CameraLocation camera, String location, SceneTimeOfDay time, String action) {
        SceneVariant variant = new SceneVariant();
        variant.setHeading(new SceneHeading(camera, SceneLocation.of(location), time));
        variant.addElement(SceneAction.of(action));
        return new Scene(variant);
    }
}
