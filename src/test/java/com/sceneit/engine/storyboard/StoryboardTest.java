package com.sceneit.engine.storyboard;

import com.sceneit.engine.api.CycleDetectedException;
import com.sceneit.engine.api.Id;
import com.sceneit.engine.api.InvalidMoveException;
import com.sceneit.engine.api.StoryboardException;
import com.sceneit.engine.api.StoryboardListener;
import com.sceneit.engine.api.StoryboardUpdate;
import com.sceneit.engine.api.UnknownSceneException;
import com.sceneit.engine.io.SceneItConfig;
import com.sceneit.engine.model.Author;
import com.sceneit.engine.model.AuthorName;
import com.sceneit.engine.model.Character;
import com.sceneit.engine.model.CharacterName;
import com.sceneit.engine.model.Scene;
import com.sceneit.engine.model.SceneVariant;
import com.sceneit.engine.model.StoryTemplate;
import com.sceneit.engine.model.Summary;
import com.sceneit.engine.model.Title;
import com.sceneit.engine.model.element.CameraLocation;
import com.sceneit.engine.model.element.SceneHeading;
import com.sceneit.engine.model.element.SceneLocation;
import com.sceneit.engine.model.element.SceneTimeOfDay;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.Assert.*;

public class StoryboardTest {

    private Storyboard board;
    private Scene a;
    private Scene b;
    private Scene c;
    private Scene d;
    private List<StoryboardUpdate> updates;
    private List<StoryboardException> rejections;

    @Before
    public void setUp() {
        board = new Storyboard();
        a = new Scene();
        b = new Scene();
        c = new Scene();
        d = new Scene();
        for (Scene s : new Scene[] { a, b, c, d })
            board.addScene(s);

        updates = new ArrayList<>();
        rejections = new ArrayList<>();
        board.setListener(new StoryboardListener() {
            @Override
            public void onUpdate(StoryboardUpdate update) {
                updates.add(update);
            }

            @Override
            public void onRejected(StoryboardException error) {
                rejections.add(error);
            }
        });
    }

    private static int version(Scene scene) {
        return scene.metadata().getVersion();
    }

    @Test
    public void testNewStoryboardIsEmpty() {
        Storyboard empty = new Storyboard();
        assertFalse(empty.title().isPresent());
        assertFalse(empty.template().isPresent());
        assertTrue(empty.scenes().isEmpty());
        assertTrue(empty.standaloneScenes().isEmpty());
        assertEquals("Untitled Storyboard", empty.displayTitle());
        assertEquals(1, empty.metadata().getVersion());
    }

    @Test
    public void testAddSceneRegistersAndTouches() {
        Scene e = new Scene();
        assertEquals(1, version(e));

        board.addScene(e);

        assertTrue(board.containsScene(e.id()));
        assertSame(e, board.scene(e.id()).orElseThrow());
        assertTrue(board.nextScenes(e.id()).isEmpty());
        assertTrue("New scene is not reachable from any root", board.standaloneScenes().contains(e.id()));
        assertEquals(2, version(e));
        assertEquals(List.of(new StoryboardUpdate.SceneAdded(e.id())), updates);
    }

    @Test
    public void testLinkScenesTouchesBothEndpoints() {
        int va = version(a), vb = version(b), vc = version(c);

        board.linkScenes(a.id(), b.id());

        assertEquals(Set.of(b.id()), board.nextScenes(a.id()));
        assertEquals(va + 1, version(a));
        assertEquals(vb + 1, version(b));
        assertEquals(vc, version(c));
        assertEquals(List.of(new StoryboardUpdate.LinkedScenes(a.id(), b.id())), updates);
    }

    @Test
    public void testLinkUnknownSceneLeavesGraphUntouched() {
        Scene outsider = new Scene();
        int va = version(a);

        try {
            board.linkScenes(a.id(), outsider.id());
            fail("Should have thrown UnknownSceneException");
        } catch (UnknownSceneException e) {
            assertEquals(outsider.id(), e.scene());
            assertEquals(StoryboardException.Reason.UNKNOWN_SCENE, e.reason());
        }

        assertTrue(board.nextScenes(a.id()).isEmpty());
        assertFalse(board.standaloneScenes().contains(outsider.id()));
        assertEquals(va, version(a));
        assertTrue(updates.isEmpty());
        assertEquals(1, rejections.size());
    }

    @Test
    public void testLinkChecksFromBeforeDest() {
        Id<Scene> ghost1 = Id.random();
        Id<Scene> ghost2 = Id.random();
        try {
            board.linkScenes(ghost1, ghost2);
            fail("Should have thrown UnknownSceneException");
        } catch (UnknownSceneException e) {
            assertEquals(ghost1, e.scene());
        }
    }

    @Test
    public void testUnlinkScenes() {
        board.setSceneAsRoot(a.id());
        board.linkScenes(a.id(), b.id());
        board.linkScenes(b.id(), c.id());
        assertEquals(Set.of(d.id()), board.standaloneScenes());
        int vb = version(b), vc = version(c);

        board.unlinkScenes(b.id(), c.id());

        assertEquals(Set.of(c.id(), d.id()), board.standaloneScenes());
        assertEquals(vb + 1, version(b));
        assertEquals(vc + 1, version(c));
    }

    @Test
    public void testUnlinkUnlinkedScenesStillSucceeds() {
        int va = version(a);
        board.unlinkScenes(a.id(), b.id());
        assertEquals(va + 1, version(a));
        assertEquals(new StoryboardUpdate.EdgeDeleted(a.id(), b.id()), updates.get(0));
    }

    @Test(expected = UnknownSceneException.class)
    public void testUnlinkUnknownScene() {
        board.unlinkScenes(a.id(), Id.random());
    }

    @Test
    public void testMoveSceneTouchesAllThree() {
        // a -> b -> c, a -> d
        board.linkScenes(a.id(), b.id());
        board.linkScenes(b.id(), c.id());
        board.linkScenes(a.id(), d.id());
        int va = version(a), vb = version(b), vc = version(c), vd = version(d);

        board.moveScene(c.id(), b.id(), a.id());

        assertTrue(board.nextScenes(a.id()).contains(c.id()));
        assertFalse(board.nextScenes(b.id()).contains(c.id()));
        assertEquals(va + 1, version(a));
        assertEquals(vb + 1, version(b));
        assertEquals(vc + 1, version(c));
        assertEquals(vd, version(d));
    }

    @Test
    public void testMoveIntoDescendantIsRejected() {
        // a -> b -> c, a -> d
        board.linkScenes(a.id(), b.id());
        board.linkScenes(b.id(), c.id());
        board.linkScenes(a.id(), d.id());
        updates.clear();
        int vb = version(b);

        try {
            board.moveScene(b.id(), a.id(), c.id());
            fail("Should have thrown CycleDetectedException");
        } catch (CycleDetectedException e) {
            assertEquals(b.id(), e.scene());
            assertEquals(c.id(), e.dest());
        }

        assertEquals(Set.of(b.id(), d.id()), board.nextScenes(a.id()));
        assertTrue(board.nextScenes(c.id()).isEmpty());
        assertEquals(vb, version(b));
        assertTrue(updates.isEmpty());
        assertEquals(1, rejections.size());
        assertTrue(rejections.get(0) instanceof CycleDetectedException);
    }

    @Test
    public void testSameParentMoveTouchesEachSceneOnce() {
        board.linkScenes(a.id(), b.id());
        int va = version(a), vb = version(b);

        board.moveScene(b.id(), a.id(), a.id());

        assertEquals(Set.of(b.id()), board.nextScenes(a.id()));
        assertEquals(va + 1, version(a));
        assertEquals(vb + 1, version(b));
    }

    @Test(expected = InvalidMoveException.class)
    public void testMoveWithWrongParent() {
        board.linkScenes(a.id(), b.id());
        board.moveScene(b.id(), c.id(), d.id());
    }

    @Test
    public void testMoveUnknownSceneChecksContentStoreFirst() {
        Id<Scene> ghost = Id.random();
        try {
            board.moveScene(a.id(), ghost, b.id());
            fail("Should have thrown UnknownSceneException");
        } catch (UnknownSceneException e) {
            assertEquals(ghost, e.scene());
        }
    }

    @Test
    public void testDeleteScene() {
        board.setSceneAsRoot(a.id());
        board.linkScenes(a.id(), b.id());
        board.linkScenes(b.id(), c.id());
        updates.clear();
        int vb = version(b);

        board.deleteScene(b.id());

        assertFalse(board.containsScene(b.id()));
        assertFalse(board.nextScenes(a.id()).contains(b.id()));
        assertEquals(Set.of(c.id(), d.id()), board.standaloneScenes());
        assertEquals("Deleted scene is touched on its way out", vb + 1, version(b));
        assertEquals(List.of(new StoryboardUpdate.SceneDeleted(b.id())), updates);
    }

    @Test
    public void testDeleteRootScene() {
        board.setSceneAsRoot(a.id());
        board.deleteScene(a.id());
        assertTrue(board.roots().isEmpty());
        assertEquals(Set.of(b.id(), c.id(), d.id()), board.standaloneScenes());
    }

    @Test
    public void testDeleteUnknownSceneIsNoOp() {
        board.deleteScene(Id.random());
        assertEquals(4, board.scenes().size());
        assertTrue(updates.isEmpty());
        assertTrue(rejections.isEmpty());
    }

    @Test
    public void testSetSceneAsRoot() {
        int va = version(a);
        board.setSceneAsRoot(a.id());

        assertTrue(board.isRoot(a.id()));
        assertEquals(Set.of(b.id(), c.id(), d.id()), board.standaloneScenes());
        assertEquals(va + 1, version(a));
    }

    @Test(expected = UnknownSceneException.class)
    public void testSetUnknownSceneAsRoot() {
        board.setSceneAsRoot(Id.random());
    }

    @Test
    public void testReAddingSceneKeepsEdges() {
        board.linkScenes(a.id(), b.id());
        board.addScene(a);
        assertEquals(Set.of(b.id()), board.nextScenes(a.id()));
        assertEquals(4, board.scenes().size());
    }

    @Test
    public void testTitleSummaryAndTemplate() {
        board.updateTitle(Title.of("Scott Pilgrim      vs.     The World"));
        board.updateSummary(Summary.of("A slacker fights seven exes."));
        board.updateTemplate(StoryTemplate.SCREENPLAY);

        assertEquals("Scott Pilgrim vs. The World", board.displayTitle());
        assertEquals("A slacker fights seven exes.", board.summary().orElseThrow().value());
        assertEquals(StoryTemplate.SCREENPLAY, board.template().orElseThrow());

        board.clearTitle();
        board.clearSummary();
        board.clearTemplate();
        assertFalse(board.title().isPresent());
        assertFalse(board.summary().isPresent());
        assertFalse(board.template().isPresent());
    }

    @Test
    public void testDefaultTitleFromConfig() {
        SceneItConfig config = SceneItConfig.defaults();
        config.setDefaultTitle("Draft");
        assertEquals("Draft", new Storyboard(config).displayTitle());
    }

    @Test
    public void testAuthorsAndCharacters() {
        Author author = new Author(AuthorName.of("Bryan Lee O'Malley"));
        Character ramona = new Character(CharacterName.of("Ramona"));

        board.addAuthor(author);
        board.addAuthor(author);
        board.addCharacter(ramona);

        assertEquals(1, board.authors().size());
        assertEquals(1, board.characters().size());
        assertSame(ramona, board.character(ramona.id()).orElseThrow());

        board.removeAuthor(author.id());
        board.removeCharacter(ramona.id());
        assertTrue(board.authors().isEmpty());
        assertTrue(board.characters().isEmpty());
    }

    @Test
    public void testPrintOutlineUsesHeadings() {
        SceneVariant variant = new SceneVariant();
        variant.setHeading(new SceneHeading(CameraLocation.INTERIOR, SceneLocation.of("diner"), SceneTimeOfDay.NIGHT));
        Scene headed = new Scene(variant);
        board.addScene(headed);
        board.setSceneAsRoot(a.id());
        board.linkScenes(a.id(), headed.id());

        String outline = board.printOutline(null);

        assertTrue(outline.startsWith("ROOT: " + a.id() + "\n"));
        assertTrue(outline.contains("  - INT. diner - NIGHT [" + headed.id() + "]\n"));
    }
}
