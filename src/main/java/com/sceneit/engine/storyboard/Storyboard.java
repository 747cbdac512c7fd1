package com.sceneit.engine.storyboard;

import com.sceneit.engine.api.HasMetadata;
import com.sceneit.engine.api.Id;
import com.sceneit.engine.api.StoryboardException;
import com.sceneit.engine.api.StoryboardListener;
import com.sceneit.engine.api.StoryboardUpdate;
import com.sceneit.engine.api.UnknownSceneException;
import com.sceneit.engine.graph.SceneGraph;
import com.sceneit.engine.io.SceneItConfig;
import com.sceneit.engine.model.Author;
import com.sceneit.engine.model.Character;
import com.sceneit.engine.model.Metadata;
import com.sceneit.engine.model.Scene;
import com.sceneit.engine.model.StoryTemplate;
import com.sceneit.engine.model.Summary;
import com.sceneit.engine.model.Title;
import com.sceneit.engine.util.SceneGraphExplain;
import com.sceneit.engine.util.TextRules;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * The project workbench: packages all of a story's details and is the only
 * entry point for structural edits.
 *
 * Ownership:
 * - scene bank: id -> {@link Scene}, the authoritative content store.
 * - {@link SceneGraph}: ordering and relationships over the same ids. The graph
 * never holds scenes, only their ids.
 *
 * Every structural command follows the same path:
 * 1. Validate that every referenced scene is in the scene bank.
 * 2. Delegate the structural change to the graph.
 * 3. Touch the metadata of every scene the returned update names.
 * 4. Publish the update to the listener.
 *
 * A rejected command throws a {@link StoryboardException} and changes nothing.
 *
 * Thread Safety:
 * Not thread-safe. One editor session owns a storyboard; concurrent mutation
 * must be serialised by the caller (see
 * {@link com.sceneit.engine.wiring.StoryboardSession}).
 */
@Log4j2
public final class Storyboard implements HasMetadata {
    private final SceneItConfig config;
    private final TextRules textRules;

    private Title title;
    private Summary summary;
    private StoryTemplate template;
    private final Map<Id<Author>, Author> authors = new LinkedHashMap<>();
    private final Map<Id<Scene>, Scene> sceneBank = new LinkedHashMap<>();
    private final Map<Id<Character>, Character> characters = new LinkedHashMap<>();
    private final SceneGraph sceneGraph = new SceneGraph();
    private final Metadata metadata = new Metadata();

    private StoryboardListener listener;

    public Storyboard() {
        this(SceneItConfig.defaults());
    }

    public Storyboard(SceneItConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.textRules = TextRules.from(config);
    }

    public SceneItConfig config() {
        return config;
    }

    /**
     * Validation limits from this storyboard's configuration. Pass them to
     * {@code Title.of(input, rules)} and the name factories so user input is
     * checked against the configured lengths.
     */
    public TextRules textRules() {
        return textRules;
    }

    public void setListener(StoryboardListener listener) {
        this.listener = listener;
    }

    // ---- structural commands ----

    /**
     * Registers a scene in the scene bank and in the scene graph. Adding a scene
     * whose id is already present replaces its content and keeps its edges.
     */
    public void addScene(Scene scene) {
        Objects.requireNonNull(scene, "scene");
        StoryboardUpdate update = sceneGraph.addScene(scene.id());
        sceneBank.put(scene.id(), scene);
        apply(update);
    }

    /**
     * Moves {@code scene} from parent {@code from} to parent {@code dest}. On
     * success all three scenes are touched.
     *
     * @throws UnknownSceneException if any of the scenes is not in the scene
     *                               bank (checked in order scene, from, dest).
     * @throws StoryboardException   any failure of
     *                               {@link SceneGraph#moveScene}.
     */
    public void moveScene(Id<Scene> scene, Id<Scene> from, Id<Scene> dest) {
        requireScene(scene);
        requireScene(from);
        requireScene(dest);
        StoryboardUpdate update;
        try {
            update = sceneGraph.moveScene(scene, from, dest);
        } catch (StoryboardException e) {
            throw rejected(e);
        }
        apply(update);
    }

    /**
     * Creates the directed link {@code from -> dest}: {@code dest} becomes a
     * possible next scene after {@code from}. Both endpoints are touched.
     *
     * @throws UnknownSceneException if {@code from}, then {@code dest}, is not in
     *                               the scene bank. The graph is not modified.
     */
    public void linkScenes(Id<Scene> from, Id<Scene> dest) {
        requireScene(from);
        requireScene(dest);
        apply(sceneGraph.addEdge(from, dest));
    }

    /**
     * Removes the link {@code from -> dest} without deleting either scene.
     * Unlinking scenes that are not linked succeeds and still touches both.
     *
     * @throws UnknownSceneException    if {@code from}, then {@code dest}, is
     *                                  not in the scene bank.
     * @throws com.sceneit.engine.api.SceneNotInGraphException if {@code from} is
     *                                  not in the scene graph.
     */
    public void unlinkScenes(Id<Scene> from, Id<Scene> dest) {
        requireScene(from);
        requireScene(dest);
        StoryboardUpdate update;
        try {
            update = sceneGraph.deleteEdge(from, dest);
        } catch (StoryboardException e) {
            throw rejected(e);
        }
        apply(update);
    }

    /**
     * Removes a scene from the scene bank and from the scene graph, including
     * every link to or from it and its root mark.
     * <p>
     * Deleting a scene that is not in the scene bank is a no-op.
     */
    public void deleteScene(Id<Scene> scene) {
        if (!sceneBank.containsKey(scene)) {
            log.debug("Delete of unknown scene {} ignored", scene);
            return;
        }
        StoryboardUpdate update;
        try {
            update = sceneGraph.deleteScene(scene);
        } catch (StoryboardException e) {
            throw rejected(e);
        }
        touchAll(update);
        sceneBank.remove(scene);
        publish(update);
    }

    /**
     * Marks a scene as a story entry point.
     *
     * @throws UnknownSceneException if the scene is not in the scene bank.
     */
    public void setSceneAsRoot(Id<Scene> scene) {
        requireScene(scene);
        apply(sceneGraph.addRoot(scene));
    }

    /**
     * Scenes that no root leads to. They will not appear in any traversal of
     * the story from its entry points; useful for spotting forgotten scenes and
     * narrative dead ends.
     */
    public Set<Id<Scene>> standaloneScenes() {
        return sceneGraph.unreachableScenes();
    }

    /** Possible next scenes after {@code scene}. */
    public Set<Id<Scene>> nextScenes(Id<Scene> scene) {
        return sceneGraph.nextScenes(scene);
    }

    public Set<Id<Scene>> roots() {
        return sceneGraph.roots();
    }

    public boolean isRoot(Id<Scene> scene) {
        return sceneGraph.isRoot(scene);
    }

    /**
     * Outline listing of the story, labelled with scene headings where the
     * active variant has one.
     *
     * @param start Scene to list from, or {@code null} for every root.
     */
    public String printOutline(Id<Scene> start) {
        Map<Id<Scene>, String> labels = new HashMap<>();
        for (Scene scene : sceneBank.values())
            scene.activeVariant().heading()
                    .ifPresent(h -> labels.put(scene.id(), h + " [" + scene.id() + "]"));
        return new SceneGraphExplain(sceneGraph, config.getIndent(), labels).printFrom(start);
    }

    private void apply(StoryboardUpdate update) {
        touchAll(update);
        publish(update);
    }

    private void touchAll(StoryboardUpdate update) {
        // a same-parent move names its parent twice
        for (Id<Scene> id : new LinkedHashSet<>(update.affectedScenes())) {
            Scene scene = sceneBank.get(id);
            if (scene != null)
                scene.touch();
        }
    }

    private void publish(StoryboardUpdate update) {
        log.trace("Applied {}", update);
        StoryboardListener l = this.listener;
        if (l != null)
            l.onUpdate(update);
    }

    private void requireScene(Id<Scene> scene) {
        if (!sceneBank.containsKey(scene))
            throw rejected(new UnknownSceneException(scene));
    }

    private StoryboardException rejected(StoryboardException error) {
        log.debug("Rejected structural edit: {} {}", error.reason(), error.scenes());
        StoryboardListener l = this.listener;
        if (l != null)
            l.onRejected(error);
        return error;
    }

    // ---- content ----

    public Optional<Scene> scene(Id<Scene> id) {
        return Optional.ofNullable(sceneBank.get(id));
    }

    public boolean containsScene(Id<Scene> id) {
        return sceneBank.containsKey(id);
    }

    public Collection<Scene> scenes() {
        return Collections.unmodifiableCollection(sceneBank.values());
    }

    public Optional<Title> title() {
        return Optional.ofNullable(title);
    }

    /** The title, or the configured placeholder when none is set. */
    public String displayTitle() {
        return title != null ? title.value() : config.getDefaultTitle();
    }

    /** Sets or replaces the title. */
    public void updateTitle(Title title) {
        this.title = Objects.requireNonNull(title, "title");
    }

    /** Returns the storyboard to an unnamed state. */
    public void clearTitle() {
        this.title = null;
    }

    public Optional<Summary> summary() {
        return Optional.ofNullable(summary);
    }

    public void updateSummary(Summary summary) {
        this.summary = Objects.requireNonNull(summary, "summary");
    }

    public void clearSummary() {
        this.summary = null;
    }

    public Optional<StoryTemplate> template() {
        return Optional.ofNullable(template);
    }

    /**
     * Selects the script format. Scene data is not modified.
     */
    public void updateTemplate(StoryTemplate template) {
        this.template = Objects.requireNonNull(template, "template");
    }

    public void clearTemplate() {
        this.template = null;
    }

    /** Adds an author; an author with the same id is replaced. */
    public void addAuthor(Author author) {
        authors.put(author.id(), author);
    }

    public void removeAuthor(Id<Author> author) {
        authors.remove(author);
    }

    public Collection<Author> authors() {
        return Collections.unmodifiableCollection(authors.values());
    }

    /** Adds a character; a character with the same id is replaced. */
    public void addCharacter(Character character) {
        characters.put(character.id(), character);
    }

    /**
     * Removes a character. Dialogue that names it as speaker keeps the now
     * dangling id.
     */
    public void removeCharacter(Id<Character> character) {
        characters.remove(character);
    }

    public Optional<Character> character(Id<Character> id) {
        return Optional.ofNullable(characters.get(id));
    }

    public Collection<Character> characters() {
        return Collections.unmodifiableCollection(characters.values());
    }

    @Override
    public Metadata metadata() {
        return metadata;
    }
}
