package com.sceneit.engine.graph;

import com.sceneit.engine.api.CycleDetectedException;
import com.sceneit.engine.api.Id;
import com.sceneit.engine.api.InvalidMoveException;
import com.sceneit.engine.api.SceneNotInGraphException;
import com.sceneit.engine.api.StoryboardUpdate;
import com.sceneit.engine.model.Scene;
import com.sceneit.engine.util.SceneGraphExplain;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import lombok.extern.log4j.Log4j2;

/**
 * Ordering and relationship model for scenes: what can come next.
 *
 * The graph stores scene identifiers only, never scene content. It supports
 * branching paths, optional transitions and alternate story flows.
 *
 * Data layout:
 * - edges: scene id -> set of direct successors. Every member has an entry,
 * even with no successors. Any id referenced as a successor is a member.
 * - roots: story entry points, always a subset of the members.
 *
 * Cycles are not forbidden in general; {@link #moveScene} alone refuses moves
 * that would close one.
 *
 * Every mutation returns a {@link StoryboardUpdate} describing what changed, or
 * throws and leaves the graph untouched.
 *
 * Thread Safety:
 * Not thread-safe. Intended for exclusive use by one editor session; callers
 * serialise mutating access externally.
 */
@Log4j2
public final class SceneGraph {
    // Insertion-ordered so listings are stable between runs.
    private final Map<Id<Scene>, Set<Id<Scene>>> edges = new LinkedHashMap<>();
    private final Set<Id<Scene>> roots = new LinkedHashSet<>();

    /**
     * Adds a scene with no successors. Idempotent: an existing member keeps its
     * edges.
     */
    public StoryboardUpdate addScene(Id<Scene> scene) {
        Objects.requireNonNull(scene, "scene");
        edges.computeIfAbsent(scene, k -> new LinkedHashSet<>());
        return new StoryboardUpdate.SceneAdded(scene);
    }

    /**
     * Marks a scene as a story entry point, adding it to the graph first if
     * needed.
     */
    public StoryboardUpdate addRoot(Id<Scene> scene) {
        addScene(scene);
        roots.add(scene);
        return new StoryboardUpdate.SceneSetAsRoot(scene);
    }

    /**
     * Adds the transition {@code from -> dest}, adding either scene to the graph
     * if it is not a member yet. Re-adding an existing edge changes nothing.
     * <p>
     * Example: Scene 3 -> Scene 4 or Scene 3 -> Scene 5
     */
    public StoryboardUpdate addEdge(Id<Scene> from, Id<Scene> dest) {
        addScene(from);
        addScene(dest);
        edges.get(from).add(dest);
        return new StoryboardUpdate.LinkedScenes(from, dest);
    }

    /**
     * Reparents {@code scene} from {@code from} to {@code dest}.
     *
     * Steps:
     * 1. All three ids must be members (checked in order scene, from, dest).
     * 2. {@code from == dest}: nothing to do, the update is still reported.
     * 3. Remove the edge {@code from -> scene}; it must exist.
     * 4. If {@code scene} already reaches {@code dest}, the new edge
     * {@code dest -> scene} would close a loop: restore the removed edge and
     * fail. Moving a scene under itself counts as a loop.
     * 5. Add {@code dest -> scene}.
     *
     * @throws SceneNotInGraphException naming the first id that is not a member.
     * @throws InvalidMoveException     if {@code scene} is not a successor of
     *                                  {@code from}.
     * @throws CycleDetectedException   if {@code scene} can reach {@code dest}.
     */
    public StoryboardUpdate moveScene(Id<Scene> scene, Id<Scene> from, Id<Scene> dest) {
        requireMember(scene);
        requireMember(from);
        requireMember(dest);

        if (from.equals(dest))
            return new StoryboardUpdate.Moved(scene, from, dest);

        Set<Id<Scene>> parentEdges = edges.get(from);
        if (!parentEdges.remove(scene))
            throw new InvalidMoveException(scene, from, dest);

        if (isDescendant(scene, dest)) {
            parentEdges.add(scene);
            throw new CycleDetectedException(scene, dest);
        }

        edges.get(dest).add(scene);
        return new StoryboardUpdate.Moved(scene, from, dest);
    }

    /**
     * Removes a scene, its outgoing edges, its root mark and every edge pointing
     * to it. O(V) over all successor sets.
     *
     * @throws SceneNotInGraphException if the scene is not a member.
     */
    public StoryboardUpdate deleteScene(Id<Scene> scene) {
        if (edges.remove(scene) == null)
            throw new SceneNotInGraphException(scene);
        roots.remove(scene);
        for (Set<Id<Scene>> successors : edges.values())
            successors.remove(scene);
        return new StoryboardUpdate.SceneDeleted(scene);
    }

    /**
     * Removes the transition {@code from -> dest}. Removing an edge that does not
     * exist is a silent no-op; the update is still reported.
     *
     * @throws SceneNotInGraphException if {@code from} is not a member.
     */
    public StoryboardUpdate deleteEdge(Id<Scene> from, Id<Scene> dest) {
        Set<Id<Scene>> successors = edges.get(from);
        if (successors == null)
            throw new SceneNotInGraphException(from);
        if (!successors.remove(dest))
            log.trace("No edge {} -> {} to delete", from, dest);
        return new StoryboardUpdate.EdgeDeleted(from, dest);
    }

    /**
     * Direct successors of {@code scene}: every possible "next" scene. The
     * returned view can be iterated any number of times and reflects later
     * changes. Empty if the scene has no successors or is not a member.
     */
    public Set<Id<Scene>> nextScenes(Id<Scene> scene) {
        Set<Id<Scene>> successors = edges.get(scene);
        return successors == null ? Collections.emptySet() : Collections.unmodifiableSet(successors);
    }

    /**
     * Members that cannot be reached from any root. With no roots every member is
     * unreachable.
     * <p>
     * Multi-source depth-first traversal seeded with all roots at once.
     */
    public Set<Id<Scene>> unreachableScenes() {
        Set<Id<Scene>> visited = new HashSet<>();
        Deque<Id<Scene>> stack = new ArrayDeque<>(roots);

        while (!stack.isEmpty()) {
            Id<Scene> scene = stack.pop();
            if (visited.add(scene)) {
                Set<Id<Scene>> successors = edges.get(scene);
                if (successors != null)
                    stack.addAll(successors);
            }
        }

        Set<Id<Scene>> unreachable = new LinkedHashSet<>();
        for (Id<Scene> scene : edges.keySet())
            if (!visited.contains(scene))
                unreachable.add(scene);
        return unreachable;
    }

    /**
     * Whether {@code target} is reachable from {@code start} by following
     * edges. A scene always reaches itself.
     * <p>
     * Depth-first with an explicit stack; stops as soon as {@code target} is
     * popped. Visited scenes are tracked, so cycles terminate.
     */
    public boolean isDescendant(Id<Scene> start, Id<Scene> target) {
        Set<Id<Scene>> visited = new HashSet<>();
        Deque<Id<Scene>> stack = new ArrayDeque<>();
        stack.push(start);

        while (!stack.isEmpty()) {
            Id<Scene> scene = stack.pop();
            if (scene.equals(target))
                return true;
            if (visited.add(scene)) {
                Set<Id<Scene>> successors = edges.get(scene);
                if (successors != null)
                    for (Id<Scene> next : successors)
                        stack.push(next);
            }
        }
        return false;
    }

    /**
     * Breadth-first listing of the graph, for debugging.
     *
     * @param start Scene to list the subtree of, or {@code null} to list from
     *              every root.
     * @see SceneGraphExplain#printFrom(Id)
     */
    public String printFrom(Id<Scene> start) {
        return new SceneGraphExplain(this).printFrom(start);
    }

    public boolean contains(Id<Scene> scene) {
        return edges.containsKey(scene);
    }

    public boolean isRoot(Id<Scene> scene) {
        return roots.contains(scene);
    }

    /** All members, in insertion order. Read-only view. */
    public Set<Id<Scene>> scenes() {
        return Collections.unmodifiableSet(edges.keySet());
    }

    /** Root scenes, in the order they were marked. Read-only view. */
    public Set<Id<Scene>> roots() {
        return Collections.unmodifiableSet(roots);
    }

    public int sceneCount() {
        return edges.size();
    }

    public int edgeCount() {
        int n = 0;
        for (Set<Id<Scene>> successors : edges.values())
            n += successors.size();
        return n;
    }

    private void requireMember(Id<Scene> scene) {
        if (!edges.containsKey(scene))
            throw new SceneNotInGraphException(scene);
    }
}
