package com.sceneit.engine.util;

import com.sceneit.engine.api.Id;
import com.sceneit.engine.graph.SceneGraph;
import com.sceneit.engine.model.Scene;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Diagnostic utility for inspecting scene graph topology.
 *
 * <p>
 * Generates human-readable listings of the graph. The output is meant for
 * people and log files; it is not a stable machine-readable format.
 */
public final class SceneGraphExplain {
    private final SceneGraph graph;
    private final String indent;
    private final Map<Id<Scene>, String> labels;

    public SceneGraphExplain(SceneGraph graph) {
        this(graph, "  ", Collections.emptyMap());
    }

    /**
     * @param indent Indentation unit repeated once per traversal depth.
     * @param labels Optional display labels; scenes without one show their id.
     */
    public SceneGraphExplain(SceneGraph graph, String indent, Map<Id<Scene>, String> labels) {
        this.graph = graph;
        this.indent = indent;
        this.labels = labels;
    }

    /**
     * Breadth-first listing.
     *
     * <p>
     * With a {@code start} scene, lists the subtree below it. With {@code null},
     * every root is an independent origin (depth restarts at 0) preceded by a
     * {@code ROOT:} header. Each scene is listed once in the whole output, the
     * first time the traversal reaches it, so a scene shared by several roots
     * appears under whichever root is listed first.
     */
    public String printFrom(Id<Scene> start) {
        StringBuilder sb = new StringBuilder(256);
        Set<Id<Scene>> visited = new HashSet<>();
        if (start != null) {
            appendSubtree(sb, start, visited);
            return sb.toString();
        }
        for (Id<Scene> root : graph.roots()) {
            sb.append("ROOT: ").append(label(root)).append('\n');
            appendSubtree(sb, root, visited);
            sb.append('\n');
        }
        return sb.toString();
    }

    private void appendSubtree(StringBuilder sb, Id<Scene> origin, Set<Id<Scene>> visited) {
        Deque<Id<Scene>> queue = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        queue.add(origin);
        depths.add(0);

        while (!queue.isEmpty()) {
            Id<Scene> scene = queue.poll();
            int depth = depths.poll();
            if (!visited.add(scene))
                continue;

            sb.append(indent.repeat(depth)).append("- ").append(label(scene)).append('\n');

            for (Id<Scene> next : graph.nextScenes(scene)) {
                queue.add(next);
                depths.add(depth + 1);
            }
        }
    }

    /**
     * Dumps every member with its successors, roots flagged.
     */
    public String dumpEdges() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Scene graph (").append(graph.sceneCount()).append(" scenes, ")
                .append(graph.edgeCount()).append(" edges):\n");
        for (Id<Scene> scene : graph.scenes()) {
            sb.append("  ").append(label(scene));
            if (graph.isRoot(scene))
                sb.append(" (ROOT)");
            Set<Id<Scene>> next = graph.nextScenes(scene);
            if (!next.isEmpty()) {
                sb.append(" -> ");
                boolean first = true;
                for (Id<Scene> n : next) {
                    if (!first)
                        sb.append(", ");
                    sb.append(label(n));
                    first = false;
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Generates a Mermaid JS flowchart of the whole graph.
     * <p>
     * Nodes are declared first, then edges. Roots get the {@code root} class.
     * </p>
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph TD;\n");

        for (Id<Scene> scene : graph.scenes()) {
            sb.append("  ").append(nodeName(scene)).append("[\"").append(escape(label(scene))).append("\"]");
            if (graph.isRoot(scene))
                sb.append(":::root");
            sb.append(";\n");
        }

        for (Id<Scene> scene : graph.scenes())
            for (Id<Scene> next : graph.nextScenes(scene))
                sb.append("  ").append(nodeName(scene)).append(" --> ").append(nodeName(next)).append(";\n");

        return sb.toString();
    }

    private String label(Id<Scene> scene) {
        String label = labels.get(scene);
        return label != null ? label : scene.toString();
    }

    private static String nodeName(Id<Scene> scene) {
        return "s_" + scene.toString().replace('-', '_');
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
