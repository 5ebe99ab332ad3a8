package com.logic.lgraph.graph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Lists the loops closed by back edges of a depth-first walk. Each loop is a
 * node path whose last element repeats its first, e.g. {@code [a, b, c, a]}.
 * Walk order follows node and edge insertion order.
 */
final class CycleFinder {
    private final Graph graph;
    private final Set<String> visited = new HashSet<>();
    private final Set<String> onStack = new HashSet<>();
    private final List<List<String>> loops = new ArrayList<>();

    private CycleFinder(Graph graph) {
        this.graph = graph;
    }

    static List<List<String>> find(Graph graph) {
        CycleFinder finder = new CycleFinder(graph);
        for (String id : graph.getNodes().keySet()) {
            if (!finder.visited.contains(id))
                finder.walk(id, new ArrayList<>());
        }
        return finder.loops;
    }

    private void walk(String id, List<String> path) {
        visited.add(id);
        onStack.add(id);
        path.add(id);
        for (String child : graph.children(id)) {
            if (onStack.contains(child)) {
                List<String> loop = new ArrayList<>(path.subList(path.indexOf(child), path.size()));
                loop.add(child);
                loops.add(loop);
            } else if (!visited.contains(child)) {
                walk(child, new ArrayList<>(path));
            }
        }
        onStack.remove(id);
    }
}
