package com.logic.lgraph.engine;

import com.logic.lgraph.exception.StructuralException;
import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.graph.Edge;
import com.logic.lgraph.graph.Graph;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Dependency order of a graph's nodes, computed with Kahn's algorithm.
 *
 * <p>
 * This is the one ordering used everywhere: {@link Graph#topologicalSort()},
 * the topological and eager strategies and graph execution all build it. Ties
 * are broken by node insertion order, so the result is deterministic.
 *
 * <p>
 * Children are stored CSR style: {@code childrenList[childrenOffset[i]]} up to
 * {@code childrenList[childrenOffset[i+1]]} (exclusive) are the topological
 * indices of node {@code i}'s children, one entry per edge.
 */
@Log4j2
public final class TopologicalOrder {
    // Node ids in execution order
    private final String[] topoOrder;

    private final int[] childrenOffset;
    private final int[] childrenList;
    private final int[] parentCount;
    private final Map<String, Integer> idToIndex;

    private TopologicalOrder(String[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> idToIndex) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.idToIndex = idToIndex;
    }

    /**
     * Orders every node of {@code graph} over all of its edges, whatever their
     * conditions.
     *
     * @throws StructuralException (CYCLIC_GRAPH) if the graph has a cycle.
     */
    public static TopologicalOrder of(Graph graph) {
        Builder b = builder();
        for (String id : graph.getNodes().keySet())
            b.addNode(id);
        for (Edge e : graph.getEdges().values())
            b.addEdge(e.getSource(), e.getTarget());
        return b.build();
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    public String nodeId(int ti) {
        return topoOrder[ti];
    }

    public int topoIndex(String id) {
        Integer idx = idToIndex.get(id);
        if (idx == null)
            throw new ValidationException("Unknown node: " + id);
        return idx;
    }

    /** A node with no incoming edges. */
    public boolean isSource(int ti) {
        return parentCount[ti] == 0;
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    public List<String> order() {
        return List.of(topoOrder);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> idToIdx = new HashMap<>();
        private final List<List<Integer>> forwardEdges = new ArrayList<>();

        public Builder addNode(String id) {
            if (idToIdx.containsKey(id))
                throw new ValidationException("Duplicate node id: " + id);
            idToIdx.put(id, nodes.size());
            nodes.add(id);
            forwardEdges.add(new ArrayList<>());
            return this;
        }

        /** Self-edges are accepted here and reported as a cycle by {@link #build()}. */
        public Builder addEdge(String from, String to) {
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        private int requireIndex(String id) {
            Integer idx = idToIdx.get(id);
            if (idx == null)
                throw new ValidationException("Unknown node: " + id);
            return idx;
        }

        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            for (List<Integer> children : forwardEdges)
                for (int child : children)
                    inDegree[child]++;

            int[] queue = new int[n];
            int head = 0, tail = 0;
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    queue[tail++] = i;

            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (head < tail) {
                int curr = queue[head++];
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        queue[tail++] = child;
            }
            if (topoIdx != n) {
                log.debug("Kahn ordering stopped after {} of {} nodes", topoIdx, n);
                throw new StructuralException(StructuralException.Kind.CYCLIC_GRAPH,
                        "Graph contains a cycle: ordered " + topoIdx + " of " + n + " nodes");
            }

            String[] ordered = new String[n];
            Map<String, Integer> index = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                ordered[ti] = nodes.get(reverseMap[ti]);
                index.put(ordered[ti], ti);
            }

            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            int[] parentCounts = new int[n];
            for (int ti = 0; ti < n; ti++) {
                List<Integer> children = forwardEdges.get(reverseMap[ti]);
                int base = offsets[ti];
                for (int j = 0; j < children.size(); j++) {
                    int childTi = topoMap[children.get(j)];
                    flatChildren[base + j] = childTi;
                    parentCounts[childTi]++;
                }
            }
            return new TopologicalOrder(ordered, offsets, flatChildren, parentCounts, index);
        }
    }
}
