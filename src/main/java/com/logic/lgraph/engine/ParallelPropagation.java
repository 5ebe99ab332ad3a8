package com.logic.lgraph.engine;

import com.logic.lgraph.graph.Edge;
import com.logic.lgraph.graph.Graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Level-synchronous propagation over the part of the graph reachable from the
 * start nodes.
 *
 * <p>
 * A node's level is one more than the highest level among its reachable
 * parents; nodes without such parents are level 0. The nodes of a level are
 * submitted together to the engine executor and may run concurrently. Each
 * task evaluates only its own node; results, steps and counters are merged
 * by the calling thread once the whole level is done, and only then are
 * values pushed to the next levels.
 */
public final class ParallelPropagation extends PropagationStrategy {

    public ParallelPropagation(Graph graph) {
        super(graph);
    }

    @Override
    public StrategyType type() {
        return StrategyType.PARALLEL;
    }

    @Override
    protected void run(PropagationRequest request) {
        List<List<String>> levels = buildLevels(request.startNodes());
        Map<String, List<Double>> pending = seedInputs(request);

        for (int level = 0; level < levels.size(); level++) {
            List<String> batch = levels.get(level);
            Map<String, Object> meta = Map.of("level", level);
            metrics.depth(level);

            List<CompletableFuture<Evaluation>> tasks = new ArrayList<>(batch.size());
            for (String nodeId : batch) {
                double[] in = toArray(pending.get(nodeId));
                tasks.add(CompletableFuture.supplyAsync(
                        () -> evaluate(nodeId, in, PropagationStep.PARALLEL_EVALUATE, meta), executor()));
            }

            // Barrier
            List<Evaluation> done = joinAll(tasks);
            for (Evaluation ev : done) {
                visited.add(ev.nodeId);
                commit(ev);
            }
            for (Evaluation ev : done)
                pushToChildren(ev.nodeId, ev.value, pending);
        }
    }

    /**
     * Longest-path levels of the subgraph reachable from {@code startNodes},
     * lowest level first.
     *
     * @throws com.logic.lgraph.exception.StructuralException (CYCLIC_GRAPH)
     *         if that subgraph has a cycle.
     */
    public List<List<String>> buildLevels(List<String> startNodes) {
        Set<String> reachable = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String s : startNodes) {
            if (reachable.add(s))
                queue.add(s);
        }
        while (!queue.isEmpty()) {
            for (String child : graph.children(queue.poll())) {
                if (reachable.add(child))
                    queue.add(child);
            }
        }

        TopologicalOrder.Builder b = TopologicalOrder.builder();
        for (String id : reachable)
            b.addNode(id);
        for (String id : reachable) {
            for (Edge e : graph.outgoingEdges(id))
                b.addEdge(id, e.getTarget());
        }
        TopologicalOrder topology = b.build();

        int n = topology.nodeCount();
        int[] level = new int[n];
        List<List<String>> levels = new ArrayList<>();
        for (int ti = 0; ti < n; ti++) {
            while (levels.size() <= level[ti])
                levels.add(new ArrayList<>());
            levels.get(level[ti]).add(topology.nodeId(ti));
            for (int i = 0; i < topology.childCount(ti); i++) {
                int child = topology.child(ti, i);
                level[child] = Math.max(level[child], level[ti] + 1);
            }
        }
        return levels;
    }
}
