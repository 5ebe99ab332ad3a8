package com.logic.lgraph;

import com.logic.lgraph.engine.PropagationEngine;
import com.logic.lgraph.fn.fuzzy.FuzzyInferenceSystem;
import com.logic.lgraph.graph.Graph;
import com.logic.lgraph.graph.GraphType;
import com.logic.lgraph.io.GraphJson;

/**
 * LGraph: logic graph evaluation core.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Nodes</b> turn numeric inputs into one output: crisp and
 * multi-valued gates, fuzzy gates, weighted decision nodes and sampled
 * probabilistic nodes.</li>
 * <li><b>Edges</b> carry a node's output to another, optionally transformed
 * (negated, scaled) and gated by a condition.</li>
 * <li><b>Propagation</b> walks the graph with one of nine strategies, from
 * plain forward flow to level-parallel and demand-driven evaluation.</li>
 * </ul>
 *
 * <h3>Errors</h3>
 * <p>
 * A node that fails outputs 0 and records its error; the run goes on and
 * reports the error list. Only structural problems (cycles where an order is
 * needed) and cancellation fail a run.
 */
public final class LGraph {

    private LGraph() {
        // Utility class
    }

    /** A new acyclic graph. */
    public static Graph graph(String name) {
        return new Graph(null, name, GraphType.DAG);
    }

    public static Graph graph(String name, GraphType type) {
        return new Graph(null, name, type);
    }

    /** A propagation engine over {@code graph}, set to the forward strategy. */
    public static PropagationEngine engine(Graph graph) {
        return new PropagationEngine(graph);
    }

    public static FuzzyInferenceSystem fuzzySystem() {
        return new FuzzyInferenceSystem();
    }

    public static String toJson(Graph graph) {
        return GraphJson.toJson(graph);
    }

    public static Graph fromJson(String json) {
        return GraphJson.fromJson(json);
    }
}
