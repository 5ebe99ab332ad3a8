package com.logic.lgraph.api;

import com.logic.lgraph.node.Node;

/**
 * Computes a node's output from its inputs.
 *
 * <p>
 * Injected into every {@link Node} at construction. Implementations may throw;
 * {@link Node#evaluate(double...)} catches the failure, records it on the node
 * and returns 0.
 */
@FunctionalInterface
public interface NodeEvaluator {
    double evaluate(Node node, double[] inputs);
}
