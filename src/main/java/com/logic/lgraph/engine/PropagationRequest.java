package com.logic.lgraph.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Arguments of one propagation run.
 *
 * <p>
 * {@code inputs.get(i)} belongs to {@code startNodes.get(i)}; a missing or
 * null entry means no inputs. Goal nodes and target values are read by the
 * backward pass (bidirectional runs use both halves) and pick the nodes a lazy
 * run resolves. Strategies that need goals fall back to the start nodes, with
 * the first input of each as its target.
 */
public final class PropagationRequest {
    private static final double[] NONE = new double[0];

    private final List<String> startNodes;
    private final List<double[]> inputs;
    private final List<String> goalNodes;
    private final double[] targetValues;

    public PropagationRequest(List<String> startNodes, List<double[]> inputs, List<String> goalNodes,
            double[] targetValues) {
        this.startNodes = startNodes == null ? List.of() : List.copyOf(startNodes);
        this.inputs = inputs == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(inputs));
        this.goalNodes = goalNodes == null ? List.of() : List.copyOf(goalNodes);
        this.targetValues = targetValues == null ? NONE : targetValues.clone();
    }

    public static PropagationRequest of(List<String> startNodes, List<double[]> inputs) {
        return new PropagationRequest(startNodes, inputs, null, null);
    }

    /** Single start node with its inputs. */
    public static PropagationRequest from(String startNode, double... inputs) {
        List<double[]> in = new ArrayList<>(1);
        in.add(inputs);
        return new PropagationRequest(List.of(startNode), in, null, null);
    }

    /** Goal-only request, as used by backward and lazy runs. */
    public static PropagationRequest goals(List<String> goalNodes, double... targetValues) {
        return new PropagationRequest(null, null, goalNodes, targetValues);
    }

    public PropagationRequest withGoals(List<String> goalNodes, double... targetValues) {
        return new PropagationRequest(startNodes, inputs, goalNodes, targetValues);
    }

    public List<String> startNodes() {
        return startNodes;
    }

    public List<double[]> inputs() {
        return inputs;
    }

    /** Inputs of the i-th start node, never null. */
    public double[] inputsFor(int i) {
        if (i >= inputs.size() || inputs.get(i) == null)
            return NONE;
        return inputs.get(i).clone();
    }

    public boolean hasInputsFor(int i) {
        return i < inputs.size() && inputs.get(i) != null;
    }

    public List<String> goalNodes() {
        return goalNodes;
    }

    public double[] targetValues() {
        return targetValues.clone();
    }

    /** Goal nodes, or the start nodes when none were given. */
    public List<String> effectiveGoals() {
        return goalNodes.isEmpty() ? startNodes : goalNodes;
    }

    /** Target of the i-th effective goal; 0 if none was given. */
    public double targetFor(int i) {
        if (!goalNodes.isEmpty())
            return i < targetValues.length ? targetValues[i] : 0;
        double[] in = i < inputs.size() ? inputs.get(i) : null;
        return in == null || in.length == 0 ? 0 : in[0];
    }

    @Override
    public String toString() {
        return "PropagationRequest[start=" + startNodes + ", goals=" + goalNodes + "]";
    }
}
