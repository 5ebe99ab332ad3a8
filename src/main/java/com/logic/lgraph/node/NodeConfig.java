package com.logic.lgraph.node;

import com.logic.lgraph.api.MembershipFunction;
import com.logic.lgraph.api.NodeEvaluator;
import com.logic.lgraph.fn.FnN;
import com.logic.lgraph.fn.OperatorType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

import lombok.Getter;

/**
 * Fluent description of a node, consumed by
 * {@link com.logic.lgraph.graph.Graph#addNode(NodeConfig)}. Unset fields take
 * the node defaults: random id, layer 0, kind DECISION, the kind's default
 * operator, two branches, LINEAR scoring.
 */
@Getter
public final class NodeConfig {
    private String id;
    private String name;
    private int layer;
    private double x, y;
    private NodeKind kind = NodeKind.DECISION;
    private OperatorType operator;
    private int branchCount = 2;
    private List<String> branchLabels;
    private List<String> branchConditions;
    private Map<String, Boolean> truthTable;
    private MembershipFunction membership;
    private double[] probabilities;
    private FnN customFunction;
    private ScoringFunction scoring = ScoringFunction.LINEAR;
    private DoubleUnaryOperator customScoring;
    private double[] weights;
    private double[] thresholds;
    private double bias;
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final Map<String, Object> visual = new LinkedHashMap<>();
    private NodeEvaluator evaluator;

    public static NodeConfig of(String id, NodeKind kind) {
        return new NodeConfig().id(id).kind(kind);
    }

    public NodeConfig id(String id) {
        this.id = id;
        return this;
    }

    public NodeConfig name(String name) {
        this.name = name;
        return this;
    }

    public NodeConfig layer(int layer) {
        this.layer = layer;
        return this;
    }

    public NodeConfig position(double x, double y) {
        this.x = x;
        this.y = y;
        return this;
    }

    public NodeConfig kind(NodeKind kind) {
        this.kind = kind;
        return this;
    }

    public NodeConfig operator(OperatorType operator) {
        this.operator = operator;
        return this;
    }

    /** Parses an operator name such as {@code "and"} or {@code "fuzzy_min"}. */
    public NodeConfig operator(String name) {
        this.operator = OperatorType.parse(name);
        return this;
    }

    public NodeConfig branchCount(int branchCount) {
        this.branchCount = branchCount;
        return this;
    }

    public NodeConfig branchLabels(List<String> branchLabels) {
        this.branchLabels = branchLabels;
        return this;
    }

    public NodeConfig branchConditions(List<String> branchConditions) {
        this.branchConditions = branchConditions;
        return this;
    }

    public NodeConfig truthTable(Map<String, Boolean> truthTable) {
        this.truthTable = truthTable;
        return this;
    }

    public NodeConfig membership(MembershipFunction membership) {
        this.membership = membership;
        return this;
    }

    public NodeConfig probabilities(double... probabilities) {
        this.probabilities = probabilities;
        return this;
    }

    public NodeConfig customFunction(FnN customFunction) {
        this.customFunction = customFunction;
        return this;
    }

    public NodeConfig scoring(ScoringFunction scoring) {
        this.scoring = scoring;
        return this;
    }

    /** Sets a custom scoring function and selects {@link ScoringFunction#CUSTOM}. */
    public NodeConfig customScoring(DoubleUnaryOperator customScoring) {
        this.customScoring = customScoring;
        this.scoring = ScoringFunction.CUSTOM;
        return this;
    }

    public NodeConfig weights(double... weights) {
        this.weights = weights;
        return this;
    }

    public NodeConfig thresholds(double... thresholds) {
        this.thresholds = thresholds;
        return this;
    }

    public NodeConfig bias(double bias) {
        this.bias = bias;
        return this;
    }

    public NodeConfig meta(String key, Object value) {
        this.metadata.put(key, value);
        return this;
    }

    public NodeConfig metadata(Map<String, ?> metadata) {
        if (metadata != null)
            this.metadata.putAll(metadata);
        return this;
    }

    public NodeConfig visual(Map<String, ?> visual) {
        if (visual != null)
            this.visual.putAll(visual);
        return this;
    }

    public NodeConfig evaluator(NodeEvaluator evaluator) {
        this.evaluator = evaluator;
        return this;
    }
}
