package com.logic.lgraph.node;

import com.logic.lgraph.api.MembershipFunction;
import com.logic.lgraph.api.NodeEvaluator;
import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.fn.FnN;
import com.logic.lgraph.fn.OperatorType;
import com.logic.lgraph.fn.fuzzy.FuzzyGateType;
import com.logic.lgraph.fn.logic.GateType;
import com.logic.lgraph.util.ErrorRateLimiter;
import com.logic.lgraph.util.Props;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.DoubleUnaryOperator;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * A vertex of a {@link com.logic.lgraph.graph.Graph}.
 *
 * <p>
 * Configuration is fixed at construction (only layer and position may change
 * later); the outcome of the latest evaluation lives in {@link NodeState}.
 * Adjacency is owned by the graph, not by the node.
 *
 * <p>
 * {@link #evaluate(double...)} never throws: failures are recorded in the
 * state's {@code error}, the node outputs 0 and the failure is logged at WARN
 * through a rate limiter owned by the node.
 */
@Getter
public final class Node {
    private static final Logger log = LogManager.getLogger(Node.class);
    private static final NodeEvaluator DEFAULT_EVALUATOR = new DefaultNodeEvaluator();
    // Numeric gate and fuzzy parameters read from metadata at evaluation
    private static final List<String> NUMERIC_PARAMS = List.of("k", "maxValue", "fuzzyThreshold", "gamma", "lambda", "w");

    private final String id;
    private final String name;
    private int layer;
    private double x, y;
    private final NodeKind kind;
    private final OperatorType operator;
    private final int branchCount;
    private final List<String> branchLabels;
    private final List<String> branchConditions;
    private final Map<String, Boolean> truthTable;
    private final MembershipFunction membership;
    private final double[] probabilities;
    private final FnN customFunction;
    private final ScoringFunction scoring;
    private final DoubleUnaryOperator customScoring;
    private final double[] weights;
    private final double[] thresholds;
    private final double bias;
    private final Map<String, Object> metadata;
    private final Map<String, Object> visual;
    private final NodeEvaluator evaluator;
    private final NodeState state = new NodeState();
    @Getter(AccessLevel.PACKAGE)
    private final ErrorRateLimiter errorLog = new ErrorRateLimiter(log, 1000, Level.WARN);

    /**
     * @throws ValidationException if the configuration is inconsistent, e.g. a
     *                             fuzzy gate configured with a crisp operator.
     */
    public Node(NodeConfig config) {
        this.id = config.getId() == null ? UUID.randomUUID().toString() : config.getId();
        if (id.isBlank())
            throw new ValidationException("Node id must not be blank");
        this.name = config.getName() != null ? config.getName()
                : "Node_" + id.substring(0, Math.min(8, id.length()));
        this.layer = config.getLayer();
        this.x = config.getX();
        this.y = config.getY();
        this.kind = config.getKind() == null ? NodeKind.DECISION : config.getKind();
        this.operator = config.getOperator() == null ? kind.defaultOperator() : config.getOperator();
        this.branchCount = config.getBranchCount();
        if (branchCount < 1)
            throw new ValidationException("Node " + id + ": branch count must be at least 1, got " + branchCount);
        this.branchLabels = config.getBranchLabels() == null || config.getBranchLabels().isEmpty()
                ? defaultBranchLabels(branchCount)
                : List.copyOf(config.getBranchLabels());
        this.branchConditions = config.getBranchConditions() == null ? List.of()
                : List.copyOf(config.getBranchConditions());
        this.truthTable = config.getTruthTable() == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(config.getTruthTable()));
        this.membership = config.getMembership();
        this.probabilities = config.getProbabilities() == null ? null : config.getProbabilities().clone();
        this.customFunction = config.getCustomFunction();
        this.scoring = config.getScoring() == null ? ScoringFunction.LINEAR : config.getScoring();
        this.customScoring = config.getCustomScoring();
        this.weights = config.getWeights() == null ? new double[0] : config.getWeights().clone();
        this.thresholds = config.getThresholds() == null ? new double[0] : config.getThresholds().clone();
        this.bias = config.getBias();
        this.metadata = new LinkedHashMap<>(config.getMetadata());
        this.visual = new LinkedHashMap<>(config.getVisual());
        this.evaluator = config.getEvaluator() == null ? DEFAULT_EVALUATOR : config.getEvaluator();
        validate();
    }

    private void validate() {
        validateParameters();
        switch (kind) {
            case LOGIC_GATE -> {
                if (!(operator instanceof GateType))
                    throw new ValidationException("Node " + id + ": logic gate needs a gate operator, got " + operator.id());
            }
            case FUZZY_GATE -> {
                if (!(operator instanceof FuzzyGateType))
                    throw new ValidationException("Node " + id + ": fuzzy gate needs a fuzzy operator, got " + operator.id());
            }
            case MULTI_VALUED -> {
                if (!(operator instanceof GateType g) || g.family() != GateType.Family.MULTI_VALUED)
                    throw new ValidationException(
                            "Node " + id + ": multi-valued node needs a multi-valued operator, got " + operator.id());
            }
            case PROBABILISTIC -> {
                if (probabilities != null) {
                    for (double p : probabilities) {
                        if (!(p >= 0))
                            throw new ValidationException("Node " + id + ": probabilities must be non-negative");
                    }
                }
            }
            default -> {
                // DECISION, HYBRID and STATISTICAL accept any operator
            }
        }
    }

    private void validateParameters() {
        try {
            for (String key : NUMERIC_PARAMS)
                Props.getDouble(metadata, key, 0);
            Props.getDoubleArray(metadata, "weights");
        } catch (ValidationException e) {
            throw new ValidationException("Node " + id + ": " + e.getMessage(), e);
        }
    }

    /**
     * Evaluates this node and stores the result in its state.
     *
     * @return the output, or 0 if evaluation failed
     */
    public double evaluate(double... inputs) {
        state.setError(null);
        double result;
        try {
            result = evaluator.evaluate(this, inputs);
        } catch (RuntimeException e) {
            state.setError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            errorLog.log("Evaluation of node " + id + " failed: " + state.getError(), e);
            result = 0;
        }
        state.setValue(result);
        state.setActive(true);
        state.setVisited(true);
        return result;
    }

    public void setLayer(int layer) {
        this.layer = layer;
    }

    public void setPosition(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double[] getProbabilities() {
        return probabilities == null ? null : probabilities.clone();
    }

    public double[] getWeights() {
        return weights.clone();
    }

    public double[] getThresholds() {
        return thresholds.clone();
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Map<String, Object> getVisual() {
        return Collections.unmodifiableMap(visual);
    }

    public String branchLabel(int branch) {
        return branch >= 0 && branch < branchLabels.size() ? branchLabels.get(branch) : null;
    }

    /** Configuration equivalent to this node, with the same id. State is not part of it. */
    public NodeConfig toConfig() {
        NodeConfig c = new NodeConfig()
                .id(id).name(name).layer(layer).position(x, y)
                .kind(kind).operator(operator)
                .branchCount(branchCount).branchLabels(branchLabels).branchConditions(branchConditions)
                .truthTable(truthTable).membership(membership)
                .customFunction(customFunction)
                .scoring(scoring)
                .weights(weights.clone()).thresholds(thresholds.clone()).bias(bias)
                .metadata(metadata).visual(visual)
                .evaluator(evaluator);
        if (probabilities != null)
            c.probabilities(probabilities.clone());
        if (customScoring != null)
            c.customScoring(customScoring).scoring(scoring);
        return c;
    }

    /** Copy under a fresh random id, named {@code <name>_copy}. */
    public Node copy() {
        return copy(UUID.randomUUID().toString());
    }

    public Node copy(String newId) {
        return new Node(toConfig().id(newId).name(name + "_copy"));
    }

    /** Generated labels: False/True, Low/Medium/High, Very Low..Very High, else "Branch n". */
    public static List<String> defaultBranchLabels(int count) {
        switch (count) {
            case 2:
                return List.of("False", "True");
            case 3:
                return List.of("Low", "Medium", "High");
            case 4:
                return List.of("Very Low", "Low", "High", "Very High");
            default:
                List<String> labels = new ArrayList<>(count);
                for (int i = 0; i < count; i++)
                    labels.add("Branch " + (i + 1));
                return Collections.unmodifiableList(labels);
        }
    }

    @Override
    public String toString() {
        return "Node[" + id + ", " + kind.id() + "/" + operator.id() + "]";
    }
}
