package com.logic.lgraph.graph;

import com.logic.lgraph.api.EdgeCondition;
import com.logic.lgraph.exception.EvaluationException;
import com.logic.lgraph.exception.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import lombok.Getter;

/**
 * A directed connection between two nodes, referenced by id. Ports are
 * indices into the endpoints' branches/inputs and carry no ownership.
 */
@Getter
public final class Edge {
    private final String id;
    private final String source;
    private final String target;
    private final int sourcePort;
    private final int targetPort;
    private final double weight;
    private final ConditionType condition;
    private final EdgeCondition predicate;
    private final String label;
    private final EdgeTransform transform;
    private final Map<String, Object> metadata;
    private final Map<String, Object> visual;
    private final EdgeState state = new EdgeState();

    public Edge(String source, String target, EdgeConfig config) {
        this.id = config.getId() == null ? UUID.randomUUID().toString() : config.getId();
        if (id.isBlank())
            throw new ValidationException("Edge id must not be blank");
        if (config.getSourcePort() < 0 || config.getTargetPort() < 0)
            throw new ValidationException("Edge " + id + ": ports must be non-negative");
        if (Double.isNaN(config.getWeight()))
            throw new ValidationException("Edge " + id + ": weight must be a number");
        this.source = source;
        this.target = target;
        this.sourcePort = config.getSourcePort();
        this.targetPort = config.getTargetPort();
        this.weight = config.getWeight();
        this.condition = config.getCondition() == null ? ConditionType.ALWAYS : config.getCondition();
        this.predicate = config.getPredicate();
        this.label = config.getLabel() == null ? "" : config.getLabel();
        this.transform = config.getTransform() == null ? EdgeTransform.DIRECT : config.getTransform();
        this.metadata = new LinkedHashMap<>(config.getMetadata());
        this.visual = new LinkedHashMap<>(config.getVisual());
    }

    /** Forward value delivered to the target; recorded in the edge state. */
    public double evaluate(double sourceValue) {
        return record(transform.apply(sourceValue, weight));
    }

    /**
     * Value the source must have for the target to see {@code targetValue}.
     * Leaves the edge state untouched.
     *
     * @throws EvaluationException when the transform cannot be inverted.
     */
    public double inverse(double targetValue) {
        return transform.inverse(targetValue, weight);
    }

    /**
     * Like {@link #inverse(double)}, but records the value in the edge state.
     *
     * @throws EvaluationException when the transform cannot be inverted; the
     *                             message is also recorded on the edge.
     */
    public double invert(double targetValue) {
        try {
            return record(inverse(targetValue));
        } catch (EvaluationException e) {
            state.setError(e.getMessage());
            throw e;
        }
    }

    /** Stores {@code v} as the value the edge carried in this run. */
    public double record(double v) {
        state.setValue(v);
        state.setFlow(Math.abs(v));
        state.setActive(true);
        return v;
    }

    /**
     * Whether a value from the source may cross this edge.
     *
     * @throws EvaluationException if a custom condition throws; the message is
     *                             also recorded on the edge.
     */
    public boolean checkCondition(double sourceValue) {
        return switch (condition) {
            case ALWAYS -> true;
            case NEVER -> false;
            case CUSTOM -> predicate == null || testPredicate(sourceValue);
        };
    }

    private boolean testPredicate(double sourceValue) {
        try {
            return predicate.test(sourceValue);
        } catch (RuntimeException e) {
            String message = "Condition of edge " + id + " failed: "
                    + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            state.setError(message);
            throw new EvaluationException(message, e);
        }
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Map<String, Object> getVisual() {
        return Collections.unmodifiableMap(visual);
    }

    public EdgeConfig toConfig() {
        EdgeConfig c = new EdgeConfig()
                .id(id).sourcePort(sourcePort).targetPort(targetPort).weight(weight)
                .condition(condition).label(label).transform(transform)
                .metadata(metadata).visual(visual);
        if (predicate != null)
            c.when(predicate).condition(condition);
        return c;
    }

    @Override
    public String toString() {
        return "Edge[" + id + ": " + source + " -> " + target + ", " + transform.id() + " x" + weight + "]";
    }
}
