package com.logic.lgraph.graph;

import com.logic.lgraph.api.EdgeCondition;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/** Fluent description of an edge. Defaults: random id, ports 0, weight 1, ALWAYS, DIRECT. */
@Getter
public final class EdgeConfig {
    private String id;
    private int sourcePort;
    private int targetPort;
    private double weight = 1.0;
    private ConditionType condition = ConditionType.ALWAYS;
    private EdgeCondition predicate;
    private String label = "";
    private EdgeTransform transform = EdgeTransform.DIRECT;
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final Map<String, Object> visual = new LinkedHashMap<>();

    public static EdgeConfig defaults() {
        return new EdgeConfig();
    }

    public EdgeConfig id(String id) {
        this.id = id;
        return this;
    }

    public EdgeConfig sourcePort(int sourcePort) {
        this.sourcePort = sourcePort;
        return this;
    }

    public EdgeConfig targetPort(int targetPort) {
        this.targetPort = targetPort;
        return this;
    }

    public EdgeConfig weight(double weight) {
        this.weight = weight;
        return this;
    }

    public EdgeConfig condition(ConditionType condition) {
        this.condition = condition;
        return this;
    }

    /** Installs a predicate on the source value and selects {@link ConditionType#CUSTOM}. */
    public EdgeConfig when(EdgeCondition predicate) {
        this.predicate = predicate;
        this.condition = ConditionType.CUSTOM;
        return this;
    }

    public EdgeConfig label(String label) {
        this.label = label;
        return this;
    }

    public EdgeConfig transform(EdgeTransform transform) {
        this.transform = transform;
        return this;
    }

    public EdgeConfig metadata(Map<String, ?> metadata) {
        if (metadata != null)
            this.metadata.putAll(metadata);
        return this;
    }

    public EdgeConfig visual(Map<String, ?> visual) {
        if (visual != null)
            this.visual.putAll(visual);
        return this;
    }
}
