package com.logic.lgraph.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO form of a {@link com.logic.lgraph.graph.Graph}, as written to and read
 * from JSON. Enum-valued fields hold lower-case names.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GraphDefinition {
    private String id, name, version, type;
    private Boolean allowCycles;
    private List<NodeDef> nodes;
    private List<EdgeDef> edges;
    private Map<String, Object> metadata;
    private String created, modified;

    /** A node and its configuration. Custom functions are not serialisable and are left out. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String id, name;
        private int layer;
        private PositionDef position;
        private String nodeType, logicType;
        private Integer branchCount;
        private List<String> branchLabels, branchConditions;
        // An empty table is a gate that is always 0, so it must survive the round trip
        @JsonInclude(JsonInclude.Include.NON_NULL)
        private Map<String, Boolean> truthTable;
        private MembershipDef fuzzyMembership;
        private double[] probabilityDistribution;
        private String scoringFunction;
        private double[] weights, thresholds;
        private double bias;
        private Map<String, Object> metadata, visual;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PositionDef {
        private double x, y;
    }

    /**
     * A parametric membership function. {@code points} is used by
     * {@code piecewise_linear}, {@code params} by every other shape.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class MembershipDef {
        private String shape;
        private double[] params;
        private double[][] points;
    }

    /** An edge; {@code operator} is the edge transform. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class EdgeDef {
        private String id, source, target;
        private int sourcePort, targetPort;
        private Double weight;
        private String condition, label, operator;
        private Map<String, Object> visual, metadata;
    }
}
