package com.logic.lgraph.io;

import com.logic.lgraph.api.MembershipFunction;
import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.fn.OperatorType;
import com.logic.lgraph.fn.fuzzy.MembershipShape;
import com.logic.lgraph.fn.fuzzy.ParametricMembership;
import com.logic.lgraph.graph.ConditionType;
import com.logic.lgraph.graph.Edge;
import com.logic.lgraph.graph.EdgeConfig;
import com.logic.lgraph.graph.EdgeTransform;
import com.logic.lgraph.graph.Graph;
import com.logic.lgraph.graph.GraphType;
import com.logic.lgraph.node.Node;
import com.logic.lgraph.node.NodeConfig;
import com.logic.lgraph.node.NodeKind;
import com.logic.lgraph.node.ScoringFunction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Converts between a live {@link Graph} and its {@link GraphDefinition}.
 *
 * <p>
 * Compiling goes through the normal mutation calls, so every definition is
 * validated like hand-built graphs are: unknown type names, duplicate ids,
 * dangling edge endpoints and, for graphs without {@code allowCycles}, cyclic
 * edges are all rejected.
 */
@Log4j2
public final class GraphCompiler {
    private GraphCompiler() {
        // Utility class
    }

    public static Graph compile(GraphDefinition def) {
        GraphType type = def.getType() == null ? GraphType.DAG : GraphType.fromString(def.getType());
        Graph graph = new Graph(def.getId(), def.getName() == null ? "Logic Graph" : def.getName(), type);
        if (def.getAllowCycles() != null)
            graph.setAllowCycles(def.getAllowCycles());
        if (def.getVersion() != null)
            graph.setVersion(def.getVersion());
        if (def.getMetadata() != null)
            graph.getMetadata().putAll(def.getMetadata());

        if (def.getNodes() != null) {
            for (GraphDefinition.NodeDef nd : def.getNodes())
                graph.addNode(toConfig(nd));
        }
        if (def.getEdges() != null) {
            for (GraphDefinition.EdgeDef ed : def.getEdges()) {
                if (ed.getSource() == null || ed.getTarget() == null)
                    throw new ValidationException("Edge " + ed.getId() + " needs a source and a target");
                graph.addEdge(ed.getSource(), ed.getTarget(), toConfig(ed));
            }
        }
        graph.setTimestamps(def.getCreated(), def.getModified());
        log.debug("Compiled graph {} with {} nodes and {} edges", graph.getId(), graph.getNodes().size(),
                graph.getEdges().size());
        return graph;
    }

    public static GraphDefinition describe(Graph graph) {
        GraphDefinition def = new GraphDefinition();
        def.setId(graph.getId());
        def.setName(graph.getName());
        def.setVersion(graph.getVersion());
        def.setType(graph.getType().id());
        def.setAllowCycles(graph.isAllowCycles());
        def.setMetadata(new LinkedHashMap<>(graph.getMetadata()));
        def.setCreated(graph.getCreated());
        def.setModified(graph.getModified());

        List<GraphDefinition.NodeDef> nodes = new ArrayList<>(graph.getNodes().size());
        for (Node n : graph.getNodes().values())
            nodes.add(describe(n));
        def.setNodes(nodes);

        List<GraphDefinition.EdgeDef> edges = new ArrayList<>(graph.getEdges().size());
        for (Edge e : graph.getEdges().values())
            edges.add(describe(e));
        def.setEdges(edges);
        return def;
    }

    static NodeConfig toConfig(GraphDefinition.NodeDef nd) {
        NodeConfig c = new NodeConfig()
                .id(nd.getId())
                .name(nd.getName())
                .layer(nd.getLayer())
                .kind(nd.getNodeType() == null ? NodeKind.DECISION : NodeKind.fromString(nd.getNodeType()))
                .branchLabels(nd.getBranchLabels())
                .branchConditions(nd.getBranchConditions())
                .truthTable(nd.getTruthTable())
                .bias(nd.getBias())
                .metadata(nd.getMetadata())
                .visual(nd.getVisual());
        if (nd.getPosition() != null)
            c.position(nd.getPosition().getX(), nd.getPosition().getY());
        if (nd.getLogicType() != null)
            c.operator(OperatorType.parse(nd.getLogicType()));
        if (nd.getBranchCount() != null)
            c.branchCount(nd.getBranchCount());
        if (nd.getFuzzyMembership() != null)
            c.membership(toMembership(nd.getFuzzyMembership()));
        if (nd.getProbabilityDistribution() != null)
            c.probabilities(nd.getProbabilityDistribution());
        if (nd.getScoringFunction() != null)
            c.scoring(ScoringFunction.fromString(nd.getScoringFunction()));
        if (nd.getWeights() != null)
            c.weights(nd.getWeights());
        if (nd.getThresholds() != null)
            c.thresholds(nd.getThresholds());
        return c;
    }

    static GraphDefinition.NodeDef describe(Node n) {
        GraphDefinition.NodeDef nd = new GraphDefinition.NodeDef();
        nd.setId(n.getId());
        nd.setName(n.getName());
        nd.setLayer(n.getLayer());
        GraphDefinition.PositionDef pos = new GraphDefinition.PositionDef();
        pos.setX(n.getX());
        pos.setY(n.getY());
        nd.setPosition(pos);
        nd.setNodeType(n.getKind().id());
        nd.setLogicType(n.getOperator().id());
        nd.setBranchCount(n.getBranchCount());
        nd.setBranchLabels(n.getBranchLabels());
        nd.setBranchConditions(n.getBranchConditions());
        if (n.getTruthTable() != null)
            nd.setTruthTable(new LinkedHashMap<>(n.getTruthTable()));
        nd.setFuzzyMembership(describe(n.getId(), n.getMembership()));
        nd.setProbabilityDistribution(n.getProbabilities());
        nd.setScoringFunction(n.getScoring().id());
        nd.setWeights(n.getWeights());
        nd.setThresholds(n.getThresholds());
        nd.setBias(n.getBias());
        nd.setMetadata(new LinkedHashMap<>(n.getMetadata()));
        nd.setVisual(new LinkedHashMap<>(n.getVisual()));
        if (n.getCustomFunction() != null || n.getCustomScoring() != null)
            log.debug("Node {}: custom functions are not serialised", n.getId());
        return nd;
    }

    static EdgeConfig toConfig(GraphDefinition.EdgeDef ed) {
        EdgeConfig c = new EdgeConfig()
                .id(ed.getId())
                .sourcePort(ed.getSourcePort())
                .targetPort(ed.getTargetPort())
                .label(ed.getLabel())
                .metadata(ed.getMetadata())
                .visual(ed.getVisual());
        if (ed.getWeight() != null)
            c.weight(ed.getWeight());
        if (ed.getCondition() != null)
            c.condition(ConditionType.fromString(ed.getCondition()));
        if (ed.getOperator() != null)
            c.transform(EdgeTransform.fromString(ed.getOperator()));
        return c;
    }

    static GraphDefinition.EdgeDef describe(Edge e) {
        GraphDefinition.EdgeDef ed = new GraphDefinition.EdgeDef();
        ed.setId(e.getId());
        ed.setSource(e.getSource());
        ed.setTarget(e.getTarget());
        ed.setSourcePort(e.getSourcePort());
        ed.setTargetPort(e.getTargetPort());
        ed.setWeight(e.getWeight());
        ed.setCondition(e.getCondition().id());
        ed.setLabel(e.getLabel());
        ed.setOperator(e.getTransform().id());
        ed.setMetadata(new LinkedHashMap<>(e.getMetadata()));
        ed.setVisual(new LinkedHashMap<>(e.getVisual()));
        return ed;
    }

    static MembershipFunction toMembership(GraphDefinition.MembershipDef md) {
        if (md.getShape() == null)
            throw new ValidationException("Membership definition needs a shape");
        MembershipShape shape = MembershipShape.fromString(md.getShape());
        if (shape == MembershipShape.PIECEWISE_LINEAR) {
            if (md.getPoints() == null)
                throw new ValidationException("Piecewise linear membership needs points");
            return ParametricMembership.piecewiseLinear(md.getPoints());
        }
        return new ParametricMembership(shape, md.getParams() == null ? new double[0] : md.getParams());
    }

    static GraphDefinition.MembershipDef describe(String nodeId, MembershipFunction mf) {
        if (mf == null)
            return null;
        if (!(mf instanceof ParametricMembership pm)) {
            log.debug("Node {}: membership function {} is not parametric and is not serialised", nodeId, mf);
            return null;
        }
        GraphDefinition.MembershipDef md = new GraphDefinition.MembershipDef();
        md.setShape(pm.shape().id());
        double[] params = pm.params();
        if (pm.shape() == MembershipShape.PIECEWISE_LINEAR) {
            double[][] points = new double[params.length / 2][];
            for (int i = 0; i < points.length; i++)
                points[i] = new double[] { params[2 * i], params[2 * i + 1] };
            md.setPoints(points);
        } else {
            md.setParams(params);
        }
        return md;
    }
}
