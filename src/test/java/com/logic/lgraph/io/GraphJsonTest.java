package com.logic.lgraph.io;

import com.logic.lgraph.engine.PropagationEngine;
import com.logic.lgraph.engine.PropagationRequest;
import com.logic.lgraph.exception.StructuralException;
import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.fn.fuzzy.FuzzyGateType;
import com.logic.lgraph.fn.fuzzy.ParametricMembership;
import com.logic.lgraph.fn.logic.GateType;
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
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class GraphJsonTest {
    private static final double EPS = 1e-9;

    private Graph graph;

    @Before
    public void setUp() {
        graph = new Graph("g-1", "alarm", GraphType.DAG);
        graph.getMetadata().put("owner", "plant-3");
        graph.addNode(NodeConfig.of("sensor", NodeKind.LOGIC_GATE).operator("or")
                .name("Sensor").layer(0).position(10, 20).meta("unit", "bar"));
        graph.addNode(NodeConfig.of("level", NodeKind.FUZZY_GATE).operator(FuzzyGateType.FUZZY_MAX)
                .membership(ParametricMembership.triangular(0, 5, 10)).layer(1));
        graph.addNode(NodeConfig.of("curve", NodeKind.FUZZY_GATE)
                .membership(ParametricMembership.piecewiseLinear(new double[][] { { 0, 0 }, { 10, 1 } })));
        graph.addNode(NodeConfig.of("score", NodeKind.DECISION).branchCount(3)
                .branchLabels(List.of("ok", "warn", "trip"))
                .scoring(ScoringFunction.SIGMOID).weights(2, 1).thresholds(0.3, 0.7).bias(0.25).layer(2));
        graph.addNode(NodeConfig.of("dice", NodeKind.PROBABILISTIC).probabilities(0.25, 0.75));
        graph.addNode(NodeConfig.of("table", NodeKind.LOGIC_GATE).operator("custom")
                .truthTable(Map.of("1", true, "0", false)));

        graph.addEdge("sensor", "level", new EdgeConfig().id("e1").transform(EdgeTransform.AMPLIFY).weight(5)
                .sourcePort(1).targetPort(0).label("raw"));
        graph.addEdge("level", "score", new EdgeConfig().id("e2"));
        graph.addEdge("curve", "score", new EdgeConfig().id("e3").condition(ConditionType.NEVER));
        graph.addEdge("sensor", "table", new EdgeConfig().id("e4").transform(EdgeTransform.NEGATE));
    }

    @Test
    public void testRoundTripKeepsStructure() {
        String json = GraphJson.toJson(graph);
        Graph copy = GraphJson.fromJson(json);

        assertEquals("g-1", copy.getId());
        assertEquals("alarm", copy.getName());
        assertEquals(GraphType.DAG, copy.getType());
        assertEquals(Graph.VERSION, copy.getVersion());
        assertEquals("plant-3", copy.getMetadata().get("owner"));
        assertEquals(graph.getCreated(), copy.getCreated());
        assertEquals(List.copyOf(graph.getNodes().keySet()), List.copyOf(copy.getNodes().keySet()));
        assertEquals(List.copyOf(graph.getEdges().keySet()), List.copyOf(copy.getEdges().keySet()));

        Node sensor = copy.getNode("sensor");
        assertEquals(NodeKind.LOGIC_GATE, sensor.getKind());
        assertSame(GateType.OR, sensor.getOperator());
        assertEquals("Sensor", sensor.getName());
        assertEquals(10, sensor.getX(), EPS);
        assertEquals(20, sensor.getY(), EPS);
        assertEquals("bar", sensor.getMetadata().get("unit"));

        assertEquals(ParametricMembership.triangular(0, 5, 10), copy.getNode("level").getMembership());
        assertSame(FuzzyGateType.FUZZY_MAX, copy.getNode("level").getOperator());
        assertEquals(ParametricMembership.piecewiseLinear(new double[][] { { 0, 0 }, { 10, 1 } }),
                copy.getNode("curve").getMembership());

        Node score = copy.getNode("score");
        assertEquals(3, score.getBranchCount());
        assertEquals(List.of("ok", "warn", "trip"), score.getBranchLabels());
        assertEquals(ScoringFunction.SIGMOID, score.getScoring());
        assertArrayEquals(new double[] { 2, 1 }, score.getWeights(), EPS);
        assertArrayEquals(new double[] { 0.3, 0.7 }, score.getThresholds(), EPS);
        assertEquals(0.25, score.getBias(), EPS);
        assertEquals(2, score.getLayer());

        assertArrayEquals(new double[] { 0.25, 0.75 }, copy.getNode("dice").getProbabilities(), EPS);
        assertEquals(Boolean.TRUE, copy.getNode("table").getTruthTable().get("1"));

        Edge e1 = copy.getEdge("e1");
        assertEquals("sensor", e1.getSource());
        assertEquals("level", e1.getTarget());
        assertEquals(EdgeTransform.AMPLIFY, e1.getTransform());
        assertEquals(5, e1.getWeight(), EPS);
        assertEquals(1, e1.getSourcePort());
        assertEquals("raw", e1.getLabel());
        assertEquals(ConditionType.NEVER, copy.getEdge("e3").getCondition());
        assertEquals(EdgeTransform.NEGATE, copy.getEdge("e4").getTransform());
    }

    @Test
    public void testRoundTripEvaluatesTheSame() {
        Graph copy = GraphJson.fromJson(GraphJson.toJson(graph));
        PropagationRequest request = PropagationRequest.from("sensor", 1);

        Map<String, Double> before = new PropagationEngine(graph).setStrategy("forward").execute(request).getResults();
        Map<String, Double> after = new PropagationEngine(copy).setStrategy("forward").execute(request).getResults();
        assertEquals(before, after);
        assertEquals(1, after.get("level"), EPS);
    }

    @Test
    public void testEmptyTruthTableSurvivesRoundTrip() {
        Graph g = new Graph();
        g.addNode(NodeConfig.of("dead", NodeKind.LOGIC_GATE).operator("and").truthTable(Map.of()));
        assertEquals(0, g.getNode("dead").evaluate(1, 1), EPS);

        String json = GraphJson.toJson(g);
        assertTrue(json.contains("\"truthTable\""));
        Node copy = GraphJson.fromJson(json).getNode("dead");
        assertEquals(Map.of(), copy.getTruthTable());
        assertEquals(0, copy.evaluate(1, 1), EPS);
    }

    @Test
    public void testWireNamesAreLowerCase() {
        String json = GraphJson.toJson(graph);
        assertTrue(json.contains("\"nodeType\" : \"logic_gate\""));
        assertTrue(json.contains("\"logicType\" : \"fuzzy_max\""));
        assertTrue(json.contains("\"operator\" : \"amplify\""));
        assertTrue(json.contains("\"shape\" : \"piecewise_linear\""));
    }

    @Test
    public void testUnknownPropertiesAreIgnored() {
        String json = "{\"name\":\"tiny\",\"renderer\":\"svg\",\"nodes\":["
                + "{\"id\":\"a\",\"nodeType\":\"logic_gate\",\"logicType\":\"fuzzy_and\",\"colour\":\"red\"},"
                + "{\"id\":\"b\",\"nodeType\":\"decision\"}],"
                + "\"edges\":[{\"source\":\"a\",\"target\":\"b\",\"animated\":true}]}";
        try {
            GraphJson.fromJson(json);
            fail("fuzzy operator accepted on a logic gate");
        } catch (ValidationException e) {
            assertTrue(e.getMessage().contains("logic gate"));
        }

        Graph g = GraphJson.fromJson(json.replace("fuzzy_and", "or"));
        assertEquals("tiny", g.getName());
        assertEquals(2, g.getNodes().size());
        assertEquals(List.of("b"), g.children("a"));
        assertEquals(1, g.getEdges().values().iterator().next().getWeight(), EPS);
    }

    @Test(expected = ValidationException.class)
    public void testMalformedJson() {
        GraphJson.fromJson("{\"nodes\": [");
    }

    @Test(expected = ValidationException.class)
    public void testUnknownNodeType() {
        GraphJson.fromJson("{\"nodes\":[{\"id\":\"a\",\"nodeType\":\"quantum\"}]}");
    }

    @Test(expected = ValidationException.class)
    public void testEdgeWithoutTarget() {
        GraphJson.fromJson("{\"nodes\":[{\"id\":\"a\"}],\"edges\":[{\"source\":\"a\"}]}");
    }

    @Test(expected = StructuralException.class)
    public void testCyclicEdgesNeedAllowCycles() {
        GraphJson.fromJson("{\"nodes\":[{\"id\":\"a\"},{\"id\":\"b\"}],"
                + "\"edges\":[{\"source\":\"a\",\"target\":\"b\"},{\"source\":\"b\",\"target\":\"a\"}]}");
    }

    @Test
    public void testCyclicGraphRoundTrips() {
        Graph g = GraphJson.fromJson("{\"type\":\"cyclic\",\"nodes\":[{\"id\":\"a\"},{\"id\":\"b\"}],"
                + "\"edges\":[{\"source\":\"a\",\"target\":\"b\"},{\"source\":\"b\",\"target\":\"a\"}]}");
        assertTrue(g.isAllowCycles());
        assertTrue(GraphJson.fromJson(GraphJson.toJson(g)).detectCycle());
    }

    @Test
    public void testCustomFunctionsAreNotWritten() {
        Graph g = new Graph();
        g.addNode(NodeConfig.of("f", NodeKind.DECISION).customFunction(in -> 42));
        Graph copy = GraphJson.fromJson(GraphJson.toJson(g));
        assertNull(copy.getNode("f").getCustomFunction());
        assertEquals(0, copy.getNode("f").evaluate(), EPS);
    }
}
