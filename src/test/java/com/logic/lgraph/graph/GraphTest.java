package com.logic.lgraph.graph;

import com.logic.lgraph.exception.EvaluationException;
import com.logic.lgraph.exception.StructuralException;
import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.node.NodeConfig;
import com.logic.lgraph.node.NodeKind;
import com.logic.lgraph.node.ScoringFunction;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class GraphTest {
    private static final double EPS = 1e-9;

    private Graph graph;

    private static NodeConfig sum(String id) {
        return NodeConfig.of(id, NodeKind.DECISION).customFunction(in -> Arrays.stream(in).sum());
    }

    @Before
    public void setUp() {
        graph = new Graph();
        graph.addNode(sum("a"));
        graph.addNode(sum("b"));
        graph.addNode(sum("c"));
    }

    @Test
    public void testRejectedEdgeLeavesGraphUnchanged() {
        graph.addEdge("a", "b");
        graph.addEdge("b", "c");
        String modified = graph.getModified();

        try {
            graph.addEdge("c", "a");
            fail("edge closing a cycle was accepted");
        } catch (StructuralException e) {
            assertEquals(StructuralException.Kind.CYCLE_DETECTED, e.getKind());
        }
        assertEquals(2, graph.getEdges().size());
        assertEquals(3, graph.getNodes().size());
        assertTrue(graph.children("c").isEmpty());
        assertTrue(graph.incomingEdges("a").isEmpty());
        assertEquals(modified, graph.getModified());
        assertFalse(graph.detectCycle());
    }

    @Test
    public void testMalformedParameterRejectedByAddNode() {
        try {
            graph.addNode(NodeConfig.of("gate", NodeKind.LOGIC_GATE).operator("exactly").meta("k", "two"));
            fail("malformed gate parameter accepted");
        } catch (ValidationException e) {
            assertNull(graph.getNode("gate"));
            assertEquals(3, graph.getNodes().size());
        }
    }

    @Test(expected = StructuralException.class)
    public void testSelfLoopRejectedInDag() {
        graph.addEdge("a", "a");
    }

    @Test
    public void testCyclicGraphAcceptsLoops() {
        Graph cyclic = new Graph(GraphType.CYCLIC);
        assertTrue(cyclic.isAllowCycles());
        cyclic.addNode(sum("a"));
        cyclic.addNode(sum("b"));
        cyclic.addNode(sum("c"));
        cyclic.addEdge("a", "b");
        cyclic.addEdge("b", "c");
        cyclic.addEdge("c", "a");

        assertTrue(cyclic.detectCycle());
        assertEquals(List.of(List.of("a", "b", "c", "a")), cyclic.findCycles());
        try {
            cyclic.topologicalSort();
            fail("cyclic graph sorted");
        } catch (StructuralException e) {
            assertEquals(StructuralException.Kind.CYCLIC_GRAPH, e.getKind());
        }
    }

    @Test
    public void testRemoveNodeCascades() {
        Edge ab = graph.addEdge("a", "b");
        graph.addEdge("b", "c");
        graph.addEdge("a", "c");

        assertTrue(graph.removeNode("b"));
        assertFalse(graph.removeNode("b"));
        assertEquals(1, graph.getEdges().size());
        assertNull(graph.getEdge(ab.getId()));
        assertEquals(List.of("c"), graph.children("a"));
        assertEquals(List.of("a"), graph.parents("c"));

        assertTrue(graph.removeEdge(graph.outgoingEdges("a").get(0).getId()));
        assertTrue(graph.children("a").isEmpty());
    }

    @Test(expected = ValidationException.class)
    public void testEdgeToMissingNode() {
        graph.addEdge("a", "zzz");
    }

    @Test(expected = ValidationException.class)
    public void testDuplicateNode() {
        graph.addNode(sum("a"));
    }

    @Test(expected = ValidationException.class)
    public void testDuplicateEdgeId() {
        graph.addEdge("a", "b", new EdgeConfig().id("e1"));
        graph.addEdge("b", "c", new EdgeConfig().id("e1"));
    }

    @Test
    public void testParallelEdgesCollapseInChildren() {
        graph.addEdge("a", "b");
        graph.addEdge("a", "b", new EdgeConfig().sourcePort(1));
        assertEquals(2, graph.outgoingEdges("a").size());
        assertEquals(List.of("b"), graph.children("a"));
    }

    @Test
    public void testTopologicalSortRespectsEdges() {
        graph.addNode(sum("d"));
        graph.addEdge("c", "b");
        graph.addEdge("a", "d");
        graph.addEdge("b", "d");

        List<String> order = graph.topologicalSort();
        assertEquals(4, order.size());
        for (Edge e : graph.getEdges().values())
            assertTrue(e.toString(), order.indexOf(e.getSource()) < order.indexOf(e.getTarget()));
    }

    @Test
    public void testLayers() {
        graph.getNode("b").setLayer(2);
        graph.getNode("c").setLayer(1);
        assertEquals(List.of(0, 1, 2), List.copyOf(graph.layers().keySet()));
        assertEquals(List.of("c"), graph.layers().get(1));
    }

    @Test
    public void testExecuteAppliesTransforms() {
        graph.addEdge("a", "b", new EdgeConfig().transform(EdgeTransform.NEGATE));
        Edge amplify = graph.addEdge("a", "c", new EdgeConfig().transform(EdgeTransform.AMPLIFY).weight(3));
        graph.addEdge("b", "c");

        Map<String, Double> results = graph.execute(Map.of("a", 2.0));
        assertEquals(2, results.get("a"), EPS);
        assertEquals(-2, results.get("b"), EPS);
        assertEquals(4, results.get("c"), EPS);
        assertTrue(graph.isExecuted());
        assertTrue(graph.getErrors().isEmpty());
        assertEquals(6, amplify.getState().getValue(), EPS);
        assertTrue(amplify.getState().isActive());
    }

    @Test
    public void testExecuteHonoursConditions() {
        graph.addEdge("a", "b", new EdgeConfig().condition(ConditionType.NEVER));
        graph.addEdge("a", "c", new EdgeConfig().when(v -> v > 1));

        Map<String, Double> low = graph.execute(Map.of("a", 1.0));
        assertEquals(0, low.get("b"), EPS);
        assertEquals(0, low.get("c"), EPS);

        Map<String, Double> high = graph.execute(Map.of("a", 5.0));
        assertEquals(0, high.get("b"), EPS);
        assertEquals(5, high.get("c"), EPS);
    }

    @Test
    public void testThrowingConditionClosesEdge() {
        Edge failing = graph.addEdge("a", "b", new EdgeConfig().when(v -> {
            throw new IllegalStateException("no sensor");
        }));
        graph.addEdge("a", "c");

        Map<String, Double> results = graph.execute(Map.of("a", 2.0));
        assertEquals(2, results.get("a"), EPS);
        assertEquals(0, results.get("b"), EPS);
        assertEquals(2, results.get("c"), EPS);
        assertTrue(graph.isExecuted());

        assertEquals(1, graph.getErrors().size());
        NodeError error = graph.getErrors().get(0);
        assertEquals("a", error.nodeId());
        assertTrue(error.message().contains("no sensor"));
        assertEquals(error.message(), failing.getState().getError());
        assertFalse(failing.getState().isActive());
    }

    @Test(expected = ValidationException.class)
    public void testExecuteRejectsNullInputs() {
        graph.execute(null);
    }

    @Test
    public void testExecuteCollectsNodeErrors() {
        graph.addNode(NodeConfig.of("broken", NodeKind.DECISION).scoring(ScoringFunction.CUSTOM));
        graph.addEdge("a", "broken");
        graph.addEdge("broken", "b");

        Map<String, Double> results = graph.execute(Map.of("a", 1.0));
        assertEquals(0, results.get("broken"), EPS);
        assertEquals(0, results.get("b"), EPS);
        assertEquals(1, graph.getErrors().size());
        assertEquals("broken", graph.getErrors().get(0).nodeId());

        graph.clearState();
        assertFalse(graph.isExecuted());
        assertTrue(graph.getErrors().isEmpty());
        assertTrue(Double.isNaN(graph.getNode("broken").getState().getValue()));
    }

    @Test
    public void testExecuteCyclicUsesInsertionOrder() {
        Graph cyclic = new Graph(GraphType.CYCLIC);
        cyclic.addNode(sum("x"));
        cyclic.addNode(sum("y"));
        cyclic.addEdge("x", "y");
        cyclic.addEdge("y", "x");

        // y has no result yet when x runs, so x reads the seed for y
        Map<String, Double> results = cyclic.execute(Map.of("y", 4.0));
        assertEquals(4, results.get("x"), EPS);
        assertEquals(4, results.get("y"), EPS);
    }

    @Test
    public void testInverseWithZeroWeight() {
        Edge edge = graph.addEdge("a", "b", new EdgeConfig().transform(EdgeTransform.DAMPEN).weight(0));
        assertEquals(0, edge.evaluate(5), EPS);
        try {
            edge.invert(1);
            fail("inverted a zero-weight edge");
        } catch (EvaluationException e) {
            assertEquals(e.getMessage(), edge.getState().getError());
        }

        Edge amplify = graph.addEdge("a", "c", new EdgeConfig().transform(EdgeTransform.AMPLIFY).weight(4));
        assertEquals(0.5, amplify.invert(2), EPS);
        assertEquals(-3, EdgeTransform.NEGATE.inverse(3, 1), EPS);
    }

    @Test(expected = ValidationException.class)
    public void testNegativePort() {
        graph.addEdge("a", "b", new EdgeConfig().targetPort(-1));
    }
}
