package com.logic.lgraph.engine;

import com.logic.lgraph.api.PropagationListener;
import com.logic.lgraph.exception.PropagationCancelledException;
import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.graph.Graph;
import com.logic.lgraph.node.NodeConfig;
import com.logic.lgraph.node.NodeKind;
import com.logic.lgraph.node.ScoringFunction;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class PropagationEngineTest {
    private static final double EPS = 1e-9;

    @Test
    public void testGateChain() {
        Graph graph = new Graph();
        graph.addNode(NodeConfig.of("g1", NodeKind.LOGIC_GATE).operator("and"));
        graph.addNode(NodeConfig.of("g2", NodeKind.LOGIC_GATE).operator("not"));
        graph.addEdge("g1", "g2");

        PropagationEngine engine = new PropagationEngine(graph);
        assertEquals(StrategyType.FORWARD, engine.getStrategyType());

        Map<String, Double> results = engine.execute(List.of("g1"), List.<double[]>of(new double[] { 1, 1 }));
        assertEquals(Map.of("g1", 1.0, "g2", 0.0), results);
        assertEquals(RunStatus.COMPLETED, engine.getStatus());
        assertEquals(2, engine.getStepHistory().size());
        assertEquals(2, engine.getMetrics().getNodesEvaluated());
        assertEquals(1, engine.getMetrics().getEdgesTraversed());
        assertEquals(1, engine.runCount());
    }

    @Test
    public void testStrategySelection() {
        PropagationEngine engine = new PropagationEngine(GraphFixtures.chain());
        engine.setStrategy(" Topological ");
        assertEquals(StrategyType.TOPOLOGICAL, engine.getStrategyType());
        assertTrue(engine.strategy(StrategyType.LAZY) instanceof LazyPropagation);

        PropagationResult result = engine.execute(PropagationRequest.from("a", 2));
        assertEquals(StrategyType.TOPOLOGICAL, result.getStrategy());
        assertSame(result, engine.getLastResult());
        assertEquals(2, result.get("c"), EPS);
        assertTrue(Double.isNaN(result.get("missing")));

        // state of the other strategies is untouched
        assertEquals(RunStatus.IDLE, engine.strategy(StrategyType.FORWARD).getStatus());
    }

    @Test(expected = ValidationException.class)
    public void testUnknownStrategyName() {
        new PropagationEngine(GraphFixtures.chain()).setStrategy("zigzag");
    }

    @Test
    public void testUnknownStartNodeDoesNotStartRun() {
        PropagationEngine engine = new PropagationEngine(GraphFixtures.chain());
        try {
            engine.execute(PropagationRequest.from("nope", 1));
            fail("unknown start node accepted");
        } catch (ValidationException e) {
            assertTrue(e.getMessage().contains("nope"));
        }
        assertEquals(RunStatus.IDLE, engine.getStatus());
        assertTrue(engine.getStepHistory().isEmpty());
    }

    @Test
    public void testListenerSeesRunAndNodes() {
        Graph graph = GraphFixtures.chain();
        graph.addNode(NodeConfig.of("bad", NodeKind.DECISION).scoring(ScoringFunction.CUSTOM));
        graph.addEdge("c", "bad");

        RecordingListener listener = new RecordingListener();
        PropagationEngine engine = new PropagationEngine(graph).setListener(listener);
        PropagationResult result = engine.execute(PropagationRequest.from("a", 1));

        assertEquals(List.of("start 1 forward", "node a", "node b", "node c", "node bad", "error bad",
                "end 1 4 COMPLETED"), listener.events);
        assertTrue(result.hasErrors());
        assertEquals("bad", result.getErrors().get(0).nodeId());
        assertEquals(RunStatus.COMPLETED, result.getStatus());
    }

    @Test
    public void testCancelledTokenFailsRun() {
        PropagationEngine engine = new PropagationEngine(GraphFixtures.chain());
        RecordingListener listener = new RecordingListener();
        engine.setListener(listener);
        engine.getCancellationToken().cancel("shutdown");

        try {
            engine.execute(PropagationRequest.from("a", 1));
            fail("cancelled run completed");
        } catch (PropagationCancelledException e) {
            assertTrue(e.getMessage().contains("shutdown"));
        }
        assertEquals(RunStatus.FAILED, engine.getStatus());
        assertEquals("end 1 0 FAILED", listener.events.get(listener.events.size() - 1));

        engine.getCancellationToken().reset();
        assertEquals(1, engine.execute(PropagationRequest.from("a", 1)).get("c"), EPS);
    }

    @Test
    public void testCancelMidRun() {
        CancellationToken token = new CancellationToken();
        Graph graph = new Graph();
        graph.addNode(GraphFixtures.sum("a"));
        graph.addNode(NodeConfig.of("b", NodeKind.DECISION).evaluator((n, in) -> {
            token.cancel();
            return 1;
        }));
        graph.addNode(GraphFixtures.sum("c"));
        graph.addEdge("a", "b");
        graph.addEdge("b", "c");

        PropagationEngine engine = new PropagationEngine(graph).setCancellationToken(token);
        try {
            engine.execute(PropagationRequest.from("a", 1));
            fail("run went past the cancellation");
        } catch (PropagationCancelledException e) {
            assertTrue(e.getMessage().contains("before node c"));
        }
        assertEquals(List.of("a", "b"), List.copyOf(engine.strategy(StrategyType.FORWARD).getResults().keySet()));
    }

    @Test
    public void testCompareStrategiesIsolatesRuns() {
        Graph graph = GraphFixtures.loop();
        PropagationEngine engine = new PropagationEngine(graph);

        Map<StrategyType, StrategyReport> reports = engine.compareStrategies(
                List.of("forward", "topological", "eager"), List.of("x"), List.<double[]>of(new double[] { 3 }));

        assertEquals(List.of(StrategyType.FORWARD, StrategyType.TOPOLOGICAL, StrategyType.EAGER),
                new ArrayList<>(reports.keySet()));
        StrategyReport forward = reports.get(StrategyType.FORWARD);
        assertTrue(forward.isSuccess());
        assertEquals(3, forward.getResults().get("y"), EPS);
        assertEquals(2, forward.getMetrics().getNodesEvaluated());

        StrategyReport topological = reports.get(StrategyType.TOPOLOGICAL);
        assertFalse(topological.isSuccess());
        assertNull(topological.getMetrics());
        assertTrue(topological.getResults().isEmpty());
        assertNotNull(topological.getError());

        assertTrue(reports.get(StrategyType.EAGER).isSuccess());
        assertEquals(3, reports.get(StrategyType.EAGER).getMetrics().getNodesEvaluated());

        assertEquals(3, engine.runCount());
        for (StrategyType t : StrategyType.values())
            assertEquals(RunStatus.IDLE, engine.strategy(t).getStatus());
        assertNull(engine.getLastResult());
    }

    @Test
    public void testCompareStrategiesRejectsUnknownNamesUpFront() {
        PropagationEngine engine = new PropagationEngine(GraphFixtures.chain());
        try {
            engine.compareStrategies(List.of("forward", "sideways"), List.of("a"), List.of());
            fail("unknown strategy accepted");
        } catch (ValidationException e) {
            assertEquals("Unknown strategy: sideways", e.getMessage());
        }
        assertEquals(0, engine.runCount());
    }

    @Test
    public void testRunsStartFromCleanState() {
        Graph graph = GraphFixtures.chain();
        PropagationEngine engine = new PropagationEngine(graph);
        engine.execute(PropagationRequest.from("a", 5));
        assertEquals(5, graph.getNode("c").getState().getValue(), EPS);

        PropagationResult second = engine.execute(PropagationRequest.from("b", 1));
        assertEquals(List.of("b", "c"), List.copyOf(second.getResults().keySet()));
        assertTrue(Double.isNaN(graph.getNode("a").getState().getValue()));
        assertEquals(2, second.getSteps().size());
    }

    @Test
    public void testStepsCarryInputs() {
        PropagationEngine engine = new PropagationEngine(GraphFixtures.chain());
        engine.execute(PropagationRequest.from("a", 1, 2));
        PropagationStep first = engine.getStepHistory().get(0);
        assertEquals("a", first.getNodeId());
        assertEquals(PropagationStep.EVALUATE, first.getAction());
        assertEquals(3, first.getValue(), EPS);
        assertTrue(Arrays.equals(new double[] { 1, 2 }, (double[]) first.getMetadata().get("inputs")));
        assertTrue(engine.getStepHistory().get(1).getSequence() > first.getSequence());
    }

    static final class RecordingListener implements PropagationListener {
        final List<String> events = new ArrayList<>();

        @Override
        public synchronized void onRunStart(long runId, StrategyType strategy) {
            events.add("start " + runId + " " + strategy.id());
        }

        @Override
        public synchronized void onNodeEvaluated(long runId, String nodeId, double value, long durationNanos) {
            events.add("node " + nodeId);
        }

        @Override
        public synchronized void onNodeError(long runId, String nodeId, String message) {
            events.add("error " + nodeId);
        }

        @Override
        public synchronized void onRunEnd(long runId, int nodesEvaluated, RunStatus status) {
            events.add("end " + runId + " " + nodesEvaluated + " " + status);
        }
    }
}
