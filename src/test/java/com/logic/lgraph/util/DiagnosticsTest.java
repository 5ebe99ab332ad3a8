package com.logic.lgraph.util;

import com.logic.lgraph.api.PropagationListener;
import com.logic.lgraph.engine.PropagationEngine;
import com.logic.lgraph.engine.PropagationRequest;
import com.logic.lgraph.engine.RunStatus;
import com.logic.lgraph.engine.StrategyType;
import com.logic.lgraph.graph.EdgeConfig;
import com.logic.lgraph.graph.EdgeTransform;
import com.logic.lgraph.graph.Graph;
import com.logic.lgraph.node.NodeConfig;
import com.logic.lgraph.node.NodeKind;
import com.logic.lgraph.node.ScoringFunction;
import org.apache.logging.log4j.LogManager;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class DiagnosticsTest {

    private Graph graph;
    private PropagationEngine engine;

    @Before
    public void setUp() {
        graph = new Graph(null, "valve", null);
        graph.addNode(NodeConfig.of("in-a", NodeKind.LOGIC_GATE).operator("or").name("Input A"));
        graph.addNode(NodeConfig.of("gate", NodeKind.LOGIC_GATE).operator("and"));
        graph.addNode(NodeConfig.of("broken", NodeKind.DECISION).scoring(ScoringFunction.CUSTOM));
        graph.addEdge("in-a", "gate", new EdgeConfig().label("open"));
        graph.addEdge("gate", "broken", new EdgeConfig().transform(EdgeTransform.NEGATE));
        engine = new PropagationEngine(graph);
    }

    @Test
    public void testCompositeFansOutInOrder() {
        StringBuilder order = new StringBuilder();
        AtomicInteger ends = new AtomicInteger();
        CompositePropagationListener composite = new CompositePropagationListener()
                .add(new Adapter() {
                    @Override
                    public void onRunStart(long runId, StrategyType strategy) {
                        order.append("first ");
                    }
                })
                .add(new Adapter() {
                    @Override
                    public void onRunStart(long runId, StrategyType strategy) {
                        order.append("second");
                    }

                    @Override
                    public void onRunEnd(long runId, int nodesEvaluated, RunStatus status) {
                        ends.incrementAndGet();
                    }
                });
        assertEquals(2, composite.size());

        engine.setListener(composite).execute(PropagationRequest.from("in-a", 1));
        assertEquals("first second", order.toString());
        assertEquals(1, ends.get());
    }

    @Test
    public void testProfileCountsEvaluationsAndErrors() {
        NodeProfileListener profile = new NodeProfileListener();
        engine.setListener(profile);
        engine.execute(PropagationRequest.from("in-a", 1));
        engine.execute(PropagationRequest.from("in-a", 0));

        assertEquals(2, profile.runs());
        assertEquals(2, profile.stats("gate").count);
        assertEquals(0, profile.stats("gate").errors);
        assertEquals(2, profile.stats("broken").errors);
        assertTrue(profile.stats("gate").avgMicros() >= 0);
        assertNull(profile.stats("nobody"));

        String dump = profile.dump();
        assertTrue(dump.startsWith(String.format("%-30s |", "Node")));
        assertTrue(dump.contains("broken"));
        assertEquals(5, dump.split("\n").length);

        profile.reset();
        assertEquals(0, profile.runs());
        assertNull(profile.stats("gate"));
    }

    @Test
    public void testExplainNodeAndRun() {
        GraphExplain explain = new GraphExplain(graph, engine);
        assertEquals("No run yet", explain.explainLastRun());
        assertEquals("No engine attached", new GraphExplain(graph).explainLastRun());

        engine.execute(PropagationRequest.from("in-a", 1));
        assertEquals("Run 1 [forward] COMPLETED, evaluated 3/3, errors 1", explain.explainLastRun());

        String gate = explain.explainNode("gate");
        assertTrue(gate.contains("Operator: and"));
        assertTrue(gate.contains("Value: 1.0"));
        assertTrue(gate.contains("Parents (1): in-a"));
        assertTrue(gate.contains("Children (1): broken"));
        assertTrue(explain.explainNode("broken").contains("Error: "));
    }

    @Test
    public void testTopologyAndMermaid() {
        GraphExplain explain = new GraphExplain(graph);
        String topology = explain.dumpTopology();
        assertTrue(topology.startsWith("Graph valve (3 nodes, 2 edges):"));
        assertTrue(topology.contains("in-a [logic_gate] (SRC) -> gate\n"));
        assertTrue(topology.contains("gate [logic_gate] -> broken(negate)\n"));

        String mermaid = explain.toMermaid();
        assertTrue(mermaid.startsWith("graph TD;"));
        assertTrue(mermaid.contains("in_a[\"Input A<br/>or<br/><b>-</b>\"];"));
        assertTrue(mermaid.contains("in_a -- \"open\" --> gate;"));
        assertTrue(mermaid.contains("gate --> broken;"));
    }

    @Test
    public void testRateLimiterThrottlesRepeats() {
        ErrorRateLimiter limiter = new ErrorRateLimiter(LogManager.getLogger(DiagnosticsTest.class), 60_000);
        assertTrue(limiter.log("first failure", null));
        assertFalse(limiter.log("second failure", null));
        assertFalse(limiter.log("third failure", null));
        assertEquals(2, limiter.suppressedCount());
    }

    private static class Adapter implements PropagationListener {
        @Override
        public void onRunStart(long runId, StrategyType strategy) {
        }

        @Override
        public void onNodeEvaluated(long runId, String nodeId, double value, long durationNanos) {
        }

        @Override
        public void onNodeError(long runId, String nodeId, String message) {
        }

        @Override
        public void onRunEnd(long runId, int nodesEvaluated, RunStatus status) {
        }
    }
}
