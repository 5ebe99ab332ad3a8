package com.logic.lgraph.engine;

import com.logic.lgraph.api.PropagationListener;
import com.logic.lgraph.exception.EvaluationException;
import com.logic.lgraph.exception.LogicGraphException;
import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.graph.Edge;
import com.logic.lgraph.graph.Graph;
import com.logic.lgraph.graph.NodeError;
import com.logic.lgraph.node.Node;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import lombok.extern.log4j.Log4j2;

/**
 * Base of the nine propagation strategies.
 *
 * <p>
 * {@link #propagate(PropagationRequest)} is a template: it resets all run
 * state (including node and edge state in the graph), validates the request,
 * runs the subclass traversal and moves the status from RUNNING to COMPLETED,
 * or to FAILED if the traversal threw. Node evaluation failures are absorbed
 * by the node and only recorded in the error list.
 *
 * <p>
 * Evaluating a node is split in two so that level-parallel batches can run on
 * other threads: {@link #evaluate} touches only the node and returns an
 * {@link Evaluation}; {@link #commit} merges it into the shared run state and
 * is only ever called by the coordinating thread.
 */
@Log4j2
public abstract class PropagationStrategy {
    protected final Graph graph;

    protected final Set<String> visited = new HashSet<>();
    protected final Map<String, Double> results = new LinkedHashMap<>();
    protected final List<PropagationStep> steps = new ArrayList<>();
    protected final List<NodeError> errors = new ArrayList<>();
    protected final PropagationMetrics metrics = new PropagationMetrics();
    private RunStatus status = RunStatus.IDLE;

    // Sub-pass of a composite run: leaves graph state and run callbacks to the owner
    private boolean nested;
    private long runId;
    private PropagationListener listener;
    private CancellationToken token = new CancellationToken();
    private Executor executor = Runnable::run;

    protected PropagationStrategy(Graph graph) {
        this.graph = graph;
    }

    public abstract StrategyType type();

    protected abstract void run(PropagationRequest request);

    /** Applies the engine's options before a run. */
    void configure(long runId, PropagationListener listener, CancellationToken token, Executor executor) {
        this.runId = runId;
        this.listener = listener;
        this.token = token;
        this.executor = executor;
    }

    void nest() {
        this.nested = true;
    }

    protected final boolean isNested() {
        return nested;
    }

    /**
     * Runs this strategy from a clean state.
     *
     * @throws ValidationException if the request names unknown nodes. The run
     *                             does not start and the status stays IDLE.
     * @throws com.logic.lgraph.exception.StructuralException on a cyclic graph
     *                             where the strategy needs an order; the run
     *                             is FAILED.
     * @throws com.logic.lgraph.exception.PropagationCancelledException if the
     *                             token was cancelled; the run is FAILED.
     */
    public final PropagationResult propagate(PropagationRequest request) {
        reset();
        validate(request);

        status = RunStatus.RUNNING;
        final PropagationListener l = nested ? null : this.listener;
        if (l != null)
            l.onRunStart(runId, type());
        metrics.start();
        try {
            run(request);
            status = RunStatus.COMPLETED;
        } catch (RuntimeException e) {
            status = RunStatus.FAILED;
            log.error("{} run {} failed: {}", type().id(), runId, e.getMessage());
            throw e;
        } finally {
            metrics.stop();
            if (l != null)
                l.onRunEnd(runId, metrics.getNodesEvaluated(), status);
        }
        log.debug("{} run {} completed: {} ({} errors)", type().id(), runId, metrics, errors.size());
        return toResult();
    }

    /** Clears the run state of this strategy and of every node and edge. */
    public void reset() {
        visited.clear();
        results.clear();
        steps.clear();
        errors.clear();
        metrics.reset();
        status = RunStatus.IDLE;
        if (!nested)
            graph.resetElementState();
    }

    protected void validate(PropagationRequest request) {
        for (String id : request.startNodes())
            requireKnown(id);
        for (String id : request.goalNodes())
            requireKnown(id);
    }

    private void requireKnown(String nodeId) {
        if (graph.getNode(nodeId) == null)
            throw new ValidationException(type().id() + ": unknown node " + nodeId);
    }

    // ------------------------------------------------------------- evaluation

    /** Result of evaluating one node, not yet visible to the run. */
    protected static final class Evaluation {
        final String nodeId;
        final double value;
        final String error;
        final PropagationStep step;

        Evaluation(String nodeId, double value, String error, PropagationStep step) {
            this.nodeId = nodeId;
            this.value = value;
            this.error = error;
            this.step = step;
        }
    }

    /**
     * Evaluates a node after checking for cancellation and reports it to the
     * listener. Safe to call from executor threads as long as each node is
     * evaluated by one task only.
     */
    protected final Evaluation evaluate(String nodeId, double[] inputs, String action, Map<String, Object> meta) {
        token.throwIfCancelled(nodeId);
        Node node = graph.requireNode(nodeId);

        final PropagationListener l = this.listener;
        long start = System.nanoTime();
        double value = node.evaluate(inputs);
        long duration = System.nanoTime() - start;
        String error = node.getState().getError();

        if (l != null) {
            l.onNodeEvaluated(runId, nodeId, value, duration);
            if (error != null)
                l.onNodeError(runId, nodeId, error);
        }

        Map<String, Object> stepMeta = new LinkedHashMap<>();
        stepMeta.put("inputs", Arrays.copyOf(inputs, inputs.length));
        if (meta != null)
            stepMeta.putAll(meta);
        return new Evaluation(nodeId, value, error, new PropagationStep(nodeId, action, value, stepMeta));
    }

    /** Merges an evaluation into the run. Coordinating thread only. */
    protected final double commit(Evaluation ev) {
        results.put(ev.nodeId, ev.value);
        steps.add(ev.step);
        metrics.nodeEvaluated();
        if (ev.error != null)
            errors.add(new NodeError(ev.nodeId, ev.error));
        return ev.value;
    }

    protected final double evaluateNode(String nodeId, double[] inputs, String action, Map<String, Object> meta) {
        return commit(evaluate(nodeId, inputs, action, meta));
    }

    protected final void recordStep(String nodeId, String action, double value, Map<String, Object> meta) {
        steps.add(new PropagationStep(nodeId, action, value, meta));
    }

    /**
     * Checks the edge condition. A condition that throws closes the edge and
     * is recorded as an edge error of the source node; the run goes on.
     */
    protected final boolean passes(Edge e, double sourceValue) {
        try {
            return e.checkCondition(sourceValue);
        } catch (EvaluationException ex) {
            recordEdgeError(e, e.getSource(), ex.getMessage());
            return false;
        }
    }

    /** Records a failure to cross {@code e} against {@code nodeId}. Coordinating thread only. */
    protected final void recordEdgeError(Edge e, String nodeId, String message) {
        log.debug("{} cannot cross edge {}: {}", type().id(), e.getId(), message);
        errors.add(new NodeError(nodeId, message));
        recordStep(nodeId, PropagationStep.EDGE_ERROR, Double.NaN, Map.of("edge", e.getId()));
        if (listener != null)
            listener.onNodeError(runId, nodeId, message);
    }

    /**
     * Pushes {@code value} through every outgoing edge of {@code nodeId} whose
     * condition {@link #passes}, appending the transformed value to the target's
     * pending inputs in edge order.
     *
     * @return targets reached, in edge order
     */
    protected final List<String> pushToChildren(String nodeId, double value, Map<String, List<Double>> pending) {
        List<String> reached = new ArrayList<>();
        for (Edge e : graph.outgoingEdges(nodeId)) {
            if (!passes(e, value))
                continue;
            metrics.edgeTraversed();
            pending.computeIfAbsent(e.getTarget(), k -> new ArrayList<>()).add(e.evaluate(value));
            reached.add(e.getTarget());
        }
        return reached;
    }

    /** Pending values seeded with the start nodes' inputs. */
    protected static Map<String, List<Double>> seedInputs(PropagationRequest request) {
        Map<String, List<Double>> pending = new LinkedHashMap<>();
        List<String> start = request.startNodes();
        for (int i = 0; i < start.size(); i++) {
            List<Double> values = pending.computeIfAbsent(start.get(i), k -> new ArrayList<>());
            for (double v : request.inputsFor(i))
                values.add(v);
        }
        return pending;
    }

    protected static double[] toArray(List<Double> values) {
        if (values == null)
            return new double[0];
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = values.get(i);
        return out;
    }

    /**
     * Waits for every task and returns their values in task order.
     *
     * @throws RuntimeException the first task failure, unwrapped.
     */
    protected static <T> List<T> joinAll(List<CompletableFuture<T>> tasks) {
        try {
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture<?>[0])).join();
        } catch (CompletionException e) {
            throw unwrap(e);
        }
        List<T> out = new ArrayList<>(tasks.size());
        for (CompletableFuture<T> t : tasks)
            out.add(t.join());
        return out;
    }

    private static RuntimeException unwrap(CompletionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException re)
            return re;
        return new LogicGraphException("Propagation task failed", cause == null ? e : cause);
    }

    protected final Executor executor() {
        return executor;
    }

    protected final PropagationListener listener() {
        return listener;
    }

    protected final CancellationToken token() {
        return token;
    }

    protected final long runId() {
        return runId;
    }

    // --------------------------------------------------------------- accessors

    public RunStatus getStatus() {
        return status;
    }

    public Map<String, Double> getResults() {
        return Collections.unmodifiableMap(results);
    }

    public List<PropagationStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    public PropagationMetrics getMetrics() {
        return metrics.snapshot();
    }

    public List<NodeError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public Set<String> getVisited() {
        return Collections.unmodifiableSet(visited);
    }

    protected final PropagationResult toResult() {
        return new PropagationResult(type(), results, steps, metrics, status, errors);
    }
}
