package com.logic.lgraph.engine;

import com.logic.lgraph.api.PropagationListener;
import com.logic.lgraph.graph.Graph;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Drives propagation runs over one {@link Graph}.
 *
 * <p>
 * The engine holds one instance of each strategy and a current selection
 * (FORWARD initially). {@link #execute(PropagationRequest)} runs the current
 * strategy from a clean state; its step log, metrics and result stay
 * available until the next run of that strategy.
 *
 * <p>
 * Options apply to every subsequent run:
 * <ul>
 * <li>executor: where level-parallel batches and the two bidirectional passes
 * run. Defaults to the calling thread.</li>
 * <li>listener: run and node callbacks, see {@link PropagationListener}.</li>
 * <li>cancellation token: checked before every node evaluation.</li>
 * </ul>
 *
 * <p>
 * Runs are not reentrant: one run at a time per engine, and the graph must
 * not be mutated while a run is in progress.
 */
public final class PropagationEngine {
    private static final Logger log = LogManager.getLogger(PropagationEngine.class);

    private final Graph graph;
    private final Map<StrategyType, PropagationStrategy> strategies = new EnumMap<>(StrategyType.class);
    private StrategyType current = StrategyType.FORWARD;

    private Executor executor = Runnable::run;
    private PropagationListener listener;
    private CancellationToken token = new CancellationToken();

    private long runCount;
    private PropagationResult lastResult;

    public PropagationEngine(Graph graph) {
        this.graph = graph;
        for (StrategyType t : StrategyType.values())
            strategies.put(t, newStrategy(t, graph));
    }

    static PropagationStrategy newStrategy(StrategyType type, Graph graph) {
        return switch (type) {
            case FORWARD -> new ForwardPropagation(graph);
            case BACKWARD -> new BackwardPropagation(graph);
            case BIDIRECTIONAL -> new BidirectionalPropagation(graph);
            case BFS -> new BfsPropagation(graph);
            case DFS -> new DfsPropagation(graph);
            case TOPOLOGICAL -> new TopologicalPropagation(graph);
            case PARALLEL -> new ParallelPropagation(graph);
            case LAZY -> new LazyPropagation(graph);
            case EAGER -> new EagerPropagation(graph);
        };
    }

    /**
     * @throws com.logic.lgraph.exception.ValidationException for unknown names.
     */
    public PropagationEngine setStrategy(String name) {
        return setStrategy(StrategyType.fromString(name));
    }

    public PropagationEngine setStrategy(StrategyType type) {
        this.current = type;
        return this;
    }

    public StrategyType getStrategyType() {
        return current;
    }

    /** The strategy instance behind a type, e.g. to call {@link LazyPropagation#getValue}. */
    public PropagationStrategy strategy(StrategyType type) {
        return strategies.get(type);
    }

    public PropagationEngine setExecutor(Executor executor) {
        this.executor = executor == null ? Runnable::run : executor;
        return this;
    }

    public PropagationEngine setListener(PropagationListener listener) {
        this.listener = listener;
        return this;
    }

    public PropagationEngine setCancellationToken(CancellationToken token) {
        this.token = token == null ? new CancellationToken() : token;
        return this;
    }

    public CancellationToken getCancellationToken() {
        return token;
    }

    /**
     * Runs the current strategy.
     *
     * @return the run's results, steps, metrics and node errors.
     * @throws com.logic.lgraph.exception.LogicGraphException if the run could
     *         not start or failed; see {@link PropagationStrategy#propagate}.
     */
    public PropagationResult execute(PropagationRequest request) {
        PropagationStrategy strategy = strategies.get(current);
        lastResult = run(strategy, request);
        return lastResult;
    }

    /** Runs the current strategy and returns only the result map. */
    public Map<String, Double> execute(List<String> startNodes, List<double[]> inputs) {
        return execute(PropagationRequest.of(startNodes, inputs)).getResults();
    }

    private PropagationResult run(PropagationStrategy strategy, PropagationRequest request) {
        long runId = ++runCount;
        strategy.configure(runId, listener, token, executor);
        log.debug("Run {}: {} over graph {} with {}", runId, strategy.type().id(), graph.getName(), request);
        return strategy.propagate(request);
    }

    /** Step log of the current strategy's latest run. */
    public List<PropagationStep> getStepHistory() {
        return strategies.get(current).getSteps();
    }

    /** Metrics of the current strategy's latest run. */
    public PropagationMetrics getMetrics() {
        return strategies.get(current).getMetrics();
    }

    public RunStatus getStatus() {
        return strategies.get(current).getStatus();
    }

    /** Result of the latest successful {@link #execute} call, or null. */
    public PropagationResult getLastResult() {
        return lastResult;
    }

    /**
     * Runs each named strategy once on a fresh instance, so neither the
     * engine's strategies nor the other comparisons see its state. A failing
     * strategy is reported with its error and does not stop the comparison.
     *
     * @return a report per strategy, in the order named.
     * @throws com.logic.lgraph.exception.ValidationException if any name is
     *         unknown. Nothing runs in that case.
     */
    public Map<StrategyType, StrategyReport> compareStrategies(List<String> names, List<String> startNodes,
            List<double[]> inputs) {
        List<StrategyType> types = new ArrayList<>(names.size());
        for (String name : names)
            types.add(StrategyType.fromString(name));

        PropagationRequest request = PropagationRequest.of(startNodes, inputs);
        Map<StrategyType, StrategyReport> reports = new LinkedHashMap<>();
        for (StrategyType type : types) {
            try {
                reports.put(type, StrategyReport.success(run(newStrategy(type, graph), request)));
            } catch (RuntimeException e) {
                String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("Strategy {} failed during comparison: {}", type.id(), message);
                reports.put(type, StrategyReport.failure(message));
            }
        }
        return reports;
    }

    public Graph graph() {
        return graph;
    }

    public long runCount() {
        return runCount;
    }
}
