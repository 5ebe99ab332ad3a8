package com.logic.lgraph.graph;

import com.logic.lgraph.engine.TopologicalOrder;
import com.logic.lgraph.exception.EvaluationException;
import com.logic.lgraph.exception.StructuralException;
import com.logic.lgraph.exception.ValidationException;
import com.logic.lgraph.io.GraphCompiler;
import com.logic.lgraph.io.GraphDefinition;
import com.logic.lgraph.node.Node;
import com.logic.lgraph.node.NodeConfig;

import java.time.Instant;
import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A logic graph: nodes and edges in insertion order, plus the state of the
 * last {@link #execute(Map)} call.
 *
 * <p>
 * Edges are the single source of truth for connectivity. Per-node lists of
 * incoming and outgoing edge ids are kept alongside for fast lookup and are
 * only ever changed by {@code link}/{@code unlink}; {@link #children} and
 * {@link #parents} are derived from them.
 *
 * <p>
 * Unless {@code allowCycles} is set, an edge that would close a cycle is
 * rejected before anything is modified.
 *
 * <p>
 * Not thread-safe. Strategies read the graph concurrently only while no one
 * mutates it.
 */
public final class Graph {
    private static final Logger log = LogManager.getLogger(Graph.class);

    public static final String VERSION = "2.0";

    private static final int GREY = 1, BLACK = 2;

    private final String id;
    private String name;
    private String version = VERSION;
    private final GraphType type;
    private boolean allowCycles;
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private String created;
    private String modified;

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Edge> edges = new LinkedHashMap<>();
    private final Map<String, List<String>> outEdges = new HashMap<>();
    private final Map<String, List<String>> inEdges = new HashMap<>();

    // Last execute() call
    private boolean executed;
    private final Map<String, Double> results = new LinkedHashMap<>();
    private final List<NodeError> errors = new ArrayList<>();
    private long elapsedNanos;

    public Graph() {
        this(GraphType.DAG);
    }

    public Graph(GraphType type) {
        this(null, "Logic Graph", type);
    }

    /** {@code allowCycles} defaults to true for CYCLIC graphs only. */
    public Graph(String id, String name, GraphType type) {
        this.id = id == null ? UUID.randomUUID().toString() : id;
        this.name = name;
        this.type = type == null ? GraphType.DAG : type;
        this.allowCycles = this.type == GraphType.CYCLIC;
        this.created = Instant.now().toString();
        this.modified = created;
    }

    // ---------------------------------------------------------------- mutation

    /**
     * @throws ValidationException on a duplicate id or an inconsistent
     *                             configuration.
     */
    public Node addNode(NodeConfig config) {
        return addNode(new Node(config));
    }

    public Node addNode(Node node) {
        if (nodes.containsKey(node.getId()))
            throw new ValidationException("Duplicate node id: " + node.getId());
        nodes.put(node.getId(), node);
        outEdges.put(node.getId(), new ArrayList<>());
        inEdges.put(node.getId(), new ArrayList<>());
        touch();
        return node;
    }

    public Edge addEdge(String source, String target) {
        return addEdge(source, target, EdgeConfig.defaults());
    }

    /**
     * Connects two existing nodes.
     *
     * @throws ValidationException if an endpoint is missing or the edge id is
     *                             taken.
     * @throws StructuralException (CYCLE_DETECTED) if cycles are not allowed and
     *                             the edge would close one. The graph is left
     *                             exactly as it was.
     */
    public Edge addEdge(String source, String target, EdgeConfig config) {
        requireNode(source);
        requireNode(target);
        Edge edge = new Edge(source, target, config);
        if (edges.containsKey(edge.getId()))
            throw new ValidationException("Duplicate edge id: " + edge.getId());
        if (!allowCycles && hasCycle(source, target)) {
            log.debug("Rejected edge {} -> {}: would close a cycle", source, target);
            throw new StructuralException(StructuralException.Kind.CYCLE_DETECTED,
                    "Adding edge " + source + " -> " + target + " would create a cycle");
        }
        link(edge);
        touch();
        return edge;
    }

    /** Removes the node and every edge touching it. */
    public boolean removeNode(String nodeId) {
        if (!nodes.containsKey(nodeId))
            return false;
        List<String> touching = new ArrayList<>(inEdges.get(nodeId));
        touching.addAll(outEdges.get(nodeId));
        for (String edgeId : touching)
            removeEdge(edgeId);
        nodes.remove(nodeId);
        outEdges.remove(nodeId);
        inEdges.remove(nodeId);
        touch();
        return true;
    }

    public boolean removeEdge(String edgeId) {
        Edge edge = edges.get(edgeId);
        if (edge == null)
            return false;
        unlink(edge);
        touch();
        return true;
    }

    private void link(Edge edge) {
        edges.put(edge.getId(), edge);
        outEdges.get(edge.getSource()).add(edge.getId());
        inEdges.get(edge.getTarget()).add(edge.getId());
    }

    private void unlink(Edge edge) {
        edges.remove(edge.getId());
        outEdges.get(edge.getSource()).remove(edge.getId());
        inEdges.get(edge.getTarget()).remove(edge.getId());
    }

    private void touch() {
        modified = Instant.now().toString();
    }

    // --------------------------------------------------------------- adjacency

    public List<Edge> outgoingEdges(String nodeId) {
        return resolve(outEdges.get(nodeId));
    }

    public List<Edge> incomingEdges(String nodeId) {
        return resolve(inEdges.get(nodeId));
    }

    /** Distinct targets of the node's outgoing edges, in edge order. */
    public List<String> children(String nodeId) {
        Set<String> out = new LinkedHashSet<>();
        for (Edge e : outgoingEdges(nodeId))
            out.add(e.getTarget());
        return new ArrayList<>(out);
    }

    /** Distinct sources of the node's incoming edges, in edge order. */
    public List<String> parents(String nodeId) {
        Set<String> in = new LinkedHashSet<>();
        for (Edge e : incomingEdges(nodeId))
            in.add(e.getSource());
        return new ArrayList<>(in);
    }

    private List<Edge> resolve(List<String> edgeIds) {
        if (edgeIds == null)
            return List.of();
        List<Edge> out = new ArrayList<>(edgeIds.size());
        for (String edgeId : edgeIds)
            out.add(edges.get(edgeId));
        return out;
    }

    // -------------------------------------------------------------- structure

    /** Three-colour depth-first search over the children adjacency. */
    public boolean detectCycle() {
        return hasCycle(null, null);
    }

    /**
     * Cycle check over the current children plus an optional staged edge
     * {@code extraFrom -> extraTo} that is not (yet) part of the graph.
     */
    private boolean hasCycle(String extraFrom, String extraTo) {
        Map<String, Integer> colour = new HashMap<>(nodes.size() * 2);
        Deque<Iterator<String>> stack = new ArrayDeque<>();
        Deque<String> path = new ArrayDeque<>();
        for (String start : nodes.keySet()) {
            if (colour.containsKey(start))
                continue;
            colour.put(start, GREY);
            stack.push(stagedChildren(start, extraFrom, extraTo).iterator());
            path.push(start);
            while (!stack.isEmpty()) {
                Iterator<String> it = stack.peek();
                if (it.hasNext()) {
                    String child = it.next();
                    Integer c = colour.get(child);
                    if (c == null) {
                        colour.put(child, GREY);
                        stack.push(stagedChildren(child, extraFrom, extraTo).iterator());
                        path.push(child);
                    } else if (c == GREY) {
                        return true;
                    }
                } else {
                    stack.pop();
                    colour.put(path.pop(), BLACK);
                }
            }
        }
        return false;
    }

    private List<String> stagedChildren(String nodeId, String extraFrom, String extraTo) {
        List<String> children = children(nodeId);
        if (nodeId.equals(extraFrom))
            children.add(extraTo);
        return children;
    }

    /** Every loop closed by a back edge, as {@code [a, b, ..., a]} paths. */
    public List<List<String>> findCycles() {
        return CycleFinder.find(this);
    }

    /**
     * Node ids in dependency order.
     *
     * @throws StructuralException (CYCLIC_GRAPH) on a cyclic graph.
     */
    public List<String> topologicalSort() {
        return TopologicalOrder.of(this).order();
    }

    /** Node ids grouped by their configured layer, lowest layer first. */
    public SortedMap<Integer, List<String>> layers() {
        SortedMap<Integer, List<String>> layers = new TreeMap<>();
        for (Node n : nodes.values())
            layers.computeIfAbsent(n.getLayer(), k -> new ArrayList<>()).add(n.getId());
        return layers;
    }

    // -------------------------------------------------------------- execution

    /**
     * Single forward pass over every node, in dependency order (insertion order
     * when cycles are allowed).
     *
     * <p>
     * A node's inputs are its incoming edges whose condition passes, each
     * carrying the source's result through the edge transform. A source that has
     * not produced a result yet contributes {@code inputs[sourceId]}, or 0. A
     * node without incoming edges receives {@code inputs[nodeId]} if present.
     * Node failures and failing edge conditions are collected in
     * {@link #getErrors()}; they do not stop the pass. An edge whose condition
     * fails is treated as closed and its error is recorded under the source
     * node.
     *
     * @return result per node id, in evaluation order
     * @throws ValidationException if {@code inputs} is null.
     */
    public Map<String, Double> execute(Map<String, Double> inputs) {
        if (inputs == null)
            throw new ValidationException("Inputs must not be null; pass an empty map for none");
        long start = System.nanoTime();
        clearState();
        List<String> order = allowCycles ? new ArrayList<>(nodes.keySet()) : topologicalSort();

        for (String nodeId : order) {
            Node node = nodes.get(nodeId);
            List<Edge> incoming = incomingEdges(nodeId);
            double[] nodeInputs;
            if (incoming.isEmpty()) {
                Double own = inputs.get(nodeId);
                nodeInputs = own == null ? new double[0] : new double[] { own };
            } else {
                double[] buf = new double[incoming.size()];
                int n = 0;
                for (Edge e : incoming) {
                    Double upstream = results.get(e.getSource());
                    double sourceValue = upstream != null ? upstream : inputs.getOrDefault(e.getSource(), 0.0);
                    if (passes(e, sourceValue))
                        buf[n++] = e.evaluate(sourceValue);
                }
                nodeInputs = Arrays.copyOf(buf, n);
            }
            double result = node.evaluate(nodeInputs);
            results.put(nodeId, result);
            if (node.getState().hasError())
                errors.add(new NodeError(nodeId, node.getState().getError()));
        }

        executed = true;
        elapsedNanos = System.nanoTime() - start;
        log.debug("Executed graph {} ({} nodes, {} errors) in {} us", name, order.size(), errors.size(),
                elapsedNanos / 1000);
        return Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    private boolean passes(Edge e, double sourceValue) {
        try {
            return e.checkCondition(sourceValue);
        } catch (EvaluationException ex) {
            log.debug("Edge {} closed: {}", e.getId(), ex.getMessage());
            errors.add(new NodeError(e.getSource(), ex.getMessage()));
            return false;
        }
    }

    /** Resets the last-run state and the state of every node and edge. */
    public void clearState() {
        executed = false;
        results.clear();
        errors.clear();
        elapsedNanos = 0;
        resetElementState();
    }

    /** Resets node and edge state only; used at the start of each propagation run. */
    public void resetElementState() {
        for (Node n : nodes.values())
            n.getState().reset();
        for (Edge e : edges.values())
            e.getState().reset();
    }

    // ----------------------------------------------------------- serialization

    public GraphDefinition toDefinition() {
        return GraphCompiler.describe(this);
    }

    /**
     * @throws ValidationException on unknown type names or bad node settings.
     * @throws StructuralException if the definition's edges close a cycle in a
     *                             graph that does not allow cycles.
     */
    public static Graph fromDefinition(GraphDefinition definition) {
        return GraphCompiler.compile(definition);
    }

    // ---------------------------------------------------------------- accessors

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
        touch();
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public GraphType getType() {
        return type;
    }

    public boolean isAllowCycles() {
        return allowCycles;
    }

    public void setAllowCycles(boolean allowCycles) {
        this.allowCycles = allowCycles;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public String getCreated() {
        return created;
    }

    public String getModified() {
        return modified;
    }

    /** Restores timestamps read from a definition. */
    public void setTimestamps(String created, String modified) {
        if (created != null)
            this.created = created;
        if (modified != null)
            this.modified = modified;
    }

    public Map<String, Node> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public Map<String, Edge> getEdges() {
        return Collections.unmodifiableMap(edges);
    }

    public Node getNode(String nodeId) {
        return nodes.get(nodeId);
    }

    public Node requireNode(String nodeId) {
        Node node = nodes.get(nodeId);
        if (node == null)
            throw new ValidationException("Unknown node: " + nodeId);
        return node;
    }

    public Edge getEdge(String edgeId) {
        return edges.get(edgeId);
    }

    public boolean isExecuted() {
        return executed;
    }

    public Map<String, Double> getResults() {
        return Collections.unmodifiableMap(results);
    }

    public List<NodeError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }

    @Override
    public String toString() {
        return "Graph[" + id + ", " + nodes.size() + " nodes, " + edges.size() + " edges]";
    }
}
