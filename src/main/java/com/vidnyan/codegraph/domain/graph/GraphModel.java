package com.vidnyan.codegraph.domain.graph;

import java.util.*;
import java.util.function.IntFunction;

/**
 * Directed multigraph keyed by node indices.
 * Indices are assigned in insertion order starting at 0 and never change.
 * Parallel edges between the same pair are kept (aggregated calls).
 * <p>
 * The model is mutable until {@link #freeze()} is called; after that it is a
 * read-only snapshot that any number of threads may analyze concurrently.
 *
 * @param <N> node payload type
 */
public final class GraphModel<N extends GraphNode> {

    private final GraphKind kind;
    private final IntFunction<N> placeholderFactory;

    private final List<N> nodes = new ArrayList<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private final List<List<GraphEdge>> outgoing = new ArrayList<>();
    private final List<List<GraphEdge>> incoming = new ArrayList<>();
    private final Map<String, Integer> nameIndex = new HashMap<>();

    private volatile boolean frozen;

    /**
     * @param kind which graph this is
     * @param placeholderFactory payload for nodes auto-created by {@link #addEdge}
     */
    public GraphModel(GraphKind kind, IntFunction<N> placeholderFactory) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.placeholderFactory = Objects.requireNonNull(placeholderFactory, "placeholderFactory");
    }

    public static GraphModel<CallNode> callGraph() {
        return new GraphModel<>(GraphKind.CALL, i -> CallNode.named(placeholderName(i)));
    }

    public static GraphModel<ModuleNode> dependencyGraph() {
        return new GraphModel<>(GraphKind.DEPENDENCY, i -> ModuleNode.named(placeholderName(i)));
    }

    public static GraphModel<ClassNode> inheritanceGraph() {
        return new GraphModel<>(GraphKind.INHERITANCE, i -> ClassNode.named(placeholderName(i)));
    }

    private static String placeholderName(int index) {
        return "node_" + index;
    }

    public GraphKind kind() {
        return kind;
    }

    /**
     * Insert a node and return its index.
     */
    public int addNode(N payload) {
        Objects.requireNonNull(payload, "payload");
        checkMutable();
        int index = nodes.size();
        nodes.add(payload);
        outgoing.add(new ArrayList<>());
        incoming.add(new ArrayList<>());
        nameIndex.putIfAbsent(payload.displayName(), index);
        return index;
    }

    /**
     * Add a directed edge. Indices not yet present are created with
     * placeholder payloads instead of failing.
     */
    public void addEdge(int source, int target, double weight, String kind) {
        checkIndex(source);
        checkIndex(target);
        checkMutable();
        ensureNode(Math.max(source, target));

        GraphEdge edge = new GraphEdge(source, target, weight, kind);
        edges.add(edge);
        outgoing.get(source).add(edge);
        incoming.get(target).add(edge);
    }

    private void ensureNode(int index) {
        while (nodes.size() <= index) {
            addNode(placeholderFactory.apply(nodes.size()));
        }
    }

    /**
     * Swap the payload of an existing node. Used by the builder to enrich
     * nodes once the whole graph is known.
     */
    void replaceNode(int index, N payload) {
        Objects.requireNonNull(payload, "payload");
        checkMutable();
        N previous = nodes.set(index, payload);
        if (!previous.displayName().equals(payload.displayName())) {
            nameIndex.remove(previous.displayName(), index);
            nameIndex.putIfAbsent(payload.displayName(), index);
        }
    }

    /**
     * Make this model read-only. Idempotent.
     */
    public GraphModel<N> freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public N node(int index) {
        return nodes.get(index);
    }

    public List<N> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<GraphEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    /**
     * Outgoing edges of a node, in insertion order.
     */
    public List<GraphEdge> edgesFrom(int node) {
        return Collections.unmodifiableList(outgoing.get(node));
    }

    /**
     * Incoming edges of a node, in insertion order.
     */
    public List<GraphEdge> edgesInto(int node) {
        return Collections.unmodifiableList(incoming.get(node));
    }

    public int outDegree(int node) {
        return outgoing.get(node).size();
    }

    public int inDegree(int node) {
        return incoming.get(node).size();
    }

    /**
     * Check if at least one edge a → b exists.
     */
    public boolean findEdge(int a, int b) {
        if (a < 0 || a >= nodes.size()) {
            return false;
        }
        for (GraphEdge edge : outgoing.get(a)) {
            if (edge.target() == b) {
                return true;
            }
        }
        return false;
    }

    /**
     * Index of the first node inserted with the given display name.
     */
    public Optional<Integer> findNode(String name) {
        return Optional.ofNullable(nameIndex.get(name));
    }

    /**
     * Display name of a node.
     */
    public String nameOf(int index) {
        return nodes.get(index).displayName();
    }

    /**
     * Display names indexed by node index.
     */
    public List<String> nodeNames() {
        return nodes.stream().map(GraphNode::displayName).toList();
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException(kind.key() + " is frozen");
        }
    }

    private static void checkIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative node index: " + index);
        }
    }

    @Override
    public String toString() {
        return "GraphModel[" + kind.key() + ", nodes=" + nodes.size() + ", edges=" + edges.size() + "]";
    }
}
