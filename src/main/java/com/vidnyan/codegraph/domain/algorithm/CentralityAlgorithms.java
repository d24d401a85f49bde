package com.vidnyan.codegraph.domain.algorithm;

import com.vidnyan.codegraph.domain.graph.GraphEdge;
import com.vidnyan.codegraph.domain.graph.GraphModel;

import java.util.*;

/**
 * Centrality measures over a directed multigraph.
 * <p>
 * Every method is a pure function of the graph: it reads the model, never
 * mutates it and keeps no reference after returning. Results map node index
 * to a finite score, in ascending index order. Graphs with at most one node
 * yield an empty map.
 * <p>
 * Parallel edges are treated as distinct edges everywhere (they add to
 * degrees, shortest-path counts and PageRank out-degree).
 */
public final class CentralityAlgorithms {

    private CentralityAlgorithms() {
    }

    /**
     * (in-degree + out-degree) / (n - 1). A self-loop counts once in each
     * direction. Scores lie in [0, 1] for graphs without parallel edges.
     */
    public static Map<Integer, Double> degreeCentrality(GraphModel<?> graph) {
        int n = graph.nodeCount();
        if (n <= 1) {
            return Map.of();
        }

        double normalizer = n - 1;
        Map<Integer, Double> centrality = new LinkedHashMap<>();
        for (int node = 0; node < n; node++) {
            int degree = graph.inDegree(node) + graph.outDegree(node);
            centrality.put(node, degree / normalizer);
        }
        return Collections.unmodifiableMap(centrality);
    }

    /**
     * Brandes' algorithm, run from every node as source.
     * Normalized by (n - 1)(n - 2) when n > 2 (directed convention, no halving).
     * <p>
     * Cost is O(n·m); expensive on large dense graphs.
     */
    public static Map<Integer, Double> betweennessCentrality(GraphModel<?> graph) {
        int n = graph.nodeCount();
        if (n <= 1) {
            return Map.of();
        }

        double[] centrality = new double[n];
        for (int source = 0; source < n; source++) {
            accumulateFromSource(graph, source, centrality);
        }

        if (n > 2) {
            double normalizer = (double) (n - 1) * (n - 2);
            for (int i = 0; i < n; i++) {
                centrality[i] /= normalizer;
            }
        }
        return toMap(centrality);
    }

    /**
     * One Brandes pass: BFS for shortest-path counts and predecessors, then
     * dependency accumulation in reverse BFS order. Adds into {@code centrality}.
     */
    private static void accumulateFromSource(GraphModel<?> graph, int source, double[] centrality) {
        int n = graph.nodeCount();
        double[] sigma = new double[n];
        int[] distance = new int[n];
        double[] delta = new double[n];
        List<List<Integer>> predecessors = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            predecessors.add(new ArrayList<>());
        }
        Arrays.fill(distance, -1);

        Deque<Integer> stack = new ArrayDeque<>();
        Deque<Integer> queue = new ArrayDeque<>();
        sigma[source] = 1.0;
        distance[source] = 0;
        queue.add(source);

        while (!queue.isEmpty()) {
            int v = queue.poll();
            stack.push(v);

            for (GraphEdge edge : graph.edgesFrom(v)) {
                int w = edge.target();
                if (distance[w] < 0) {
                    queue.add(w);
                    distance[w] = distance[v] + 1;
                }
                if (distance[w] == distance[v] + 1) {
                    sigma[w] += sigma[v];
                    predecessors.get(w).add(v);
                }
            }
        }

        while (!stack.isEmpty()) {
            int w = stack.pop();
            for (int v : predecessors.get(w)) {
                if (sigma[w] > 0.0) {
                    delta[v] += (sigma[v] / sigma[w]) * (1.0 + delta[w]);
                }
            }
            if (w != source) {
                centrality[w] += delta[w];
            }
        }
    }

    /**
     * (reachable - 1) / sum of hop distances, following outgoing edges.
     * 0 for nodes that reach nothing.
     */
    public static Map<Integer, Double> closenessCentrality(GraphModel<?> graph) {
        int n = graph.nodeCount();
        if (n <= 1) {
            return Map.of();
        }

        Map<Integer, Double> centrality = new LinkedHashMap<>();
        for (int node = 0; node < n; node++) {
            Map<Integer, Integer> distances = singleSourceShortestPathLength(graph, node);
            long total = 0;
            for (int d : distances.values()) {
                total += d;
            }
            int reachable = distances.size();
            centrality.put(node, reachable > 1 && total > 0 ? (reachable - 1) / (double) total : 0.0);
        }
        return Collections.unmodifiableMap(centrality);
    }

    /**
     * PageRank by power iteration from a uniform 1/n start.
     * <p>
     * Nodes without outgoing edges do not redistribute their rank, so the
     * scores of a graph with dangling nodes sum to less than 1.
     *
     * @param damping probability of following an edge (usually 0.85)
     * @param maxIterations upper bound on power iterations
     * @param tolerance stop once no score moves by more than this
     */
    public static Map<Integer, Double> pageRankCentrality(
            GraphModel<?> graph,
            double damping,
            int maxIterations,
            double tolerance
    ) {
        int n = graph.nodeCount();
        if (n <= 1) {
            return Map.of();
        }

        double[] rank = new double[n];
        Arrays.fill(rank, 1.0 / n);
        double teleport = (1.0 - damping) / n;

        for (int iteration = 0; iteration < maxIterations; iteration++) {
            double[] next = new double[n];
            double maxDiff = 0.0;

            for (int v = 0; v < n; v++) {
                double value = teleport;
                for (GraphEdge edge : graph.edgesInto(v)) {
                    int u = edge.source();
                    int outDegree = graph.outDegree(u);
                    if (outDegree > 0) {
                        value += damping * rank[u] / outDegree;
                    }
                }
                next[v] = value;
                maxDiff = Math.max(maxDiff, Math.abs(value - rank[v]));
            }

            rank = next;
            if (maxDiff <= tolerance) {
                break;
            }
        }
        return toMap(rank);
    }

    /**
     * Hop distance from {@code source} to every node it reaches via outgoing
     * edges, including itself at distance 0. Iteration order is BFS order.
     */
    public static Map<Integer, Integer> singleSourceShortestPathLength(GraphModel<?> graph, int source) {
        Map<Integer, Integer> distances = new LinkedHashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        distances.put(source, 0);
        queue.add(source);

        while (!queue.isEmpty()) {
            int current = queue.poll();
            int next = distances.get(current) + 1;
            for (GraphEdge edge : graph.edgesFrom(current)) {
                if (!distances.containsKey(edge.target())) {
                    distances.put(edge.target(), next);
                    queue.add(edge.target());
                }
            }
        }
        return distances;
    }

    private static Map<Integer, Double> toMap(double[] values) {
        Map<Integer, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(i, values[i]);
        }
        return Collections.unmodifiableMap(map);
    }
}
