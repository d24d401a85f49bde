package com.vidnyan.codegraph.domain.algorithm;

import com.vidnyan.codegraph.domain.graph.GraphEdge;
import com.vidnyan.codegraph.domain.graph.GraphModel;

import java.util.*;

/**
 * Structural network statistics: clustering, density, path lengths and
 * connectivity. Degenerate inputs give 0 / empty results, never NaN.
 */
public final class NetworkAnalysis {

    private NetworkAnalysis() {
    }

    /**
     * Local clustering coefficient with the graph taken as undirected for
     * neighbourhood purposes: neighbours are predecessors plus successors
     * (the node itself excluded). The coefficient is the number of ordered
     * neighbour pairs (a, b) with an edge a → b divided by k(k - 1).
     */
    public static double clusteringCoefficient(GraphModel<?> graph, int node) {
        Set<Integer> neighbors = new LinkedHashSet<>();
        for (GraphEdge edge : graph.edgesFrom(node)) {
            neighbors.add(edge.target());
        }
        for (GraphEdge edge : graph.edgesInto(node)) {
            neighbors.add(edge.source());
        }
        neighbors.remove(node);

        int k = neighbors.size();
        if (k < 2) {
            return 0.0;
        }

        int connections = 0;
        for (int a : neighbors) {
            for (int b : neighbors) {
                if (a != b && graph.findEdge(a, b)) {
                    connections++;
                }
            }
        }
        return connections / orderedPairs(k);
    }

    /**
     * k(k - 1), computed in double so large neighbourhoods cannot overflow.
     */
    static double orderedPairs(int k) {
        return (double) k * (k - 1);
    }

    public static double averageClusteringCoefficient(GraphModel<?> graph) {
        int n = graph.nodeCount();
        if (n == 0) {
            return 0.0;
        }
        double total = 0.0;
        for (int node = 0; node < n; node++) {
            total += clusteringCoefficient(graph, node);
        }
        return total / n;
    }

    /**
     * edges / (n(n - 1)), the directed convention. Can exceed 1 only when
     * parallel edges or self-loops are present.
     */
    public static double graphDensity(GraphModel<?> graph) {
        int n = graph.nodeCount();
        if (n <= 1) {
            return 0.0;
        }
        return graph.edgeCount() / ((double) n * (n - 1));
    }

    /**
     * Mean hop distance over ordered pairs (s, t), s ≠ t, with t reachable
     * from s. Unreachable pairs are ignored.
     */
    public static double averagePathLength(GraphModel<?> graph) {
        int n = graph.nodeCount();
        if (n < 2) {
            return 0.0;
        }

        long total = 0;
        long pairs = 0;
        for (int source = 0; source < n; source++) {
            for (Map.Entry<Integer, Integer> entry :
                    CentralityAlgorithms.singleSourceShortestPathLength(graph, source).entrySet()) {
                if (entry.getKey() != source) {
                    total += entry.getValue();
                    pairs++;
                }
            }
        }
        return pairs > 0 ? total / (double) pairs : 0.0;
    }

    /**
     * Longest finite shortest-path length over all pairs.
     */
    public static int graphDiameter(GraphModel<?> graph) {
        int diameter = 0;
        for (int source = 0; source < graph.nodeCount(); source++) {
            for (int distance : CentralityAlgorithms.singleSourceShortestPathLength(graph, source).values()) {
                diameter = Math.max(diameter, distance);
            }
        }
        return diameter;
    }

    /**
     * Strongly connected components (Tarjan, iterative). Every node belongs
     * to exactly one component; singletons are included. Components come out
     * in Tarjan's completion order (reverse topological), each sorted by index.
     */
    public static List<SortedSet<Integer>> stronglyConnectedComponents(GraphModel<?> graph) {
        int n = graph.nodeCount();
        int[] index = new int[n];
        int[] lowLink = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(index, -1);

        Deque<Integer> sccStack = new ArrayDeque<>();
        List<SortedSet<Integer>> components = new ArrayList<>();
        int counter = 0;

        for (int root = 0; root < n; root++) {
            if (index[root] >= 0) {
                continue;
            }
            Deque<int[]> callStack = new ArrayDeque<>();
            index[root] = lowLink[root] = counter++;
            sccStack.push(root);
            onStack[root] = true;
            callStack.push(new int[]{root, 0});

            while (!callStack.isEmpty()) {
                int[] frame = callStack.peek();
                int v = frame[0];
                List<GraphEdge> edges = graph.edgesFrom(v);

                if (frame[1] < edges.size()) {
                    int w = edges.get(frame[1]++).target();
                    if (index[w] < 0) {
                        index[w] = lowLink[w] = counter++;
                        sccStack.push(w);
                        onStack[w] = true;
                        callStack.push(new int[]{w, 0});
                    } else if (onStack[w]) {
                        lowLink[v] = Math.min(lowLink[v], index[w]);
                    }
                    continue;
                }

                callStack.pop();
                if (!callStack.isEmpty()) {
                    int parent = callStack.peek()[0];
                    lowLink[parent] = Math.min(lowLink[parent], lowLink[v]);
                }
                if (lowLink[v] == index[v]) {
                    SortedSet<Integer> component = new TreeSet<>();
                    int w;
                    do {
                        w = sccStack.pop();
                        onStack[w] = false;
                        component.add(w);
                    } while (w != v);
                    components.add(Collections.unmodifiableSortedSet(component));
                }
            }
        }
        return List.copyOf(components);
    }

    /**
     * Weakly connected components: edge direction ignored. Ordered by
     * smallest member index, each sorted by index.
     */
    public static List<SortedSet<Integer>> weaklyConnectedComponents(GraphModel<?> graph) {
        int n = graph.nodeCount();
        boolean[] seen = new boolean[n];
        List<SortedSet<Integer>> components = new ArrayList<>();

        for (int root = 0; root < n; root++) {
            if (seen[root]) {
                continue;
            }
            SortedSet<Integer> component = new TreeSet<>();
            Deque<Integer> queue = new ArrayDeque<>();
            seen[root] = true;
            queue.add(root);

            while (!queue.isEmpty()) {
                int v = queue.poll();
                component.add(v);
                for (GraphEdge edge : graph.edgesFrom(v)) {
                    if (!seen[edge.target()]) {
                        seen[edge.target()] = true;
                        queue.add(edge.target());
                    }
                }
                for (GraphEdge edge : graph.edgesInto(v)) {
                    if (!seen[edge.source()]) {
                        seen[edge.source()] = true;
                        queue.add(edge.source());
                    }
                }
            }
            components.add(Collections.unmodifiableSortedSet(component));
        }
        return List.copyOf(components);
    }

    /**
     * Size of the largest weakly connected component, 0 for an empty graph.
     */
    public static int largestComponentSize(GraphModel<?> graph) {
        int largest = 0;
        for (Set<Integer> component : weaklyConnectedComponents(graph)) {
            largest = Math.max(largest, component.size());
        }
        return largest;
    }
}
