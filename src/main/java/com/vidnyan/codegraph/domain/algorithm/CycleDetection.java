package com.vidnyan.codegraph.domain.algorithm;

import com.vidnyan.codegraph.domain.graph.GraphEdge;
import com.vidnyan.codegraph.domain.graph.GraphModel;

import java.util.*;

/**
 * Cycle enumeration and cyclic/acyclic classification.
 * Both traversals use an explicit stack, so path length is not bounded by
 * the thread stack.
 */
public final class CycleDetection {

    private CycleDetection() {
    }

    /**
     * Enumerate every simple cycle of two or more edges.
     * <p>
     * A depth-first search is started from every node in index order and a
     * cycle is recorded whenever the search steps back onto its start node.
     * Each cycle is reported once, rotated so that its smallest index comes
     * first, as the node sequence without repeating the start (the closing
     * edge back to the first node is implied). Cycles are listed in discovery
     * order. Self-loops are not reported.
     * <p>
     * The number of simple cycles can grow exponentially with graph size;
     * callers analyzing large dense graphs should budget for that.
     */
    public static List<List<Integer>> findAllCycles(GraphModel<?> graph) {
        int n = graph.nodeCount();
        Set<List<Integer>> cycles = new LinkedHashSet<>();

        for (int start = 0; start < n; start++) {
            collectCyclesThrough(graph, start, cycles);
        }
        return List.copyOf(cycles);
    }

    /**
     * Cycles whose smallest node is {@code start}. Nodes below {@code start}
     * are skipped: any cycle through them was already found from them.
     */
    private static void collectCyclesThrough(GraphModel<?> graph, int start, Set<List<Integer>> cycles) {
        boolean[] onPath = new boolean[graph.nodeCount()];
        List<Integer> path = new ArrayList<>();
        Deque<int[]> stack = new ArrayDeque<>();

        onPath[start] = true;
        path.add(start);
        stack.push(new int[]{start, 0});

        while (!stack.isEmpty()) {
            int[] frame = stack.peek();
            List<GraphEdge> edges = graph.edgesFrom(frame[0]);

            if (frame[1] < edges.size()) {
                int target = edges.get(frame[1]++).target();
                if (target < start) {
                    continue;
                }
                if (onPath[target]) {
                    if (target == start && path.size() > 1) {
                        cycles.add(List.copyOf(path));
                    }
                    continue;
                }
                onPath[target] = true;
                path.add(target);
                stack.push(new int[]{target, 0});
            } else {
                stack.pop();
                onPath[frame[0]] = false;
                path.remove(path.size() - 1);
            }
        }
    }

    /**
     * Fast cyclic check using visited and in-stack sets. Unlike
     * {@link #findAllCycles}, a self-loop makes the graph cyclic.
     */
    public static boolean hasCycle(GraphModel<?> graph) {
        int n = graph.nodeCount();
        boolean[] visited = new boolean[n];
        boolean[] inStack = new boolean[n];

        for (int root = 0; root < n; root++) {
            if (visited[root]) {
                continue;
            }
            Deque<int[]> stack = new ArrayDeque<>();
            visited[root] = true;
            inStack[root] = true;
            stack.push(new int[]{root, 0});

            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                List<GraphEdge> edges = graph.edgesFrom(frame[0]);

                if (frame[1] < edges.size()) {
                    int target = edges.get(frame[1]++).target();
                    if (!visited[target]) {
                        visited[target] = true;
                        inStack[target] = true;
                        stack.push(new int[]{target, 0});
                    } else if (inStack[target]) {
                        return true;
                    }
                } else {
                    stack.pop();
                    inStack[frame[0]] = false;
                }
            }
        }
        return false;
    }
}
