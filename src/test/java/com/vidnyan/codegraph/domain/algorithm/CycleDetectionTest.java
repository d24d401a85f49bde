package com.vidnyan.codegraph.domain.algorithm;

import com.vidnyan.codegraph.domain.graph.GraphEdge;
import com.vidnyan.codegraph.domain.graph.GraphModel;
import com.vidnyan.codegraph.domain.graph.ModuleNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CycleDetectionTest {

    @Test
    void findAllCycles_ShouldReportTriangleOnce() {
        GraphModel<ModuleNode> graph = graph(new int[][]{{0, 1}, {1, 2}, {2, 0}});

        List<List<Integer>> cycles = CycleDetection.findAllCycles(graph);

        assertEquals(List.of(List.of(0, 1, 2)), cycles);
        assertTrue(CycleDetection.hasCycle(graph));
    }

    @Test
    void findAllCycles_ShouldRotateCycleToSmallestIndex() {
        GraphModel<ModuleNode> graph = graph(new int[][]{{2, 0}, {1, 2}, {0, 1}});

        assertEquals(List.of(List.of(0, 1, 2)), CycleDetection.findAllCycles(graph));
    }

    @Test
    void findAllCycles_ShouldReturnEmptyForAcyclicAndEmptyGraphs() {
        GraphModel<ModuleNode> dag = graph(new int[][]{{0, 1}, {0, 2}, {1, 3}, {2, 3}});
        GraphModel<ModuleNode> empty = GraphModel.dependencyGraph();

        assertTrue(CycleDetection.findAllCycles(dag).isEmpty());
        assertFalse(CycleDetection.hasCycle(dag));
        assertTrue(CycleDetection.findAllCycles(empty).isEmpty());
        assertFalse(CycleDetection.hasCycle(empty));
    }

    @Test
    void selfLoop_ShouldBeCyclicButNotEnumerated() {
        GraphModel<ModuleNode> graph = graph(new int[][]{{0, 0}, {0, 1}});

        assertTrue(CycleDetection.findAllCycles(graph).isEmpty());
        assertTrue(CycleDetection.hasCycle(graph));
    }

    @Test
    void findAllCycles_ShouldIgnoreParallelEdges() {
        GraphModel<ModuleNode> graph = graph(new int[][]{{0, 1}, {0, 1}, {1, 0}});

        assertEquals(List.of(List.of(0, 1)), CycleDetection.findAllCycles(graph));
    }

    @Test
    void findAllCycles_ShouldFindEverySimpleCycle() {
        // 0 <-> 1, 0 <-> 2 and the loop 0 -> 1 -> 2 -> 0
        GraphModel<ModuleNode> graph = graph(new int[][]{{0, 1}, {1, 0}, {1, 2}, {2, 0}, {0, 2}});

        List<List<Integer>> cycles = CycleDetection.findAllCycles(graph);

        assertEquals(3, cycles.size());
        assertTrue(cycles.contains(List.of(0, 1)));
        assertTrue(cycles.contains(List.of(0, 1, 2)));
        assertTrue(cycles.contains(List.of(0, 2)));
        assertFalse(cycles.contains(List.of(0, 2, 1)));
    }

    @Test
    void hasCycle_ShouldHandleLongChains() {
        int length = 100_000;
        GraphModel<ModuleNode> chain = GraphModel.dependencyGraph();
        for (int i = 0; i + 1 < length; i++) {
            chain.addEdge(i, i + 1, 1.0, GraphEdge.IMPORT);
        }

        assertFalse(CycleDetection.hasCycle(chain));

        chain.addEdge(length - 1, 0, 1.0, GraphEdge.IMPORT);
        assertTrue(CycleDetection.hasCycle(chain));
    }

    @Test
    void findAllCycles_ShouldHandleLongRing() {
        int length = 2_000;
        GraphModel<ModuleNode> ring = GraphModel.dependencyGraph();
        for (int i = 0; i < length; i++) {
            ring.addEdge(i, (i + 1) % length, 1.0, GraphEdge.IMPORT);
        }

        List<List<Integer>> cycles = CycleDetection.findAllCycles(ring);

        assertEquals(1, cycles.size());
        assertEquals(length, cycles.get(0).size());
        assertEquals(0, cycles.get(0).get(0));
    }

    private static GraphModel<ModuleNode> graph(int[][] edges) {
        GraphModel<ModuleNode> graph = GraphModel.dependencyGraph();
        for (int[] edge : edges) {
            graph.addEdge(edge[0], edge[1], 1.0, GraphEdge.IMPORT);
        }
        return graph;
    }
}
