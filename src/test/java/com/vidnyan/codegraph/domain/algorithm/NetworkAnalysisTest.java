package com.vidnyan.codegraph.domain.algorithm;

import com.vidnyan.codegraph.domain.graph.CallNode;
import com.vidnyan.codegraph.domain.graph.GraphEdge;
import com.vidnyan.codegraph.domain.graph.GraphModel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;

import static org.junit.jupiter.api.Assertions.*;

class NetworkAnalysisTest {

    private static final double EPSILON = 1e-9;

    @Test
    void graphDensity_ShouldBeHalfForSingleEdgeBetweenTwoNodes() {
        assertEquals(0.5, NetworkAnalysis.graphDensity(graph(new int[][]{{0, 1}})), EPSILON);
    }

    @Test
    void graphDensity_ShouldBeZeroForTrivialGraphs() {
        GraphModel<CallNode> single = GraphModel.callGraph();
        single.addNode(CallNode.named("main"));

        assertEquals(0.0, NetworkAnalysis.graphDensity(GraphModel.callGraph()));
        assertEquals(0.0, NetworkAnalysis.graphDensity(single));
    }

    @Test
    void clusteringCoefficient_ShouldBeZeroWithFewerThanTwoNeighbours() {
        GraphModel<CallNode> graph = graph(new int[][]{{0, 1}, {1, 1}});
        graph.addNode(CallNode.named("isolated"));

        assertEquals(0.0, NetworkAnalysis.clusteringCoefficient(graph, 0));
        assertEquals(0.0, NetworkAnalysis.clusteringCoefficient(graph, 1));
        assertEquals(0.0, NetworkAnalysis.clusteringCoefficient(graph, 2));
    }

    @Test
    void clusteringCoefficient_ShouldCountOrderedNeighbourPairs() {
        // 0 -> 1, 1 -> 2, 0 -> 2: each node sees one of its two ordered pairs linked
        GraphModel<CallNode> graph = graph(new int[][]{{0, 1}, {1, 2}, {0, 2}});

        for (int node = 0; node < 3; node++) {
            assertEquals(0.5, NetworkAnalysis.clusteringCoefficient(graph, node), EPSILON);
        }
        assertEquals(0.5, NetworkAnalysis.averageClusteringCoefficient(graph), EPSILON);
    }

    @Test
    void clusteringCoefficient_ShouldBePositiveForMutualTriangle() {
        GraphModel<CallNode> graph = graph(new int[][]{{0, 1}, {1, 0}, {1, 2}, {2, 1}, {0, 2}, {2, 0}});

        for (int node = 0; node < 3; node++) {
            assertEquals(1.0, NetworkAnalysis.clusteringCoefficient(graph, node), EPSILON);
        }
    }

    @Test
    void orderedPairs_ShouldNotOverflowForLargeNeighbourhoods() {
        assertEquals(46_342.0 * 46_341.0, NetworkAnalysis.orderedPairs(46_342), 1.0);
        assertTrue(NetworkAnalysis.orderedPairs(100_000) > 0.0);
        assertEquals(2.0, NetworkAnalysis.orderedPairs(2));
    }

    @Test
    void clusteringCoefficient_ShouldStayInRangeForHub() {
        // hub 0 calls every leaf, one leaf pair is linked
        int leaves = 500;
        GraphModel<CallNode> star = GraphModel.callGraph();
        for (int leaf = 1; leaf <= leaves; leaf++) {
            star.addEdge(0, leaf, 1.0, GraphEdge.CALL);
        }
        star.addEdge(1, 2, 1.0, GraphEdge.CALL);

        double coefficient = NetworkAnalysis.clusteringCoefficient(star, 0);

        assertEquals(1.0 / (leaves * (leaves - 1.0)), coefficient, 1e-15);
        assertTrue(coefficient > 0.0 && coefficient <= 1.0);
    }

    @Test
    void averagePathLength_ShouldIgnoreSelfAndUnreachablePairs() {
        GraphModel<CallNode> path = graph(new int[][]{{0, 1}, {1, 2}});

        // pairs (0,1)=1, (0,2)=2, (1,2)=1
        assertEquals(4.0 / 3.0, NetworkAnalysis.averagePathLength(path), EPSILON);
        assertEquals(2, NetworkAnalysis.graphDiameter(path));
    }

    @Test
    void pathMetrics_ShouldBeZeroWithoutEdges() {
        GraphModel<CallNode> graph = GraphModel.callGraph();
        graph.addNode(CallNode.named("a"));
        graph.addNode(CallNode.named("b"));

        assertEquals(0.0, NetworkAnalysis.averagePathLength(graph));
        assertEquals(0, NetworkAnalysis.graphDiameter(graph));
        assertEquals(0.0, NetworkAnalysis.averageClusteringCoefficient(GraphModel.callGraph()));
    }

    @Test
    void stronglyConnectedComponents_ShouldCoverEveryNodeOnce() {
        GraphModel<CallNode> graph = graph(new int[][]{{0, 1}, {1, 0}, {1, 2}, {3, 4}, {4, 3}, {2, 3}});

        List<SortedSet<Integer>> components = NetworkAnalysis.stronglyConnectedComponents(graph);

        assertEquals(3, components.size());
        assertTrue(components.contains(Set.of(0, 1)));
        assertTrue(components.contains(Set.of(2)));
        assertTrue(components.contains(Set.of(3, 4)));
        assertEquals(5, components.stream().mapToInt(Set::size).sum());
    }

    @Test
    void stronglyConnectedComponents_ShouldHandleLongChains() {
        int length = 50_000;
        GraphModel<CallNode> chain = GraphModel.callGraph();
        for (int i = 0; i + 1 < length; i++) {
            chain.addEdge(i, i + 1, 1.0, GraphEdge.CALL);
        }

        assertEquals(length, NetworkAnalysis.stronglyConnectedComponents(chain).size());
    }

    @Test
    void weaklyConnectedComponents_ShouldIgnoreDirection() {
        GraphModel<CallNode> graph = graph(new int[][]{{1, 0}, {2, 3}, {3, 1}});
        graph.addNode(CallNode.named("isolated"));
        graph.addEdge(5, 6, 1.0, GraphEdge.CALL);

        List<SortedSet<Integer>> components = NetworkAnalysis.weaklyConnectedComponents(graph);

        assertEquals(List.of(Set.of(0, 1, 2, 3), Set.of(4), Set.of(5, 6)), components);
        assertEquals(4, NetworkAnalysis.largestComponentSize(graph));
        assertEquals(0, NetworkAnalysis.largestComponentSize(GraphModel.callGraph()));
    }

    private static GraphModel<CallNode> graph(int[][] edges) {
        GraphModel<CallNode> graph = GraphModel.callGraph();
        for (int[] edge : edges) {
            graph.addEdge(edge[0], edge[1], 1.0, GraphEdge.CALL);
        }
        return graph;
    }
}
