package com.vidnyan.codegraph.domain.analysis;

import com.vidnyan.codegraph.domain.graph.CallNode;
import com.vidnyan.codegraph.domain.graph.GraphBuilder;
import com.vidnyan.codegraph.domain.graph.GraphKind;
import com.vidnyan.codegraph.domain.graph.GraphModel;
import com.vidnyan.codegraph.domain.metrics.CentralityMetrics;
import com.vidnyan.codegraph.domain.metrics.GraphAnalysisResult;
import com.vidnyan.codegraph.domain.metrics.NetworkMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphAnalyzerTest {

    @Test
    void analyze_ShouldReportSmallCodebase() {
        // Arrange
        GraphBuilder builder = new GraphBuilder()
                .addCall("main", "helper", 5)
                .addCall("helper", "util", 3)
                .addDependency("main_module", "helper_module", "import")
                .addInheritance("Child", "Parent");
        GraphAnalyzer analyzer = builder.build();

        // Act
        GraphAnalysisResult result = analyzer.analyze();

        // Assert
        assertEquals(3, result.statistics().callGraph().nodeCount());
        assertEquals(2, result.statistics().callGraph().edgeCount());
        assertEquals(0, result.cycles().totalCycles());
        assertFalse(result.statistics().callGraph().cyclic());

        GraphModel<?> calls = analyzer.callGraph();
        int main = calls.findNode("main").orElseThrow();
        int helper = calls.findNode("helper").orElseThrow();
        CentralityMetrics centrality = result.callCentrality();
        assertTrue(centrality.degree().get(helper) > centrality.degree().get(main));
        assertEquals(helper, centrality.mostCentralBetweenness().orElseThrow().getKey());

        assertEquals(2, result.dependencyCentrality().degree().size());
        assertEquals(7, result.components().totalComponents());
        assertEquals(4.0 / 3.0, result.statistics().callGraph().averageDegree(), 1e-9);
        assertEquals(1.0, result.coupling().instability().get(0), 1e-9);
    }

    @Test
    void analyze_ShouldBeIdempotent() {
        GraphAnalyzer analyzer = new GraphBuilder()
                .addCall("a", "b", 1)
                .addCall("b", "c", 2)
                .addCall("c", "a", 1)
                .addCall("a", "c", 4)
                .addDependency("x", "y", "import")
                .addDependency("y", "x", "from_import")
                .build();

        assertEquals(analyzer.analyze(), analyzer.analyze());
        assertEquals(analyzer.calculateNetworkMetrics(), analyzer.calculateNetworkMetrics());
        assertEquals(analyzer.checkProblematicPatterns(), analyzer.checkProblematicPatterns());
    }

    @Test
    void analyze_ShouldHandleEmptyGraphs() {
        GraphAnalyzer analyzer = new GraphBuilder().build();

        GraphAnalysisResult result = analyzer.analyze();

        assertEquals(CentralityMetrics.empty(), result.callCentrality());
        assertEquals(0, result.cycles().totalCycles());
        assertEquals(0, result.components().totalComponents());
        assertEquals(0.0, result.statistics().dependencyGraph().averageDegree());
        assertEquals(NetworkMetrics.empty(), analyzer.calculateNetworkMetrics().get(GraphKind.CALL));
        assertTrue(analyzer.checkProblematicPatterns().isEmpty());
    }

    @Test
    void checkProblematicPatterns_ShouldReportDependencyCycle() {
        GraphAnalyzer analyzer = new GraphBuilder()
                .addDependency("a", "b", "import")
                .addDependency("b", "c", "import")
                .addDependency("c", "a", "import")
                .build();

        Map<String, List<String>> issues = analyzer.checkProblematicPatterns();

        assertTrue(issues.containsKey(IssueCategory.CYCLES.key()));
        assertEquals(
                List.of("Found 1 dependency cycles which can cause circular imports"),
                issues.get("cycles"));
        // 3 edges over 6 ordered pairs
        assertEquals(
                List.of("Dependency graph is very dense - consider modularization"),
                issues.get("density"));
        assertFalse(issues.containsKey("coupling"));
    }

    @Test
    void checkProblematicPatterns_ShouldReportInheritanceCycleAndUnstableModules() {
        GraphAnalyzer analyzer = new GraphBuilder()
                .addInheritance("A", "B")
                .addInheritance("B", "A")
                .addDependency("app", "os", "import")
                .addDependency("cli", "sys", "import")
                .addDependency("web", "json", "import")
                .addDependency("web", "re", "import")
                .addDependency("web", "io", "import")
                .build();

        Map<String, List<String>> issues = analyzer.checkProblematicPatterns();

        assertEquals(
                List.of("Found 1 inheritance cycles which indicate design problems"),
                issues.get("cycles"));
        assertFalse(issues.containsKey("coupling"));
        assertFalse(issues.containsKey("density"));
    }

    @Test
    void checkProblematicPatterns_ShouldHonourCustomThresholds() {
        PatternThresholds strict = new PatternThresholds(0, 0.1, 1, 0.3, 0.1);
        GraphBuilder builder = new GraphBuilder()
                .addCall("f", "f", 1)
                .addCall("f", "g", 1)
                .addCall("g", "f", 1)
                .addDependency("app", "util", "import")
                .addDependency("app", "log", "import");
        GraphAnalyzer analyzer = builder.build(PageRankSettings.DEFAULTS, strict);

        Map<String, List<String>> issues = analyzer.checkProblematicPatterns();

        assertEquals(List.of("Found 1 call cycles - consider refactoring recursive patterns"), issues.get("cycles"));
        assertEquals(List.of(
                "High average instability detected - modules are too dependent on others",
                "Modules with very high coupling detected - consider decomposition"
        ), issues.get("coupling"));
        assertEquals(List.of(
                "Dependency graph is very dense - consider modularization",
                "Call graph is very dense - functions are tightly coupled"
        ), issues.get("density"));
        assertEquals(List.of("cycles", "coupling", "density"), List.copyOf(issues.keySet()));
        assertSame(strict, analyzer.thresholds());
    }

    @Test
    void defaultThresholds_ShouldFlagCallCyclesAboveTen() {
        assertNull(callRings(10).build().checkProblematicPatterns().get("cycles"));
        assertEquals(
                List.of("Found 11 call cycles - consider refactoring recursive patterns"),
                callRings(11).build().checkProblematicPatterns().get("cycles"));
    }

    @Test
    void defaultThresholds_ShouldFlagCouplingAboveTwenty() {
        String message = "Modules with very high coupling detected - consider decomposition";

        List<String> atLimit = importersOf("core", 20).build().checkProblematicPatterns().get("coupling");
        List<String> overLimit = importersOf("core", 21).build().checkProblematicPatterns().get("coupling");

        assertFalse(atLimit.contains(message));
        assertTrue(overLimit.contains(message));
    }

    @Test
    void defaultThresholds_ShouldFlagInstabilityAboveEightTenths() {
        String message = "High average instability detected - modules are too dependent on others";

        // four importers (I = 1) and one imported module (I = 0): average exactly 0.8
        Map<String, List<String>> atLimit = importersOf("core", 4).build().checkProblematicPatterns();
        // five importers: average 5/6
        Map<String, List<String>> overLimit = importersOf("core", 5).build().checkProblematicPatterns();

        assertFalse(atLimit.containsKey("coupling"));
        assertEquals(List.of(message), overLimit.get("coupling"));
    }

    @Test
    void defaultThresholds_ShouldFlagDependencyDensityAboveThreeTenths() {
        // acyclic, 6 edges over 5 * 4 ordered pairs
        GraphBuilder builder = new GraphBuilder()
                .addDependency("a", "b", "import")
                .addDependency("a", "c", "import")
                .addDependency("b", "c", "import")
                .addDependency("b", "d", "import")
                .addDependency("c", "d", "import")
                .addDependency("d", "e", "import");
        GraphBuilder denser = new GraphBuilder()
                .addDependency("a", "b", "import")
                .addDependency("a", "c", "import")
                .addDependency("b", "c", "import")
                .addDependency("b", "d", "import")
                .addDependency("c", "d", "import")
                .addDependency("d", "e", "import")
                .addDependency("a", "e", "import");

        assertTrue(builder.build().checkProblematicPatterns().isEmpty());
        assertEquals(
                List.of("Dependency graph is very dense - consider modularization"),
                denser.build().checkProblematicPatterns().get("density"));
    }

    @Test
    void defaultThresholds_ShouldFlagCallDensityAboveHalf() {
        // acyclic, 6 edges over 4 * 3 ordered pairs
        GraphBuilder builder = new GraphBuilder()
                .addCall("a", "b", 1)
                .addCall("a", "c", 1)
                .addCall("a", "d", 1)
                .addCall("b", "c", 1)
                .addCall("b", "d", 1)
                .addCall("c", "d", 1);
        GraphBuilder denser = new GraphBuilder()
                .addCall("a", "b", 1)
                .addCall("a", "c", 1)
                .addCall("a", "d", 1)
                .addCall("b", "c", 1)
                .addCall("b", "d", 1)
                .addCall("c", "d", 1)
                .addCall("a", "b", 2);

        assertTrue(builder.build().checkProblematicPatterns().isEmpty());
        assertEquals(
                List.of("Call graph is very dense - functions are tightly coupled"),
                denser.build().checkProblematicPatterns().get("density"));
    }

    @Test
    void calculateNetworkMetrics_ShouldCoverEveryGraph() {
        GraphAnalyzer analyzer = new GraphBuilder()
                .addCall("main", "helper", 1)
                .addCall("helper", "util", 1)
                .addDependency("a", "b", "import")
                .build();

        Map<GraphKind, NetworkMetrics> metrics = analyzer.calculateNetworkMetrics();

        assertEquals(3, metrics.size());
        NetworkMetrics calls = metrics.get(GraphKind.CALL);
        assertEquals(2, calls.diameter());
        assertEquals(1, calls.connectedComponents());
        assertEquals(3, calls.largestComponentSize());
        assertEquals(4.0 / 3.0, calls.averagePathLength(), 1e-9);
        assertEquals(0.5, metrics.get(GraphKind.DEPENDENCY).density(), 1e-9);
    }

    @Test
    void constructor_ShouldFreezeGraphs() {
        GraphModel<CallNode> calls = GraphModel.callGraph();
        calls.addEdge(0, 1, 1.0, "call");

        GraphAnalyzer analyzer = new GraphAnalyzer(calls, GraphModel.dependencyGraph(), GraphModel.inheritanceGraph());

        assertTrue(calls.isFrozen());
        assertSame(calls, analyzer.graph(GraphKind.CALL));
        assertEquals(2, analyzer.calculateCentrality(GraphKind.CALL).pageRank().size());
        assertThrows(IllegalStateException.class, () -> calls.addEdge(1, 0, 1.0, "call"));
    }

    private static GraphBuilder callRings(int rings) {
        GraphBuilder builder = new GraphBuilder();
        for (int i = 0; i < rings; i++) {
            builder.addCall("f" + i, "g" + i, 1)
                    .addCall("g" + i, "f" + i, 1);
        }
        return builder;
    }

    private static GraphBuilder importersOf(String module, int importers) {
        GraphBuilder builder = new GraphBuilder();
        for (int i = 0; i < importers; i++) {
            builder.addDependency("client" + i, module, "import");
        }
        return builder;
    }
}
