package com.vidnyan.codegraph.domain.analysis;

import com.vidnyan.codegraph.domain.algorithm.CentralityAlgorithms;
import com.vidnyan.codegraph.domain.algorithm.CouplingAnalysis;
import com.vidnyan.codegraph.domain.algorithm.CycleDetection;
import com.vidnyan.codegraph.domain.algorithm.NetworkAnalysis;
import com.vidnyan.codegraph.domain.graph.*;
import com.vidnyan.codegraph.domain.metrics.*;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Runs the graph algorithms over the call, dependency and inheritance graphs
 * of one codebase.
 * <p>
 * The analyzer owns its three frozen graphs and holds no other state: every
 * method recomputes from scratch, so repeated calls return equal results and
 * concurrent calls need no locking.
 * <p>
 * Betweenness and full cycle enumeration dominate the cost; on large dense
 * graphs {@link #analyze()} can take a long time. Deadlines are the caller's
 * concern.
 */
@Slf4j
public class GraphAnalyzer {

    private final GraphModel<CallNode> callGraph;
    private final GraphModel<ModuleNode> dependencyGraph;
    private final GraphModel<ClassNode> inheritanceGraph;
    private final PageRankSettings pageRank;
    private final PatternThresholds thresholds;

    public GraphAnalyzer(
            GraphModel<CallNode> callGraph,
            GraphModel<ModuleNode> dependencyGraph,
            GraphModel<ClassNode> inheritanceGraph
    ) {
        this(callGraph, dependencyGraph, inheritanceGraph, PageRankSettings.DEFAULTS, PatternThresholds.DEFAULTS);
    }

    public GraphAnalyzer(
            GraphModel<CallNode> callGraph,
            GraphModel<ModuleNode> dependencyGraph,
            GraphModel<ClassNode> inheritanceGraph,
            PageRankSettings pageRank,
            PatternThresholds thresholds
    ) {
        this.callGraph = Objects.requireNonNull(callGraph, "callGraph").freeze();
        this.dependencyGraph = Objects.requireNonNull(dependencyGraph, "dependencyGraph").freeze();
        this.inheritanceGraph = Objects.requireNonNull(inheritanceGraph, "inheritanceGraph").freeze();
        this.pageRank = Objects.requireNonNull(pageRank, "pageRank");
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    /**
     * Centrality, cycles, strongly connected components, coupling and
     * statistics for all three graphs.
     */
    public GraphAnalysisResult analyze() {
        log.debug("Analyzing {}, {}, {}", callGraph, dependencyGraph, inheritanceGraph);
        return new GraphAnalysisResult(
                calculateCentrality(GraphKind.CALL),
                calculateCentrality(GraphKind.DEPENDENCY),
                calculateCentrality(GraphKind.INHERITANCE),
                detectCycles(),
                findStronglyConnectedComponents(),
                calculateCouplingMetrics(),
                calculateGraphStatistics()
        );
    }

    public CentralityMetrics calculateCentrality(GraphKind kind) {
        GraphModel<?> graph = graph(kind);
        return CentralityMetrics.of(
                CentralityAlgorithms.degreeCentrality(graph),
                CentralityAlgorithms.betweennessCentrality(graph),
                CentralityAlgorithms.closenessCentrality(graph),
                CentralityAlgorithms.pageRankCentrality(
                        graph, pageRank.damping(), pageRank.maxIterations(), pageRank.tolerance())
        );
    }

    public CycleAnalysis detectCycles() {
        CycleAnalysis cycles = CycleAnalysis.of(
                CycleDetection.findAllCycles(callGraph),
                CycleDetection.findAllCycles(dependencyGraph),
                CycleDetection.findAllCycles(inheritanceGraph)
        );
        log.debug("Found {} cycles ({} call, {} dependency, {} inheritance)",
                cycles.totalCycles(),
                cycles.callCycles().size(),
                cycles.dependencyCycles().size(),
                cycles.inheritanceCycles().size());
        return cycles;
    }

    public ComponentAnalysis findStronglyConnectedComponents() {
        return ComponentAnalysis.of(
                NetworkAnalysis.stronglyConnectedComponents(callGraph),
                NetworkAnalysis.stronglyConnectedComponents(dependencyGraph),
                NetworkAnalysis.stronglyConnectedComponents(inheritanceGraph)
        );
    }

    /**
     * Coupling is only meaningful between modules, so only the dependency
     * graph is measured.
     */
    public CouplingMetrics calculateCouplingMetrics() {
        return CouplingAnalysis.calculate(dependencyGraph);
    }

    public GraphStatistics calculateGraphStatistics() {
        return new GraphStatistics(
                graphStats(callGraph),
                graphStats(dependencyGraph),
                graphStats(inheritanceGraph)
        );
    }

    private static GraphStats graphStats(GraphModel<?> graph) {
        int nodes = graph.nodeCount();
        int edges = graph.edgeCount();
        return new GraphStats(
                nodes,
                edges,
                NetworkAnalysis.graphDensity(graph),
                CycleDetection.hasCycle(graph),
                nodes > 0 ? (edges * 2.0) / nodes : 0.0
        );
    }

    /**
     * Density, clustering, path lengths and weak connectivity per graph.
     * Separate from {@link #analyze()} because the all-pairs passes are
     * costly and rarely needed.
     */
    public Map<GraphKind, NetworkMetrics> calculateNetworkMetrics() {
        Map<GraphKind, NetworkMetrics> metrics = new EnumMap<>(GraphKind.class);
        for (GraphKind kind : GraphKind.values()) {
            metrics.put(kind, networkMetrics(graph(kind)));
        }
        return Collections.unmodifiableMap(metrics);
    }

    private static NetworkMetrics networkMetrics(GraphModel<?> graph) {
        return new NetworkMetrics(
                NetworkAnalysis.graphDensity(graph),
                NetworkAnalysis.averageClusteringCoefficient(graph),
                NetworkAnalysis.averagePathLength(graph),
                NetworkAnalysis.graphDiameter(graph),
                NetworkAnalysis.weaklyConnectedComponents(graph).size(),
                NetworkAnalysis.largestComponentSize(graph)
        );
    }

    /**
     * Heuristic diagnostics keyed by {@link IssueCategory#key()}
     * ("cycles", "coupling", "density"). Categories without findings are absent.
     */
    public Map<String, List<String>> checkProblematicPatterns() {
        Map<String, List<String>> issues = new LinkedHashMap<>();

        CycleAnalysis cycles = detectCycles();
        List<String> cycleIssues = new ArrayList<>();
        if (!cycles.dependencyCycles().isEmpty()) {
            cycleIssues.add(String.format(
                    "Found %d dependency cycles which can cause circular imports",
                    cycles.dependencyCycles().size()));
        }
        if (!cycles.inheritanceCycles().isEmpty()) {
            cycleIssues.add(String.format(
                    "Found %d inheritance cycles which indicate design problems",
                    cycles.inheritanceCycles().size()));
        }
        if (cycles.callCycles().size() > thresholds.maxCallCycles()) {
            cycleIssues.add(String.format(
                    "Found %d call cycles - consider refactoring recursive patterns",
                    cycles.callCycles().size()));
        }
        putIfAny(issues, IssueCategory.CYCLES, cycleIssues);

        CouplingStats coupling = calculateCouplingMetrics().summaryStats();
        List<String> couplingIssues = new ArrayList<>();
        if (coupling.avgInstability() > thresholds.maxAverageInstability()) {
            couplingIssues.add("High average instability detected - modules are too dependent on others");
        }
        if (coupling.maxCoupling() > thresholds.maxNodeCoupling()) {
            couplingIssues.add("Modules with very high coupling detected - consider decomposition");
        }
        putIfAny(issues, IssueCategory.COUPLING, couplingIssues);

        List<String> densityIssues = new ArrayList<>();
        if (NetworkAnalysis.graphDensity(dependencyGraph) > thresholds.maxDependencyDensity()) {
            densityIssues.add("Dependency graph is very dense - consider modularization");
        }
        if (NetworkAnalysis.graphDensity(callGraph) > thresholds.maxCallDensity()) {
            densityIssues.add("Call graph is very dense - functions are tightly coupled");
        }
        putIfAny(issues, IssueCategory.DENSITY, densityIssues);

        return issues;
    }

    private static void putIfAny(Map<String, List<String>> issues, IssueCategory category, List<String> messages) {
        if (!messages.isEmpty()) {
            issues.put(category.key(), List.copyOf(messages));
        }
    }

    public GraphModel<?> graph(GraphKind kind) {
        return switch (kind) {
            case CALL -> callGraph;
            case DEPENDENCY -> dependencyGraph;
            case INHERITANCE -> inheritanceGraph;
        };
    }

    public GraphModel<CallNode> callGraph() {
        return callGraph;
    }

    public GraphModel<ModuleNode> dependencyGraph() {
        return dependencyGraph;
    }

    public GraphModel<ClassNode> inheritanceGraph() {
        return inheritanceGraph;
    }

    public PatternThresholds thresholds() {
        return thresholds;
    }
}
