package com.vidnyan.codegraph.application.service;

import com.vidnyan.codegraph.application.port.in.AnalyzeGraphUseCase;
import com.vidnyan.codegraph.application.port.out.RelationshipSource;
import com.vidnyan.codegraph.application.port.out.RelationshipSource.*;
import com.vidnyan.codegraph.domain.analysis.GraphAnalyzer;
import com.vidnyan.codegraph.domain.analysis.PageRankSettings;
import com.vidnyan.codegraph.domain.analysis.PatternThresholds;
import com.vidnyan.codegraph.domain.graph.GraphBuilder;
import com.vidnyan.codegraph.domain.graph.GraphKind;
import com.vidnyan.codegraph.domain.metrics.GraphAnalysisResult;
import com.vidnyan.codegraph.domain.metrics.GraphStats;
import com.vidnyan.codegraph.domain.metrics.NetworkMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Main application service that orchestrates graph analysis.
 * Implements the primary use case.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphAnalysisApplicationService implements AnalyzeGraphUseCase {

    private final RelationshipSource relationshipSource;
    private final PageRankSettings pageRankSettings;
    private final PatternThresholds patternThresholds;

    @Override
    public AnalysisReport analyze(AnalysisRequest request) {
        log.info("Starting graph analysis of: {}", request.inputPath());

        log.info("Step 1: Loading relationships...");
        RelationshipSet relationships = relationshipSource.load(request.inputPath());
        log.info("Loaded {} calls, {} dependencies, {} inheritance relationships",
                relationships.calls().size(),
                relationships.dependencies().size(),
                relationships.inheritance().size());

        return analyze(relationships, request.includeNetworkMetrics());
    }

    @Override
    public AnalysisReport analyze(RelationshipSet relationships, boolean includeNetworkMetrics) {
        Instant startTime = Instant.now();

        log.info("Step 2: Building graphs...");
        GraphAnalyzer analyzer = buildAnalyzer(relationships);
        log.info("Built: {} call nodes, {} modules, {} classes",
                analyzer.callGraph().nodeCount(),
                analyzer.dependencyGraph().nodeCount(),
                analyzer.inheritanceGraph().nodeCount());

        log.info("Step 3: Analyzing graphs...");
        GraphAnalysisResult result = analyzer.analyze();
        logStatistics(result);

        Map<GraphKind, NetworkMetrics> networkMetrics = Map.of();
        if (includeNetworkMetrics) {
            log.info("Step 4: Calculating network metrics...");
            networkMetrics = analyzer.calculateNetworkMetrics();
        } else {
            log.info("Step 4: Network metrics skipped");
        }

        log.info("Step 5: Checking problematic patterns...");
        Map<String, List<String>> issues = analyzer.checkProblematicPatterns();
        issues.forEach((category, messages) ->
                messages.forEach(message -> log.warn("  [{}] {}", category, message)));

        Map<GraphKind, List<String>> nodeNames = new EnumMap<>(GraphKind.class);
        for (GraphKind kind : GraphKind.values()) {
            nodeNames.put(kind, analyzer.graph(kind).nodeNames());
        }

        Duration totalDuration = Duration.between(startTime, Instant.now());
        AnalysisStats stats = new AnalysisStats(
                relationships.relationshipCount(),
                analyzer.callGraph().nodeCount(),
                analyzer.dependencyGraph().nodeCount(),
                analyzer.inheritanceGraph().nodeCount(),
                totalDuration.toMillis()
        );

        log.info("Graph analysis complete: {} cycles, {} issue categories in {}ms",
                result.cycles().totalCycles(), issues.size(), stats.totalDurationMs());

        return new AnalysisReport(result, networkMetrics, issues, Map.copyOf(nodeNames), stats);
    }

    private GraphAnalyzer buildAnalyzer(RelationshipSet relationships) {
        GraphBuilder builder = new GraphBuilder();

        for (CallRelation call : relationships.calls()) {
            builder.addCall(call.caller(), call.callee(), call.callCount());
        }
        for (DependencyRelation dependency : relationships.dependencies()) {
            builder.addDependency(dependency.importer(), dependency.imported(), dependency.importType());
        }
        for (InheritanceRelation inheritance : relationships.inheritance()) {
            builder.addInheritance(inheritance.child(), inheritance.parent(), inheritance.inheritanceType());
        }

        for (FunctionDefinition function : relationships.functions()) {
            builder.defineFunction(function.name(), function.filePath(), function.lineNumber());
        }
        for (ModuleDefinition module : relationships.modules()) {
            builder.defineModule(module.name(), module.filePath(), module.external());
        }
        for (ClassDefinition type : relationships.classes()) {
            builder.defineClass(type.name(), type.filePath(), type.lineNumber());
        }

        return builder.build(pageRankSettings, patternThresholds);
    }

    private void logStatistics(GraphAnalysisResult result) {
        for (GraphKind kind : GraphKind.values()) {
            GraphStats stats = result.statistics().statsFor(kind);
            log.info("  {}: {} nodes, {} edges, density {}, cyclic={}",
                    kind.key(),
                    stats.nodeCount(),
                    stats.edgeCount(),
                    String.format("%.3f", stats.density()),
                    stats.cyclic());
        }
    }
}
