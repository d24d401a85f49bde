package com.vidnyan.codegraph.application.port.in;

import com.vidnyan.codegraph.application.port.out.RelationshipSource.RelationshipSet;
import com.vidnyan.codegraph.domain.graph.GraphKind;
import com.vidnyan.codegraph.domain.metrics.GraphAnalysisResult;
import com.vidnyan.codegraph.domain.metrics.NetworkMetrics;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Primary use case: build the three code graphs and analyze them.
 */
public interface AnalyzeGraphUseCase {
    
    /**
     * Load relationships from the request's input and analyze them.
     */
    AnalysisReport analyze(AnalysisRequest request);
    
    /**
     * Analyze relationships that are already in memory.
     */
    AnalysisReport analyze(RelationshipSet relationships, boolean includeNetworkMetrics);
    
    /**
     * Analysis request parameters.
     */
    record AnalysisRequest(
        Path inputPath,
        boolean includeNetworkMetrics
    ) {
        public static AnalysisRequest forPath(Path path) {
            return new AnalysisRequest(path, true);
        }
    }
    
    /**
     * Analysis output.
     * Network metrics are empty when they were not requested.
     * Node names are indexed by node index so callers can label the results.
     */
    record AnalysisReport(
        GraphAnalysisResult result,
        Map<GraphKind, NetworkMetrics> networkMetrics,
        Map<String, List<String>> issues,
        Map<GraphKind, List<String>> nodeNames,
        AnalysisStats stats
    ) {
        public boolean hasIssues() {
            return !issues.isEmpty();
        }
        
        public int issueCount() {
            return issues.values().stream().mapToInt(List::size).sum();
        }
        
        public String nameOf(GraphKind kind, int node) {
            List<String> names = nodeNames.getOrDefault(kind, List.of());
            return node >= 0 && node < names.size() ? names.get(node) : "node_" + node;
        }
    }
    
    /**
     * Analysis statistics.
     */
    record AnalysisStats(
        int relationshipsLoaded,
        int callNodes,
        int dependencyNodes,
        int inheritanceNodes,
        long totalDurationMs
    ) {}
}
