package com.vidnyan.codegraph.report;

import com.vidnyan.codegraph.application.port.in.AnalyzeGraphUseCase.AnalysisReport;
import com.vidnyan.codegraph.domain.graph.GraphKind;
import com.vidnyan.codegraph.domain.metrics.CentralityMetrics;
import com.vidnyan.codegraph.domain.metrics.CouplingStats;
import com.vidnyan.codegraph.domain.metrics.GraphStats;
import com.vidnyan.codegraph.domain.metrics.NetworkMetrics;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Report Model - serializable output of a graph analysis.
 * Node indices are replaced by node names.
 */
@Value
@Builder
public class GraphReport {
    Summary summary;
    Map<String, GraphSection> graphs;
    Map<String, Double> moduleInstability;
    Map<String, List<String>> issues;
    
    @Value
    @Builder
    public static class Summary {
        int relationshipsLoaded;
        int totalCycles;
        int totalComponents;
        int issueCount;
        long durationMs;
        CouplingStats coupling;
    }
    
    @Value
    @Builder
    public static class GraphSection {
        GraphStats statistics;
        NetworkMetrics network;
        List<List<String>> cycles;
        List<List<String>> components;
        Map<String, Double> topPageRank;
        String mostCentralBetweenness;
        String highestDegree;
    }
    
    static final int TOP_NODES = 10;
    
    /**
     * Build report from an analysis. Only components with more than one
     * node are listed.
     */
    public static GraphReport build(AnalysisReport report) {
        Map<String, GraphSection> graphs = new LinkedHashMap<>();
        for (GraphKind kind : GraphKind.values()) {
            graphs.put(kind.key(), section(report, kind));
        }
        
        Map<String, Double> instability = new LinkedHashMap<>();
        report.result().coupling().mostUnstableNodes(Integer.MAX_VALUE).forEach(e ->
                instability.put(report.nameOf(GraphKind.DEPENDENCY, e.getKey()), e.getValue()));
        
        Summary summary = Summary.builder()
                .relationshipsLoaded(report.stats().relationshipsLoaded())
                .totalCycles(report.result().cycles().totalCycles())
                .totalComponents(report.result().components().totalComponents())
                .issueCount(report.issueCount())
                .durationMs(report.stats().totalDurationMs())
                .coupling(report.result().coupling().summaryStats())
                .build();
        
        return GraphReport.builder()
                .summary(summary)
                .graphs(graphs)
                .moduleInstability(instability)
                .issues(report.issues())
                .build();
    }
    
    private static GraphSection section(AnalysisReport report, GraphKind kind) {
        CentralityMetrics centrality = report.result().centralityFor(kind);
        
        Map<String, Double> topPageRank = new LinkedHashMap<>();
        centrality.topPageRank(TOP_NODES).forEach(e ->
                topPageRank.put(report.nameOf(kind, e.getKey()), e.getValue()));
        
        List<List<String>> components = new ArrayList<>();
        for (SortedSet<Integer> component : report.result().components().componentsFor(kind)) {
            if (component.size() > 1) {
                components.add(names(report, kind, component));
            }
        }
        
        return GraphSection.builder()
                .statistics(report.result().statistics().statsFor(kind))
                .network(report.networkMetrics().get(kind))
                .cycles(report.result().cycles().cyclesFor(kind).stream()
                        .map(cycle -> names(report, kind, cycle))
                        .toList())
                .components(components)
                .topPageRank(topPageRank)
                .mostCentralBetweenness(centrality.mostCentralBetweenness()
                        .map(e -> report.nameOf(kind, e.getKey()))
                        .orElse(null))
                .highestDegree(centrality.highestDegree()
                        .map(e -> report.nameOf(kind, e.getKey()))
                        .orElse(null))
                .build();
    }
    
    private static List<String> names(AnalysisReport report, GraphKind kind, Collection<Integer> nodes) {
        return nodes.stream().map(node -> report.nameOf(kind, node)).toList();
    }
}
