package com.vidnyan.codegraph.domain.metrics;

import com.vidnyan.codegraph.domain.graph.GraphKind;

/**
 * Everything {@code GraphAnalyzer.analyze()} computes, across the three graphs.
 * All numeric fields are finite.
 */
public record GraphAnalysisResult(
    CentralityMetrics callCentrality,
    CentralityMetrics dependencyCentrality,
    CentralityMetrics inheritanceCentrality,
    CycleAnalysis cycles,
    ComponentAnalysis components,
    CouplingMetrics coupling,
    GraphStatistics statistics
) {
    
    public CentralityMetrics centralityFor(GraphKind kind) {
        return switch (kind) {
            case CALL -> callCentrality;
            case DEPENDENCY -> dependencyCentrality;
            case INHERITANCE -> inheritanceCentrality;
        };
    }
}
