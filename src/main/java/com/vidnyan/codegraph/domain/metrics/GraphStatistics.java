package com.vidnyan.codegraph.domain.metrics;

import com.vidnyan.codegraph.domain.graph.GraphKind;

public record GraphStatistics(
    GraphStats callGraph,
    GraphStats dependencyGraph,
    GraphStats inheritanceGraph
) {
    
    public GraphStats statsFor(GraphKind kind) {
        return switch (kind) {
            case CALL -> callGraph;
            case DEPENDENCY -> dependencyGraph;
            case INHERITANCE -> inheritanceGraph;
        };
    }
}
