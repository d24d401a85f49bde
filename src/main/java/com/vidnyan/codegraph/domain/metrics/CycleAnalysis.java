package com.vidnyan.codegraph.domain.metrics;

import com.vidnyan.codegraph.domain.graph.GraphKind;

import java.util.List;

/**
 * Simple cycles found in each graph, as node index sequences.
 */
public record CycleAnalysis(
    List<List<Integer>> callCycles,
    List<List<Integer>> dependencyCycles,
    List<List<Integer>> inheritanceCycles,
    int totalCycles
) {
    
    public static CycleAnalysis of(
            List<List<Integer>> callCycles,
            List<List<Integer>> dependencyCycles,
            List<List<Integer>> inheritanceCycles
    ) {
        return new CycleAnalysis(
                List.copyOf(callCycles),
                List.copyOf(dependencyCycles),
                List.copyOf(inheritanceCycles),
                callCycles.size() + dependencyCycles.size() + inheritanceCycles.size()
        );
    }
    
    public List<List<Integer>> cyclesFor(GraphKind kind) {
        return switch (kind) {
            case CALL -> callCycles;
            case DEPENDENCY -> dependencyCycles;
            case INHERITANCE -> inheritanceCycles;
        };
    }
}
