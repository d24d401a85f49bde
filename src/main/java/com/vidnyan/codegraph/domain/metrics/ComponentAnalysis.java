package com.vidnyan.codegraph.domain.metrics;

import com.vidnyan.codegraph.domain.graph.GraphKind;

import java.util.List;
import java.util.SortedSet;

/**
 * Strongly connected components of each graph. Singleton components are
 * included, so every node appears in exactly one component.
 */
public record ComponentAnalysis(
    List<SortedSet<Integer>> callComponents,
    List<SortedSet<Integer>> dependencyComponents,
    List<SortedSet<Integer>> inheritanceComponents,
    int totalComponents
) {
    
    public static ComponentAnalysis of(
            List<SortedSet<Integer>> callComponents,
            List<SortedSet<Integer>> dependencyComponents,
            List<SortedSet<Integer>> inheritanceComponents
    ) {
        return new ComponentAnalysis(
                List.copyOf(callComponents),
                List.copyOf(dependencyComponents),
                List.copyOf(inheritanceComponents),
                callComponents.size() + dependencyComponents.size() + inheritanceComponents.size()
        );
    }
    
    public List<SortedSet<Integer>> componentsFor(GraphKind kind) {
        return switch (kind) {
            case CALL -> callComponents;
            case DEPENDENCY -> dependencyComponents;
            case INHERITANCE -> inheritanceComponents;
        };
    }
}
