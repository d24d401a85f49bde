package com.vidnyan.codegraph.domain.algorithm;

import com.vidnyan.codegraph.domain.graph.GraphModel;
import com.vidnyan.codegraph.domain.metrics.CouplingMetrics;

import java.util.HashMap;
import java.util.Map;

/**
 * Afferent/efferent coupling and instability for a dependency graph.
 */
public final class CouplingAnalysis {

    /**
     * Abstractness assigned to every module. The real ratio of abstract to
     * concrete types needs class-level information the dependency graph
     * does not carry.
     */
    public static final double ABSTRACTNESS_PLACEHOLDER = 0.5;

    private CouplingAnalysis() {
    }

    public static CouplingMetrics calculate(GraphModel<?> dependencyGraph) {
        int n = dependencyGraph.nodeCount();
        Map<Integer, Integer> afferent = new HashMap<>();
        Map<Integer, Integer> efferent = new HashMap<>();
        Map<Integer, Double> instability = new HashMap<>();
        Map<Integer, Double> abstractness = new HashMap<>();
        Map<Integer, Double> distance = new HashMap<>();

        for (int node = 0; node < n; node++) {
            int ca = dependencyGraph.inDegree(node);
            int ce = dependencyGraph.outDegree(node);
            double i = CouplingMetrics.instability(ca, ce);

            afferent.put(node, ca);
            efferent.put(node, ce);
            instability.put(node, i);
            abstractness.put(node, ABSTRACTNESS_PLACEHOLDER);
            distance.put(node, CouplingMetrics.distanceFromMain(ABSTRACTNESS_PLACEHOLDER, i));
        }

        return new CouplingMetrics(afferent, efferent, instability, abstractness, distance);
    }
}
