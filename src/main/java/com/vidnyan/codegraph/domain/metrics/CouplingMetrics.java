package com.vidnyan.codegraph.domain.metrics;

import java.util.*;

/**
 * Per-module coupling for the dependency graph, keyed by node index.
 * <ul>
 *   <li>afferent (Ca): incoming dependencies</li>
 *   <li>efferent (Ce): outgoing dependencies</li>
 *   <li>instability (I): Ce / (Ca + Ce), 0 when both are 0</li>
 *   <li>abstractness (A): placeholder constant, see {@code CouplingAnalysis}</li>
 *   <li>distance from main sequence (D): |A + I - 1|</li>
 * </ul>
 */
public record CouplingMetrics(
    Map<Integer, Integer> afferentCoupling,
    Map<Integer, Integer> efferentCoupling,
    Map<Integer, Double> instability,
    Map<Integer, Double> abstractness,
    Map<Integer, Double> distanceFromMain
) {
    
    public CouplingMetrics {
        afferentCoupling = Collections.unmodifiableMap(new TreeMap<>(afferentCoupling));
        efferentCoupling = Collections.unmodifiableMap(new TreeMap<>(efferentCoupling));
        instability = Collections.unmodifiableMap(new TreeMap<>(instability));
        abstractness = Collections.unmodifiableMap(new TreeMap<>(abstractness));
        distanceFromMain = Collections.unmodifiableMap(new TreeMap<>(distanceFromMain));
    }
    
    public static CouplingMetrics empty() {
        return new CouplingMetrics(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
    }
    
    public static double instability(int afferent, int efferent) {
        int total = afferent + efferent;
        return total == 0 ? 0.0 : efferent / (double) total;
    }
    
    public static double distanceFromMain(double abstractness, double instability) {
        return Math.abs(abstractness + instability - 1.0);
    }
    
    /**
     * Ca + Ce for a node, 0 for unknown nodes.
     */
    public int totalCoupling(int node) {
        return afferentCoupling.getOrDefault(node, 0) + efferentCoupling.getOrDefault(node, 0);
    }
    
    /**
     * Nodes with the highest Ca + Ce, highest first. Ties go to the lower index.
     */
    public List<Map.Entry<Integer, Integer>> mostCoupledNodes(int n) {
        return afferentCoupling.keySet().stream()
                .map(node -> Map.entry(node, totalCoupling(node)))
                .sorted(Map.Entry.<Integer, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(n)
                .toList();
    }
    
    public List<Map.Entry<Integer, Double>> mostUnstableNodes(int n) {
        return instability.entrySet().stream()
                .sorted(Map.Entry.<Integer, Double>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(n)
                .map(e -> Map.entry(e.getKey(), e.getValue()))
                .toList();
    }
    
    public CouplingStats summaryStats() {
        return new CouplingStats(
                afferentCoupling.size(),
                CentralityMetrics.average(afferentCoupling),
                CentralityMetrics.average(efferentCoupling),
                CentralityMetrics.average(instability),
                CentralityMetrics.average(distanceFromMain),
                mostCoupledNodes(1).stream().mapToInt(Map.Entry::getValue).findFirst().orElse(0)
        );
    }
}
