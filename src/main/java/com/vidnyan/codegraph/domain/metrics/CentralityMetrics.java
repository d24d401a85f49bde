package com.vidnyan.codegraph.domain.metrics;

import java.util.*;

/**
 * Centrality scores for one graph, keyed by node index.
 * Eigenvector centrality is not computed separately: it holds the PageRank scores.
 */
public record CentralityMetrics(
    Map<Integer, Double> degree,
    Map<Integer, Double> betweenness,
    Map<Integer, Double> closeness,
    Map<Integer, Double> pageRank,
    Map<Integer, Double> eigenvector
) {
    
    public CentralityMetrics {
        degree = sorted(degree);
        betweenness = sorted(betweenness);
        closeness = sorted(closeness);
        pageRank = sorted(pageRank);
        eigenvector = sorted(eigenvector);
    }
    
    private static Map<Integer, Double> sorted(Map<Integer, Double> scores) {
        return Collections.unmodifiableMap(new TreeMap<>(scores));
    }
    
    public static CentralityMetrics empty() {
        return new CentralityMetrics(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
    }
    
    /**
     * Create metrics with the PageRank scores standing in for eigenvector centrality.
     */
    public static CentralityMetrics of(
            Map<Integer, Double> degree,
            Map<Integer, Double> betweenness,
            Map<Integer, Double> closeness,
            Map<Integer, Double> pageRank
    ) {
        return new CentralityMetrics(degree, betweenness, closeness, pageRank, pageRank);
    }
    
    public Optional<Map.Entry<Integer, Double>> mostCentralBetweenness() {
        return highest(betweenness);
    }
    
    public Optional<Map.Entry<Integer, Double>> mostCentralCloseness() {
        return highest(closeness);
    }
    
    public Optional<Map.Entry<Integer, Double>> highestDegree() {
        return highest(degree);
    }
    
    /**
     * Top {@code n} nodes by PageRank, highest first. Ties go to the lower index.
     */
    public List<Map.Entry<Integer, Double>> topPageRank(int n) {
        return pageRank.entrySet().stream()
                .sorted(BY_SCORE_DESC)
                .limit(n)
                .map(e -> Map.entry(e.getKey(), e.getValue()))
                .toList();
    }
    
    public CentralityAverages averageCentralities() {
        return new CentralityAverages(
                average(betweenness),
                average(closeness),
                average(degree),
                average(eigenvector),
                average(pageRank)
        );
    }
    
    private static final Comparator<Map.Entry<Integer, Double>> BY_SCORE_DESC =
            Map.Entry.<Integer, Double>comparingByValue().reversed()
                    .thenComparing(Map.Entry.comparingByKey());
    
    private static Optional<Map.Entry<Integer, Double>> highest(Map<Integer, Double> scores) {
        return scores.entrySet().stream()
                .sorted(BY_SCORE_DESC)
                .findFirst()
                .map(e -> Map.entry(e.getKey(), e.getValue()));
    }
    
    static double average(Map<Integer, ? extends Number> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Number value : values.values()) {
            sum += value.doubleValue();
        }
        return sum / values.size();
    }
}
