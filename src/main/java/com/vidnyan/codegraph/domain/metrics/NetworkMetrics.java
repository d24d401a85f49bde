package com.vidnyan.codegraph.domain.metrics;

/**
 * Heavier network statistics for one graph. Component figures are for
 * weakly connected components.
 */
public record NetworkMetrics(
    double density,
    double clusteringCoefficient,
    double averagePathLength,
    int diameter,
    int connectedComponents,
    int largestComponentSize
) {
    
    public static final double SPARSE_DENSITY = 0.1;
    public static final double DENSE_DENSITY = 0.5;
    
    public static NetworkMetrics empty() {
        return new NetworkMetrics(0.0, 0.0, 0.0, 0, 0, 0);
    }
    
    public boolean isSparse() {
        return density < SPARSE_DENSITY;
    }
    
    public boolean isDense() {
        return density > DENSE_DENSITY;
    }
    
    /**
     * Mean of density, clustering and inverse average path length.
     */
    public double complexityScore() {
        double pathScore = averagePathLength > 0.0 ? 1.0 / averagePathLength : 0.0;
        return (density + clusteringCoefficient + pathScore) / 3.0;
    }
}
