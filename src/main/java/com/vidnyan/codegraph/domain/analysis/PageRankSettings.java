package com.vidnyan.codegraph.domain.analysis;

/**
 * Power-iteration parameters for PageRank.
 */
public record PageRankSettings(
    double damping,
    int maxIterations,
    double tolerance
) {
    
    public static final PageRankSettings DEFAULTS = new PageRankSettings(0.85, 100, 1e-6);
    
    public PageRankSettings {
        if (!(damping >= 0.0 && damping <= 1.0)) {
            throw new IllegalArgumentException("damping must be in [0, 1]: " + damping);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        if (!(tolerance > 0.0)) {
            throw new IllegalArgumentException("tolerance must be positive: " + tolerance);
        }
    }
}
