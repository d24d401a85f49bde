package com.vidnyan.codegraph.domain.analysis;

/**
 * Limits above which {@link GraphAnalyzer#checkProblematicPatterns()} reports an issue.
 * Every comparison is strict (value &gt; limit).
 */
public record PatternThresholds(
    int maxCallCycles,
    double maxAverageInstability,
    int maxNodeCoupling,
    double maxDependencyDensity,
    double maxCallDensity
) {
    
    public static final PatternThresholds DEFAULTS = new PatternThresholds(10, 0.8, 20, 0.3, 0.5);
}
