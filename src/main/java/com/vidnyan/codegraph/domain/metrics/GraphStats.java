package com.vidnyan.codegraph.domain.metrics;

/**
 * Scalar statistics of one graph.
 * Average degree is 2·edges / nodes; density is edges / (n(n - 1)).
 */
public record GraphStats(
    int nodeCount,
    int edgeCount,
    double density,
    boolean cyclic,
    double averageDegree
) {}
