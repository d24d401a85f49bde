package com.vidnyan.codegraph.domain.metrics;

/**
 * Mean of each centrality measure over all nodes (0 for an empty graph).
 */
public record CentralityAverages(
    double avgBetweenness,
    double avgCloseness,
    double avgDegree,
    double avgEigenvector,
    double avgPageRank
) {}
