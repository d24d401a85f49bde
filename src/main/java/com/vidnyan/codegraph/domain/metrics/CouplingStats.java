package com.vidnyan.codegraph.domain.metrics;

/**
 * Summary of coupling across all modules.
 */
public record CouplingStats(
    int totalNodes,
    double avgAfferent,
    double avgEfferent,
    double avgInstability,
    double avgDistanceFromMain,
    int maxCoupling
) {}
