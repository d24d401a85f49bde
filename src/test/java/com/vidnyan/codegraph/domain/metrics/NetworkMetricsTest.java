package com.vidnyan.codegraph.domain.metrics;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NetworkMetricsTest {

    @Test
    void complexityScore_ShouldAverageDensityClusteringAndInversePathLength() {
        NetworkMetrics metrics = new NetworkMetrics(0.2, 0.3, 2.0, 3, 1, 5);

        assertEquals((0.2 + 0.3 + 0.5) / 3.0, metrics.complexityScore(), 1e-9);
        assertFalse(metrics.isSparse());
        assertFalse(metrics.isDense());
    }

    @Test
    void classification_ShouldUseDensityBounds() {
        assertTrue(new NetworkMetrics(0.05, 0.0, 0.0, 0, 1, 1).isSparse());
        assertTrue(new NetworkMetrics(0.6, 0.0, 1.0, 1, 1, 2).isDense());
        assertEquals(0.0, NetworkMetrics.empty().complexityScore());
    }
}
