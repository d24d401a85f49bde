package com.vidnyan.codegraph.domain.graph;

/**
 * Directed edge between two node indices.
 * Weight is the call count for call edges and 1.0 for import and inheritance edges.
 * Kind is "call", the import type ("import", "from_import", ...) or the
 * inheritance type ("extends", "implements").
 */
public record GraphEdge(
    int source,
    int target,
    double weight,
    String kind
) {
    
    public static final String CALL = "call";
    public static final String IMPORT = "import";
    public static final String EXTENDS = "extends";
    
    public boolean isSelfLoop() {
        return source == target;
    }
    
    /**
     * Check if this edge is significant (weight at or above threshold).
     */
    public boolean isSignificant(double threshold) {
        return weight >= threshold;
    }
}
