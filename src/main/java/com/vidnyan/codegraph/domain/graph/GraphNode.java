package com.vidnyan.codegraph.domain.graph;

/**
 * Payload carried by a node of a {@link GraphModel}.
 * Algorithms never look at the payload; it exists for reporting.
 */
public interface GraphNode {
    
    /**
     * Name shown in reports and used for name lookups.
     */
    String displayName();
    
    /**
     * File the node was discovered in, empty when unknown.
     */
    String filePath();
}
