package com.vidnyan.codegraph.domain.graph;

/**
 * The three graphs derived from one codebase.
 */
public enum GraphKind {
    CALL("call_graph"),
    DEPENDENCY("dependency_graph"),
    INHERITANCE("inheritance_graph");
    
    private final String key;
    
    GraphKind(String key) {
        this.key = key;
    }
    
    /**
     * Stable key used in reports.
     */
    public String key() {
        return key;
    }
}
