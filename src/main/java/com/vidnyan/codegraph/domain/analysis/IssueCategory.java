package com.vidnyan.codegraph.domain.analysis;

/**
 * Groups of diagnostics produced by {@link GraphAnalyzer#checkProblematicPatterns()}.
 */
public enum IssueCategory {
    CYCLES("cycles"),
    COUPLING("coupling"),
    DENSITY("density");
    
    private final String key;
    
    IssueCategory(String key) {
        this.key = key;
    }
    
    public String key() {
        return key;
    }
}
