package com.vidnyan.codegraph.domain.graph;

import java.util.Objects;

/**
 * A function in the call graph.
 */
public record CallNode(
    String functionName,
    String filePath,
    int lineNumber
) implements GraphNode {
    
    public CallNode {
        Objects.requireNonNull(functionName, "functionName");
        filePath = filePath != null ? filePath : "";
    }
    
    /**
     * Node for a function whose location is not known yet.
     */
    public static CallNode named(String functionName) {
        return new CallNode(functionName, "", 0);
    }
    
    /**
     * Qualified name in the form {@code file::function}.
     */
    public String qualifiedName() {
        return filePath + "::" + functionName;
    }
    
    @Override
    public String displayName() {
        return functionName;
    }
}
