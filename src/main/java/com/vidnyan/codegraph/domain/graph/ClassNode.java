package com.vidnyan.codegraph.domain.graph;

import java.util.Objects;

/**
 * A class in the inheritance graph.
 * Hierarchy depth is the length of the longest child → parent chain above the class.
 */
public record ClassNode(
    String className,
    String filePath,
    int lineNumber,
    int hierarchyDepth
) implements GraphNode {
    
    public ClassNode {
        Objects.requireNonNull(className, "className");
        filePath = filePath != null ? filePath : "";
    }
    
    public static ClassNode named(String className) {
        return new ClassNode(className, "", 0, 0);
    }
    
    public ClassNode withHierarchyDepth(int depth) {
        return new ClassNode(className, filePath, lineNumber, depth);
    }
    
    /**
     * Qualified name in the form {@code file::class}.
     */
    public String qualifiedName() {
        return filePath + "::" + className;
    }
    
    @Override
    public String displayName() {
        return className;
    }
}
