package com.vidnyan.codegraph.domain.graph;

import java.util.Objects;

/**
 * A module (file or package) in the dependency graph.
 */
public record ModuleNode(
    String moduleName,
    String filePath,
    boolean external
) implements GraphNode {
    
    public ModuleNode {
        Objects.requireNonNull(moduleName, "moduleName");
        filePath = filePath != null ? filePath : "";
    }
    
    public static ModuleNode named(String moduleName) {
        return new ModuleNode(moduleName, "", false);
    }
    
    public boolean isInternal() {
        return !external;
    }
    
    public String moduleType() {
        return external ? "external" : "internal";
    }
    
    @Override
    public String displayName() {
        return moduleName;
    }
}
