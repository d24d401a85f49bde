package com.vidnyan.codegraph.application.port.out;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for loading the relationships extracted from a codebase.
 * Implemented by adapters that read extractor output (JSON files, ...).
 */
public interface RelationshipSource {
    
    /**
     * Load all relationships from a source.
     * @param source location of the extractor output
     * @return relationships, never null
     * @throws RelationshipLoadException if the source cannot be read
     */
    RelationshipSet load(Path source);
    
    /**
     * Everything the graph builder needs: edges plus optional node details.
     */
    record RelationshipSet(
        List<CallRelation> calls,
        List<DependencyRelation> dependencies,
        List<InheritanceRelation> inheritance,
        List<FunctionDefinition> functions,
        List<ModuleDefinition> modules,
        List<ClassDefinition> classes
    ) {
        public RelationshipSet {
            calls = List.copyOf(calls);
            dependencies = List.copyOf(dependencies);
            inheritance = List.copyOf(inheritance);
            functions = List.copyOf(functions);
            modules = List.copyOf(modules);
            classes = List.copyOf(classes);
        }
        
        public static RelationshipSet of(
                List<CallRelation> calls,
                List<DependencyRelation> dependencies,
                List<InheritanceRelation> inheritance
        ) {
            return new RelationshipSet(calls, dependencies, inheritance, List.of(), List.of(), List.of());
        }
        
        public int relationshipCount() {
            return calls.size() + dependencies.size() + inheritance.size();
        }
    }
    
    record CallRelation(String caller, String callee, int callCount) {}
    
    record DependencyRelation(String importer, String imported, String importType) {}
    
    record InheritanceRelation(String child, String parent, String inheritanceType) {}
    
    record FunctionDefinition(String name, String filePath, int lineNumber) {}
    
    record ModuleDefinition(String name, String filePath, boolean external) {}
    
    record ClassDefinition(String name, String filePath, int lineNumber) {}
}
