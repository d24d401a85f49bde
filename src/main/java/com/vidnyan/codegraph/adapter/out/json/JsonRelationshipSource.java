package com.vidnyan.codegraph.adapter.out.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.codegraph.application.port.out.RelationshipLoadException;
import com.vidnyan.codegraph.application.port.out.RelationshipSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Reads extractor output from a JSON file:
 * <pre>
 * {
 *   "calls":        [{"caller": "main", "callee": "helper", "count": 5}],
 *   "dependencies": [{"importer": "app", "imported": "util", "type": "import"}],
 *   "inheritance":  [{"child": "Child", "parent": "Parent", "type": "extends"}],
 *   "functions":    [{"name": "main", "file": "src/main.py", "line": 3}],
 *   "modules":      [{"name": "requests", "file": "", "external": true}],
 *   "classes":      [{"name": "Child", "file": "src/model.py", "line": 10}]
 * }
 * </pre>
 * Every section is optional. Entries missing a required name are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonRelationshipSource implements RelationshipSource {

    private final ObjectMapper objectMapper;

    @Override
    public RelationshipSet load(Path source) {
        if (source == null || !Files.isRegularFile(source)) {
            throw new RelationshipLoadException(source, "Relationship file not found", null);
        }

        GraphFileDto dto;
        try (InputStream in = Files.newInputStream(source)) {
            dto = objectMapper.readValue(in, GraphFileDto.class);
        } catch (IOException e) {
            throw new RelationshipLoadException(source, "Failed to read relationships", e);
        }
        if (dto == null) {
            dto = new GraphFileDto();
        }

        RelationshipSet relationships = new RelationshipSet(
                map(dto.calls, c -> valid(c.caller) && valid(c.callee) && c.count >= 0, "call",
                        c -> new CallRelation(c.caller, c.callee, c.count)),
                map(dto.dependencies, d -> valid(d.importer) && valid(d.imported), "dependency",
                        d -> new DependencyRelation(d.importer, d.imported, d.type != null ? d.type : "import")),
                map(dto.inheritance, i -> valid(i.child) && valid(i.parent), "inheritance",
                        i -> new InheritanceRelation(i.child, i.parent, i.type != null ? i.type : "extends")),
                map(dto.functions, f -> valid(f.name), "function",
                        f -> new FunctionDefinition(f.name, f.file, f.line)),
                map(dto.modules, m -> valid(m.name), "module",
                        m -> new ModuleDefinition(m.name, m.file, m.external)),
                map(dto.classes, c -> valid(c.name), "class",
                        c -> new ClassDefinition(c.name, c.file, c.line))
        );

        log.info("Loaded {} relationships from {}", relationships.relationshipCount(), source);
        return relationships;
    }

    private static <D, R> List<R> map(List<D> entries, Predicate<D> isValid, String what, Function<D, R> mapper) {
        if (entries == null) {
            return List.of();
        }
        List<R> result = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            D entry = entries.get(i);
            if (entry == null || !isValid.test(entry)) {
                log.warn("Skipping malformed {} entry at position {}", what, i);
                continue;
            }
            result.add(mapper.apply(entry));
        }
        return result;
    }

    private static boolean valid(String name) {
        return name != null && !name.isBlank();
    }

    // DTO classes for JSON deserialization
    static class GraphFileDto {
        public List<CallDto> calls;
        public List<DependencyDto> dependencies;
        public List<InheritanceDto> inheritance;
        public List<FunctionDto> functions;
        public List<ModuleDto> modules;
        public List<ClassDto> classes;
    }

    static class CallDto {
        public String caller;
        public String callee;
        public int count = 1;
    }

    static class DependencyDto {
        public String importer;
        public String imported;
        public String type;
    }

    static class InheritanceDto {
        public String child;
        public String parent;
        public String type;
    }

    static class FunctionDto {
        public String name;
        public String file;
        public int line;
    }

    static class ModuleDto {
        public String name;
        public String file;
        public boolean external;
    }

    static class ClassDto {
        public String name;
        public String file;
        public int line;
    }
}
