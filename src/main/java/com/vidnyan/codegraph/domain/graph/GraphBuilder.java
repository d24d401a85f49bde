package com.vidnyan.codegraph.domain.graph;

import com.vidnyan.codegraph.domain.analysis.GraphAnalyzer;
import com.vidnyan.codegraph.domain.analysis.PageRankSettings;
import com.vidnyan.codegraph.domain.analysis.PatternThresholds;

import java.util.*;

/**
 * Populates the call, dependency and inheritance graphs from extracted
 * relationships and hands them, frozen, to a {@link GraphAnalyzer}.
 * <p>
 * Nodes are created on first mention and reused afterwards. Repeating a
 * relationship adds a parallel edge rather than merging it.
 * Not thread-safe; one builder per analysis run.
 */
public class GraphBuilder {

    private final GraphModel<CallNode> callGraph = GraphModel.callGraph();
    private final GraphModel<ModuleNode> dependencyGraph = GraphModel.dependencyGraph();
    private final GraphModel<ClassNode> inheritanceGraph = GraphModel.inheritanceGraph();

    // name → node index, per graph
    private final Map<String, Integer> callNodes = new HashMap<>();
    private final Map<String, Integer> dependencyNodes = new HashMap<>();
    private final Map<String, Integer> inheritanceNodes = new HashMap<>();

    private boolean built;

    /**
     * Add a function call relationship.
     */
    public GraphBuilder addCall(String caller, String callee, int callCount) {
        if (callCount < 0) {
            throw new IllegalArgumentException("Negative call count for " + caller + " -> " + callee);
        }
        int from = callNode(caller);
        int to = callNode(callee);
        callGraph.addEdge(from, to, callCount, GraphEdge.CALL);
        return this;
    }

    /**
     * Add a module dependency relationship.
     */
    public GraphBuilder addDependency(String importer, String imported, String importType) {
        int from = dependencyNode(importer);
        int to = dependencyNode(imported);
        dependencyGraph.addEdge(from, to, 1.0, importType != null ? importType : GraphEdge.IMPORT);
        return this;
    }

    /**
     * Add a class inheritance relationship (child extends parent).
     */
    public GraphBuilder addInheritance(String child, String parent) {
        return addInheritance(child, parent, GraphEdge.EXTENDS);
    }

    public GraphBuilder addInheritance(String child, String parent, String inheritanceType) {
        int from = inheritanceNode(child);
        int to = inheritanceNode(parent);
        inheritanceGraph.addEdge(from, to, 1.0, inheritanceType != null ? inheritanceType : GraphEdge.EXTENDS);
        return this;
    }

    /**
     * Record where a function is defined. Creates the node if needed.
     */
    public GraphBuilder defineFunction(String name, String filePath, int lineNumber) {
        int index = callNode(name);
        callGraph.replaceNode(index, new CallNode(name, filePath, lineNumber));
        return this;
    }

    /**
     * Record module details. Creates the node if needed.
     */
    public GraphBuilder defineModule(String name, String filePath, boolean external) {
        int index = dependencyNode(name);
        dependencyGraph.replaceNode(index, new ModuleNode(name, filePath, external));
        return this;
    }

    /**
     * Record where a class is defined. Creates the node if needed.
     */
    public GraphBuilder defineClass(String name, String filePath, int lineNumber) {
        int index = inheritanceNode(name);
        ClassNode current = inheritanceGraph.node(index);
        inheritanceGraph.replaceNode(index, new ClassNode(name, filePath, lineNumber, current.hierarchyDepth()));
        return this;
    }

    /**
     * Build with default PageRank settings and diagnostic thresholds.
     */
    public GraphAnalyzer build() {
        return build(PageRankSettings.DEFAULTS, PatternThresholds.DEFAULTS);
    }

    /**
     * Freeze the three graphs and hand them to a new analyzer.
     * The builder cannot be used afterwards.
     */
    public GraphAnalyzer build(PageRankSettings pageRank, PatternThresholds thresholds) {
        checkNotBuilt();
        built = true;
        assignHierarchyDepths();
        return new GraphAnalyzer(
                callGraph.freeze(),
                dependencyGraph.freeze(),
                inheritanceGraph.freeze(),
                pageRank,
                thresholds
        );
    }

    public GraphModel<CallNode> callGraph() {
        return callGraph;
    }

    public GraphModel<ModuleNode> dependencyGraph() {
        return dependencyGraph;
    }

    public GraphModel<ClassNode> inheritanceGraph() {
        return inheritanceGraph;
    }

    private int callNode(String name) {
        checkNotBuilt();
        return callNodes.computeIfAbsent(requireName(name), n -> callGraph.addNode(CallNode.named(n)));
    }

    private int dependencyNode(String name) {
        checkNotBuilt();
        return dependencyNodes.computeIfAbsent(requireName(name), n -> dependencyGraph.addNode(ModuleNode.named(n)));
    }

    private int inheritanceNode(String name) {
        checkNotBuilt();
        return inheritanceNodes.computeIfAbsent(requireName(name), n -> inheritanceGraph.addNode(ClassNode.named(n)));
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Node name must not be blank");
        }
        return name;
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("GraphBuilder already built");
        }
    }

    /**
     * Depth = longest child → parent chain. Edges closing an inheritance
     * cycle are ignored so every class gets a finite depth.
     */
    private void assignHierarchyDepths() {
        int n = inheritanceGraph.nodeCount();
        int[] depth = new int[n];
        Arrays.fill(depth, -1);
        boolean[] inProgress = new boolean[n];

        for (int root = 0; root < n; root++) {
            if (depth[root] >= 0) {
                continue;
            }
            Deque<int[]> stack = new ArrayDeque<>();
            stack.push(new int[]{root, 0});
            inProgress[root] = true;

            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                int node = frame[0];
                List<GraphEdge> parents = inheritanceGraph.edgesFrom(node);

                if (frame[1] < parents.size()) {
                    int parent = parents.get(frame[1]++).target();
                    if (depth[parent] < 0 && !inProgress[parent]) {
                        inProgress[parent] = true;
                        stack.push(new int[]{parent, 0});
                    }
                    continue;
                }

                stack.pop();
                int d = 0;
                for (GraphEdge edge : parents) {
                    if (depth[edge.target()] >= 0) {
                        d = Math.max(d, depth[edge.target()] + 1);
                    }
                }
                depth[node] = d;
                inProgress[node] = false;
            }
        }

        for (int i = 0; i < n; i++) {
            ClassNode node = inheritanceGraph.node(i);
            if (node.hierarchyDepth() != depth[i]) {
                inheritanceGraph.replaceNode(i, node.withHierarchyDepth(depth[i]));
            }
        }
    }
}
