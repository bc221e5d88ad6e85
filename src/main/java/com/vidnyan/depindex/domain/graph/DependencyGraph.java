package com.vidnyan.depindex.domain.graph;

import com.vidnyan.depindex.domain.error.NoPathException;
import com.vidnyan.depindex.domain.error.NodeNotFoundException;
import com.vidnyan.depindex.domain.model.DependencyRecord;
import com.vidnyan.depindex.domain.model.ModulePaths;

import java.util.*;

/**
 * File/module level dependency graph built from fact records.
 * Used for reachability, circular dependency detection and path queries.
 * Immutable and thread-safe once built.
 */
public final class DependencyGraph {

    private final Map<String, GraphNode> nodes;                 // sorted by id
    private final Map<String, SortedSet<String>> successors;    // node → nodes it depends on
    private final Map<String, SortedSet<String>> predecessors;  // node → nodes that depend on it
    private final Map<String, GraphEdge> edges;
    private final ModulePaths paths;

    private DependencyGraph(
            Map<String, GraphNode> nodes,
            Map<String, SortedSet<String>> successors,
            Map<String, SortedSet<String>> predecessors,
            Map<String, GraphEdge> edges,
            ModulePaths paths
    ) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.successors = Collections.unmodifiableMap(successors);
        this.predecessors = Collections.unmodifiableMap(predecessors);
        this.edges = Collections.unmodifiableMap(edges);
        this.paths = paths;
    }

    /**
     * Build options.
     */
    public record BuildOptions(boolean includeCallEdges) {
        public static BuildOptions defaults() {
            return new BuildOptions(false);
        }
    }

    public static DependencyGraph build(Collection<DependencyRecord> records) {
        return build(records, BuildOptions.defaults(), ModulePaths.defaults());
    }

    /**
     * Build dependency graph from fact records.
     * An import of a module that is itself an analyzed file points at that file's node.
     */
    public static DependencyGraph build(Collection<DependencyRecord> records, BuildOptions options, ModulePaths paths) {
        Map<String, GraphNode> nodes = new TreeMap<>();
        Map<String, SortedSet<String>> succ = new HashMap<>();
        Map<String, SortedSet<String>> pred = new HashMap<>();
        Map<String, GraphEdge> edges = new LinkedHashMap<>();

        // Module name → file node, so local imports link file to file
        Map<String, String> fileByModule = new HashMap<>();
        for (DependencyRecord record : records) {
            String file = paths.normalize(record.filePath());
            nodes.put(file, new GraphNode(file, GraphNode.Kind.FILE));
            fileByModule.putIfAbsent(paths.moduleName(file), file);
        }

        for (DependencyRecord record : records) {
            String source = paths.normalize(record.filePath());

            for (String module : record.importedModules()) {
                String target = fileByModule.getOrDefault(module, module);
                addEdge(nodes, succ, pred, edges, source, target, GraphEdge.Kind.IMPORTS);
            }

            if (options.includeCallEdges()) {
                for (String prefix : record.callPrefixes()) {
                    String target = fileByModule.getOrDefault(prefix, prefix);
                    addEdge(nodes, succ, pred, edges, source, target, GraphEdge.Kind.CALLS);
                }
            }
        }

        return new DependencyGraph(nodes, succ, pred, edges, paths);
    }

    private static void addEdge(
            Map<String, GraphNode> nodes,
            Map<String, SortedSet<String>> succ,
            Map<String, SortedSet<String>> pred,
            Map<String, GraphEdge> edges,
            String source, String target, GraphEdge.Kind kind
    ) {
        nodes.putIfAbsent(target, new GraphNode(target, GraphNode.Kind.MODULE));
        // first edge between a pair wins, later ones are no-ops
        edges.putIfAbsent(source + '\u0000' + target, new GraphEdge(source, target, kind));
        succ.computeIfAbsent(source, k -> new TreeSet<>()).add(target);
        pred.computeIfAbsent(target, k -> new TreeSet<>()).add(source);
    }

    /**
     * Map a user supplied file or module name onto a node id.
     */
    public Optional<String> resolve(String query) {
        if (query == null || query.isBlank()) {
            return Optional.empty();
        }
        if (nodes.containsKey(query)) {
            return Optional.of(query);
        }
        String normalized = paths.normalize(query);
        if (nodes.containsKey(normalized)) {
            return Optional.of(normalized);
        }
        String module = paths.moduleName(query);
        if (nodes.containsKey(module)) {
            return Optional.of(module);
        }
        return Optional.empty();
    }

    public boolean contains(String query) {
        return resolve(query).isPresent();
    }

    private String require(String query) {
        return resolve(query).orElseThrow(() -> new NodeNotFoundException(query));
    }

    public Optional<GraphNode> node(String query) {
        return resolve(query).map(nodes::get);
    }

    /**
     * Nodes this node depends on.
     */
    public Set<String> successors(String node) {
        return successors.getOrDefault(node, Collections.emptySortedSet());
    }

    /**
     * Nodes that depend on this node.
     */
    public Set<String> predecessors(String node) {
        return predecessors.getOrDefault(node, Collections.emptySortedSet());
    }

    public Collection<GraphNode> nodes() {
        return nodes.values();
    }

    public Collection<GraphEdge> edges() {
        return edges.values();
    }

    /**
     * Nodes reachable from {@code start} within {@code maxDepth} hops, start excluded.
     * Ordered by hop distance, then lexicographically. Terminates on cyclic graphs since
     * every node is visited once.
     *
     * @throws NodeNotFoundException if {@code maxDepth > 0} and start is not in the graph
     */
    public List<String> transitiveClosure(String start, int maxDepth) {
        if (maxDepth <= 0) {
            return List.of();
        }
        String origin = require(start);

        List<String> reached = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(origin);
        List<String> frontier = List.of(origin);

        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            SortedSet<String> next = new TreeSet<>();
            for (String node : frontier) {
                for (String dep : successors(node)) {
                    if (!visited.contains(dep)) {
                        next.add(dep);
                    }
                }
            }
            visited.addAll(next);
            reached.addAll(next);
            frontier = new ArrayList<>(next);
        }
        return reached;
    }

    /**
     * Shortest dependency path by hop count, both endpoints included.
     *
     * @throws NodeNotFoundException if either endpoint is not in the graph
     * @throws NoPathException if target is unreachable from source
     */
    public List<String> shortestPath(String source, String target) {
        String from = require(source);
        String to = require(target);
        if (from.equals(to)) {
            return List.of(from);
        }

        Map<String, String> parent = new HashMap<>();
        Queue<String> queue = new ArrayDeque<>();
        parent.put(from, from);
        queue.add(from);

        while (!queue.isEmpty()) {
            String node = queue.poll();
            for (String dep : successors(node)) {
                if (parent.containsKey(dep)) {
                    continue;
                }
                parent.put(dep, node);
                if (dep.equals(to)) {
                    return unwind(parent, from, to);
                }
                queue.add(dep);
            }
        }
        throw new NoPathException(source, target);
    }

    private static List<String> unwind(Map<String, String> parent, String from, String to) {
        LinkedList<String> path = new LinkedList<>();
        String current = to;
        while (!current.equals(from)) {
            path.addFirst(current);
            current = parent.get(current);
        }
        path.addFirst(from);
        return List.copyOf(path);
    }

    /**
     * Find all elementary cycles.
     */
    public List<List<String>> findCycles() {
        return findCycles(Integer.MAX_VALUE);
    }

    /**
     * Find elementary cycles, stopping after {@code maxCycles}.
     * Each cycle starts at its lexicographically smallest node and does not repeat it at the end.
     */
    public List<List<String>> findCycles(int maxCycles) {
        return new ElementaryCycleFinder(new ArrayList<>(nodes.keySet()), successors).find(maxCycles);
    }

    public boolean isAcyclic() {
        return findCycles(1).isEmpty();
    }

    /**
     * Get statistics.
     */
    public Stats stats() {
        int n = nodes.size();
        int e = edges.size();
        double density = n > 1 ? (double) e / ((double) n * (n - 1)) : 0.0;
        int files = (int) nodes.values().stream().filter(GraphNode::isFile).count();
        return new Stats(n, e, density, isAcyclic(), files, n - files, weaklyConnectedComponents());
    }

    private int weaklyConnectedComponents() {
        Set<String> seen = new HashSet<>();
        int components = 0;
        for (String root : nodes.keySet()) {
            if (!seen.add(root)) {
                continue;
            }
            components++;
            Deque<String> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                String node = stack.pop();
                for (String next : successors(node)) {
                    if (seen.add(next)) {
                        stack.push(next);
                    }
                }
                for (String next : predecessors(node)) {
                    if (seen.add(next)) {
                        stack.push(next);
                    }
                }
            }
        }
        return components;
    }

    public record Stats(
        int nodeCount,
        int edgeCount,
        double density,
        boolean acyclic,
        int fileCount,
        int moduleCount,
        int weaklyConnectedComponents
    ) {}
}
