package io.xfgslicer.graph;

import io.xfgslicer.model.DependenceEdge;
import io.xfgslicer.model.DependenceKind;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Line-level program dependence graph of one source file.
 * <p>
 * Vertices are source line numbers. Edges are control or data dependences between lines;
 * the same pair of lines may be joined by both a control and a data edge, and self-loops
 * are kept. Immutable once built.
 */
public class ProgramDependenceGraph {

    private final String sourceFile;
    private final SortedSet<Integer> vertices;
    private final List<DependenceEdge> edges;

    // Derived indexes for traversal
    private final Map<Integer, Set<Integer>> successors;   // line -> lines it points to
    private final Map<Integer, Set<Integer>> predecessors; // line -> lines pointing to it

    private ProgramDependenceGraph(String sourceFile, SortedSet<Integer> vertices, Collection<DependenceEdge> edges) {
        this.sourceFile = sourceFile;
        this.vertices = Collections.unmodifiableSortedSet(new TreeSet<>(vertices));
        this.edges = List.copyOf(edges);

        Map<Integer, Set<Integer>> succ = new HashMap<>();
        Map<Integer, Set<Integer>> pred = new HashMap<>();
        for (DependenceEdge edge : this.edges) {
            succ.computeIfAbsent(edge.from(), k -> new LinkedHashSet<>()).add(edge.to());
            pred.computeIfAbsent(edge.to(), k -> new LinkedHashSet<>()).add(edge.from());
        }
        this.successors = freeze(succ);
        this.predecessors = freeze(pred);
    }

    private static Map<Integer, Set<Integer>> freeze(Map<Integer, Set<Integer>> map) {
        Map<Integer, Set<Integer>> frozen = new HashMap<>();
        map.forEach((line, set) -> frozen.put(line, Collections.unmodifiableSet(set)));
        return Collections.unmodifiableMap(frozen);
    }

    public static Builder builder(String sourceFile) {
        return new Builder(sourceFile);
    }

    /**
     * Source file this graph was built for.
     */
    public String sourceFile() {
        return sourceFile;
    }

    /**
     * All lines of the graph, ascending. Includes lines without any edge.
     */
    public SortedSet<Integer> vertices() {
        return vertices;
    }

    /**
     * All edges in the order they were added.
     */
    public List<DependenceEdge> edges() {
        return edges;
    }

    /**
     * Lines directly depending on the given line (edge targets).
     */
    public Set<Integer> successors(int line) {
        return successors.getOrDefault(line, Set.of());
    }

    /**
     * Lines the given line directly depends on (edge sources).
     */
    public Set<Integer> predecessors(int line) {
        return predecessors.getOrDefault(line, Set.of());
    }

    public int vertexCount() {
        return vertices.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public long edgeCount(DependenceKind kind) {
        return edges.stream().filter(e -> e.kind() == kind).count();
    }

    /**
     * Edges whose endpoints are both in the given line set, in graph order.
     */
    public List<DependenceEdge> edgesWithin(Set<Integer> lines) {
        return edges.stream()
                .filter(e -> lines.contains(e.from()) && lines.contains(e.to()))
                .toList();
    }

    @Override
    public String toString() {
        return "ProgramDependenceGraph{" + sourceFile + ", " + vertexCount() + " lines, "
                + edges.stream().map(DependenceEdge::formatted).collect(Collectors.joining(", ", "[", "]")) + "}";
    }

    /**
     * Builder for ProgramDependenceGraph. Adding the same edge twice keeps one copy.
     */
    public static class Builder {
        private final String sourceFile;
        private final SortedSet<Integer> vertices = new TreeSet<>();
        private final Set<DependenceEdge> edges = new LinkedHashSet<>();

        private Builder(String sourceFile) {
            this.sourceFile = sourceFile;
        }

        public Builder addVertex(int line) {
            vertices.add(line);
            return this;
        }

        public Builder addVertices(Collection<Integer> lines) {
            vertices.addAll(lines);
            return this;
        }

        public Builder addEdge(int from, int to, DependenceKind kind) {
            vertices.add(from);
            vertices.add(to);
            edges.add(new DependenceEdge(from, to, kind));
            return this;
        }

        public Builder addEdge(DependenceEdge edge) {
            return addEdge(edge.from(), edge.to(), edge.kind());
        }

        public ProgramDependenceGraph build() {
            return new ProgramDependenceGraph(sourceFile, vertices, edges);
        }
    }
}
