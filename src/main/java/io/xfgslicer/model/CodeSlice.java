package io.xfgslicer.model;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One extracted slice (XFG): the part of a file's program dependence graph that is
 * reachable backward and forward from a key line.
 *
 * @param sourceFile Source file the slice was taken from
 * @param category   Category the key line was classified under
 * @param keyLine    Line the traversal was seeded from
 * @param nodes      Lines in the slice, ascending; always contains the key line
 * @param edges      Dependence edges between lines of the slice
 * @param label      1 if the slice touches a known vulnerable line, 0 if not, null when unlabeled
 */
public record CodeSlice(
        String sourceFile,
        KeyLineCategory category,
        int keyLine,
        SortedSet<Integer> nodes,
        List<DependenceEdge> edges,
        Integer label
) {
    public CodeSlice {
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        nodes = Collections.unmodifiableSortedSet(new TreeSet<>(nodes));
        edges = List.copyOf(edges);
        if (!nodes.contains(keyLine)) {
            throw new IllegalArgumentException("slice for line " + keyLine + " does not contain its key line");
        }
    }

    public CodeSlice(String sourceFile, KeyLineCategory category, int keyLine,
                     SortedSet<Integer> nodes, List<DependenceEdge> edges) {
        this(sourceFile, category, keyLine, nodes, edges, null);
    }

    /**
     * Returns a copy of this slice carrying the given label.
     */
    public CodeSlice withLabel(int label) {
        return new CodeSlice(sourceFile, category, keyLine, nodes, edges, label);
    }

    public boolean isLabeled() {
        return label != null;
    }

    public int edgeCount() {
        return edges.size();
    }

    public long edgeCount(DependenceKind kind) {
        return edges.stream().filter(e -> e.kind() == kind).count();
    }
}
