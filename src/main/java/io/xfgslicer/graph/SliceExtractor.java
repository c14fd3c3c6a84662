package io.xfgslicer.graph;

import io.xfgslicer.model.CodeSlice;
import io.xfgslicer.model.FileSlices;
import io.xfgslicer.model.KeyLineCategory;
import io.xfgslicer.model.KeyLineSet;

import java.util.*;
import java.util.function.IntFunction;

/**
 * Extracts one slice per key line: every line reachable from the key line by following
 * dependence edges backward, plus every line reachable forward, together with the edges
 * among them.
 */
public class SliceExtractor {

    /**
     * Extracts all slices of a file. A file without a graph yields an empty collection.
     */
    public FileSlices extract(PdgResult result, String sourceFile) {
        if (!result.hasGraph()) {
            return FileSlices.empty(sourceFile);
        }
        return extract(result.graph(), result.keyLines());
    }

    /**
     * Extracts slices for every category and key line. Categories are visited in
     * declaration order and lines in ascending order. A line listed under two categories
     * gives two slices.
     */
    public FileSlices extract(ProgramDependenceGraph graph, KeyLineSet keyLines) {
        Map<KeyLineCategory, List<CodeSlice>> slices = new EnumMap<>(KeyLineCategory.class);
        for (KeyLineCategory category : KeyLineCategory.values()) {
            List<CodeSlice> categorySlices = new ArrayList<>();
            for (int keyLine : keyLines.lines(category)) {
                categorySlices.add(slice(graph, keyLine, category));
            }
            slices.put(category, categorySlices);
        }
        return new FileSlices(graph.sourceFile(), slices);
    }

    /**
     * Builds the slice seeded at a single key line.
     */
    public CodeSlice slice(ProgramDependenceGraph graph, int keyLine, KeyLineCategory category) {
        Set<Integer> lines = new LinkedHashSet<>(backward(graph, keyLine));
        lines.addAll(forward(graph, keyLine));
        return new CodeSlice(graph.sourceFile(), category, keyLine,
                new TreeSet<>(lines), graph.edgesWithin(lines));
    }

    /**
     * Lines the key line transitively depends on, including itself, in BFS order.
     */
    public Set<Integer> backward(ProgramDependenceGraph graph, int keyLine) {
        return breadthFirst(keyLine, graph::predecessors);
    }

    /**
     * Lines transitively depending on the key line, including itself, in BFS order.
     */
    public Set<Integer> forward(ProgramDependenceGraph graph, int keyLine) {
        return breadthFirst(keyLine, graph::successors);
    }

    private Set<Integer> breadthFirst(int start, IntFunction<Set<Integer>> neighbours) {
        Set<Integer> visited = new LinkedHashSet<>();
        Queue<Integer> workQueue = new ArrayDeque<>();
        visited.add(start);
        workQueue.add(start);

        while (!workQueue.isEmpty()) {
            int current = workQueue.poll();
            for (int next : neighbours.apply(current)) {
                if (visited.add(next)) {
                    workQueue.add(next);
                }
            }
        }
        return visited;
    }
}
