package io.xfgslicer.graph;

import io.xfgslicer.classify.Classification;
import io.xfgslicer.model.KeyLineSet;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of building the dependence graph of one file: either the graph together with
 * the file's key lines, or the reason there is no graph.
 *
 * @param graph            The graph, null when {@code noGraphReason} is set
 * @param classification   Key lines and dropped candidates, null when there is no graph
 * @param noGraphReason    Why nothing was built, null when a graph exists
 * @param unresolvedEdges  Dependence edges dropped because an endpoint has no line
 * @param ignoredEdges     Edges whose type carries no dependence (AST, CFG, ...)
 */
public record PdgResult(
        ProgramDependenceGraph graph,
        Classification classification,
        NoGraphReason noGraphReason,
        int unresolvedEdges,
        int ignoredEdges
) {
    public PdgResult {
        if ((graph == null) == (noGraphReason == null)) {
            throw new IllegalArgumentException("exactly one of graph and noGraphReason must be set");
        }
    }

    public static PdgResult of(ProgramDependenceGraph graph, Classification classification,
                               int unresolvedEdges, int ignoredEdges) {
        return new PdgResult(graph, classification, null, unresolvedEdges, ignoredEdges);
    }

    public static PdgResult noGraph(NoGraphReason reason) {
        return new PdgResult(null, null, reason, 0, 0);
    }

    public boolean hasGraph() {
        return graph != null;
    }

    public Optional<ProgramDependenceGraph> graphIfPresent() {
        return Optional.ofNullable(graph);
    }

    /**
     * Key lines of the file; empty when there is no graph.
     */
    public KeyLineSet keyLines() {
        return classification != null ? classification.keyLines() : KeyLineSet.empty();
    }

    public Classification classificationOrEmpty() {
        return classification != null ? classification : new Classification(KeyLineSet.empty(), List.of());
    }
}
