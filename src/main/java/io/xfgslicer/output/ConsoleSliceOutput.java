package io.xfgslicer.output;

import io.xfgslicer.classify.Classification;
import io.xfgslicer.classify.DropReason;
import io.xfgslicer.graph.PdgResult;
import io.xfgslicer.graph.ProgramDependenceGraph;
import io.xfgslicer.model.CodeSlice;
import io.xfgslicer.model.DependenceEdge;
import io.xfgslicer.model.DependenceKind;
import io.xfgslicer.model.FileSlices;
import io.xfgslicer.model.KeyLineCategory;

import java.io.PrintStream;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints the dependence graph and slices of a single file for inspection.
 */
public class ConsoleSliceOutput {
    private final PrintStream out;
    private final boolean useColor;

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String CYAN = "\u001B[36m";
    private static final String GREEN = "\u001B[32m";
    private static final String YELLOW = "\u001B[33m";
    private static final String RED = "\u001B[31m";
    private static final String DIM = "\u001B[2m";

    public ConsoleSliceOutput(PrintStream out, boolean useColor) {
        this.out = out;
        this.useColor = useColor;
    }

    /**
     * Print graph statistics and key lines.
     */
    public void printSummary(PdgResult result) {
        out.println("=== DEPENDENCE GRAPH ===");
        if (!result.hasGraph()) {
            out.println("No graph: " + result.noGraphReason());
            out.println();
            return;
        }
        ProgramDependenceGraph graph = result.graph();
        out.println("Source file: " + graph.sourceFile());
        out.println("Lines: " + graph.vertexCount());
        out.println("Control edges: " + graph.edgeCount(DependenceKind.CONTROL));
        out.println("Data edges: " + graph.edgeCount(DependenceKind.DATA));
        out.println("Edges without line: " + result.unresolvedEdges());
        out.println("Edges of other types: " + result.ignoredEdges());
        out.println();

        Classification classification = result.classificationOrEmpty();
        out.println("=== KEY LINES ===");
        for (KeyLineCategory category : KeyLineCategory.values()) {
            String lines = classification.keyLines().lines(category).stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(", "));
            out.println(color(CYAN, category.wireName()) + ": " + (lines.isEmpty() ? color(DIM, "(none)") : lines));
        }
        if (!classification.dropped().isEmpty()) {
            out.println(color(DIM, "Dropped candidates: "
                    + classification.droppedFor(DropReason.NO_LOCATION) + " without location, "
                    + classification.droppedFor(DropReason.MALFORMED_LOCATION) + " with malformed location, "
                    + classification.droppedFor(DropReason.CALLEE_MISSING) + " calls without callee"));
        }
        out.println();
    }

    /**
     * Print every slice, grouped by category.
     */
    public void printSlices(FileSlices slices) {
        out.println("=== SLICES ===");
        for (KeyLineCategory category : KeyLineCategory.values()) {
            List<CodeSlice> categorySlices = slices.slices(category);
            out.println(color(CYAN, category.wireName()) + color(DIM, " (" + categorySlices.size() + ")") + ":");
            for (CodeSlice slice : categorySlices) {
                printSlice(slice);
            }
        }
        out.println();
        out.println("Total slices: " + slices.totalSlices());
    }

    private void printSlice(CodeSlice slice) {
        String label = "";
        if (slice.isLabeled()) {
            label = slice.label() == 1 ? " " + color(RED, "[vulnerable]") : " " + color(DIM, "[clean]");
        }
        out.println("  " + color(GREEN, "line " + slice.keyLine()) + label + ": "
                + slice.nodes().stream().map(String::valueOf).collect(Collectors.joining(", ", "{", "}")));
        for (DependenceEdge edge : slice.edges()) {
            String kind = edge.kind() == DependenceKind.CONTROL ? color(YELLOW, "control") : color(CYAN, "data");
            out.println("    " + edge.from() + " -> " + edge.to() + " " + kind);
        }
    }

    private String color(String code, String text) {
        return useColor ? code + text + RESET : text;
    }
}
