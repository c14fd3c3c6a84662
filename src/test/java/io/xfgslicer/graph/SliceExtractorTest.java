package io.xfgslicer.graph;

import io.xfgslicer.classify.KeyLineClassifier;
import io.xfgslicer.classify.SensitiveApiList;
import io.xfgslicer.model.CodeSlice;
import io.xfgslicer.model.DependenceEdge;
import io.xfgslicer.model.DependenceKind;
import io.xfgslicer.model.EdgeRecord;
import io.xfgslicer.model.FileSlices;
import io.xfgslicer.model.KeyLineCategory;
import io.xfgslicer.model.KeyLineSet;
import io.xfgslicer.model.NodeRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.xfgslicer.model.DependenceKind.CONTROL;
import static io.xfgslicer.model.DependenceKind.DATA;
import static org.assertj.core.api.Assertions.assertThat;

class SliceExtractorTest {

    private SliceExtractor extractor;

    /**
     * 1 -c-> 2 -d-> 3 -d-> 4, 5 -d-> 3, 6 -c-> 7, plus isolated 9.
     */
    private ProgramDependenceGraph graph;

    @BeforeEach
    void setUp() {
        extractor = new SliceExtractor();
        graph = ProgramDependenceGraph.builder("f.c")
                .addEdge(1, 2, CONTROL)
                .addEdge(2, 3, DATA)
                .addEdge(3, 4, DATA)
                .addEdge(5, 3, DATA)
                .addEdge(6, 7, CONTROL)
                .addVertex(9)
                .build();
    }

    @Test
    void slice_unionsBackwardAndForwardReachability() {
        CodeSlice slice = extractor.slice(graph, 3, KeyLineCategory.ARRAY);

        assertThat(slice.nodes()).containsExactly(1, 2, 3, 4, 5);
        assertThat(slice.edges()).containsExactly(
                new DependenceEdge(1, 2, CONTROL),
                new DependenceEdge(2, 3, DATA),
                new DependenceEdge(3, 4, DATA),
                new DependenceEdge(5, 3, DATA));
        assertThat(slice.keyLine()).isEqualTo(3);
        assertThat(slice.category()).isEqualTo(KeyLineCategory.ARRAY);
        assertThat(slice.sourceFile()).isEqualTo("f.c");
    }

    @Test
    void slice_doesNotFollowMixedDirections() {
        // 1 and 2 are ancestors of 3 but not of 5; reaching them would take a backward step after a forward one
        CodeSlice slice = extractor.slice(graph, 4, KeyLineCategory.ARITH);

        assertThat(slice.nodes()).containsExactly(1, 2, 3, 4, 5);

        CodeSlice fromFive = extractor.slice(graph, 5, KeyLineCategory.ARITH);
        assertThat(fromFive.nodes()).containsExactly(3, 4, 5);
        assertThat(fromFive.edges()).containsExactly(
                new DependenceEdge(3, 4, DATA),
                new DependenceEdge(5, 3, DATA));
    }

    @Test
    void slice_ofIsolatedLineIsThatLineAlone() {
        CodeSlice slice = extractor.slice(graph, 9, KeyLineCategory.PTR);

        assertThat(slice.nodes()).containsExactly(9);
        assertThat(slice.edges()).isEmpty();
    }

    @Test
    void slice_ofLineOutsideGraphStillContainsKeyLine() {
        CodeSlice slice = extractor.slice(graph, 42, KeyLineCategory.CALL);

        assertThat(slice.nodes()).containsExactly(42);
        assertThat(slice.edges()).isEmpty();
    }

    @Test
    void slice_keepsInducedEdgesNotOnTraversalPath() {
        // 3 -> 2 and the self-loop on 3 are kept although no traversal uses them
        ProgramDependenceGraph cyclic = ProgramDependenceGraph.builder("g.c")
                .addEdge(1, 2, DATA)
                .addEdge(2, 3, DATA)
                .addEdge(3, 2, CONTROL)
                .addEdge(3, 3, DATA)
                .build();

        CodeSlice slice = extractor.slice(cyclic, 1, KeyLineCategory.CALL);

        assertThat(slice.nodes()).containsExactly(1, 2, 3);
        assertThat(slice.edges()).hasSize(4);
        assertThat(slice.edgeCount(CONTROL)).isEqualTo(1);
    }

    @Test
    void backwardAndForward_visitEachLineOnceInBfsOrder() {
        assertThat(extractor.backward(graph, 4)).containsExactly(4, 3, 2, 5, 1);
        assertThat(extractor.forward(graph, 1)).containsExactly(1, 2, 3, 4);
    }

    @Test
    void extract_producesOneSlicePerCategoryAndLine() {
        KeyLineSet keyLines = KeyLineSet.builder()
                .add(KeyLineCategory.CALL, 3)
                .add(KeyLineCategory.ARITH, 3)
                .add(KeyLineCategory.ARITH, 7)
                .build();

        FileSlices slices = extractor.extract(graph, keyLines);

        assertThat(slices.totalSlices()).isEqualTo(3);
        assertThat(slices.slices(KeyLineCategory.ARRAY)).isEmpty();
        assertThat(slices.slices(KeyLineCategory.PTR)).isEmpty();
        assertThat(slices.slices(KeyLineCategory.ARITH))
                .extracting(CodeSlice::keyLine)
                .containsExactly(3, 7);

        CodeSlice call = slices.slices(KeyLineCategory.CALL).get(0);
        CodeSlice arith = slices.slices(KeyLineCategory.ARITH).get(0);
        assertThat(call.nodes()).isEqualTo(arith.nodes());
        assertThat(call.category()).isNotEqualTo(arith.category());
        assertThat(slices.slices(KeyLineCategory.ARITH).get(1).nodes()).containsExactly(6, 7);
    }

    @Test
    void extract_withoutGraphYieldsEmptySlices() {
        FileSlices slices = extractor.extract(PdgResult.noGraph(NoGraphReason.TABLES_ABSENT), "missing.c");

        assertThat(slices).isNotNull();
        assertThat(slices.isEmpty()).isTrue();
        assertThat(slices.sourceFile()).isEqualTo("missing.c");
        assertThat(slices.byCategory()).containsOnlyKeys(KeyLineCategory.values());
    }

    @Test
    void everySlice_containsKeyLineAndIsClosedAndFaithful() {
        ProgramDependenceGraph dense = ProgramDependenceGraph.builder("h.c")
                .addEdge(1, 3, CONTROL).addEdge(1, 4, CONTROL).addEdge(3, 5, DATA)
                .addEdge(4, 5, DATA).addEdge(5, 6, DATA).addEdge(7, 6, DATA)
                .addEdge(8, 7, CONTROL).addEdge(6, 1, DATA).addEdge(10, 11, DATA)
                .addEdge(5, 5, DATA).addVertex(12)
                .build();

        for (int line : dense.vertices()) {
            CodeSlice slice = extractor.slice(dense, line, KeyLineCategory.ARITH);

            assertThat(slice.nodes()).contains(line);

            // Every edge has both ends inside the slice
            for (DependenceEdge edge : slice.edges()) {
                assertThat(slice.nodes()).contains(edge.from(), edge.to());
            }

            // Every graph edge between slice lines is in the slice
            for (DependenceEdge edge : dense.edges()) {
                if (slice.nodes().contains(edge.from()) && slice.nodes().contains(edge.to())) {
                    assertThat(slice.edges()).contains(edge);
                }
            }

            // Re-slicing inside the slice's own edges gives the same lines
            ProgramDependenceGraph.Builder own = ProgramDependenceGraph.builder("h.c");
            slice.nodes().forEach(own::addVertex);
            slice.edges().forEach(own::addEdge);
            CodeSlice again = extractor.slice(own.build(), line, KeyLineCategory.ARITH);
            assertThat(again.nodes()).isEqualTo(slice.nodes());
        }
    }

    @Test
    void endToEnd_sensitiveCallWithDataEdge() {
        PdgConstructor constructor = new PdgConstructor(
                new KeyLineClassifier(SensitiveApiList.parse("strcpy")));
        List<NodeRecord> nodes = List.of(
                new NodeRecord("CallExpression", "strcpy(dst, src)", "10:5", "", "0"),
                new NodeRecord("Callee", "strcpy", "", "", "1"),
                new NodeRecord("ExpressionStatement", "puts(dst)", "12:1", "", "2"));
        List<EdgeRecord> edges = List.of(new EdgeRecord("0", "2", "REACHES"));

        PdgResult result = constructor.build(nodes, edges, "e2e.c");
        FileSlices slices = extractor.extract(result, "e2e.c");

        assertThat(result.keyLines().lines(KeyLineCategory.CALL)).containsExactly(10);
        assertThat(result.graph().edges()).containsExactly(new DependenceEdge(10, 12, DependenceKind.DATA));
        assertThat(slices.slices(KeyLineCategory.CALL)).hasSize(1);
        CodeSlice slice = slices.slices(KeyLineCategory.CALL).get(0);
        assertThat(slice.nodes()).containsExactly(10, 12);
        assertThat(slice.edges()).containsExactly(new DependenceEdge(10, 12, DependenceKind.DATA));
    }
}
