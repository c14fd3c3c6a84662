package io.xfgslicer.graph;

import io.xfgslicer.classify.Classification;
import io.xfgslicer.classify.KeyLineClassifier;
import io.xfgslicer.classify.LineResolver;
import io.xfgslicer.model.DependenceEdge;
import io.xfgslicer.model.DependenceKind;
import io.xfgslicer.model.EdgeRecord;
import io.xfgslicer.model.NodeRecord;
import io.xfgslicer.table.TableLoader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the line-level program dependence graph of a source file from its node and edge
 * tables, and classifies its key lines from the same node table.
 * <p>
 * Edges of type {@code CONTROLS} become control dependences and {@code REACHES} data
 * dependences; all other edge types are skipped. An edge is kept only when both of its
 * nodes carry a location of their own.
 */
public class PdgConstructor {

    public static final String NODES_TABLE = "nodes.csv";
    public static final String EDGES_TABLE = "edges.csv";

    private final KeyLineClassifier classifier;

    public PdgConstructor(KeyLineClassifier classifier) {
        this.classifier = classifier;
    }

    /**
     * Builds the graph from the tables in {@code tableDir}.
     *
     * @param tableDir   Directory holding {@value #NODES_TABLE} and {@value #EDGES_TABLE}
     * @param sourceFile Source file the tables describe, recorded on the graph
     * @return The graph, or a no-graph result if either table is missing or there are no nodes
     * @throws IOException If a table exists but cannot be read
     */
    public PdgResult build(Path tableDir, String sourceFile) throws IOException {
        Path nodesPath = tableDir.resolve(NODES_TABLE);
        Path edgesPath = tableDir.resolve(EDGES_TABLE);
        if (!Files.exists(nodesPath) || !Files.exists(edgesPath)) {
            return PdgResult.noGraph(NoGraphReason.TABLES_ABSENT);
        }

        List<NodeRecord> nodes = TableLoader.load(nodesPath).stream()
                .map(NodeRecord::fromRow)
                .toList();
        List<EdgeRecord> edges = TableLoader.load(edgesPath).stream()
                .map(EdgeRecord::fromRow)
                .toList();
        return build(nodes, edges, sourceFile);
    }

    /**
     * Builds the graph from already loaded tables.
     */
    public PdgResult build(List<NodeRecord> nodes, List<EdgeRecord> edges, String sourceFile) {
        if (nodes.isEmpty()) {
            return PdgResult.noGraph(NoGraphReason.NO_NODES);
        }

        Classification classification = classifier.classify(nodes);
        Map<String, Integer> nodeIdToLine = LineResolver.nodeIdToLine(nodes);

        List<DependenceEdge> controlEdges = new ArrayList<>();
        List<DependenceEdge> dataEdges = new ArrayList<>();
        int unresolved = 0;
        int ignored = 0;

        for (EdgeRecord edge : edges) {
            DependenceKind kind = DependenceKind.forEdgeType(edge.type());
            if (kind == null) {
                ignored++;
                continue;
            }
            Integer startLine = nodeIdToLine.get(edge.start());
            Integer endLine = nodeIdToLine.get(edge.end());
            if (startLine == null || endLine == null) {
                unresolved++;
                continue;
            }
            DependenceEdge lineEdge = new DependenceEdge(startLine, endLine, kind);
            if (kind == DependenceKind.CONTROL) {
                controlEdges.add(lineEdge);
            } else {
                dataEdges.add(lineEdge);
            }
        }

        ProgramDependenceGraph.Builder builder = ProgramDependenceGraph.builder(sourceFile)
                .addVertices(nodeIdToLine.values());
        controlEdges.forEach(builder::addEdge);
        dataEdges.forEach(builder::addEdge);

        return PdgResult.of(builder.build(), classification, unresolved, ignored);
    }
}
