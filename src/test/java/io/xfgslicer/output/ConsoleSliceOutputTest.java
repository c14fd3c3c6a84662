package io.xfgslicer.output;

import io.xfgslicer.classify.KeyLineClassifier;
import io.xfgslicer.classify.SensitiveApiList;
import io.xfgslicer.graph.NoGraphReason;
import io.xfgslicer.graph.PdgConstructor;
import io.xfgslicer.graph.PdgResult;
import io.xfgslicer.graph.SliceExtractor;
import io.xfgslicer.model.EdgeRecord;
import io.xfgslicer.model.FileSlices;
import io.xfgslicer.model.NodeRecord;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleSliceOutputTest {

    @Test
    void printsGraphKeyLinesAndSlicesWithoutColor() {
        PdgConstructor constructor = new PdgConstructor(new KeyLineClassifier(SensitiveApiList.parse("gets")));
        PdgResult result = constructor.build(
                List.of(new NodeRecord("CallExpression", "gets(buf)", "4:1", "", "1"),
                        new NodeRecord("Callee", "gets", "", "", "2"),
                        new NodeRecord("IfStatement", "if (buf[0])", "5:1", "", "3")),
                List.of(new EdgeRecord("1", "3", "REACHES")),
                "x.c");
        FileSlices slices = new SliceExtractor().extract(result, "x.c");

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ConsoleSliceOutput output = new ConsoleSliceOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8), false);
        output.printSummary(result);
        output.printSlices(slices);

        String text = buffer.toString(StandardCharsets.UTF_8);
        assertThat(text).contains("Data edges: 1")
                .contains("call: 4")
                .contains("line 4: {4, 5}")
                .contains("4 -> 5 data")
                .contains("Total slices: 1")
                .doesNotContain("\u001B[");
    }

    @Test
    void printsNoGraphReason() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new ConsoleSliceOutput(new PrintStream(buffer, true, StandardCharsets.UTF_8), true)
                .printSummary(PdgResult.noGraph(NoGraphReason.TABLES_ABSENT));

        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("No graph: TABLES_ABSENT");
    }
}
