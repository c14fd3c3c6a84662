package io.xfgslicer.output;

import io.xfgslicer.batch.BatchSummary;
import io.xfgslicer.model.CodeSlice;
import io.xfgslicer.model.DependenceEdge;
import io.xfgslicer.model.FileSlices;
import io.xfgslicer.model.KeyLineCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static io.xfgslicer.model.DependenceKind.CONTROL;
import static io.xfgslicer.model.DependenceKind.DATA;
import static org.assertj.core.api.Assertions.assertThat;

class JsonSliceWriterTest {

    @TempDir
    Path tempDir;

    private static CodeSlice callSlice() {
        return new CodeSlice("/data/src/a.c", KeyLineCategory.CALL, 10,
                new TreeSet<>(List.of(12, 10, 8)),
                List.of(new DependenceEdge(8, 10, CONTROL), new DependenceEdge(10, 12, DATA)));
    }

    @Test
    void write_placesOneFilePerSliceUnderCategory() throws IOException {
        FileSlices slices = new FileSlices("/data/src/a.c", Map.of(
                KeyLineCategory.CALL, List.of(callSlice()),
                KeyLineCategory.ARITH, List.of(new CodeSlice("/data/src/a.c", KeyLineCategory.ARITH, 8,
                        new TreeSet<>(List.of(8)), List.of()))));
        JsonSliceWriter writer = new JsonSliceWriter(tempDir);

        int written = writer.write(slices, "/src/a.c");

        assertThat(written).isEqualTo(2);
        assertThat(tempDir.resolve("src/a.c/call/10.xfg.json")).exists();
        assertThat(tempDir.resolve("src/a.c/arith/8.xfg.json")).exists();
        assertThat(tempDir.resolve("src/a.c/array")).exists();
    }

    @Test
    void write_skipsFilesWithoutSlices() throws IOException {
        JsonSliceWriter writer = new JsonSliceWriter(tempDir);

        int written = writer.write(FileSlices.empty("b.c"), "b.c");

        assertThat(written).isZero();
        assertThat(tempDir.resolve("b.c")).doesNotExist();
    }

    @Test
    void write_serializesLinesEdgesAndOmitsMissingLabel() throws IOException {
        StringWriter out = new StringWriter();

        new JsonSliceWriter(tempDir).write(callSlice(), out);

        String json = out.toString();
        assertThat(json).contains("\"file\":\"/data/src/a.c\"")
                .contains("\"category\":\"call\"")
                .contains("\"keyLine\":10")
                .contains("\"nodes\":[8,10,12]")
                .contains("{\"from\":8,\"to\":10,\"kind\":\"c\"}")
                .contains("{\"from\":10,\"to\":12,\"kind\":\"d\"}")
                .doesNotContain("label");
    }

    @Test
    void read_returnsWhatWasWritten() throws IOException {
        JsonSliceWriter writer = new JsonSliceWriter(tempDir, true);
        CodeSlice labeled = callSlice().withLabel(1);
        writer.write(new FileSlices("a.c", Map.of(KeyLineCategory.CALL, List.of(labeled))), "a.c");

        JsonSliceWriter.JsonSlice read = writer.read(tempDir.resolve("a.c/call/10.xfg.json"));

        assertThat(read.label()).isEqualTo(1);
        assertThat(read.nodes()).containsExactly(8, 10, 12);
        assertThat(read.edges()).extracting(JsonSliceWriter.JsonSlice.Edge::kind).containsExactly("c", "d");
    }

    @Test
    void writeSummary_writesCountsPerCategory() throws IOException {
        BatchSummary summary = new BatchSummary(Instant.parse("2024-01-02T03:04:05Z"), Duration.ofMillis(1500),
                3, 2, 1, 0, Map.of(KeyLineCategory.CALL, 4, KeyLineCategory.PTR, 1), List.of());

        Path file = new JsonSliceWriter(tempDir.resolve("XFG")).writeSummary(summary);

        String json = Files.readString(file);
        assertThat(file.getFileName().toString()).isEqualTo(JsonSliceWriter.SUMMARY_FILE);
        assertThat(json).contains("\"startedAt\":\"2024-01-02T03:04:05Z\"")
                .contains("\"durationMs\":1500")
                .contains("\"totalSlices\":5")
                .contains("\"call\":4")
                .contains("\"array\":0");
    }
}
