package io.xfgslicer.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.xfgslicer.batch.BatchSummary;
import io.xfgslicer.model.CodeSlice;
import io.xfgslicer.model.DependenceEdge;
import io.xfgslicer.model.FileSlices;
import io.xfgslicer.model.KeyLineCategory;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes each slice as a JSON document at
 * {@code <outputRoot>/<relativePath>/<category>/<keyLine>.xfg.json}.
 */
public class JsonSliceWriter implements SliceWriter {

    public static final String SLICE_SUFFIX = ".xfg.json";
    public static final String SUMMARY_FILE = "summary.json";

    private final Path outputRoot;
    private final ObjectMapper mapper;

    public JsonSliceWriter(Path outputRoot) {
        this(outputRoot, false);
    }

    public JsonSliceWriter(Path outputRoot, boolean prettyPrint) {
        this.outputRoot = outputRoot;
        this.mapper = createMapper(prettyPrint);
    }

    private static ObjectMapper createMapper(boolean prettyPrint) {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public int write(FileSlices slices, String relativePath) throws IOException {
        if (slices.isEmpty()) {
            return 0;
        }
        Path fileRoot = outputRoot.resolve(stripLeadingSeparators(relativePath));
        int written = 0;
        for (Map.Entry<KeyLineCategory, List<CodeSlice>> entry : slices.byCategory().entrySet()) {
            Path categoryDir = fileRoot.resolve(entry.getKey().wireName());
            Files.createDirectories(categoryDir);
            for (CodeSlice slice : entry.getValue()) {
                Path out = categoryDir.resolve(slice.keyLine() + SLICE_SUFFIX);
                try (Writer writer = Files.newBufferedWriter(out)) {
                    write(slice, writer);
                }
                written++;
            }
        }
        return written;
    }

    /**
     * Serializes one slice.
     */
    public void write(CodeSlice slice, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonSlice(slice));
    }

    /**
     * Reads back a slice document written by this writer.
     */
    public JsonSlice read(Path path) throws IOException {
        return mapper.readValue(path.toFile(), JsonSlice.class);
    }

    /**
     * Writes the run summary to {@value #SUMMARY_FILE} under the output root.
     */
    public Path writeSummary(BatchSummary summary) throws IOException {
        Files.createDirectories(outputRoot);
        Path out = outputRoot.resolve(SUMMARY_FILE);
        Map<String, Integer> perCategory = new TreeMap<>();
        summary.slicesByCategory().forEach((category, count) -> perCategory.put(category.wireName(), count));
        JsonSummary json = new JsonSummary(
                summary.startedAt(),
                summary.duration().toMillis(),
                summary.filesDiscovered(),
                summary.filesSliced(),
                summary.filesSkipped(),
                summary.filesFailed(),
                summary.totalSlices(),
                perCategory
        );
        try (Writer writer = Files.newBufferedWriter(out)) {
            mapper.writeValue(writer, json);
        }
        return out;
    }

    private JsonSlice toJsonSlice(CodeSlice slice) {
        return new JsonSlice(
                slice.sourceFile(),
                slice.category().wireName(),
                slice.keyLine(),
                slice.label(),
                List.copyOf(slice.nodes()),
                slice.edges().stream().map(this::toJsonEdge).toList()
        );
    }

    private JsonSlice.Edge toJsonEdge(DependenceEdge edge) {
        return new JsonSlice.Edge(edge.from(), edge.to(), edge.kind().tag());
    }

    private static String stripLeadingSeparators(String path) {
        String p = path.replace('\\', '/');
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        return p;
    }

    /**
     * JSON structure of one slice.
     */
    public record JsonSlice(
            String file,
            String category,
            int keyLine,
            Integer label,
            List<Integer> nodes,
            List<Edge> edges
    ) {
        public record Edge(int from, int to, String kind) {}
    }

    /**
     * JSON structure of the run summary.
     */
    public record JsonSummary(
            Instant startedAt,
            long durationMs,
            int filesDiscovered,
            int filesSliced,
            int filesSkipped,
            int filesFailed,
            int totalSlices,
            Map<String, Integer> slicesByCategory
    ) {}
}
