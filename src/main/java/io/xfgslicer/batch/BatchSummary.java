package io.xfgslicer.batch;

import io.xfgslicer.model.KeyLineCategory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Counts for a finished batch run.
 *
 * @param startedAt        When the run started
 * @param duration         How long it took
 * @param filesDiscovered  Source files found
 * @param filesSliced      Files with a dependence graph
 * @param filesSkipped     Files without extractor output
 * @param filesFailed      Files whose tables or output could not be read or written
 * @param slicesByCategory Slices written per category
 * @param failures         Failed files with their error message
 */
public record BatchSummary(
        Instant startedAt,
        Duration duration,
        int filesDiscovered,
        int filesSliced,
        int filesSkipped,
        int filesFailed,
        Map<KeyLineCategory, Integer> slicesByCategory,
        List<FileFailure> failures
) {
    public BatchSummary {
        Map<KeyLineCategory, Integer> counts = new EnumMap<>(KeyLineCategory.class);
        for (KeyLineCategory category : KeyLineCategory.values()) {
            counts.put(category, slicesByCategory.getOrDefault(category, 0));
        }
        slicesByCategory = Collections.unmodifiableMap(counts);
        failures = List.copyOf(failures);
    }

    public int totalSlices() {
        return slicesByCategory.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int filesProcessed() {
        return filesSliced + filesSkipped;
    }

    /**
     * A file that could not be processed.
     */
    public record FileFailure(Path sourceFile, String message) {}
}
