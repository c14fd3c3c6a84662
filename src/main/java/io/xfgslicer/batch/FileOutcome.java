package io.xfgslicer.batch;

import io.xfgslicer.graph.NoGraphReason;
import io.xfgslicer.model.FileSlices;

/**
 * Result of processing one source file.
 *
 * @param relativePath  Source path relative to the source root, with {@code /} separators
 * @param slices        Extracted slices (empty when skipped)
 * @param noGraphReason Why the file was skipped, null if it was sliced
 */
public record FileOutcome(String relativePath, FileSlices slices, NoGraphReason noGraphReason) {

    public static FileOutcome sliced(String relativePath, FileSlices slices) {
        return new FileOutcome(relativePath, slices, null);
    }

    public static FileOutcome skipped(String relativePath, FileSlices slices, NoGraphReason reason) {
        return new FileOutcome(relativePath, slices, reason);
    }

    public boolean isSkipped() {
        return noGraphReason != null;
    }
}
