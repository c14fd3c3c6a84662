package io.xfgslicer.manifest;

import io.xfgslicer.model.CodeSlice;
import io.xfgslicer.model.FileSlices;

import java.util.Collections;
import java.util.Set;

/**
 * Labels slices against the vulnerable lines a manifest lists for their file.
 * A slice is vulnerable (label 1) when any of its lines is a flaw line. Files the
 * manifest does not list have no ground truth and stay unlabeled.
 */
public class SliceLabeler {

    private final Manifest manifest;

    public SliceLabeler(Manifest manifest) {
        this.manifest = manifest;
    }

    /**
     * Labels every slice of a file.
     *
     * @param slices       The file's slices
     * @param manifestPath The file's path as written in the manifest
     */
    public FileSlices label(FileSlices slices, String manifestPath) {
        if (!manifest.covers(manifestPath)) {
            return slices;
        }
        Set<Integer> vulnerable = manifest.vulnerableLines(manifestPath);
        return slices.map(slice -> label(slice, vulnerable));
    }

    static CodeSlice label(CodeSlice slice, Set<Integer> vulnerableLines) {
        boolean vulnerable = !Collections.disjoint(slice.nodes(), vulnerableLines);
        return slice.withLabel(vulnerable ? 1 : 0);
    }
}
