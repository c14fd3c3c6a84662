package io.xfgslicer.output;

import io.xfgslicer.model.FileSlices;

import java.io.IOException;

/**
 * Persists the slices of one file.
 */
public interface SliceWriter {

    /**
     * Writes all slices of a file.
     *
     * @param slices       The file's slices
     * @param relativePath Location of the file under the output root, used to partition output
     * @return Number of slices written
     */
    int write(FileSlices slices, String relativePath) throws IOException;
}
