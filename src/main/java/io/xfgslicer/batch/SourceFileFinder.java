package io.xfgslicer.batch;

import io.xfgslicer.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * Finds the source files of a dataset by extension.
 */
public final class SourceFileFinder {

    private SourceFileFinder() {
    }

    /**
     * Walks {@code root} recursively and returns regular files whose name ends with one of
     * the given extensions, sorted by path.
     *
     * @throws ConfigurationException If the root is not a directory
     * @throws IOException            If the walk fails
     */
    public static List<Path> find(Path root, List<String> extensions) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new ConfigurationException("Source root is not a directory: " + root);
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> hasExtension(p, extensions))
                    .sorted()
                    .toList();
        }
    }

    static boolean hasExtension(Path path, List<String> extensions) {
        String name = path.getFileName().toString();
        for (String ext : extensions) {
            if (name.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }
}
