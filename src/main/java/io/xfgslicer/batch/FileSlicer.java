package io.xfgslicer.batch;

import io.xfgslicer.graph.PdgConstructor;
import io.xfgslicer.graph.PdgResult;
import io.xfgslicer.graph.SliceExtractor;
import io.xfgslicer.manifest.SliceLabeler;
import io.xfgslicer.model.FileSlices;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Function;

/**
 * Runs the whole per-file pipeline: load tables, build the dependence graph, extract and
 * optionally label slices. Holds no mutable state, so one instance serves all workers.
 */
public class FileSlicer {

    private final Path sourceRoot;
    private final Function<Path, Path> tableDirLocator;
    private final PdgConstructor pdgConstructor;
    private final SliceExtractor sliceExtractor;
    private final SliceLabeler labeler;

    /**
     * @param sourceRoot      Root that relative paths are computed against
     * @param tableDirLocator Maps a source file to the directory holding its tables
     * @param pdgConstructor  Graph constructor
     * @param sliceExtractor  Slice extractor
     * @param labeler         Labeler, or null to leave slices unlabeled
     */
    public FileSlicer(Path sourceRoot,
                      Function<Path, Path> tableDirLocator,
                      PdgConstructor pdgConstructor,
                      SliceExtractor sliceExtractor,
                      SliceLabeler labeler) {
        this.sourceRoot = sourceRoot;
        this.tableDirLocator = tableDirLocator;
        this.pdgConstructor = pdgConstructor;
        this.sliceExtractor = sliceExtractor;
        this.labeler = labeler;
    }

    /**
     * Processes one source file.
     *
     * @throws IOException If the file's tables exist but cannot be read
     */
    public FileOutcome process(Path sourceFile) throws IOException {
        String relativePath = relativize(sourceFile);
        PdgResult result = pdgConstructor.build(tableDirLocator.apply(sourceFile), sourceFile.toString());
        if (!result.hasGraph()) {
            return FileOutcome.skipped(relativePath, FileSlices.empty(sourceFile.toString()), result.noGraphReason());
        }

        FileSlices slices = sliceExtractor.extract(result.graph(), result.keyLines());
        if (labeler != null) {
            slices = labeler.label(slices, relativePath);
        }
        return FileOutcome.sliced(relativePath, slices);
    }

    String relativize(Path sourceFile) {
        Path absolute = sourceFile.toAbsolutePath().normalize();
        Path root = sourceRoot.toAbsolutePath().normalize();
        Path relative = absolute.startsWith(root) ? root.relativize(absolute) : sourceFile.getFileName();
        return relative.toString().replace('\\', '/');
    }
}
