package io.xfgslicer;

import io.xfgslicer.batch.BatchSlicer;
import io.xfgslicer.batch.BatchSummary;
import io.xfgslicer.batch.FileSlicer;
import io.xfgslicer.batch.SourceFileFinder;
import io.xfgslicer.classify.KeyLineClassifier;
import io.xfgslicer.classify.SensitiveApiList;
import io.xfgslicer.graph.PdgConstructor;
import io.xfgslicer.graph.PdgResult;
import io.xfgslicer.graph.SliceExtractor;
import io.xfgslicer.manifest.Manifest;
import io.xfgslicer.manifest.ManifestReader;
import io.xfgslicer.manifest.SliceLabeler;
import io.xfgslicer.model.FileSlices;
import io.xfgslicer.model.KeyLineCategory;
import io.xfgslicer.output.ConsoleSliceOutput;
import io.xfgslicer.output.JsonSliceWriter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the xfg-slicer tool.
 */
@Command(
        name = "xfg-slicer",
        mixinStandardHelpOptions = true,
        version = "xfg-slicer 1.0.0",
        description = "Builds line-level program dependence graphs from code property graph tables " +
                "and extracts one bidirectional slice (XFG) per key line.",
        footer = {
                "",
                "Examples:",
                "  xfg-slicer -c configs/dwk.yaml",
                "  xfg-slicer -c configs/dwk.yaml --workers 16 --verbose",
                "  xfg-slicer -c configs/dwk.yaml --inspect data/CWE119/csv/parsed/src/foo.c"
        }
)
public class XfgSlicerCli implements Callable<Integer> {

    @Option(
            names = {"-c", "--config"},
            description = "Path to YAML configuration file",
            defaultValue = "configs/dwk.yaml"
    )
    private Path configPath;

    @Option(
            names = {"--data-folder"},
            description = "Overrides 'dataFolder' from the configuration"
    )
    private Path dataFolder;

    @Option(
            names = {"--dataset"},
            description = "Overrides 'datasetName' from the configuration"
    )
    private String datasetName;

    @Option(
            names = {"-s", "--sensitive-apis"},
            description = "Overrides 'sensitiveApiPath': comma-separated list of sensitive function names"
    )
    private Path sensitiveApiPath;

    @Option(
            names = {"-w", "--workers"},
            description = "Overrides 'workers': number of files processed in parallel"
    )
    private Integer workers;

    @Option(
            names = {"--inspect"},
            description = "Slice a single table directory (holding nodes.csv and edges.csv) and print the result"
    )
    private Path inspectDir;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    @Override
    public Integer call() {
        try {
            if (inspectDir != null) {
                return inspect(loadSensitiveApis(inspectSensitiveApiPath()));
            }

            SlicerConfig config = loadConfig();

            // Fatal inputs are checked before any file is touched
            SensitiveApiList sensitiveApis = loadSensitiveApis(config.getSensitiveApiPath());
            PdgConstructor pdgConstructor = new PdgConstructor(new KeyLineClassifier(sensitiveApis));
            SliceExtractor sliceExtractor = new SliceExtractor();

            SliceLabeler labeler = null;
            if (config.hasManifest()) {
                log("Reading manifest " + config.manifestPath());
                Manifest manifest = new ManifestReader().read(config.manifestPath());
                log("  " + manifest.testCaseCount() + " test cases");
                labeler = new SliceLabeler(manifest);
            }

            log("Discovering source files in " + config.sourceRoot() + "...");
            List<Path> sourceFiles = SourceFileFinder.find(config.sourceRoot(), config.getSourceExtensions());
            System.out.println("Total source files: " + sourceFiles.size());

            FileSlicer fileSlicer = new FileSlicer(config.sourceRoot(), config::tableDirFor,
                    pdgConstructor, sliceExtractor, labeler);
            JsonSliceWriter writer = new JsonSliceWriter(config.outputRoot());
            BatchSlicer batch = new BatchSlicer(fileSlicer, writer, config.getWorkers(),
                    config.getQueueCapacity(), this::log);

            log("Slicing with " + config.getWorkers() + " workers...");
            BatchSummary summary = batch.run(sourceFiles);
            Path summaryFile = writer.writeSummary(summary);

            printSummary(summary);
            log("Summary written to: " + summaryFile);
            return 0;

        } catch (ConfigurationException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted");
            return 1;
        }
    }

    private SlicerConfig loadConfig() {
        SlicerConfig.Builder builder;
        if (Files.exists(configPath)) {
            log("Loading configuration from: " + configPath);
            builder = SlicerConfig.load(configPath).toBuilder();
        } else if (dataFolder != null && datasetName != null) {
            builder = SlicerConfig.builder();
        } else {
            throw new ConfigurationException("Config file does not exist: " + configPath);
        }

        if (dataFolder != null) {
            builder.dataFolder(dataFolder);
        }
        if (datasetName != null) {
            builder.datasetName(datasetName);
        }
        if (sensitiveApiPath != null) {
            builder.sensitiveApiPath(sensitiveApiPath);
        }
        if (workers != null) {
            builder.workers(workers);
        }
        return builder.build();
    }

    private SensitiveApiList loadSensitiveApis(Path path) {
        SensitiveApiList sensitiveApis = SensitiveApiList.load(path);
        log("Loaded " + sensitiveApis.size() + " sensitive APIs from " + path);
        return sensitiveApis;
    }

    /**
     * Sensitive API list for inspection: the option if given, else the configuration's, else the default.
     */
    private Path inspectSensitiveApiPath() {
        if (sensitiveApiPath != null) {
            return sensitiveApiPath;
        }
        if (Files.exists(configPath)) {
            return SlicerConfig.load(configPath).getSensitiveApiPath();
        }
        return Path.of(SlicerConfig.DEFAULT_SENSITIVE_API_PATH);
    }

    private int inspect(SensitiveApiList sensitiveApis) throws IOException {
        if (!Files.isDirectory(inspectDir)) {
            System.err.println("Error: Not a directory: " + inspectDir);
            return 1;
        }
        PdgConstructor pdgConstructor = new PdgConstructor(new KeyLineClassifier(sensitiveApis));
        PdgResult result = pdgConstructor.build(inspectDir, inspectDir.toString());
        FileSlices slices = new SliceExtractor().extract(result, inspectDir.toString());

        ConsoleSliceOutput output = new ConsoleSliceOutput(System.out, !noColor);
        output.printSummary(result);
        output.printSlices(slices);
        return 0;
    }

    private void printSummary(BatchSummary summary) {
        System.out.println();
        System.out.println("Files processed: " + summary.filesProcessed() + " of " + summary.filesDiscovered()
                + " (" + summary.filesSliced() + " sliced, " + summary.filesSkipped() + " without tables)");
        if (summary.filesFailed() > 0) {
            System.err.println("Files failed: " + summary.filesFailed());
            if (verbose) {
                for (BatchSummary.FileFailure failure : summary.failures()) {
                    System.err.println("  " + failure.sourceFile() + ": " + failure.message());
                }
            }
        }
        StringBuilder perCategory = new StringBuilder();
        for (KeyLineCategory category : KeyLineCategory.values()) {
            if (perCategory.length() > 0) {
                perCategory.append(", ");
            }
            perCategory.append(category.wireName()).append('=').append(summary.slicesByCategory().get(category));
        }
        System.out.println("Slices: " + summary.totalSlices() + " (" + perCategory + ")");
        System.out.println("Finished in " + summary.duration().toMillis() + " ms");
    }

    private void log(String message) {
        if (verbose) {
            System.out.println(message);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new XfgSlicerCli()).execute(args);
        System.exit(exitCode);
    }
}
