package io.xfgslicer;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Run configuration loaded from a YAML file.
 * <p>
 * The dataset root is {@code dataFolder/datasetName}. Below it the run expects sources in
 * {@code source-code}, extractor tables in {@code csv/parsed} and writes slices to {@code XFG}.
 */
public class SlicerConfig {

    public static final String DEFAULT_SENSITIVE_API_PATH = "data/sensiAPI.txt";
    public static final List<String> DEFAULT_SOURCE_EXTENSIONS = List.of(".c", ".cpp", ".h");
    public static final int DEFAULT_QUEUE_CAPACITY = 64;

    private final Path dataFolder;
    private final String datasetName;
    private final Path sensitiveApiPath;
    private final List<String> sourceExtensions;
    private final int workers;
    private final int queueCapacity;
    private final String manifest;
    private final String outputFormat;

    private SlicerConfig(Builder builder) {
        this.dataFolder = builder.dataFolder;
        this.datasetName = builder.datasetName;
        this.sensitiveApiPath = builder.sensitiveApiPath;
        this.sourceExtensions = List.copyOf(builder.sourceExtensions);
        this.workers = builder.workers;
        this.queueCapacity = builder.queueCapacity;
        this.manifest = builder.manifest;
        this.outputFormat = builder.outputFormat;
    }

    /**
     * Load configuration from a YAML file.
     *
     * @throws ConfigurationException If the file is missing, unreadable or lacks a required key
     */
    public static SlicerConfig load(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new ConfigurationException("Config file does not exist: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            return fromYaml(in, configPath.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read config file " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load configuration from a YAML stream.
     */
    @SuppressWarnings("unchecked")
    public static SlicerConfig fromYaml(InputStream in, String sourceName) {
        Map<String, Object> data;
        try {
            data = new Yaml().load(in);
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Invalid YAML in " + sourceName + ": " + e.getMessage(), e);
        }
        if (data == null) {
            throw new ConfigurationException("Empty or invalid config file: " + sourceName);
        }
        return toBuilder(data).build();
    }

    private static Builder toBuilder(Map<String, Object> data) {
        Builder builder = builder();

        String dataFolder = getString(data, "dataFolder");
        if (dataFolder != null) {
            builder.dataFolder(Path.of(dataFolder));
        }
        builder.datasetName(getString(data, "datasetName"));

        String sensitiveApiPath = getString(data, "sensitiveApiPath");
        if (sensitiveApiPath != null) {
            builder.sensitiveApiPath(Path.of(sensitiveApiPath));
        }

        Object extensions = data.get("sourceExtensions");
        if (extensions instanceof List<?> list && !list.isEmpty()) {
            builder.sourceExtensions(list.stream()
                    .filter(e -> e != null && !e.toString().isBlank())
                    .map(e -> e.toString().strip())
                    .toList());
        }

        Integer workers = getInt(data, "workers");
        if (workers != null) {
            builder.workers(workers);
        }
        Integer queueCapacity = getInt(data, "queueCapacity");
        if (queueCapacity != null) {
            builder.queueCapacity(queueCapacity);
        }

        builder.manifest(getString(data, "manifest"));

        String outputFormat = getString(data, "outputFormat");
        if (outputFormat != null) {
            builder.outputFormat(outputFormat);
        }
        return builder;
    }

    private static String getString(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().strip();
        return text.isEmpty() ? null : text;
    }

    private static Integer getInt(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        try {
            return Integer.parseInt(value.toString().strip());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got: " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this configuration, for applying overrides.
     */
    public Builder toBuilder() {
        return builder()
                .dataFolder(dataFolder)
                .datasetName(datasetName)
                .sensitiveApiPath(sensitiveApiPath)
                .sourceExtensions(sourceExtensions)
                .workers(workers)
                .queueCapacity(queueCapacity)
                .manifest(manifest)
                .outputFormat(outputFormat);
    }

    public Path getDataFolder() {
        return dataFolder;
    }

    public String getDatasetName() {
        return datasetName;
    }

    public Path getSensitiveApiPath() {
        return sensitiveApiPath;
    }

    public List<String> getSourceExtensions() {
        return sourceExtensions;
    }

    public int getWorkers() {
        return workers;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    /**
     * Manifest path relative to the dataset root, or null if slices are not labeled.
     */
    public String getManifest() {
        return manifest;
    }

    public boolean hasManifest() {
        return manifest != null;
    }

    public Path datasetRoot() {
        return dataFolder.resolve(datasetName);
    }

    public Path sourceRoot() {
        return datasetRoot().resolve("source-code");
    }

    public Path tableRoot() {
        return datasetRoot().resolve("csv").resolve("parsed");
    }

    public Path outputRoot() {
        return datasetRoot().resolve("XFG");
    }

    public Path manifestPath() {
        return manifest != null ? datasetRoot().resolve(manifest) : null;
    }

    /**
     * Directory holding the extractor tables of a source file. The extractor mirrors the
     * absolute source path below the table root.
     */
    public Path tableDirFor(Path sourceFile) {
        String absolute = sourceFile.toAbsolutePath().normalize().toString().replace('\\', '/');
        while (absolute.startsWith("/")) {
            absolute = absolute.substring(1);
        }
        // Only a Windows drive colon is dropped; colons in file names are kept
        absolute = absolute.replaceFirst("^([A-Za-z]):", "$1");
        return tableRoot().resolve(absolute);
    }

    public static class Builder {
        private Path dataFolder;
        private String datasetName;
        private Path sensitiveApiPath = Path.of(DEFAULT_SENSITIVE_API_PATH);
        private List<String> sourceExtensions = DEFAULT_SOURCE_EXTENSIONS;
        private int workers = Runtime.getRuntime().availableProcessors();
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private String manifest;
        private String outputFormat = "json";

        public Builder dataFolder(Path dataFolder) {
            this.dataFolder = dataFolder;
            return this;
        }

        public Builder datasetName(String datasetName) {
            this.datasetName = datasetName;
            return this;
        }

        public Builder sensitiveApiPath(Path sensitiveApiPath) {
            this.sensitiveApiPath = sensitiveApiPath;
            return this;
        }

        public Builder sourceExtensions(List<String> sourceExtensions) {
            this.sourceExtensions = sourceExtensions;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder manifest(String manifest) {
            this.manifest = manifest;
            return this;
        }

        public Builder outputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        /**
         * @throws ConfigurationException If a required setting is missing or out of range
         */
        public SlicerConfig build() {
            if (dataFolder == null) {
                throw new ConfigurationException("Config must specify 'dataFolder'");
            }
            if (datasetName == null || datasetName.isBlank()) {
                throw new ConfigurationException("Config must specify 'datasetName'");
            }
            if (sensitiveApiPath == null) {
                throw new ConfigurationException("Config must specify 'sensitiveApiPath'");
            }
            if (sourceExtensions == null || sourceExtensions.isEmpty()) {
                throw new ConfigurationException("'sourceExtensions' must not be empty");
            }
            if (workers < 1) {
                throw new ConfigurationException("'workers' must be at least 1, got: " + workers);
            }
            if (queueCapacity < 1) {
                throw new ConfigurationException("'queueCapacity' must be at least 1, got: " + queueCapacity);
            }
            if (!"json".equals(outputFormat)) {
                throw new ConfigurationException("Unsupported output format: " + outputFormat + " (supported: json)");
            }
            return new SlicerConfig(this);
        }
    }
}
