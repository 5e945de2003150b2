package com.sysmuse.consolidation.config;

import com.sysmuse.consolidation.ConfigurationException;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

/**
 * ProcessingConfig - all options for one consolidation run.
 * Built once through {@link Builder} and read-only afterwards; copies are made
 * for the few places that need a variation (schema map, default options).
 */
public class ProcessingConfig {

    private final Path inputFolder;
    private final String outputFile;
    private final boolean recursive;
    private final List<String> fileTypeFilter;
    private final Map<String, List<String>> schemaMap;
    private final boolean toLower;
    private final boolean spacesToUnderscores;
    private final IndexMode indexMode;
    private final long indexStart;
    private final List<String> columns;
    private final boolean forceInMemory;
    private final Map<String, Object> readOptions;
    private final Map<String, Object> writeOptions;

    private ProcessingConfig(Builder builder) {
        this.inputFolder = builder.inputFolder;
        this.outputFile = builder.outputFile;
        this.recursive = builder.recursive;
        this.fileTypeFilter = builder.fileTypeFilter == null ? null
                : Collections.unmodifiableList(new ArrayList<>(builder.fileTypeFilter));
        this.schemaMap = builder.schemaMap == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.schemaMap));
        this.toLower = builder.toLower;
        this.spacesToUnderscores = builder.spacesToUnderscores;
        this.indexMode = builder.indexMode;
        this.indexStart = builder.indexStart;
        this.columns = builder.columns == null ? null
                : Collections.unmodifiableList(new ArrayList<>(builder.columns));
        this.forceInMemory = builder.forceInMemory;
        this.readOptions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.readOptions));
        this.writeOptions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.writeOptions));
    }

    public static Builder builder(String inputFolder) {
        return new Builder(inputFolder);
    }

    public static Builder builder(Path inputFolder) {
        return new Builder(inputFolder == null ? null : inputFolder.toString());
    }

    public Path getInputFolder() {
        return inputFolder;
    }

    public String getOutputFile() {
        return outputFile;
    }

    public boolean isRecursive() {
        return recursive;
    }

    /**
     * Extensions to include, lower-case without dot; null means every supported type.
     */
    public List<String> getFileTypeFilter() {
        return fileTypeFilter;
    }

    public Map<String, List<String>> getSchemaMap() {
        return schemaMap;
    }

    public boolean isToLower() {
        return toLower;
    }

    public boolean isSpacesToUnderscores() {
        return spacesToUnderscores;
    }

    /**
     * Index policy, null when unset.
     */
    public IndexMode getIndexMode() {
        return indexMode;
    }

    public long getIndexStart() {
        return indexStart;
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean hasColumns() {
        return columns != null && !columns.isEmpty();
    }

    public boolean isForceInMemory() {
        return forceInMemory;
    }

    public Map<String, Object> getReadOptions() {
        return readOptions;
    }

    public Map<String, Object> getWriteOptions() {
        return writeOptions;
    }

    /**
     * Copy with a different alias map.
     */
    public ProcessingConfig withSchemaMap(Map<String, List<String>> newSchemaMap) {
        return toBuilder().schemaMap(newSchemaMap).build();
    }

    /**
     * Copy whose options are the given defaults overlaid with this config's own values.
     */
    public ProcessingConfig withDefaultOptions(Map<String, ?> readDefaults, Map<String, ?> writeDefaults) {
        Map<String, Object> read = new LinkedHashMap<>(readDefaults);
        read.putAll(readOptions);
        Map<String, Object> write = new LinkedHashMap<>(writeDefaults);
        write.putAll(writeOptions);
        return toBuilder().readOptions(read).writeOptions(write).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder(inputFolder.toString());
        builder.outputFile = outputFile;
        builder.recursive = recursive;
        builder.fileTypeFilter = fileTypeFilter;
        builder.schemaMap = schemaMap;
        builder.toLower = toLower;
        builder.spacesToUnderscores = spacesToUnderscores;
        builder.indexMode = indexMode;
        builder.indexStart = indexStart;
        builder.columns = columns;
        builder.forceInMemory = forceInMemory;
        builder.readOptions = new LinkedHashMap<>(readOptions);
        builder.writeOptions = new LinkedHashMap<>(writeOptions);
        return builder;
    }

    @Override
    public String toString() {
        return "ProcessingConfig{inputFolder=" + inputFolder +
                ", outputFile=" + outputFile +
                ", recursive=" + recursive +
                ", fileTypeFilter=" + fileTypeFilter +
                ", indexMode=" + indexMode +
                ", columns=" + columns +
                ", forceInMemory=" + forceInMemory + "}";
    }

    public static class Builder {
        private final Path inputFolder;
        private String outputFile;
        private boolean recursive = false;
        private List<String> fileTypeFilter;
        private Map<String, List<String>> schemaMap;
        private boolean toLower = true;
        private boolean spacesToUnderscores = true;
        private IndexMode indexMode;
        private long indexStart = 0;
        private List<String> columns;
        private boolean forceInMemory = false;
        private Map<String, Object> readOptions = new LinkedHashMap<>();
        private Map<String, Object> writeOptions = new LinkedHashMap<>();

        private Builder(String inputFolder) {
            if (inputFolder == null || inputFolder.trim().isEmpty()) {
                throw new ConfigurationException("input_folder is required");
            }
            this.inputFolder = Paths.get(inputFolder.trim());
        }

        public Builder outputFile(String outputFile) {
            this.outputFile = outputFile == null || outputFile.trim().isEmpty() ? null : outputFile.trim();
            return this;
        }

        public Builder recursive(boolean recursive) {
            this.recursive = recursive;
            return this;
        }

        /**
         * Single extension shorthand, e.g. "csv" or ".CSV".
         */
        public Builder fileTypeFilter(String extension) {
            if (extension == null) {
                this.fileTypeFilter = null;
                return this;
            }
            return fileTypeFilter(Collections.singletonList(extension));
        }

        public Builder fileTypeFilter(List<String> extensions) {
            if (extensions == null) {
                this.fileTypeFilter = null;
                return this;
            }
            List<String> normalized = new ArrayList<>();
            for (String extension : extensions) {
                String ext = extension.trim().toLowerCase(Locale.ROOT);
                while (ext.startsWith(".")) {
                    ext = ext.substring(1);
                }
                if (!ext.isEmpty() && !normalized.contains(ext)) {
                    normalized.add(ext);
                }
            }
            this.fileTypeFilter = normalized;
            return this;
        }

        public Builder schemaMap(Map<String, List<String>> schemaMap) {
            this.schemaMap = schemaMap;
            return this;
        }

        public Builder toLower(boolean toLower) {
            this.toLower = toLower;
            return this;
        }

        public Builder spacesToUnderscores(boolean spacesToUnderscores) {
            this.spacesToUnderscores = spacesToUnderscores;
            return this;
        }

        public Builder indexMode(IndexMode indexMode) {
            this.indexMode = indexMode;
            return this;
        }

        public Builder indexMode(String indexMode) {
            this.indexMode = IndexMode.fromString(indexMode);
            return this;
        }

        public Builder indexStart(long indexStart) {
            this.indexStart = indexStart;
            return this;
        }

        /**
         * Comma-separated shorthand, e.g. "first_name, last_name, age".
         */
        public Builder columns(String columns) {
            if (columns == null || columns.trim().isEmpty()) {
                this.columns = null;
                return this;
            }
            return columns(Arrays.asList(columns.split(",")));
        }

        public Builder columns(List<String> columns) {
            if (columns == null) {
                this.columns = null;
                return this;
            }
            List<String> trimmed = new ArrayList<>();
            for (String column : columns) {
                String name = column.trim();
                if (!name.isEmpty()) {
                    trimmed.add(name);
                }
            }
            this.columns = trimmed;
            return this;
        }

        public Builder forceInMemory(boolean forceInMemory) {
            this.forceInMemory = forceInMemory;
            return this;
        }

        public Builder readOptions(Map<String, ?> readOptions) {
            this.readOptions = copyOptions("read_options", readOptions);
            return this;
        }

        public Builder writeOptions(Map<String, ?> writeOptions) {
            this.writeOptions = copyOptions("write_options", writeOptions);
            return this;
        }

        public Builder readOption(String name, Object value) {
            this.readOptions.put(name, value);
            return this;
        }

        public Builder writeOption(String name, Object value) {
            this.writeOptions.put(name, value);
            return this;
        }

        public ProcessingConfig build() {
            return new ProcessingConfig(this);
        }

        private static Map<String, Object> copyOptions(String label, Map<String, ?> options) {
            Map<String, Object> copy = new LinkedHashMap<>();
            if (options == null) {
                return copy;
            }
            for (Map.Entry<String, ?> entry : options.entrySet()) {
                if (entry.getKey() == null) {
                    throw new ConfigurationException(label + " must map option names to values");
                }
                copy.put(entry.getKey(), entry.getValue());
            }
            return copy;
        }
    }
}
