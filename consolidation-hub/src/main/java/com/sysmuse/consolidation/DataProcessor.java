package com.sysmuse.consolidation;

import com.sysmuse.consolidation.config.ProcessingConfig;
import com.sysmuse.consolidation.handler.FileHandler;
import com.sysmuse.consolidation.handler.HandlerRegistry;
import com.sysmuse.consolidation.progress.NullProgressReporter;
import com.sysmuse.consolidation.progress.ProgressReporter;
import com.sysmuse.consolidation.schema.SchemaDetector;
import com.sysmuse.consolidation.service.FileDiscovery;
import com.sysmuse.consolidation.service.FileProcessor;
import com.sysmuse.consolidation.service.OutputWriter;
import com.sysmuse.consolidation.strategy.InMemoryStrategy;
import com.sysmuse.consolidation.strategy.ProcessingStrategy;
import com.sysmuse.consolidation.strategy.StreamingStrategy;
import com.sysmuse.consolidation.table.DataBatch;
import com.sysmuse.consolidation.util.LoggingUtil;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.*;

/**
 * DataProcessor - entry point of a consolidation run.
 *
 * Validates the configuration, resolves the output handler, picks the streaming
 * or in-memory strategy and reports progress around it. Default read and write
 * options given at construction apply to every run; a run's own options win.
 */
public class DataProcessor {

    private final Map<String, Object> readDefaults;
    private final Map<String, Object> writeDefaults;
    private final HandlerRegistry registry;
    private final SchemaDetector schemaDetector;
    private final FileProcessor fileProcessor;
    private final OutputWriter outputWriter;
    private ProgressReporter progressReporter = new NullProgressReporter();

    public DataProcessor() {
        this(null, null);
    }

    public DataProcessor(Map<String, ?> readDefaults, Map<String, ?> writeDefaults) {
        this(readDefaults, writeDefaults, new OutputWriter());
    }

    /**
     * @param outputWriter writer to use, e.g. one printing to a captured console stream
     */
    public DataProcessor(Map<String, ?> readDefaults, Map<String, ?> writeDefaults, OutputWriter outputWriter) {
        this.readDefaults = readDefaults == null ? new LinkedHashMap<>() : new LinkedHashMap<>(readDefaults);
        this.writeDefaults = writeDefaults == null ? new LinkedHashMap<>() : new LinkedHashMap<>(writeDefaults);
        this.registry = new HandlerRegistry();
        this.schemaDetector = new SchemaDetector(registry);
        this.fileProcessor = new FileProcessor(registry);
        this.outputWriter = outputWriter;
    }

    public void setProgressReporter(ProgressReporter progressReporter) {
        this.progressReporter = progressReporter == null ? new NullProgressReporter() : progressReporter;
        this.fileProcessor.setProgressReporter(this.progressReporter);
    }

    public ProgressReporter getProgressReporter() {
        return progressReporter;
    }

    /**
     * Consolidate the configured input folder.
     *
     * @throws ConfigurationException      for an invalid configuration, before any file is read
     * @throws UnsupportedFormatException  when the output file has no handler
     * @throws NoSchemaDetectedException   when streaming and no input file yields a column
     * @throws java.io.UncheckedIOException when writing the output fails
     */
    public ProcessingResult run(ProcessingConfig config) {
        long start = System.nanoTime();
        validate(config);
        LoggingUtil.info("Starting data processing: input_folder=" + config.getInputFolder() +
                ", output_file=" + config.getOutputFile());

        FileHandler outputHandler = resolveOutputHandler(config);
        boolean streaming = shouldUseStreaming(config, outputHandler);
        ProcessingConfig effective = config.withDefaultOptions(readDefaults, writeDefaults);

        List<Path> files = FileDiscovery.listFiles(effective);
        progressReporter.startProcessing(files.size());

        ProcessingResult result;
        if (files.isEmpty()) {
            LoggingUtil.warn("No eligible files found in " + config.getInputFolder());
            result = ProcessingResult.empty(config.getOutputFile(), Duration.ofNanos(System.nanoTime() - start),
                    streaming ? null : new DataBatch());
        } else {
            ProcessingStrategy strategy = streaming
                    ? new StreamingStrategy(schemaDetector, fileProcessor, outputWriter)
                    : new InMemoryStrategy(schemaDetector, fileProcessor, outputWriter);
            result = strategy.process(effective, files, outputHandler);
        }

        progressReporter.completeProcessing(result.getTotalRows(), result.getProcessingTime());
        LoggingUtil.info("Data processing finished in " + Duration.ofNanos(System.nanoTime() - start).toMillis() +
                "ms: " + result);
        return result;
    }

    public List<String> getAvailableStrategies() {
        return Arrays.asList(StreamingStrategy.NAME, InMemoryStrategy.NAME);
    }

    /**
     * Service status for diagnostics.
     */
    public Map<String, Object> getServiceStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("schema_detector", schemaDetector.getClass().getSimpleName());
        status.put("file_processor", fileProcessor.getClass().getSimpleName());
        status.put("output_writer", outputWriter.getClass().getSimpleName());
        status.put("read_options", new ArrayList<>(readDefaults.keySet()));
        status.put("write_options", new ArrayList<>(writeDefaults.keySet()));
        status.put("progress_reporter", progressReporter.getClass().getSimpleName());
        return status;
    }

    private static void validate(ProcessingConfig config) {
        if (config == null) {
            throw new ConfigurationException("Processing configuration is required");
        }
        Path folder = config.getInputFolder();
        if (!Files.exists(folder)) {
            throw new ConfigurationException("Input folder does not exist: " + folder);
        }
        if (!Files.isDirectory(folder)) {
            throw new ConfigurationException("Input folder is not a directory: " + folder);
        }
        FileDiscovery.normalizeFilter(config.getFileTypeFilter());
    }

    /**
     * Handler for the output file; null when output goes to the console.
     */
    private FileHandler resolveOutputHandler(ProcessingConfig config) {
        if (config.getOutputFile() == null) {
            return null;
        }
        return registry.getHandler(Paths.get(config.getOutputFile()));
    }

    private static boolean shouldUseStreaming(ProcessingConfig config, FileHandler outputHandler) {
        if (config.isForceInMemory()) {
            LoggingUtil.info("Using in-memory processing (forced by configuration)");
            return false;
        }
        if (outputHandler == null || !outputHandler.isStreamable()) {
            LoggingUtil.info("Using in-memory processing (output format requires full dataset)");
            return false;
        }
        LoggingUtil.info("Using streaming processing");
        return true;
    }
}
