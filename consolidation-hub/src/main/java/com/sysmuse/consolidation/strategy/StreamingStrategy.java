package com.sysmuse.consolidation.strategy;

import com.sysmuse.consolidation.ProcessingResult;
import com.sysmuse.consolidation.config.ProcessingConfig;
import com.sysmuse.consolidation.handler.FileHandler;
import com.sysmuse.consolidation.index.IndexManager;
import com.sysmuse.consolidation.schema.SchemaDetector;
import com.sysmuse.consolidation.service.FileDiscovery;
import com.sysmuse.consolidation.service.FileProcessor;
import com.sysmuse.consolidation.service.OutputWriter;
import com.sysmuse.consolidation.table.ColumnType;
import com.sysmuse.consolidation.table.DataBatch;
import com.sysmuse.consolidation.util.LoggingUtil;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * StreamingStrategy - bounded memory. The schema is fixed before any file is
 * read so every appended batch matches the header of the first one.
 */
public class StreamingStrategy implements ProcessingStrategy {

    public static final String NAME = "streaming";

    private final SchemaDetector schemaDetector;
    private final FileProcessor fileProcessor;
    private final OutputWriter outputWriter;

    public StreamingStrategy(SchemaDetector schemaDetector, FileProcessor fileProcessor, OutputWriter outputWriter) {
        this.schemaDetector = schemaDetector;
        this.fileProcessor = fileProcessor;
        this.outputWriter = outputWriter;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ProcessingResult process(ProcessingConfig config, List<Path> files, FileHandler outputHandler) {
        long start = System.nanoTime();

        IndexManager indexManager = new IndexManager(config.getIndexMode(), config.getIndexStart());
        Map<String, Object> writeOptions = indexManager.applyWriteOptions(config.getWriteOptions());

        LoggingUtil.info("Detecting schema for streaming consistency");
        Map<String, ColumnType> schema = config.hasColumns()
                ? SchemaDetector.schemaFromColumns(config.getColumns())
                : schemaDetector.detectSchema(config, files);
        LoggingUtil.info("Starting streaming processing with " + schema.size() + " schema columns");

        Iterator<DataBatch> batches = fileProcessor.processFilesStreaming(config, files, schema, indexManager);
        Path outputFile = config.getOutputFile() == null ? null : Paths.get(config.getOutputFile());
        long totalRows;
        try {
            totalRows = outputWriter.writeStreaming(batches, outputFile, outputHandler, writeOptions, indexManager);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write output " + outputFile, e);
        }

        // Streaming keeps no per-file tally; count what is on disk now
        int filesProcessed = FileDiscovery.listFiles(config).size();
        Duration processingTime = Duration.ofNanos(System.nanoTime() - start);

        LoggingUtil.info("Streaming processing complete: " + filesProcessed + " file(s), " + totalRows +
                " rows in " + processingTime.toMillis() + "ms");
        return new ProcessingResult(filesProcessed, totalRows, schema.size(), processingTime,
                config.getOutputFile(), schema, null);
    }
}
