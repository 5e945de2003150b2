package com.sysmuse.consolidation.strategy;

import com.sysmuse.consolidation.ProcessingResult;
import com.sysmuse.consolidation.config.ProcessingConfig;
import com.sysmuse.consolidation.handler.FileHandler;
import com.sysmuse.consolidation.index.IndexManager;
import com.sysmuse.consolidation.schema.SchemaDetector;
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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * InMemoryStrategy - reads everything, concatenates, writes once.
 * Needed for formats that cannot be appended to; columns are reconciled by the
 * concatenation itself unless explicit columns are configured.
 */
public class InMemoryStrategy implements ProcessingStrategy {

    public static final String NAME = "in_memory";

    private final SchemaDetector schemaDetector;
    private final FileProcessor fileProcessor;
    private final OutputWriter outputWriter;

    public InMemoryStrategy(SchemaDetector schemaDetector, FileProcessor fileProcessor, OutputWriter outputWriter) {
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

        Map<String, ColumnType> schema = null;
        if (config.hasColumns()) {
            LoggingUtil.info("Using predefined columns for in-memory processing");
            schema = schemaDetector.detectSchema(config);
        }

        LoggingUtil.info("Starting in-memory processing");
        List<DataBatch> batches = fileProcessor.processFilesInMemory(config, files, schema, indexManager);
        if (batches.isEmpty()) {
            LoggingUtil.warn("No data batches processed");
            DataBatch none = schema == null ? new DataBatch() : new DataBatch(new ArrayList<>(schema.keySet()));
            return ProcessingResult.empty(config.getOutputFile(), Duration.ofNanos(System.nanoTime() - start),
                    none);
        }

        LoggingUtil.info("Merging " + batches.size() + " batch(es) into complete dataset");
        DataBatch table = DataBatch.concat(batches);

        Path outputFile = config.getOutputFile() == null ? null : Paths.get(config.getOutputFile());
        DataBatch data;
        try {
            data = outputWriter.writeCompleteDataset(table, outputFile, outputHandler, writeOptions, indexManager);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write output " + outputFile, e);
        }

        long totalRows = data.size();
        int filesProcessed = countSourceFiles(data);
        Duration processingTime = Duration.ofNanos(System.nanoTime() - start);
        LoggingUtil.info("In-memory processing complete: " + filesProcessed + " file(s), " + totalRows +
                " rows, " + data.columnCount() + " columns in " + processingTime.toMillis() + "ms");

        return new ProcessingResult(filesProcessed, totalRows, data.columnCount(), processingTime,
                config.getOutputFile(), schema, data);
    }

    /**
     * Distinct non-null source_file values of the table.
     */
    static int countSourceFiles(DataBatch table) {
        if (!table.hasColumn(SchemaDetector.SOURCE_FILE)) {
            return 0;
        }
        Set<Object> sources = new HashSet<>(table.getColumnValues(SchemaDetector.SOURCE_FILE));
        sources.remove(null);
        return sources.size();
    }
}
