package com.sysmuse.consolidation.schema;

import com.sysmuse.consolidation.NoSchemaDetectedException;
import com.sysmuse.consolidation.config.ProcessingConfig;
import com.sysmuse.consolidation.handler.BatchReader;
import com.sysmuse.consolidation.handler.FileHandler;
import com.sysmuse.consolidation.handler.HandlerRegistry;
import com.sysmuse.consolidation.normalize.ColumnNormalizer;
import com.sysmuse.consolidation.service.FileDiscovery;
import com.sysmuse.consolidation.table.ColumnType;
import com.sysmuse.consolidation.table.DataBatch;
import com.sysmuse.consolidation.util.LoggingUtil;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * SchemaDetector - builds the unified column to type map of a run.
 *
 * Either takes the explicitly configured columns, or samples the first rows of
 * every input file and merges the observed column types by promotion.
 */
public class SchemaDetector {

    public static final String SOURCE_FILE = "source_file";

    private final HandlerRegistry registry;

    public SchemaDetector(HandlerRegistry registry) {
        this.registry = registry;
    }

    public Map<String, ColumnType> detectSchema(ProcessingConfig config) {
        if (config.hasColumns()) {
            return schemaFromColumns(config.getColumns());
        }
        return detectSchema(config, FileDiscovery.listFiles(config));
    }

    /**
     * Sample the given files. Files that cannot be read are skipped with a warning.
     *
     * @throws NoSchemaDetectedException when no file yields a single column
     */
    public Map<String, ColumnType> detectSchema(ProcessingConfig config, List<Path> files) {
        LoggingUtil.info("Starting schema detection over " + files.size() + " file(s) in " + config.getInputFolder());
        ColumnNormalizer normalizer = ColumnNormalizer.forConfig(config);
        Map<String, ColumnType> schema = new LinkedHashMap<>();
        int filesSampled = 0;

        for (Path file : files) {
            DataBatch sample;
            try {
                sample = readSample(file, config.getReadOptions(), normalizer);
            } catch (IOException | RuntimeException e) {
                LoggingUtil.warn("Could not sample file " + file.getFileName() + ": " + e.getMessage());
                continue;
            }
            if (sample == null || sample.columnCount() == 0) {
                continue;
            }
            mergeSchema(schema, observeTypes(normalizer.normalize(sample)));
            filesSampled++;
        }

        if (schema.isEmpty()) {
            throw new NoSchemaDetectedException("No valid files found for schema detection in " + config.getInputFolder());
        }
        schema.put(SOURCE_FILE, ColumnType.OBJECT);

        LoggingUtil.info("Schema detection complete: " + schema.size() + " columns from " + filesSampled + " file(s)");
        if (LoggingUtil.isDebugEnabled()) {
            LoggingUtil.debug("Detected schema: " + schema);
        }
        return schema;
    }

    /**
     * Schema for explicitly listed columns. Every column is OBJECT, plus source_file.
     */
    public static Map<String, ColumnType> schemaFromColumns(List<String> columns) {
        Map<String, ColumnType> schema = new LinkedHashMap<>();
        for (String column : columns) {
            schema.put(column, ColumnType.OBJECT);
        }
        schema.put(SOURCE_FILE, ColumnType.OBJECT);
        return schema;
    }

    /**
     * Observed type of every column of a batch, in column order.
     */
    public static Map<String, ColumnType> observeTypes(DataBatch batch) {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (String column : batch.getColumns()) {
            types.put(column, ColumnType.ofValues(batch.getColumnValues(column)));
        }
        return types;
    }

    /**
     * Fold a file's column types into the run schema; unseen columns are appended.
     */
    public static void mergeSchema(Map<String, ColumnType> schema, Map<String, ColumnType> fileSchema) {
        for (Map.Entry<String, ColumnType> entry : fileSchema.entrySet()) {
            schema.put(entry.getKey(), ColumnType.merge(schema.get(entry.getKey()), entry.getValue()));
        }
    }

    private DataBatch readSample(Path file, Map<String, Object> readOptions,
                                 ColumnNormalizer normalizer) throws IOException {
        FileHandler handler = registry.getHandler(file);
        Integer sampleRows = handler.schemaSampleRows();
        if (sampleRows == null) {
            return firstBatch(handler, file, readOptions, normalizer);
        }

        Map<String, Object> sampling = new LinkedHashMap<>(readOptions);
        sampling.put("nrows", sampleRows);
        try {
            return firstBatch(handler, file, sampling, normalizer);
        } catch (IOException | RuntimeException e) {
            LoggingUtil.debug("Sampled read of " + file.getFileName() + " failed (" + e.getMessage() +
                    "), retrying without a row limit");
            return firstBatch(handler, file, readOptions, normalizer);
        }
    }

    private static DataBatch firstBatch(FileHandler handler, Path file, Map<String, ?> options,
                                        ColumnNormalizer normalizer) throws IOException {
        try (BatchReader reader = handler.read(file, options, normalizer)) {
            return reader.hasNext() ? reader.next() : null;
        }
    }
}
