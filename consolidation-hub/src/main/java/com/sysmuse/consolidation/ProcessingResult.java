package com.sysmuse.consolidation;

import com.sysmuse.consolidation.table.ColumnType;
import com.sysmuse.consolidation.table.DataBatch;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of one consolidation run.
 */
public class ProcessingResult {

    private final int filesProcessed;
    private final long totalRows;
    private final int totalColumns;
    private final Duration processingTime;
    private final String outputFile;
    private final Map<String, ColumnType> schema;
    private final DataBatch data;

    public ProcessingResult(int filesProcessed, long totalRows, int totalColumns, Duration processingTime,
                            String outputFile, Map<String, ColumnType> schema, DataBatch data) {
        this.filesProcessed = filesProcessed;
        this.totalRows = totalRows;
        this.totalColumns = totalColumns;
        this.processingTime = processingTime;
        this.outputFile = outputFile;
        this.schema = schema == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(schema));
        this.data = data;
    }

    /**
     * Result of a run that found nothing to process.
     */
    public static ProcessingResult empty(String outputFile, Duration processingTime) {
        return empty(outputFile, processingTime, null);
    }

    /**
     * Empty result that still carries a (row-less) table, as in-memory runs do.
     */
    public static ProcessingResult empty(String outputFile, Duration processingTime, DataBatch data) {
        return new ProcessingResult(0, 0, data == null ? 0 : data.columnCount(), processingTime, outputFile,
                null, data);
    }

    public int getFilesProcessed() {
        return filesProcessed;
    }

    public long getTotalRows() {
        return totalRows;
    }

    public int getTotalColumns() {
        return totalColumns;
    }

    public Duration getProcessingTime() {
        return processingTime;
    }

    /**
     * Output path as configured, null for console output.
     */
    public String getOutputFile() {
        return outputFile;
    }

    /**
     * Unified schema, null when the run did not need one.
     */
    public Map<String, ColumnType> getSchema() {
        return schema;
    }

    /**
     * Consolidated table; only in-memory runs keep it.
     */
    public DataBatch getData() {
        return data;
    }

    public boolean hasData() {
        return data != null;
    }

    @Override
    public String toString() {
        return "ProcessingResult{filesProcessed=" + filesProcessed +
                ", totalRows=" + totalRows +
                ", totalColumns=" + totalColumns +
                ", processingTime=" + processingTime.toMillis() + "ms" +
                ", outputFile=" + outputFile + "}";
    }
}
