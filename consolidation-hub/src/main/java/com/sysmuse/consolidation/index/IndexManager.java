package com.sysmuse.consolidation.index;

import com.sysmuse.consolidation.config.IndexMode;
import com.sysmuse.consolidation.table.DataBatch;
import com.sysmuse.consolidation.util.LoggingUtil;

import java.util.*;

/**
 * IndexManager - assigns synthetic row numbers to batches.
 *
 * Numbers are carried in a temporary column while batches travel through the
 * pipeline and moved into the batch's row index right before output. One
 * instance serves exactly one run.
 */
public class IndexManager {

    public static final String TEMP_COLUMN = "__index__";

    private final IndexMode mode;
    private final long startValue;
    private long globalPosition;
    private long filePosition;
    private int fileCount = 0;

    public IndexManager(IndexMode mode, long startValue) {
        this.mode = mode;
        this.startValue = startValue;
        this.globalPosition = startValue;
        this.filePosition = startValue;
    }

    public IndexMode getMode() {
        return mode;
    }

    public long getStartValue() {
        return startValue;
    }

    /**
     * Number of files whose first batch has been seen.
     */
    public int getFileCount() {
        return fileCount;
    }

    public boolean shouldIncludeIndex() {
        return mode != null && mode != IndexMode.NONE;
    }

    /**
     * Attach consecutive numbers to a batch in the temporary column.
     * Without an active mode the batch is returned unchanged.
     */
    public DataBatch processBatch(DataBatch batch, boolean isNewFile) {
        if (!shouldIncludeIndex()) {
            return batch;
        }

        if (isNewFile) {
            fileCount++;
            if (mode == IndexMode.LOCAL) {
                filePosition = startValue;
            }
        }

        long first;
        if (mode == IndexMode.LOCAL) {
            first = filePosition;
            filePosition += batch.size();
        } else {
            first = globalPosition;
            globalPosition += batch.size();
        }

        List<Long> numbers = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            numbers.add(first + i);
        }
        DataBatch result = batch.copy();
        result.dropColumn(TEMP_COLUMN);
        result.setColumn(TEMP_COLUMN, numbers);
        return result;
    }

    /**
     * Move the temporary column of one streamed batch into its row index.
     *
     * @throws IllegalStateException when the batch never went through {@link #processBatch}
     */
    public DataBatch finalizeBatch(DataBatch batch) {
        return finalizeIndex(batch, "Batch");
    }

    /**
     * Move the temporary column of a concatenated table into its row index.
     *
     * @throws IllegalStateException when the table never went through {@link #processBatch}
     */
    public DataBatch finalizeTable(DataBatch table) {
        return finalizeIndex(table, "Table");
    }

    /**
     * Write options with the index flag forced to match the mode. An unset mode
     * leaves the caller's value alone.
     */
    public Map<String, Object> applyWriteOptions(Map<String, ?> writeOptions) {
        Map<String, Object> updated = new LinkedHashMap<>();
        if (writeOptions != null) {
            updated.putAll(writeOptions);
        }
        if (mode != null) {
            Object previous = updated.put("index", mode != IndexMode.NONE);
            if (previous != null && !previous.equals(updated.get("index"))) {
                LoggingUtil.debug("Index mode " + mode + " overrides write option index=" + previous);
            }
        }
        return updated;
    }

    public void resetFileTracking() {
        fileCount = 0;
        globalPosition = startValue;
        filePosition = startValue;
    }

    private DataBatch finalizeIndex(DataBatch batch, String what) {
        if (!shouldIncludeIndex()) {
            return batch;
        }
        if (!batch.hasColumn(TEMP_COLUMN)) {
            throw new IllegalStateException(what + " missing " + TEMP_COLUMN + " column. Call processBatch() first.");
        }
        List<Long> index = new ArrayList<>(batch.size());
        for (Object value : batch.getColumnValues(TEMP_COLUMN)) {
            index.add(((Number) value).longValue());
        }
        DataBatch result = batch.copy();
        result.dropColumn(TEMP_COLUMN);
        result.setRowIndex(index);
        return result;
    }
}
