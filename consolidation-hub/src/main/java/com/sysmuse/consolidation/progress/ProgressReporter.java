package com.sysmuse.consolidation.progress;

import java.time.Duration;

/**
 * Observer of a consolidation run. Called synchronously at file and batch
 * boundaries; implementations must return quickly and must not touch the run.
 */
public interface ProgressReporter {

    void startProcessing(int totalFiles);

    void startFile(String fileName);

    /**
     * @param rowsInBatch    rows in the batch just read
     * @param estimatedTotal expected rows of the current file, null when unknown
     */
    void updateRows(long rowsInBatch, Long estimatedTotal);

    void completeFile(long rowsProcessed);

    void completeProcessing(long totalRows, Duration processingTime);
}
