package com.sysmuse.consolidation.progress;

import com.sysmuse.consolidation.util.LoggingUtil;

import java.time.Duration;

/**
 * Writes progress events to the application log.
 */
public class LoggingProgressReporter implements ProgressReporter {

    private int totalFiles;
    private int filesStarted;
    private long currentRows;

    @Override
    public void startProcessing(int totalFiles) {
        this.totalFiles = totalFiles;
        this.filesStarted = 0;
        LoggingUtil.info("Starting processing of " + totalFiles + " file(s)");
    }

    @Override
    public void startFile(String fileName) {
        filesStarted++;
        currentRows = 0;
        LoggingUtil.info("Processing file " + filesStarted + "/" + totalFiles + ": " + fileName);
    }

    @Override
    public void updateRows(long rowsInBatch, Long estimatedTotal) {
        currentRows += rowsInBatch;
        if (estimatedTotal != null && estimatedTotal > 0) {
            LoggingUtil.debug(String.format("  Processed %,d of ~%,d rows (%.1f%%)",
                    currentRows, estimatedTotal, currentRows * 100.0 / estimatedTotal));
        } else {
            LoggingUtil.debug(String.format("  Processed %,d rows", currentRows));
        }
    }

    @Override
    public void completeFile(long rowsProcessed) {
        LoggingUtil.info(String.format("  Completed: %,d rows processed", rowsProcessed));
    }

    @Override
    public void completeProcessing(long totalRows, Duration processingTime) {
        double seconds = processingTime.toMillis() / 1000.0;
        double rate = seconds > 0 ? totalRows / seconds : 0;
        LoggingUtil.info(String.format("Processing complete: %,d rows in %.2fs (%,.0f rows/sec)",
                totalRows, seconds, rate));
    }

    public int getFilesStarted() {
        return filesStarted;
    }
}
