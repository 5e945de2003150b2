package com.sysmuse.consolidation.progress;

import java.time.Duration;

/**
 * Reporter that ignores every event. Default for runs nobody is watching.
 */
public class NullProgressReporter implements ProgressReporter {

    @Override
    public void startProcessing(int totalFiles) {
    }

    @Override
    public void startFile(String fileName) {
    }

    @Override
    public void updateRows(long rowsInBatch, Long estimatedTotal) {
    }

    @Override
    public void completeFile(long rowsProcessed) {
    }

    @Override
    public void completeProcessing(long totalRows, Duration processingTime) {
    }
}
