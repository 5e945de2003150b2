package com.sysmuse.consolidation.service;

import com.sysmuse.consolidation.config.ProcessingConfig;
import com.sysmuse.consolidation.handler.BatchReader;
import com.sysmuse.consolidation.handler.FileHandler;
import com.sysmuse.consolidation.handler.HandlerRegistry;
import com.sysmuse.consolidation.index.IndexManager;
import com.sysmuse.consolidation.normalize.ColumnNormalizer;
import com.sysmuse.consolidation.progress.NullProgressReporter;
import com.sysmuse.consolidation.progress.ProgressReporter;
import com.sysmuse.consolidation.schema.SchemaDetector;
import com.sysmuse.consolidation.table.ColumnType;
import com.sysmuse.consolidation.table.DataBatch;
import com.sysmuse.consolidation.util.LoggingUtil;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * FileProcessor - reads every input file batch by batch and prepares each batch
 * for output: provenance tagging, column normalization, alignment to the run's
 * columns and index numbering.
 *
 * A file that fails to open or to read is logged and skipped. When streaming, batches
 * it produced before the failure have already been handed out; the in-memory path
 * holds a file's batches back until the file is read to the end, so a failed file
 * contributes no rows.
 */
public class FileProcessor {

    private final HandlerRegistry registry;
    private ProgressReporter progressReporter = new NullProgressReporter();

    public FileProcessor(HandlerRegistry registry) {
        this.registry = registry;
    }

    public void setProgressReporter(ProgressReporter progressReporter) {
        this.progressReporter = progressReporter == null ? new NullProgressReporter() : progressReporter;
    }

    /**
     * Lazily produce processed batches, reading a file only when the previous one is used up.
     *
     * @param schema run schema every batch is aligned to; null leaves columns as read
     */
    public Iterator<DataBatch> processFilesStreaming(ProcessingConfig config, List<Path> files,
                                                     Map<String, ColumnType> schema, IndexManager indexManager) {
        return new ProcessedBatchIterator(config, files, targetColumns(config, schema), indexManager, false);
    }

    public Iterator<DataBatch> processFilesStreaming(ProcessingConfig config, Map<String, ColumnType> schema,
                                                     IndexManager indexManager) {
        return processFilesStreaming(config, FileDiscovery.listFiles(config), schema, indexManager);
    }

    /**
     * Process every file and collect all batches. Only files read to the end contribute.
     */
    public List<DataBatch> processFilesInMemory(ProcessingConfig config, List<Path> files,
                                                Map<String, ColumnType> schema, IndexManager indexManager) {
        List<DataBatch> batches = new ArrayList<>();
        Iterator<DataBatch> iterator =
                new ProcessedBatchIterator(config, files, targetColumns(config, schema), indexManager, true);
        while (iterator.hasNext()) {
            batches.add(iterator.next());
        }
        return batches;
    }

    public List<DataBatch> processFilesInMemory(ProcessingConfig config, Map<String, ColumnType> schema,
                                                IndexManager indexManager) {
        return processFilesInMemory(config, FileDiscovery.listFiles(config), schema, indexManager);
    }

    private static List<String> targetColumns(ProcessingConfig config, Map<String, ColumnType> schema) {
        if (schema != null) {
            return new ArrayList<>(schema.keySet());
        }
        if (config.hasColumns()) {
            return config.getColumns();
        }
        return null;
    }

    /**
     * Walks the files, one open reader at a time. With {@code wholeFiles} a file's
     * batches are released only once the file has been read completely, and index
     * numbers are assigned at that point.
     */
    private class ProcessedBatchIterator implements Iterator<DataBatch> {
        private final ProcessingConfig config;
        private final Iterator<Path> files;
        private final List<String> targetColumns;
        private final IndexManager indexManager;
        private final ColumnNormalizer normalizer;
        private final boolean wholeFiles;
        private final List<DataBatch> fileBuffer = new ArrayList<>();
        private final Deque<DataBatch> pending = new ArrayDeque<>();

        private Path currentFile;
        private String currentSource;
        private BatchReader currentReader;
        private boolean firstBatchOfFile;
        private long rowsInFile;

        ProcessedBatchIterator(ProcessingConfig config, List<Path> files, List<String> targetColumns,
                               IndexManager indexManager, boolean wholeFiles) {
            this.config = config;
            this.files = files.iterator();
            this.targetColumns = targetColumns;
            this.indexManager = indexManager;
            this.normalizer = ColumnNormalizer.forConfig(config);
            this.wholeFiles = wholeFiles;
        }

        @Override
        public boolean hasNext() {
            while (pending.isEmpty()) {
                if (currentReader == null && !openNextFile()) {
                    return false;
                }
                if (currentReader == null) {
                    continue;
                }
                try {
                    if (currentReader.hasNext()) {
                        DataBatch batch = prepare(currentReader.next());
                        rowsInFile += batch.size();
                        progressReporter.updateRows(batch.size(), null);
                        if (wholeFiles) {
                            fileBuffer.add(batch);
                        } else {
                            pending.add(assignIndex(batch));
                        }
                    } else {
                        releaseFileBuffer();
                        progressReporter.completeFile(rowsInFile);
                        closeCurrent();
                    }
                } catch (RuntimeException e) {
                    if (!fileBuffer.isEmpty()) {
                        LoggingUtil.warn("Discarding " + fileBuffer.size() + " batch(es) read from " +
                                currentFile.getFileName());
                    }
                    LoggingUtil.error("Failed to process file " + currentFile.getFileName() + ": " + e.getMessage(), e);
                    fileBuffer.clear();
                    closeCurrent();
                }
            }
            return true;
        }

        @Override
        public DataBatch next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pending.poll();
        }

        /**
         * @return false when there are no files left
         */
        private boolean openNextFile() {
            if (!files.hasNext()) {
                return false;
            }
            currentFile = files.next();
            currentSource = FileDiscovery.sourceFilePath(config.getInputFolder(), currentFile);
            firstBatchOfFile = true;
            rowsInFile = 0;

            LoggingUtil.info("Processing file: " + currentSource);
            progressReporter.startFile(currentFile.getFileName().toString());
            try {
                FileHandler handler = registry.getHandler(currentFile);
                currentReader = handler.read(currentFile, config.getReadOptions(), normalizer);
            } catch (IOException | RuntimeException e) {
                LoggingUtil.error("Failed to process file " + currentFile.getFileName() + ": " + e.getMessage(), e);
                currentReader = null;
            }
            return true;
        }

        private DataBatch prepare(DataBatch raw) {
            raw.setConstant(SchemaDetector.SOURCE_FILE, currentSource);
            DataBatch batch = normalizer.normalize(raw);
            if (targetColumns != null) {
                batch = batch.reindex(targetColumns);
            }
            return batch;
        }

        private DataBatch assignIndex(DataBatch batch) {
            DataBatch indexed = indexManager.processBatch(batch, firstBatchOfFile);
            firstBatchOfFile = false;
            return indexed;
        }

        private void releaseFileBuffer() {
            List<DataBatch> indexed = new ArrayList<>(fileBuffer.size());
            for (DataBatch batch : fileBuffer) {
                indexed.add(assignIndex(batch));
            }
            fileBuffer.clear();
            pending.addAll(indexed);
        }

        private void closeCurrent() {
            if (currentReader != null) {
                try {
                    currentReader.close();
                } catch (IOException e) {
                    LoggingUtil.warn("Failed to close " + currentFile + ": " + e.getMessage());
                }
            }
            currentReader = null;
        }
    }
}
