package com.sysmuse.consolidation.service;

import com.sysmuse.consolidation.handler.FileHandler;
import com.sysmuse.consolidation.index.IndexManager;
import com.sysmuse.consolidation.table.DataBatch;
import com.sysmuse.consolidation.util.LoggingUtil;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OutputWriter - writes processed batches to a file through a handler, or to the
 * console when no output file is configured.
 */
public class OutputWriter {

    private final PrintStream console;
    private final TextTableRenderer renderer = new TextTableRenderer();

    public OutputWriter() {
        this(System.out);
    }

    public OutputWriter(PrintStream console) {
        this.console = console;
    }

    /**
     * Write batches as they arrive. The first batch creates the file with a header;
     * every later batch is appended without one.
     *
     * @return total rows written
     */
    public long writeStreaming(Iterator<DataBatch> batches, Path outputFile, FileHandler handler,
                               Map<String, ?> writeOptions, IndexManager indexManager) throws IOException {
        Map<String, Object> options = new LinkedHashMap<>(writeOptions);
        options.put("mode", "w");
        options.put("header", true);
        boolean toFile = handler != null && outputFile != null;
        if (toFile) {
            createParentDirectories(outputFile);
        }

        long totalRows = 0;
        while (batches.hasNext()) {
            DataBatch batch = indexManager.finalizeBatch(batches.next());
            if (toFile) {
                writeToFile(batch, outputFile, handler, options);
                options.put("mode", "a");
                options.put("header", false);
            } else {
                writeToConsole(batch, options);
            }
            totalRows += batch.size();
        }

        if (toFile) {
            LoggingUtil.info("Streaming output complete: " + totalRows + " rows written to " + outputFile);
        }
        return totalRows;
    }

    /**
     * Write a complete table in one go. An empty table is not written.
     *
     * @return the table as written, with index handling applied; an empty table is returned as given
     */
    public DataBatch writeCompleteDataset(DataBatch table, Path outputFile, FileHandler handler,
                                     Map<String, ?> writeOptions, IndexManager indexManager) throws IOException {
        if (table.isEmpty()) {
            LoggingUtil.warn("No data to write - empty dataset");
            return table;
        }

        DataBatch finalTable = indexManager.finalizeTable(table);
        if (handler != null && outputFile != null) {
            createParentDirectories(outputFile);
            writeToFile(finalTable, outputFile, handler, writeOptions);
            LoggingUtil.info("Batch output complete: " + finalTable.size() + " rows, " +
                    finalTable.columnCount() + " columns written to " + outputFile);
        } else {
            writeToConsole(finalTable, writeOptions);
        }
        return finalTable;
    }

    private void writeToFile(DataBatch batch, Path outputFile, FileHandler handler,
                             Map<String, ?> options) throws IOException {
        try {
            handler.write(batch, outputFile, options);
        } catch (IOException | RuntimeException e) {
            LoggingUtil.error("Failed to write " + batch.size() + " rows to " + outputFile + ": " + e.getMessage(), e);
            throw e;
        }
    }

    private void writeToConsole(DataBatch batch, Map<String, ?> options) {
        Object index = options.get("index");
        boolean includeIndex = index instanceof Boolean ? (Boolean) index : Boolean.parseBoolean(String.valueOf(index));
        console.println(renderer.render(batch, includeIndex));
    }

    private static void createParentDirectories(Path outputFile) throws IOException {
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            Files.createDirectories(parent);
        }
    }
}
