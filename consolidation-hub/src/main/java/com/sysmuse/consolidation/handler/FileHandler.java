package com.sysmuse.consolidation.handler;

import com.sysmuse.consolidation.normalize.ColumnNormalizer;
import com.sysmuse.consolidation.table.DataBatch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Read/write contract shared by every supported file format.
 *
 * Options are passed as one shared name/value map; each handler keeps only the
 * names it understands and silently ignores the rest.
 */
public interface FileHandler {

    enum Mode {
        READ,
        WRITE
    }

    /**
     * Lower-case extension without dot, e.g. "csv".
     */
    String extension();

    /**
     * True when the format supports appending batches to an existing file.
     */
    boolean isStreamable();

    /**
     * Rows to read when sampling a file for its schema; null reads the whole file.
     */
    Integer schemaSampleRows();

    /**
     * Open a file as a lazy sequence of batches. The caller closes the reader.
     *
     * @param normalizer rule applied to each sheet before sheets are merged; formats
     *                   without sheets ignore it
     */
    BatchReader read(Path path, Map<String, ?> options, ColumnNormalizer normalizer) throws IOException;

    /**
     * Read with the default column naming rule.
     */
    default BatchReader read(Path path, Map<String, ?> options) throws IOException {
        return read(path, options, new ColumnNormalizer());
    }

    /**
     * Write one batch or a complete table.
     */
    void write(DataBatch batch, Path path, Map<String, ?> options) throws IOException;

    /**
     * Keep only the options this handler accepts for the given mode.
     */
    Map<String, Object> filterOptions(Map<String, ?> options, Mode mode);
}
