package com.sysmuse.consolidation.handler;

import com.sysmuse.consolidation.normalize.ColumnNormalizer;
import com.sysmuse.consolidation.table.DataBatch;
import com.sysmuse.consolidation.table.ValueParser;
import com.sysmuse.consolidation.util.LoggingUtil;

import java.io.*;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * CsvHandler - delimited text. The only streamable format: batches can be
 * appended to an existing file.
 */
public class CsvHandler extends AbstractFileHandler {

    public static final int DEFAULT_CHUNK_SIZE = 10000;

    private static final Set<String> READ_OPTIONS = new HashSet<>(Arrays.asList(
            "sep", "delimiter", "encoding", "nrows", "chunksize", "skiprows", "na_values", "quotechar", "dtype"));
    private static final Set<String> WRITE_OPTIONS = new HashSet<>(Arrays.asList(
            "sep", "encoding", "na_rep", "index", "index_label", "header", "mode", "quotechar", "date_format"));

    public CsvHandler() {
        super("csv", READ_OPTIONS, WRITE_OPTIONS);
    }

    @Override
    public boolean isStreamable() {
        return true;
    }

    @Override
    public Integer schemaSampleRows() {
        return 2;
    }

    @Override
    public BatchReader read(Path path, Map<String, ?> options, ColumnNormalizer normalizer) throws IOException {
        Map<String, Object> readOptions = filterOptions(options, Mode.READ);
        LoggingUtil.debug("Reading CSV file: " + path);

        char separator = separatorOption(readOptions);
        char quote = quoteOption(readOptions);
        int chunkSize = intOption(readOptions, "chunksize", DEFAULT_CHUNK_SIZE);
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunksize must be positive, got " + chunkSize);
        }
        Integer maxRows = intOption(readOptions, "nrows", null);
        int skipRows = intOption(readOptions, "skiprows", 0);
        Charset charset = charsetOption(readOptions);

        BufferedReader reader = Files.newBufferedReader(path, charset);
        CsvRecordReader records = new CsvRecordReader(reader, separator, quote);
        try {
            for (int i = 0; i < skipRows; i++) {
                if (records.readRecord() == null) {
                    break;
                }
            }
            List<String> header = records.readRecord();
            if (header == null) {
                LoggingUtil.warn("Empty CSV file: " + path);
                records.close();
                return BatchReader.empty();
            }
            return new CsvBatchReader(path, records, headerNames(header), parserFor(readOptions), chunkSize, maxRows);
        } catch (IOException | RuntimeException e) {
            records.close();
            throw e;
        }
    }

    @Override
    public void write(DataBatch batch, Path path, Map<String, ?> options) throws IOException {
        Map<String, Object> writeOptions = filterOptions(options, Mode.WRITE);

        String separator = String.valueOf(separatorOption(writeOptions));
        char quote = quoteOption(writeOptions);
        String naRep = stringOption(writeOptions, "na_rep", "");
        boolean header = booleanOption(writeOptions, "header", true);
        boolean index = includeIndex(writeOptions);
        String mode = stringOption(writeOptions, "mode", "w");
        DateTimeFormatter dateFormat = dateFormatOption(writeOptions);

        OpenOption[] openOptions = "a".equals(mode)
                ? new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.APPEND}
                : new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE};

        try (BufferedWriter writer = Files.newBufferedWriter(path, charsetOption(writeOptions), openOptions)) {
            List<String> columns = batch.getColumns();
            if (header) {
                List<String> cells = new ArrayList<>();
                if (index) {
                    cells.add(escape(indexLabel(writeOptions), separator, quote));
                }
                for (String column : columns) {
                    cells.add(escape(column, separator, quote));
                }
                writer.write(String.join(separator, cells));
                writer.newLine();
            }

            List<Map<String, Object>> rows = batch.getRows();
            for (int r = 0; r < rows.size(); r++) {
                Map<String, Object> row = rows.get(r);
                List<String> cells = new ArrayList<>();
                if (index) {
                    cells.add(String.valueOf(indexValue(batch, r)));
                }
                for (String column : columns) {
                    cells.add(escape(formatValue(row.get(column), naRep, dateFormat), separator, quote));
                }
                writer.write(String.join(separator, cells));
                writer.newLine();
            }
        }
        LoggingUtil.debug("Wrote " + batch.size() + " rows to " + path + " (mode=" + mode + ", header=" + header + ")");
    }

    /**
     * Quote a value when it contains the separator, the quote character or a line break.
     */
    static String escape(String value, String separator, char quote) {
        boolean needsQuoting = value.contains(separator) ||
                value.indexOf(quote) >= 0 ||
                value.contains("\n") ||
                value.contains("\r");
        if (!needsQuoting) {
            return value;
        }
        String q = String.valueOf(quote);
        return q + value.replace(q, q + q) + q;
    }

    private static char separatorOption(Map<String, ?> options) {
        Object value = options.get("sep");
        if (value == null) {
            value = options.get("delimiter");
        }
        if (value == null) {
            return ',';
        }
        String text = value.toString();
        if (text.equals("\\t")) {
            return '\t';
        }
        if (text.length() != 1) {
            throw new IllegalArgumentException("Separator must be a single character, got: '" + text + "'");
        }
        return text.charAt(0);
    }

    private static char quoteOption(Map<String, ?> options) {
        String text = stringOption(options, "quotechar", "\"");
        if (text.length() != 1) {
            throw new IllegalArgumentException("quotechar must be a single character, got: '" + text + "'");
        }
        return text.charAt(0);
    }

    /**
     * Lazily turns records into batches of at most chunkSize rows.
     */
    private static class CsvBatchReader implements BatchReader {
        private final Path path;
        private final CsvRecordReader records;
        private final List<String> columns;
        private final ValueParser parser;
        private final int chunkSize;
        private final Integer maxRows;
        private long rowsRead = 0;
        private DataBatch pending;
        private boolean exhausted = false;

        CsvBatchReader(Path path, CsvRecordReader records, List<String> columns,
                       ValueParser parser, int chunkSize, Integer maxRows) {
            this.path = path;
            this.records = records;
            this.columns = columns;
            this.parser = parser;
            this.chunkSize = chunkSize;
            this.maxRows = maxRows;
        }

        @Override
        public boolean hasNext() {
            if (pending == null && !exhausted) {
                try {
                    pending = readChunk();
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed reading " + path, e);
                }
            }
            return pending != null;
        }

        @Override
        public DataBatch next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            DataBatch batch = pending;
            pending = null;
            return batch;
        }

        private DataBatch readChunk() throws IOException {
            DataBatch batch = new DataBatch(columns);
            Map<String, Object> values = new HashMap<>();
            while (batch.size() < chunkSize && (maxRows == null || rowsRead < maxRows)) {
                List<String> record = records.readRecord();
                if (record == null) {
                    break;
                }
                if (record.size() > columns.size()) {
                    LoggingUtil.warn("Record " + records.getRecordNumber() + " in " + path + " has " +
                            record.size() + " fields, expected " + columns.size() + "; extra fields dropped");
                }
                values.clear();
                for (int i = 0; i < columns.size(); i++) {
                    values.put(columns.get(i), i < record.size() ? parser.parse(record.get(i)) : null);
                }
                batch.addRow(values);
                rowsRead++;
            }
            if (batch.isEmpty()) {
                exhausted = true;
                close();
                return null;
            }
            return batch;
        }

        @Override
        public void close() {
            exhausted = true;
            try {
                records.close();
            } catch (IOException e) {
                LoggingUtil.warn("Failed to close " + path + ": " + e.getMessage());
            }
        }
    }
}
