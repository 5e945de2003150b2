package com.sysmuse.consolidation.handler;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads delimited records one at a time, honoring quoted fields.
 * A quoted field may contain the separator, line breaks and doubled quote
 * characters. Blank lines are skipped.
 */
class CsvRecordReader implements Closeable {

    private final Reader reader;
    private final char separator;
    private final char quote;
    private int pushback = -2;
    private boolean firstChar = true;
    private long recordNumber = 0;

    CsvRecordReader(Reader reader, char separator, char quote) {
        this.reader = reader;
        this.separator = separator;
        this.quote = quote;
    }

    /**
     * Next record, or null at end of input.
     */
    List<String> readRecord() throws IOException {
        while (true) {
            int c = read();
            if (c == -1) {
                return null;
            }
            if (c == '\n') {
                continue;
            }
            if (c == '\r') {
                skipLineFeed();
                continue;
            }
            unread(c);
            recordNumber++;
            return parseRecord();
        }
    }

    long getRecordNumber() {
        return recordNumber;
    }

    private List<String> parseRecord() throws IOException {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean wasQuoted = false;

        while (true) {
            int c = read();
            if (c == -1) {
                if (inQuotes) {
                    throw new IOException("Unterminated quoted field in record " + recordNumber);
                }
                fields.add(field.toString());
                return fields;
            }
            char ch = (char) c;

            if (inQuotes) {
                if (ch == quote) {
                    int next = read();
                    if (next == quote) {
                        field.append(quote);
                    } else {
                        inQuotes = false;
                        unread(next);
                    }
                } else {
                    field.append(ch);
                }
                continue;
            }

            if (ch == quote && field.length() == 0 && !wasQuoted) {
                inQuotes = true;
                wasQuoted = true;
            } else if (ch == separator) {
                fields.add(field.toString());
                field.setLength(0);
                wasQuoted = false;
            } else if (ch == '\n') {
                fields.add(field.toString());
                return fields;
            } else if (ch == '\r') {
                skipLineFeed();
                fields.add(field.toString());
                return fields;
            } else {
                field.append(ch);
            }
        }
    }

    private void skipLineFeed() throws IOException {
        int next = read();
        if (next != '\n') {
            unread(next);
        }
    }

    private int read() throws IOException {
        int c;
        if (pushback != -2) {
            c = pushback;
            pushback = -2;
            return c;
        }
        c = reader.read();
        // Drop a UTF-8 byte order mark at the very start
        if (firstChar) {
            firstChar = false;
            if (c == '\uFEFF') {
                c = reader.read();
            }
        }
        return c;
    }

    private void unread(int c) {
        pushback = c;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
