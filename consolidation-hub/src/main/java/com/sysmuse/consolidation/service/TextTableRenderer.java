package com.sysmuse.consolidation.service;

import com.sysmuse.consolidation.table.DataBatch;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders a batch as a plain text table with right-aligned columns.
 */
public class TextTableRenderer {

    public static final String NULL_TEXT = "NaN";

    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public String render(DataBatch batch, boolean includeIndex) {
        List<String> columns = batch.getColumns();
        if (batch.isEmpty()) {
            return "Empty DataBatch\nColumns: " + columns;
        }

        int cellCount = columns.size() + (includeIndex ? 1 : 0);
        List<String[]> lines = new ArrayList<>();

        String[] header = new String[cellCount];
        int offset = 0;
        if (includeIndex) {
            header[0] = "";
            offset = 1;
        }
        for (int c = 0; c < columns.size(); c++) {
            header[c + offset] = columns.get(c);
        }
        lines.add(header);

        List<Map<String, Object>> rows = batch.getRows();
        List<Long> index = batch.getRowIndex();
        for (int r = 0; r < rows.size(); r++) {
            String[] line = new String[cellCount];
            if (includeIndex) {
                line[0] = String.valueOf(index != null ? index.get(r) : r);
            }
            for (int c = 0; c < columns.size(); c++) {
                line[c + offset] = text(rows.get(r).get(columns.get(c)));
            }
            lines.add(line);
        }

        int[] widths = new int[cellCount];
        for (String[] line : lines) {
            for (int c = 0; c < cellCount; c++) {
                widths[c] = Math.max(widths[c], line[c].length());
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int l = 0; l < lines.size(); l++) {
            if (l > 0) {
                sb.append('\n');
            }
            String[] line = lines.get(l);
            for (int c = 0; c < cellCount; c++) {
                if (c > 0) {
                    sb.append("  ");
                }
                sb.append(pad(line[c], widths[c]));
            }
        }
        return sb.toString();
    }

    private static String text(Object value) {
        if (value == null) {
            return NULL_TEXT;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(DATE_TIME_FORMAT);
        }
        return value.toString().replace("\n", "\\n");
    }

    private static String pad(String value, int width) {
        StringBuilder sb = new StringBuilder(width);
        for (int i = value.length(); i < width; i++) {
            sb.append(' ');
        }
        return sb.append(value).toString();
    }
}
