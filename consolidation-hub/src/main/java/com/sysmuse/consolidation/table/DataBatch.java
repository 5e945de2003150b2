package com.sysmuse.consolidation.table;

import java.util.*;

/**
 * DataBatch - rectangular collection of rows sharing one ordered column list.
 * Serves both as the streaming unit (one chunk of a file) and as the full table
 * of a run once batches are concatenated.
 *
 * Column order lives in the column list; each row maps column name to value and
 * always holds a key for every column (null for a missing cell).
 */
public class DataBatch {

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    // Finalized row identifiers, null until an index has been applied
    private List<Long> rowIndex;

    public DataBatch() {
        this(new ArrayList<>());
    }

    public DataBatch(List<String> columns) {
        this.columns = new ArrayList<>(columns);
        this.rows = new ArrayList<>();
        if (new HashSet<>(columns).size() != columns.size()) {
            throw new IllegalArgumentException("Duplicate column names: " + columns);
        }
    }

    /**
     * Build a batch from row maps. Columns are the union of row keys in encounter order.
     */
    public static DataBatch fromRows(List<? extends Map<String, ?>> rowMaps) {
        LinkedHashSet<String> names = new LinkedHashSet<>();
        for (Map<String, ?> row : rowMaps) {
            names.addAll(row.keySet());
        }
        DataBatch batch = new DataBatch(new ArrayList<>(names));
        for (Map<String, ?> row : rowMaps) {
            batch.addRow(row);
        }
        return batch;
    }

    /**
     * Concatenate batches. Columns are unioned in encounter order and gaps filled
     * with null; row indexes are kept only when every batch carries one.
     */
    public static DataBatch concat(List<DataBatch> batches) {
        LinkedHashSet<String> names = new LinkedHashSet<>();
        boolean allIndexed = !batches.isEmpty();
        for (DataBatch batch : batches) {
            names.addAll(batch.columns);
            allIndexed &= batch.rowIndex != null;
        }
        DataBatch result = new DataBatch(new ArrayList<>(names));
        List<Long> index = allIndexed ? new ArrayList<>() : null;
        for (DataBatch batch : batches) {
            for (Map<String, Object> row : batch.rows) {
                result.addRow(row);
            }
            if (index != null) {
                index.addAll(batch.rowIndex);
            }
        }
        result.rowIndex = index;
        return result;
    }

    public List<String> getColumns() {
        return Collections.unmodifiableList(columns);
    }

    public List<Map<String, Object>> getRows() {
        return Collections.unmodifiableList(rows);
    }

    public int size() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String name) {
        return columns.contains(name);
    }

    /**
     * Append a row. Keys outside the column list are ignored.
     */
    public void addRow(Map<String, ?> values) {
        Map<String, Object> row = new HashMap<>(columns.size() * 2);
        for (String column : columns) {
            row.put(column, values.get(column));
        }
        rows.add(row);
        rowIndex = null;
    }

    public Object getValue(int row, String column) {
        return rows.get(row).get(column);
    }

    public List<Object> getColumnValues(String column) {
        if (!columns.contains(column)) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * Set a column's values, appending the column at the end when it is new.
     */
    public void setColumn(String name, List<?> values) {
        if (columns.contains(name)) {
            fill(name, values);
        } else {
            insertColumn(columns.size(), name, values);
        }
    }

    /**
     * Set every row of a column to one value, appending the column when it is new.
     */
    public void setConstant(String name, Object value) {
        if (!columns.contains(name)) {
            columns.add(name);
        }
        for (Map<String, Object> row : rows) {
            row.put(name, value);
        }
    }

    public void insertColumn(int position, String name, List<?> values) {
        if (columns.contains(name)) {
            throw new IllegalArgumentException("Column already exists: " + name);
        }
        columns.add(Math.max(0, Math.min(position, columns.size())), name);
        fill(name, values);
    }

    public void dropColumn(String name) {
        if (columns.remove(name)) {
            for (Map<String, Object> row : rows) {
                row.remove(name);
            }
        }
    }

    public void renameColumn(String from, String to) {
        if (from.equals(to)) {
            return;
        }
        int position = columns.indexOf(from);
        if (position < 0) {
            throw new IllegalArgumentException("Unknown column: " + from);
        }
        if (columns.contains(to)) {
            throw new IllegalArgumentException("Column already exists: " + to);
        }
        columns.set(position, to);
        for (Map<String, Object> row : rows) {
            row.put(to, row.remove(from));
        }
    }

    /**
     * Conform to a target column list: columns not in the target are dropped and
     * target columns missing here are added empty.
     */
    public DataBatch reindex(Collection<String> target) {
        DataBatch result = new DataBatch(new ArrayList<>(target));
        for (Map<String, Object> row : rows) {
            result.addRow(row);
        }
        result.rowIndex = rowIndex == null ? null : new ArrayList<>(rowIndex);
        return result;
    }

    public DataBatch copy() {
        DataBatch result = new DataBatch(columns);
        for (Map<String, Object> row : rows) {
            result.rows.add(new HashMap<>(row));
        }
        result.rowIndex = rowIndex == null ? null : new ArrayList<>(rowIndex);
        return result;
    }

    /**
     * First {@code count} rows as a new batch.
     */
    public DataBatch head(int count) {
        DataBatch result = new DataBatch(columns);
        for (int i = 0; i < Math.min(count, rows.size()); i++) {
            result.rows.add(new HashMap<>(rows.get(i)));
        }
        if (rowIndex != null) {
            result.rowIndex = new ArrayList<>(rowIndex.subList(0, result.rows.size()));
        }
        return result;
    }

    public List<Long> getRowIndex() {
        return rowIndex == null ? null : Collections.unmodifiableList(rowIndex);
    }

    public boolean hasRowIndex() {
        return rowIndex != null;
    }

    public void setRowIndex(List<Long> index) {
        if (index != null && index.size() != rows.size()) {
            throw new IllegalArgumentException("Index length " + index.size() +
                    " does not match row count " + rows.size());
        }
        this.rowIndex = index == null ? null : new ArrayList<>(index);
    }

    private void fill(String name, List<?> values) {
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException("Column '" + name + "' has " + values.size() +
                    " values for " + rows.size() + " rows");
        }
        for (int i = 0; i < rows.size(); i++) {
            rows.get(i).put(name, values.get(i));
        }
    }

    @Override
    public String toString() {
        return "DataBatch{columns=" + columns + ", rows=" + rows.size() + "}";
    }
}
