package com.sysmuse.consolidation.normalize;

import com.sysmuse.consolidation.config.ProcessingConfig;
import com.sysmuse.consolidation.table.DataBatch;
import com.sysmuse.consolidation.util.LoggingUtil;

import java.util.*;
import java.util.function.Function;

/**
 * ColumnNormalizer - renames columns to one convention, folds aliases onto their
 * standard names and splits a full-name column into first and last name.
 *
 * Every operation returns a new batch; the input is left untouched.
 */
public class ColumnNormalizer {

    public static final String NAME = "name";
    public static final String FIRST_NAME = "first_name";
    public static final String LAST_NAME = "last_name";
    public static final String SHEET_NAME = "sheet_name";

    private final Map<String, List<String>> schemaMap;
    private final boolean toLower;
    private final boolean spacesToUnderscores;

    /**
     * Default rule: lower-case, spaces to underscores, no aliases.
     */
    public ColumnNormalizer() {
        this(null, true, true);
    }

    public ColumnNormalizer(Map<String, List<String>> schemaMap, boolean toLower, boolean spacesToUnderscores) {
        this.schemaMap = schemaMap == null ? Collections.emptyMap() : schemaMap;
        this.toLower = toLower;
        this.spacesToUnderscores = spacesToUnderscores;
    }

    public static ColumnNormalizer forConfig(ProcessingConfig config) {
        return new ColumnNormalizer(config.getSchemaMap(), config.isToLower(), config.isSpacesToUnderscores());
    }

    /**
     * Apply the configured casing and separator rule to one column name.
     */
    public String normalizeName(String name) {
        String result = name;
        if (toLower) {
            result = result.toLowerCase(Locale.ROOT);
        }
        if (spacesToUnderscores) {
            result = result.replace(' ', '_');
        }
        return result;
    }

    public List<String> normalizeNames(List<String> names) {
        List<String> result = new ArrayList<>(names.size());
        for (String name : names) {
            result.add(normalizeName(name));
        }
        return result;
    }

    public DataBatch normalize(DataBatch batch) {
        // Casing and separator rule
        DataBatch result = renameAll(batch, this::normalizeName);

        // Aliases onto standard names
        if (!schemaMap.isEmpty()) {
            Map<String, String> aliases = new HashMap<>();
            for (Map.Entry<String, List<String>> entry : schemaMap.entrySet()) {
                for (String alias : entry.getValue()) {
                    aliases.put(normalizeName(alias), entry.getKey());
                }
            }
            result = renameAll(result, column -> aliases.getOrDefault(column, column));
        }

        splitFullName(result);
        return result;
    }

    /**
     * Normalize each sheet, tag its rows with the sheet name and concatenate.
     */
    public DataBatch mergeBatches(Map<String, DataBatch> sheets) {
        List<DataBatch> normalized = new ArrayList<>();
        for (Map.Entry<String, DataBatch> sheet : sheets.entrySet()) {
            DataBatch batch = normalize(sheet.getValue());
            batch.setConstant(SHEET_NAME, sheet.getKey());
            normalized.add(batch);
        }
        return DataBatch.concat(normalized);
    }

    /**
     * Normalize each batch and concatenate, without provenance tagging.
     */
    public DataBatch mergeBatches(List<DataBatch> batches) {
        List<DataBatch> normalized = new ArrayList<>();
        for (DataBatch batch : batches) {
            normalized.add(normalize(batch));
        }
        return DataBatch.concat(normalized);
    }

    private void splitFullName(DataBatch batch) {
        if (!batch.hasColumn(NAME)) {
            return;
        }
        int namePosition = batch.getColumns().indexOf(NAME);

        List<Object> firstNames = new ArrayList<>(batch.size());
        List<Object> lastNames = new ArrayList<>(batch.size());
        for (Object value : batch.getColumnValues(NAME)) {
            if (value == null) {
                firstNames.add(null);
                lastNames.add(null);
                continue;
            }
            String fullName = value.toString();
            int space = fullName.indexOf(' ');
            if (space < 0) {
                firstNames.add(fullName);
                lastNames.add(null);
            } else {
                firstNames.add(fullName.substring(0, space));
                lastNames.add(fullName.substring(space + 1));
            }
        }

        // Existing columns win as a whole, even where their values are null
        String firstName = normalizeName(FIRST_NAME);
        String lastName = normalizeName(LAST_NAME);
        if (!batch.hasColumn(firstName)) {
            batch.insertColumn(namePosition + 1, firstName, firstNames);
        }
        if (!batch.hasColumn(lastName)) {
            batch.insertColumn(namePosition + 2, lastName, lastNames);
        }
        batch.dropColumn(NAME);
    }

    /**
     * Rebuild the batch under new column names. When two columns land on the same
     * name the first one in column order is kept.
     */
    private static DataBatch renameAll(DataBatch batch, Function<String, String> rule) {
        Map<String, String> sourceByTarget = new LinkedHashMap<>();
        for (String column : batch.getColumns()) {
            String target = rule.apply(column);
            if (sourceByTarget.containsKey(target)) {
                LoggingUtil.warn("Column '" + column + "' normalizes to '" + target +
                        "' which is already taken by '" + sourceByTarget.get(target) + "', dropping it");
                continue;
            }
            sourceByTarget.put(target, column);
        }

        DataBatch result = new DataBatch(new ArrayList<>(sourceByTarget.keySet()));
        for (Map<String, Object> row : batch.getRows()) {
            Map<String, Object> values = new HashMap<>();
            for (Map.Entry<String, String> entry : sourceByTarget.entrySet()) {
                values.put(entry.getKey(), row.get(entry.getValue()));
            }
            result.addRow(values);
        }
        if (batch.hasRowIndex()) {
            result.setRowIndex(batch.getRowIndex());
        }
        return result;
    }
}
