package com.sysmuse.consolidation.table;

import java.time.temporal.Temporal;

/**
 * Column types of a unified schema, ordered from most to least permissive.
 * Merging two observed types keeps the more permissive one.
 */
public enum ColumnType {
    OBJECT("object", 0),
    FLOAT("float", 1),
    INTEGER("integer", 2),
    BOOLEAN("boolean", 3),
    DATETIME("datetime", 4);

    private final String tag;
    private final int rank;

    ColumnType(String tag, int rank) {
        this.tag = tag;
        this.rank = rank;
    }

    public String getTag() {
        return tag;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Resolve a type tag, case-insensitive. Unrecognized or null tags resolve to OBJECT.
     */
    public static ColumnType fromTag(String tag) {
        if (tag != null) {
            for (ColumnType type : values()) {
                if (type.tag.equalsIgnoreCase(tag.trim())) {
                    return type;
                }
            }
        }
        return OBJECT;
    }

    /**
     * Merge an existing column type with a newly observed one.
     * A null existing type means the column has not been seen yet.
     */
    public static ColumnType merge(ColumnType existing, ColumnType observed) {
        if (existing == null) {
            return observed;
        }
        if (observed == null) {
            return existing;
        }
        return existing.rank <= observed.rank ? existing : observed;
    }

    /**
     * Tag-level merge, for callers holding raw tags.
     */
    public static String merge(String existingTag, String observedTag) {
        if (existingTag == null) {
            return observedTag;
        }
        return merge(fromTag(existingTag), fromTag(observedTag)).tag;
    }

    /**
     * Type of a single cell value; null for a missing value.
     */
    public static ColumnType ofValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return INTEGER;
        }
        if (value instanceof Number) {
            return FLOAT;
        }
        if (value instanceof Temporal) {
            return DATETIME;
        }
        return OBJECT;
    }

    /**
     * Type of a column of values: the merge of all non-null value types,
     * OBJECT when every value is missing.
     */
    public static ColumnType ofValues(Iterable<?> values) {
        ColumnType result = null;
        for (Object value : values) {
            result = merge(result, ofValue(value));
            if (result == OBJECT) {
                break;
            }
        }
        return result == null ? OBJECT : result;
    }

    @Override
    public String toString() {
        return tag;
    }
}
