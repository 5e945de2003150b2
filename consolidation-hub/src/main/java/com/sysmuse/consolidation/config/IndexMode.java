package com.sysmuse.consolidation.config;

import com.sysmuse.consolidation.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Synthetic row numbering policy for the output.
 */
public enum IndexMode {
    /** No index column in the output */
    NONE,
    /** Numbering restarts for every input file */
    LOCAL,
    /** One counter for the whole run */
    SEQUENTIAL;

    /**
     * Case-insensitive lookup. Null or blank text means "unset" and yields null.
     */
    public static IndexMode fromString(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid index mode: '" + value + "'. Valid options: " +
                    Arrays.toString(values()).toLowerCase(Locale.ROOT), e);
        }
    }
}
