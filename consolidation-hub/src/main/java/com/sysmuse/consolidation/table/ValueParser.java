package com.sysmuse.consolidation.table;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Converts raw text cells into typed values.
 * Detection order: null markers, boolean, integer, float, datetime, date, text.
 */
public class ValueParser {

    /**
     * Markers read as a missing value, in addition to the empty string.
     */
    public static final Set<String> DEFAULT_NA_VALUES = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "NA", "N/A", "n/a", "NaN", "nan", "NULL", "null", "None", "#N/A"
    )));

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = compile(
            "yyyy-MM-dd HH:mm:ss",
            "yyyy-MM-dd'T'HH:mm:ss",
            "yyyy-MM-dd HH:mm:ss.SSS",
            "yyyy-MM-dd'T'HH:mm:ss.SSS",
            "yyyy-MM-dd'T'HH:mm:ss.SSSSSS",
            "yyyy-MM-dd HH:mm",
            "yyyy-MM-dd'T'HH:mm",
            "MM/dd/yyyy HH:mm:ss",
            "M/d/yyyy H:mm:ss",
            "MM/dd/yyyy HH:mm",
            "M/d/yyyy H:mm",
            "dd.MM.yyyy HH:mm:ss"
    );

    private static final List<DateTimeFormatter> DATE_FORMATS = compile(
            "yyyy-MM-dd",
            "yyyy/MM/dd",
            "MM/dd/yyyy",
            "M/d/yyyy",
            "dd.MM.yyyy",
            "yyyy.MM.dd"
    );

    private final Set<String> naValues;
    private final boolean keepText;

    public ValueParser() {
        this(DEFAULT_NA_VALUES, false);
    }

    /**
     * @param naValues  markers to treat as missing
     * @param keepText  when true cells stay as trimmed strings and only null markers are applied
     */
    public ValueParser(Set<String> naValues, boolean keepText) {
        this.naValues = naValues;
        this.keepText = keepText;
    }

    public ValueParser withExtraNaValues(Iterable<String> extra) {
        Set<String> merged = new HashSet<>(naValues);
        for (String value : extra) {
            merged.add(value);
        }
        return new ValueParser(merged, keepText);
    }

    public ValueParser keepingText() {
        return new ValueParser(naValues, true);
    }

    public boolean isKeepText() {
        return keepText;
    }

    /**
     * Apply only the null markers to a cell that is already known to be text.
     */
    public String parseText(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        return value.isEmpty() || naValues.contains(value) ? null : value;
    }

    public Object parse(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        if (value.isEmpty() || naValues.contains(value)) {
            return null;
        }
        if (keepText) {
            return value;
        }

        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("false")) {
            return Boolean.valueOf(lower);
        }

        if (looksNumeric(value)) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                // not integral, fall through to float
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                // not numeric after all
            }
        }

        if (looksTemporal(value)) {
            for (DateTimeFormatter formatter : DATE_TIME_FORMATS) {
                try {
                    return LocalDateTime.parse(value, formatter);
                } catch (DateTimeParseException e) {
                    // try next format
                }
            }
            for (DateTimeFormatter formatter : DATE_FORMATS) {
                try {
                    return LocalDate.parse(value, formatter);
                } catch (DateTimeParseException e) {
                    // try next format
                }
            }
        }

        return value;
    }

    private static boolean looksNumeric(String value) {
        char first = value.charAt(0);
        if (!(Character.isDigit(first) || first == '-' || first == '+' || first == '.')) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (!(Character.isDigit(c) || c == '-' || c == '+' || c == '.' || c == 'e' || c == 'E')) {
                return false;
            }
        }
        return true;
    }

    private static boolean looksTemporal(String value) {
        return value.length() >= 8 && value.length() <= 32
                && Character.isDigit(value.charAt(0))
                && (value.indexOf('-') > 0 || value.indexOf('/') > 0 || value.indexOf('.') > 0);
    }

    private static List<DateTimeFormatter> compile(String... patterns) {
        List<DateTimeFormatter> formatters = new ArrayList<>();
        for (String pattern : patterns) {
            formatters.add(DateTimeFormatter.ofPattern(pattern, Locale.ROOT));
        }
        return Collections.unmodifiableList(formatters);
    }
}
