package com.sysmuse.consolidation.handler;

import com.sysmuse.consolidation.table.DataBatch;
import com.sysmuse.consolidation.table.ValueParser;
import com.sysmuse.consolidation.util.LoggingUtil;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Base class for file handlers.
 * Holds the per-mode option allow-lists and the option/value helpers shared by
 * the concrete formats.
 */
public abstract class AbstractFileHandler implements FileHandler {

    public static final String DEFAULT_INDEX_LABEL = "index";
    protected static final DateTimeFormatter DEFAULT_DATE_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String extension;
    private final Set<String> readOptionNames;
    private final Set<String> writeOptionNames;

    protected AbstractFileHandler(String extension, Set<String> readOptionNames, Set<String> writeOptionNames) {
        this.extension = extension;
        this.readOptionNames = Collections.unmodifiableSet(new HashSet<>(readOptionNames));
        this.writeOptionNames = Collections.unmodifiableSet(new HashSet<>(writeOptionNames));
    }

    @Override
    public String extension() {
        return extension;
    }

    @Override
    public boolean isStreamable() {
        return false;
    }

    public Set<String> getAcceptedOptions(Mode mode) {
        return mode == Mode.READ ? readOptionNames : writeOptionNames;
    }

    @Override
    public Map<String, Object> filterOptions(Map<String, ?> options, Mode mode) {
        Set<String> accepted = getAcceptedOptions(mode);
        Map<String, Object> filtered = new LinkedHashMap<>();
        if (options == null) {
            return filtered;
        }
        for (Map.Entry<String, ?> entry : options.entrySet()) {
            if (accepted.contains(entry.getKey())) {
                filtered.put(entry.getKey(), entry.getValue());
            } else if (LoggingUtil.isDebugEnabled()) {
                LoggingUtil.debug("Ignoring " + mode.name().toLowerCase(Locale.ROOT) + " option '" +
                        entry.getKey() + "' for ." + extension + " files");
            }
        }
        return filtered;
    }

    // ---- option helpers ----

    protected static Integer intOption(Map<String, ?> options, String name, Integer defaultValue) {
        Object value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option '" + name + "' must be an integer, got: " + value, e);
        }
    }

    protected static boolean booleanOption(Map<String, ?> options, String name, boolean defaultValue) {
        Object value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    protected static String stringOption(Map<String, ?> options, String name, String defaultValue) {
        Object value = options.get(name);
        return value == null ? defaultValue : value.toString();
    }

    protected static Charset charsetOption(Map<String, ?> options) {
        Object value = options.get("encoding");
        return value == null ? StandardCharsets.UTF_8 : Charset.forName(value.toString());
    }

    /**
     * Value parser honoring the na_values and dtype options.
     */
    protected static ValueParser parserFor(Map<String, ?> options) {
        ValueParser parser = new ValueParser();
        Object naValues = options.get("na_values");
        if (naValues instanceof Collection) {
            List<String> extra = new ArrayList<>();
            for (Object value : (Collection<?>) naValues) {
                extra.add(String.valueOf(value));
            }
            parser = parser.withExtraNaValues(extra);
        } else if (naValues != null) {
            parser = parser.withExtraNaValues(Arrays.asList(naValues.toString().split(",")));
        }
        Object dtype = options.get("dtype");
        if (dtype != null) {
            String type = dtype.toString().toLowerCase(Locale.ROOT);
            if (type.equals("str") || type.equals("string") || type.equals("object")) {
                parser = parser.keepingText();
            }
        }
        return parser;
    }

    // ---- output helpers ----

    protected static boolean includeIndex(Map<String, ?> options) {
        return booleanOption(options, "index", false);
    }

    protected static String indexLabel(Map<String, ?> options) {
        return stringOption(options, "index_label", DEFAULT_INDEX_LABEL);
    }

    /**
     * Row identifier for output: the finalized index when present, else the position.
     */
    protected static long indexValue(DataBatch batch, int row) {
        List<Long> index = batch.getRowIndex();
        return index != null ? index.get(row) : row;
    }

    /**
     * Text form of a cell value for text-based formats.
     */
    protected static String formatValue(Object value, String naRep, DateTimeFormatter dateFormat) {
        if (value == null) {
            return naRep;
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(dateFormat != null ? dateFormat : DEFAULT_DATE_TIME_FORMAT);
        }
        if (value instanceof LocalDate) {
            return dateFormat != null ? ((LocalDate) value).atStartOfDay().format(dateFormat) : value.toString();
        }
        return value.toString();
    }

    protected static DateTimeFormatter dateFormatOption(Map<String, ?> options) {
        Object pattern = options.get("date_format");
        return pattern == null ? null : DateTimeFormatter.ofPattern(pattern.toString());
    }

    /**
     * Make unique, non-empty column names from raw header cells.
     */
    protected static List<String> headerNames(List<String> rawHeaders) {
        List<String> names = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (int i = 0; i < rawHeaders.size(); i++) {
            String raw = rawHeaders.get(i);
            String name = raw == null || raw.trim().isEmpty() ? "unnamed_" + i : raw.trim();
            String candidate = name;
            for (int n = 1; used.contains(candidate); n++) {
                candidate = name + "." + n;
            }
            used.add(candidate);
            names.add(candidate);
        }
        return names;
    }
}
