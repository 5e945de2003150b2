package com.sysmuse.consolidation.handler;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sysmuse.consolidation.NoTabularDataException;
import com.sysmuse.consolidation.UnsupportedStructureException;
import com.sysmuse.consolidation.normalize.ColumnNormalizer;
import com.sysmuse.consolidation.table.DataBatch;
import com.sysmuse.consolidation.table.ValueParser;
import com.sysmuse.consolidation.util.LoggingUtil;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * JsonHandler - handles JSON record files using the Jackson library.
 *
 * Accepted layouts: a top-level array of row objects, or a top-level object whose
 * array values are treated as separate sheets keyed by property name.
 */
public class JsonHandler extends AbstractFileHandler {

    public static final String VALUE_COLUMN = "value";

    private static final Set<String> READ_OPTIONS = new HashSet<>(Arrays.asList("encoding", "dtype"));
    private static final Set<String> WRITE_OPTIONS = new HashSet<>(Arrays.asList(
            "encoding", "indent", "index", "index_label", "date_format"));

    private final ObjectMapper mapper;

    public JsonHandler() {
        super("json", READ_OPTIONS, WRITE_OPTIONS);
        this.mapper = new ObjectMapper();
    }

    /**
     * JSON is always parsed whole.
     */
    @Override
    public Integer schemaSampleRows() {
        return null;
    }

    @Override
    public BatchReader read(Path path, Map<String, ?> options, ColumnNormalizer normalizer) throws IOException {
        Map<String, Object> readOptions = filterOptions(options, Mode.READ);
        ValueParser parser = parserFor(readOptions);

        LoggingUtil.debug("Reading JSON file: " + path);
        JsonNode rootNode;
        try (Reader reader = Files.newBufferedReader(path, charsetOption(readOptions))) {
            rootNode = mapper.readTree(reader);
        }
        if (rootNode == null || rootNode.isMissingNode()) {
            throw new UnsupportedStructureException("Empty JSON document: " + path);
        }

        if (rootNode.isArray()) {
            return BatchReader.of(toBatch(rootNode, parser, false));
        }
        if (rootNode.isObject()) {
            Map<String, DataBatch> sheets = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = rootNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isArray()) {
                    sheets.put(field.getKey(), toBatch(field.getValue(), parser, true));
                }
            }
            if (sheets.isEmpty()) {
                throw new NoTabularDataException("No array data found in nested JSON: " + path);
            }
            return BatchReader.of(normalizer.mergeBatches(sheets));
        }
        throw new UnsupportedStructureException("Unsupported JSON root type: " + rootNode.getNodeType() +
                ". Expected object or array.");
    }

    @Override
    public void write(DataBatch batch, Path path, Map<String, ?> options) throws IOException {
        Map<String, Object> writeOptions = filterOptions(options, Mode.WRITE);
        boolean index = includeIndex(writeOptions);
        String indexLabel = indexLabel(writeOptions);
        DateTimeFormatter dateFormat = dateFormatOption(writeOptions);

        ArrayNode array = mapper.createArrayNode();
        List<Map<String, Object>> rows = batch.getRows();
        for (int r = 0; r < rows.size(); r++) {
            ObjectNode record = array.addObject();
            if (index) {
                record.put(indexLabel, indexValue(batch, r));
            }
            for (String column : batch.getColumns()) {
                putValue(record, column, rows.get(r).get(column), dateFormat);
            }
        }

        try (Writer writer = Files.newBufferedWriter(path, charsetOption(writeOptions))) {
            writerFor(intOption(writeOptions, "indent", 2)).writeValue(writer, array);
        }
        LoggingUtil.debug("Wrote " + batch.size() + " records to " + path);
    }

    /**
     * Spread nested objects one level into the parent record; deeper values are kept as they are.
     */
    static Map<String, JsonNode> flattenRecord(JsonNode record) {
        Map<String, JsonNode> flattened = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isObject()) {
                Iterator<Map.Entry<String, JsonNode>> nested = field.getValue().fields();
                while (nested.hasNext()) {
                    Map.Entry<String, JsonNode> entry = nested.next();
                    flattened.put(entry.getKey(), entry.getValue());
                }
            } else {
                flattened.put(field.getKey(), field.getValue());
            }
        }
        return flattened;
    }

    private DataBatch toBatch(JsonNode array, ValueParser parser, boolean flatten) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode element : array) {
            Map<String, Object> row = new LinkedHashMap<>();
            if (element.isObject()) {
                Map<String, JsonNode> fields = flatten ? flattenRecord(element) : fieldsOf(element);
                for (Map.Entry<String, JsonNode> field : fields.entrySet()) {
                    row.put(field.getKey(), javaValue(field.getValue(), parser));
                }
            } else {
                row.put(VALUE_COLUMN, javaValue(element, parser));
            }
            rows.add(row);
        }
        return DataBatch.fromRows(rows);
    }

    private static Map<String, JsonNode> fieldsOf(JsonNode node) {
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
        while (iterator.hasNext()) {
            Map.Entry<String, JsonNode> field = iterator.next();
            fields.put(field.getKey(), field.getValue());
        }
        return fields;
    }

    /**
     * Convert a JSON value to the matching Java type. Strings go through the value
     * parser so dates and null markers are recognized; containers stay as nodes.
     */
    private static Object javaValue(JsonNode node, ValueParser parser) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isContainerNode()) {
            return node;
        }
        if (parser.isKeepText()) {
            return node.asText();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.decimalValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return parser.parse(node.asText());
    }

    private static void putValue(ObjectNode record, String field, Object value, DateTimeFormatter dateFormat) {
        if (value == null) {
            record.putNull(field);
        } else if (value instanceof JsonNode) {
            record.set(field, (JsonNode) value);
        } else if (value instanceof Long || value instanceof Integer) {
            record.put(field, ((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            record.put(field, ((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            record.put(field, (Boolean) value);
        } else if (value instanceof LocalDateTime || value instanceof LocalDate) {
            record.put(field, formatValue(value, null, dateFormat));
        } else {
            record.put(field, value.toString());
        }
    }

    private ObjectWriter writerFor(int indent) {
        if (indent <= 0) {
            return mapper.writer();
        }
        DefaultIndenter indenter = new DefaultIndenter(" ".repeat(indent), DefaultIndenter.SYS_LF);
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withObjectIndenter(indenter)
                .withArrayIndenter(indenter);
        return mapper.writer(printer);
    }
}
