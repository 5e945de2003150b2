package com.sysmuse.consolidation.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sysmuse.consolidation.NoTabularDataException;
import com.sysmuse.consolidation.UnsupportedStructureException;
import com.sysmuse.consolidation.normalize.ColumnNormalizer;
import com.sysmuse.consolidation.table.DataBatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class JsonHandlerTest {

    @TempDir
    Path tempDir;

    private JsonHandler handler;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    public void setUp() {
        handler = new JsonHandler();
    }

    private Path writeFile(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private DataBatch readSingle(Path file) throws IOException {
        try (BatchReader reader = handler.read(file, Collections.emptyMap())) {
            assertTrue(reader.hasNext(), "Reader should yield a batch");
            DataBatch batch = reader.next();
            assertFalse(reader.hasNext(), "JSON files are read in one batch");
            return batch;
        }
    }

    @Test
    public void testHandlerProperties() {
        assertEquals("json", handler.extension());
        assertFalse(handler.isStreamable());
        assertNull(handler.schemaSampleRows(), "JSON has no row-limited sampling");
    }

    @Test
    public void testReadArrayOfRecords() throws IOException {
        Path file = writeFile("array.json",
                "[{\"Name\": \"John Doe\", \"Age\": 25, \"Active\": true},\n" +
                " {\"Name\": \"Jane Smith\", \"Age\": 30, \"Score\": 9.5}]");

        DataBatch batch = readSingle(file);

        assertEquals(Arrays.asList("Name", "Age", "Active", "Score"), batch.getColumns());
        assertEquals(2, batch.size());
        assertEquals(25L, batch.getValue(0, "Age"));
        assertEquals(Boolean.TRUE, batch.getValue(0, "Active"));
        assertNull(batch.getValue(1, "Active"), "Missing keys become null");
        assertEquals(9.5, batch.getValue(1, "Score"));
        assertFalse(batch.hasColumn("sheet_name"), "Array root is not tagged with a sheet");
    }

    @Test
    public void testReadNestedObjectFlattensAndTagsSheet() throws IOException {
        Path file = writeFile("nested.json",
                "{\"users\": [" +
                "  {\"name\": \"John Doe\", \"details\": {\"age\": 30, \"city\": \"NYC\"}}," +
                "  {\"name\": \"Jane Smith\", \"details\": {\"age\": 25, \"city\": \"LA\"}}" +
                "]}");

        DataBatch batch = readSingle(file);

        assertTrue(batch.hasColumn("first_name"));
        assertTrue(batch.hasColumn("last_name"));
        assertTrue(batch.hasColumn("age"));
        assertTrue(batch.hasColumn("city"));
        assertFalse(batch.hasColumn("details"), "Nested object should be spread into the record");
        assertEquals("John", batch.getValue(0, "first_name"));
        assertEquals("LA", batch.getValue(1, "city"));
        assertEquals(Arrays.asList("users", "users"), batch.getColumnValues("sheet_name"));
    }

    @Test
    public void testReadMultipleArraysConcatenates() throws IOException {
        Path file = writeFile("multi.json",
                "{\"meta\": {\"version\": 1}," +
                " \"customers\": [{\"id\": 1}, {\"id\": 2}]," +
                " \"orders\": [{\"order_id\": 10, \"total\": 99.5}]}");

        DataBatch batch = readSingle(file);

        assertEquals(3, batch.size());
        assertEquals(Arrays.asList("customers", "customers", "orders"), batch.getColumnValues("sheet_name"));
        assertNull(batch.getValue(0, "order_id"));
        assertEquals(10L, batch.getValue(2, "order_id"));
        assertFalse(batch.hasColumn("version"), "Non-array values of the root object are ignored");
    }

    @Test
    public void testNestedSheetsUseGivenNamingRule() throws IOException {
        Path file = writeFile("people.json",
                "{\"staff\": [{\"Surname\": \"Doe\", \"Home City\": \"Austin\"}]}");
        ColumnNormalizer normalizer = new ColumnNormalizer(
                Collections.singletonMap("last_name", Collections.singletonList("Surname")), false, false);

        DataBatch batch;
        try (BatchReader reader = handler.read(file, Collections.emptyMap(), normalizer)) {
            batch = reader.next();
        }

        assertEquals(Arrays.asList("last_name", "Home City", "sheet_name"), batch.getColumns());
        assertEquals("Doe", batch.getValue(0, "last_name"));
    }

    @Test
    public void testObjectWithoutArraysFails() throws IOException {
        Path file = writeFile("config.json", "{\"name\": \"settings\", \"options\": {\"a\": 1}}");

        NoTabularDataException e = assertThrows(NoTabularDataException.class,
                () -> handler.read(file, Collections.emptyMap()));
        assertTrue(e.getMessage().contains("No array data found"));
    }

    @Test
    public void testScalarRootFails() throws IOException {
        Path file = writeFile("scalar.json", "42");

        UnsupportedStructureException e = assertThrows(UnsupportedStructureException.class,
                () -> handler.read(file, Collections.emptyMap()));
        assertTrue(e.getMessage().contains("Unsupported JSON root type"));
    }

    @Test
    public void testArrayOfScalarsUsesValueColumn() throws IOException {
        Path file = writeFile("scalars.json", "[1, 2, 3]");

        DataBatch batch = readSingle(file);

        assertEquals(Collections.singletonList(JsonHandler.VALUE_COLUMN), batch.getColumns());
        assertEquals(Arrays.asList(1L, 2L, 3L), batch.getColumnValues(JsonHandler.VALUE_COLUMN));
    }

    @Test
    public void testFlattenRecordGoesOneLevelDeep() throws IOException {
        JsonNode record = mapper.readTree("{\"id\": 7, \"profile\": {\"city\": \"Oslo\", \"geo\": {\"lat\": 59.9}}}");

        Map<String, JsonNode> flattened = JsonHandler.flattenRecord(record);

        assertEquals(new LinkedHashSet<>(Arrays.asList("id", "city", "geo")), flattened.keySet());
        assertEquals("Oslo", flattened.get("city").asText());
        assertTrue(flattened.get("geo").isObject(), "Deeper nesting stays untouched");
        assertEquals(59.9, flattened.get("geo").get("lat").asDouble());
    }

    @Test
    public void testWriteRecordsWithIndex() throws IOException {
        DataBatch batch = new DataBatch(Arrays.asList("name", "age"));
        Map<String, Object> row = new HashMap<>();
        row.put("name", "Ann");
        row.put("age", 41L);
        batch.addRow(row);
        row.put("name", "Bob");
        row.put("age", null);
        batch.addRow(row);
        batch.setRowIndex(Arrays.asList(5L, 6L));

        Path output = tempDir.resolve("out.json");
        Map<String, Object> options = new HashMap<>();
        options.put("index", true);
        options.put("index_label", "row");
        handler.write(batch, output, options);

        JsonNode written = mapper.readTree(output.toFile());
        assertTrue(written.isArray());
        assertEquals(2, written.size());
        assertEquals(5, written.get(0).get("row").asInt());
        assertEquals("Ann", written.get(0).get("name").asText());
        assertTrue(written.get(1).get("age").isNull());
        assertEquals("row", written.get(0).fieldNames().next(), "Index label should be the first field");
    }

    @Test
    public void testWriteIndentation() throws IOException {
        DataBatch batch = new DataBatch(Collections.singletonList("k"));
        batch.addRow(Collections.singletonMap("k", "v"));

        Path pretty = tempDir.resolve("pretty.json");
        handler.write(batch, pretty, Collections.singletonMap("indent", 4));
        Path compact = tempDir.resolve("compact.json");
        handler.write(batch, compact, Collections.singletonMap("indent", 0));

        String prettyText = new String(Files.readAllBytes(pretty), StandardCharsets.UTF_8);
        String compactText = new String(Files.readAllBytes(compact), StandardCharsets.UTF_8);
        assertTrue(prettyText.contains("\n        \"k\""), "Fields nest two levels deep at four spaces each");
        assertEquals("[{\"k\":\"v\"}]", compactText);
    }

    @Test
    public void testFilterOptionsDropsForeignOptions() {
        Map<String, Object> options = new HashMap<>();
        options.put("encoding", "utf-8");
        options.put("sep", ";");
        options.put("sheet_name", 0);

        assertEquals(Collections.singleton("encoding"), handler.filterOptions(options, FileHandler.Mode.READ).keySet());
    }
}
