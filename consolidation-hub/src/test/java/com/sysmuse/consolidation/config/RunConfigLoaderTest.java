package com.sysmuse.consolidation.config;

import com.sysmuse.consolidation.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class RunConfigLoaderTest {

    @TempDir
    Path configDir;

    private RunConfigLoader loader;

    @BeforeEach
    public void setUp() {
        loader = new RunConfigLoader();
    }

    private Path writeFile(String name, String content) throws IOException {
        Path file = configDir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testLoadFullConfig() throws IOException {
        Path file = writeFile("run.json", "{\n" +
                "  \"input_folder\": \"input\",\n" +
                "  \"output_file\": \"out/result.csv\",\n" +
                "  \"recursive\": true,\n" +
                "  \"file_type_filter\": [\"csv\", \".JSON\"],\n" +
                "  \"schema_map\": {\"email\": [\"e-mail\", \"mail\"]},\n" +
                "  \"to_lower\": false,\n" +
                "  \"index_mode\": \"local\",\n" +
                "  \"index_start\": 100,\n" +
                "  \"columns\": \"first_name,age\",\n" +
                "  \"force_in_memory\": true,\n" +
                "  \"read_options\": {\"chunksize\": 500, \"na_values\": [\"-\", \"?\"], \"sheet_name\": null},\n" +
                "  \"write_options\": {\"na_rep\": \"NULL\", \"indent\": 2}\n" +
                "}");

        ProcessingConfig config = loader.loadFromFile(file);

        assertEquals(configDir.resolve("input").toAbsolutePath().normalize(), config.getInputFolder().toAbsolutePath());
        assertEquals(configDir.resolve("out").resolve("result.csv").toAbsolutePath().normalize().toString(),
                config.getOutputFile());
        assertTrue(config.isRecursive());
        assertEquals(Arrays.asList("csv", "json"), config.getFileTypeFilter());
        assertEquals(Arrays.asList("e-mail", "mail"), config.getSchemaMap().get("email"));
        assertFalse(config.isToLower());
        assertEquals(IndexMode.LOCAL, config.getIndexMode());
        assertEquals(100, config.getIndexStart());
        assertEquals(Arrays.asList("first_name", "age"), config.getColumns());
        assertTrue(config.isForceInMemory());
        assertEquals(500, config.getReadOptions().get("chunksize"));
        assertEquals(Arrays.asList("-", "?"), config.getReadOptions().get("na_values"));
        assertTrue(config.getReadOptions().containsKey("sheet_name"), "Null options are kept as explicit nulls");
        assertNull(config.getReadOptions().get("sheet_name"));
        assertEquals("NULL", config.getWriteOptions().get("na_rep"));
        assertTrue(loader.getLoggingProperties().isEmpty());
    }

    @Test
    public void testSchemaFileResolvedRelativeToConfig() throws IOException {
        writeFile("aliases.json", "{\"last_name\": [\"surname\"], \"age\": \"years\"}");
        Path file = writeFile("run.json", "{\"input_folder\": \".\", \"schema_file\": \"aliases.json\"}");

        ProcessingConfig config = loader.loadFromFile(file);

        assertEquals(Collections.singletonList("surname"), config.getSchemaMap().get("last_name"));
        assertEquals(Collections.singletonList("years"), config.getSchemaMap().get("age"));
    }

    @Test
    public void testLoggingSection() throws IOException {
        Path file = writeFile("run.json", "{\"input_folder\": \"in\", " +
                "\"logging\": {\"level\": \"DEBUG\", \"console\": false, \"file\": true}}");

        loader.loadFromFile(file);
        Properties logging = loader.getLoggingProperties();

        assertEquals("DEBUG", logging.getProperty("logging.level"));
        assertEquals("false", logging.getProperty("logging.console"));
        assertEquals("consolidation.log", logging.getProperty("logging.file"));
    }

    @Test
    public void testMissingFileFails() {
        assertThrows(ConfigurationException.class, () -> loader.loadFromFile(configDir.resolve("absent.json")));
    }

    @Test
    public void testMissingInputFolderFails() throws IOException {
        Path file = writeFile("run.json", "{\"output_file\": \"x.csv\"}");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.loadFromFile(file));
        assertTrue(e.getMessage().contains("input_folder"));
    }

    @Test
    public void testOptionsMustBeObject() throws IOException {
        Path file = writeFile("run.json", "{\"input_folder\": \"in\", \"read_options\": [\"sep\", \";\"]}");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.loadFromFile(file));
        assertTrue(e.getMessage().contains("read_options"));
    }

    @Test
    public void testInvalidIndexModeFails() throws IOException {
        Path file = writeFile("run.json", "{\"input_folder\": \"in\", \"index_mode\": \"random\"}");

        assertThrows(ConfigurationException.class, () -> loader.loadFromFile(file));
    }
}
