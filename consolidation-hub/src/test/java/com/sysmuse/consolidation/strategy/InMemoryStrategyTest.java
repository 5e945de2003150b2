package com.sysmuse.consolidation.strategy;

import com.sysmuse.consolidation.ProcessingResult;
import com.sysmuse.consolidation.config.IndexMode;
import com.sysmuse.consolidation.config.ProcessingConfig;
import com.sysmuse.consolidation.handler.HandlerRegistry;
import com.sysmuse.consolidation.index.IndexManager;
import com.sysmuse.consolidation.schema.SchemaDetector;
import com.sysmuse.consolidation.service.FileDiscovery;
import com.sysmuse.consolidation.service.FileProcessor;
import com.sysmuse.consolidation.service.OutputWriter;
import com.sysmuse.consolidation.table.DataBatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryStrategyTest {

    @TempDir
    Path inputDir;

    private InMemoryStrategy strategy;
    private ByteArrayOutputStream console;

    @BeforeEach
    public void setUp() throws IOException {
        HandlerRegistry registry = new HandlerRegistry();
        console = new ByteArrayOutputStream();
        strategy = new InMemoryStrategy(new SchemaDetector(registry), new FileProcessor(registry),
                new OutputWriter(new PrintStream(console, true)));

        Files.write(inputDir.resolve("a.json"),
                "[{\"id\": 1, \"tag\": \"x\"}, {\"id\": 2, \"tag\": \"y\"}]".getBytes(StandardCharsets.UTF_8));
        Files.write(inputDir.resolve("b.json"),
                "[{\"id\": 3, \"extra\": true}]".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testConcatenatesWithUnionOfColumns() {
        ProcessingConfig config = ProcessingConfig.builder(inputDir).indexMode(IndexMode.SEQUENTIAL).indexStart(1).build();

        ProcessingResult result = strategy.process(config, FileDiscovery.listFiles(config), null);

        assertEquals("in_memory", strategy.getName());
        assertEquals(2, result.getFilesProcessed());
        assertEquals(3, result.getTotalRows());
        DataBatch data = result.getData();
        assertEquals(Arrays.asList("id", "tag", "source_file", "extra"), data.getColumns());
        assertFalse(data.hasColumn(IndexManager.TEMP_COLUMN));
        assertEquals(Arrays.asList(1L, 2L, 3L), data.getRowIndex());
        assertEquals(4, result.getTotalColumns());
        assertNull(result.getSchema(), "No schema without explicit columns");
        assertTrue(new String(console.toByteArray(), StandardCharsets.UTF_8).contains("source_file"));
    }

    @Test
    public void testExplicitColumnsProduceSchema() {
        ProcessingConfig config = ProcessingConfig.builder(inputDir).columns("id").build();

        ProcessingResult result = strategy.process(config, FileDiscovery.listFiles(config), null);

        assertEquals(Arrays.asList("id", "source_file"), new ArrayList<>(result.getSchema().keySet()));
        assertEquals(Arrays.asList("id", "source_file"), result.getData().getColumns());
    }

    @Test
    public void testNoUsableInputStillReturnsTable() throws IOException {
        Files.write(inputDir.resolve("a.json"), "[{\"id\": 1".getBytes(StandardCharsets.UTF_8));
        Files.write(inputDir.resolve("b.json"), "{\"id\": 1}".getBytes(StandardCharsets.UTF_8));
        ProcessingConfig config = ProcessingConfig.builder(inputDir).indexMode(IndexMode.LOCAL).build();

        ProcessingResult result = strategy.process(config, FileDiscovery.listFiles(config), null);

        assertTrue(result.hasData());
        assertEquals(0, result.getData().size());
        assertEquals(0, result.getTotalRows());
        assertEquals(0, result.getFilesProcessed());
    }

    @Test
    public void testCountSourceFiles() {
        DataBatch table = new DataBatch(Collections.singletonList("source_file"));
        for (String source : Arrays.asList("a.csv", "a.csv", "b.csv")) {
            table.addRow(Collections.singletonMap("source_file", source));
        }
        table.addRow(Collections.singletonMap("source_file", null));

        assertEquals(2, InMemoryStrategy.countSourceFiles(table));
        assertEquals(0, InMemoryStrategy.countSourceFiles(new DataBatch(Collections.singletonList("x"))));
    }
}
