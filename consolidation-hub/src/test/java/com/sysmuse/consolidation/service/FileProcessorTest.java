package com.sysmuse.consolidation.service;

import com.sysmuse.consolidation.config.IndexMode;
import com.sysmuse.consolidation.config.ProcessingConfig;
import com.sysmuse.consolidation.handler.HandlerRegistry;
import com.sysmuse.consolidation.index.IndexManager;
import com.sysmuse.consolidation.progress.RecordingProgressReporter;
import com.sysmuse.consolidation.schema.SchemaDetector;
import com.sysmuse.consolidation.table.ColumnType;
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

public class FileProcessorTest {

    @TempDir
    Path inputDir;

    private FileProcessor processor;
    private RecordingProgressReporter reporter;

    @BeforeEach
    public void setUp() throws IOException {
        processor = new FileProcessor(new HandlerRegistry());
        reporter = new RecordingProgressReporter();
        processor.setProgressReporter(reporter);

        writeFile("a.csv", "Name,Age\nJohn Doe,25\nJane Smith,30\nBob Stone,41\n");
        writeFile("b.csv", "NAME,AGE,City\nAnn Lee,22,Boston\n");
    }

    private void writeFile(String name, String content) throws IOException {
        Files.write(inputDir.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void testInMemoryTagsAndNormalizes() {
        ProcessingConfig config = ProcessingConfig.builder(inputDir).build();

        List<DataBatch> batches = processor.processFilesInMemory(config, null, new IndexManager(null, 0));

        assertEquals(2, batches.size());
        DataBatch first = batches.get(0);
        assertEquals(Arrays.asList("first_name", "last_name", "age", "source_file"), first.getColumns());
        assertEquals("a.csv", first.getValue(0, "source_file"));
        assertEquals("b.csv", batches.get(1).getValue(0, "source_file"));
        assertEquals("Boston", batches.get(1).getValue(0, "city"));
    }

    @Test
    public void testStreamingAlignsToSchemaAndChunks() {
        ProcessingConfig config = ProcessingConfig.builder(inputDir).readOption("chunksize", 2).build();
        Map<String, ColumnType> schema = new SchemaDetector(new HandlerRegistry()).detectSchema(config);

        Iterator<DataBatch> batches = processor.processFilesStreaming(config, schema, new IndexManager(null, 0));

        List<Integer> sizes = new ArrayList<>();
        while (batches.hasNext()) {
            DataBatch batch = batches.next();
            assertEquals(new ArrayList<>(schema.keySet()), batch.getColumns(), "Every batch matches the schema");
            sizes.add(batch.size());
        }
        assertEquals(Arrays.asList(2, 1, 1), sizes);
        assertFalse(batches.hasNext());
        assertThrows(NoSuchElementException.class, batches::next);
    }

    @Test
    public void testLocalIndexRestartsPerFile() {
        ProcessingConfig config = ProcessingConfig.builder(inputDir).readOption("chunksize", 2).build();
        IndexManager indexManager = new IndexManager(IndexMode.LOCAL, 0);

        List<DataBatch> batches = processor.processFilesInMemory(config, null, indexManager);

        List<Object> index = new ArrayList<>();
        for (DataBatch batch : batches) {
            index.addAll(batch.getColumnValues(IndexManager.TEMP_COLUMN));
        }
        assertEquals(Arrays.asList(0L, 1L, 2L, 0L), index);
        assertEquals(2, indexManager.getFileCount());
    }

    @Test
    public void testExplicitColumnsSelectAndFill() {
        ProcessingConfig config = ProcessingConfig.builder(inputDir).columns(Arrays.asList("city", "age")).build();

        List<DataBatch> batches = processor.processFilesInMemory(config, null, new IndexManager(null, 0));

        assertEquals(Arrays.asList("city", "age"), batches.get(0).getColumns());
        assertNull(batches.get(0).getValue(0, "city"));
    }

    @Test
    public void testBrokenFileIsSkipped() throws IOException {
        writeFile("0_broken.json", "[{\"a\": 1},");
        ProcessingConfig config = ProcessingConfig.builder(inputDir).build();

        List<DataBatch> batches = processor.processFilesInMemory(config, null, new IndexManager(null, 0));

        assertEquals(2, batches.size(), "The broken file is logged and skipped");
        assertEquals("a.csv", batches.get(0).getValue(0, "source_file"));
    }

    @Test
    public void testFileFailingMidReadContributesNothingInMemory() throws IOException {
        writeFile("0_partial.csv", "Name,Age\nCal Reed,50\nDee Fox,60\n\"Eve Hart,70\n");
        ProcessingConfig config = ProcessingConfig.builder(inputDir).readOption("chunksize", 1).build();
        IndexManager indexManager = new IndexManager(IndexMode.SEQUENTIAL, 0);

        List<DataBatch> batches = processor.processFilesInMemory(config, null, indexManager);

        List<Object> sources = new ArrayList<>();
        List<Object> index = new ArrayList<>();
        for (DataBatch batch : batches) {
            sources.addAll(batch.getColumnValues("source_file"));
            index.addAll(batch.getColumnValues(IndexManager.TEMP_COLUMN));
        }
        assertEquals(Arrays.asList("a.csv", "a.csv", "a.csv", "b.csv"), sources);
        assertEquals(Arrays.asList(0L, 1L, 2L, 3L), index, "Rows of the failed file take no index numbers");
    }

    @Test
    public void testStreamingKeepsBatchesEmittedBeforeFailure() throws IOException {
        writeFile("0_partial.csv", "Name,Age\nCal Reed,50\nDee Fox,60\n\"Eve Hart,70\n");
        ProcessingConfig config = ProcessingConfig.builder(inputDir).readOption("chunksize", 1).build();

        Iterator<DataBatch> batches = processor.processFilesStreaming(config, null, new IndexManager(null, 0));

        List<Object> sources = new ArrayList<>();
        while (batches.hasNext()) {
            sources.addAll(batches.next().getColumnValues("source_file"));
        }
        assertEquals(Arrays.asList("0_partial.csv", "0_partial.csv", "a.csv", "a.csv", "a.csv", "b.csv"), sources);
    }

    @Test
    public void testProgressEvents() {
        ProcessingConfig config = ProcessingConfig.builder(inputDir).build();

        processor.processFilesInMemory(config, null, new IndexManager(null, 0));

        assertEquals(Arrays.asList("file:a.csv", "rows:3", "done:3", "file:b.csv", "rows:1", "done:1"),
                reporter.getEvents());
    }

    @Test
    public void testRecursiveSourceFileIsRelative() throws IOException {
        Path nested = Files.createDirectories(inputDir.resolve("2024"));
        Files.write(nested.resolve("c.csv"), "Name\nZed Ray\n".getBytes(StandardCharsets.UTF_8));
        ProcessingConfig config = ProcessingConfig.builder(inputDir).recursive(true).build();

        List<DataBatch> batches = processor.processFilesInMemory(config, null, new IndexManager(null, 0));

        assertEquals("2024/c.csv", batches.get(0).getValue(0, "source_file"));
    }
}
