package com.sysmuse.consolidation.index;

import com.sysmuse.consolidation.config.IndexMode;
import com.sysmuse.consolidation.table.DataBatch;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class IndexManagerTest {

    private static DataBatch batchOf(int rows) {
        DataBatch batch = new DataBatch(Collections.singletonList("col1"));
        for (int i = 0; i < rows; i++) {
            batch.addRow(Collections.singletonMap("col1", (long) i));
        }
        return batch;
    }

    private static List<Object> indexValues(DataBatch batch) {
        return batch.getColumnValues(IndexManager.TEMP_COLUMN);
    }

    @Test
    public void testNoneModeLeavesBatchUnchanged() {
        IndexManager manager = new IndexManager(IndexMode.NONE, 0);
        DataBatch batch = batchOf(3);

        assertSame(batch, manager.processBatch(batch, true));
        assertSame(batch, manager.finalizeBatch(batch));
    }

    @Test
    public void testUnsetModeLeavesBatchUnchanged() {
        IndexManager manager = new IndexManager(null, 0);
        DataBatch result = manager.processBatch(batchOf(3), true);

        assertFalse(result.hasColumn(IndexManager.TEMP_COLUMN));
        assertFalse(manager.shouldIncludeIndex());
    }

    @Test
    public void testLocalModeRestartsForEveryFile() {
        IndexManager manager = new IndexManager(IndexMode.LOCAL, 0);

        assertEquals(Arrays.asList(0L, 1L), indexValues(manager.processBatch(batchOf(2), true)));
        assertEquals(Arrays.asList(2L, 3L, 4L), indexValues(manager.processBatch(batchOf(3), false)));
        assertEquals(Arrays.asList(0L, 1L), indexValues(manager.processBatch(batchOf(2), true)),
                "A new file should restart numbering");
        assertEquals(2, manager.getFileCount());
    }

    @Test
    public void testSequentialModeNeverResets() {
        IndexManager manager = new IndexManager(IndexMode.SEQUENTIAL, 100);

        assertEquals(Arrays.asList(100L, 101L), indexValues(manager.processBatch(batchOf(2), true)));
        assertEquals(Arrays.asList(102L, 103L, 104L), indexValues(manager.processBatch(batchOf(3), true)));
        assertEquals(Collections.singletonList(105L), indexValues(manager.processBatch(batchOf(1), false)));
    }

    @Test
    public void testProcessBatchDoesNotModifyInput() {
        IndexManager manager = new IndexManager(IndexMode.SEQUENTIAL, 0);
        DataBatch batch = batchOf(2);
        manager.processBatch(batch, true);

        assertFalse(batch.hasColumn(IndexManager.TEMP_COLUMN));
    }

    @Test
    public void testFinalizeTableMovesTempColumnIntoRowIndex() {
        IndexManager manager = new IndexManager(IndexMode.SEQUENTIAL, 0);
        DataBatch first = manager.processBatch(batchOf(2), true);
        DataBatch second = manager.processBatch(batchOf(2), false);

        DataBatch table = manager.finalizeTable(DataBatch.concat(Arrays.asList(first, second)));

        assertEquals(Arrays.asList(0L, 1L, 2L, 3L), table.getRowIndex());
        assertFalse(table.hasColumn(IndexManager.TEMP_COLUMN));
        assertEquals(Collections.singletonList("col1"), table.getColumns());
    }

    @Test
    public void testFinalizeBatch() {
        IndexManager manager = new IndexManager(IndexMode.LOCAL, 0);
        DataBatch result = manager.finalizeBatch(manager.processBatch(batchOf(3), true));

        assertEquals(Arrays.asList(0L, 1L, 2L), result.getRowIndex());
        assertFalse(result.hasColumn(IndexManager.TEMP_COLUMN));
    }

    @Test
    public void testFinalizeWithoutTempColumnFails() {
        IndexManager manager = new IndexManager(IndexMode.SEQUENTIAL, 0);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> manager.finalizeTable(batchOf(2)));
        assertTrue(e.getMessage().contains(IndexManager.TEMP_COLUMN));
        assertThrows(IllegalStateException.class, () -> manager.finalizeBatch(batchOf(2)));
    }

    @Test
    public void testApplyWriteOptionsNoneForcesIndexOff() {
        IndexManager manager = new IndexManager(IndexMode.NONE, 0);
        Map<String, Object> options = new HashMap<>();
        options.put("sep", ",");
        options.put("index", true);

        Map<String, Object> updated = manager.applyWriteOptions(options);

        assertEquals(Boolean.FALSE, updated.get("index"));
        assertEquals(",", updated.get("sep"));
        assertEquals(Boolean.TRUE, options.get("index"), "Caller's map should not be modified");
    }

    @Test
    public void testApplyWriteOptionsActiveModeForcesIndexOn() {
        IndexManager manager = new IndexManager(IndexMode.SEQUENTIAL, 0);
        Map<String, Object> updated = manager.applyWriteOptions(Collections.singletonMap("index", false));

        assertEquals(Boolean.TRUE, updated.get("index"));
    }

    @Test
    public void testApplyWriteOptionsUnsetModeKeepsCallerValue() {
        IndexManager manager = new IndexManager(null, 0);

        assertEquals(Boolean.TRUE, manager.applyWriteOptions(Collections.singletonMap("index", true)).get("index"));
        assertFalse(manager.applyWriteOptions(Collections.emptyMap()).containsKey("index"));
    }

    @Test
    public void testResetFileTracking() {
        IndexManager manager = new IndexManager(IndexMode.SEQUENTIAL, 5);
        manager.processBatch(batchOf(3), true);
        manager.resetFileTracking();

        assertEquals(0, manager.getFileCount());
        assertEquals(Arrays.asList(5L, 6L), indexValues(manager.processBatch(batchOf(2), true)));
    }
}
