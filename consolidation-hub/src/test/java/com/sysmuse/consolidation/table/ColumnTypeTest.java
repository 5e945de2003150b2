package com.sysmuse.consolidation.table;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class ColumnTypeTest {

    @Test
    public void testMergeIsCommutative() {
        for (ColumnType a : ColumnType.values()) {
            for (ColumnType b : ColumnType.values()) {
                assertEquals(ColumnType.merge(a, b), ColumnType.merge(b, a),
                        "merge(" + a + ", " + b + ") should equal merge(" + b + ", " + a + ")");
            }
        }
    }

    @Test
    public void testMergeIsIdempotent() {
        for (ColumnType type : ColumnType.values()) {
            assertEquals(type, ColumnType.merge(type, type));
        }
    }

    @Test
    public void testPromotionPairs() {
        assertEquals(ColumnType.OBJECT, ColumnType.merge(ColumnType.OBJECT, ColumnType.DATETIME));
        assertEquals(ColumnType.FLOAT, ColumnType.merge(ColumnType.INTEGER, ColumnType.FLOAT));
        assertEquals(ColumnType.INTEGER, ColumnType.merge(ColumnType.BOOLEAN, ColumnType.INTEGER));
        assertEquals(ColumnType.BOOLEAN, ColumnType.merge(ColumnType.DATETIME, ColumnType.BOOLEAN));
    }

    @Test
    public void testMergeWithUnseenColumn() {
        assertEquals(ColumnType.INTEGER, ColumnType.merge(null, ColumnType.INTEGER));
        assertEquals("float", ColumnType.merge(null, "float"));
    }

    @Test
    public void testUnknownTagIsMostPermissive() {
        assertEquals(ColumnType.OBJECT, ColumnType.fromTag("category"));
        assertEquals("object", ColumnType.merge("datetime", "category"));
        assertEquals("integer", ColumnType.merge("INTEGER", "boolean"));
    }

    @Test
    public void testOfValues() {
        assertEquals(ColumnType.INTEGER, ColumnType.ofValues(Arrays.asList(1L, null, 3L)));
        assertEquals(ColumnType.FLOAT, ColumnType.ofValues(Arrays.asList(1L, 2.5)));
        assertEquals(ColumnType.OBJECT, ColumnType.ofValues(Arrays.asList(1L, "x")));
        assertEquals(ColumnType.DATETIME, ColumnType.ofValues(Arrays.asList(LocalDate.of(2024, 1, 2),
                LocalDateTime.of(2024, 1, 2, 3, 4))));
        assertEquals(ColumnType.BOOLEAN, ColumnType.ofValues(Arrays.asList(true, false)));
        assertEquals(ColumnType.OBJECT, ColumnType.ofValues(Arrays.asList(null, null)),
                "An all-null column should be object");
    }
}
