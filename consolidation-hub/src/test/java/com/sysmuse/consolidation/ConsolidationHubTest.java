package com.sysmuse.consolidation;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class ConsolidationHubTest {

    @Test
    public void testDefaultPropertiesOnClasspath() {
        Properties properties = ConsolidationHub.loadDefaultProperties();

        assertEquals("INFO", properties.getProperty("logging.level"));
        assertEquals("10000", properties.getProperty("csv.chunksize"));
    }

    @Test
    public void testReadDefaults() {
        Properties properties = new Properties();
        properties.setProperty("csv.chunksize", " 2500 ");

        Map<String, Object> defaults = ConsolidationHub.readDefaults(properties);

        assertEquals(2500, defaults.get("chunksize"));
    }

    @Test
    public void testInvalidChunkSizeIgnored() {
        Properties properties = new Properties();
        properties.setProperty("csv.chunksize", "lots");

        assertTrue(ConsolidationHub.readDefaults(properties).isEmpty());
    }
}
