package com.sysmuse.consolidation;

import com.sysmuse.consolidation.config.ProcessingConfig;
import com.sysmuse.consolidation.config.RunConfigLoader;
import com.sysmuse.consolidation.handler.CsvHandler;
import com.sysmuse.consolidation.progress.LoggingProgressReporter;
import com.sysmuse.consolidation.util.LoggingUtil;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * ConsolidationHub - command line launcher.
 *
 * Usage: ConsolidationHub &lt;run-config.json&gt;
 */
public class ConsolidationHub {

    public static void main(String[] args) {
        if (args.length != 1) {
            System.err.println("Usage: ConsolidationHub <run-config.json>");
            System.exit(2);
        }

        Properties defaultProps = loadDefaultProperties();
        try {
            RunConfigLoader loader = new RunConfigLoader();
            ProcessingConfig config = loader.loadFromFile(args[0]);

            Properties loggingProps = new Properties();
            loggingProps.putAll(defaultProps);
            loggingProps.putAll(loader.getLoggingProperties());
            LoggingUtil.reset();
            LoggingUtil.initialize(loggingProps);

            DataProcessor processor = new DataProcessor(readDefaults(defaultProps), null);
            processor.setProgressReporter(new LoggingProgressReporter());
            ProcessingResult result = processor.run(config);

            LoggingUtil.info("Files processed: " + result.getFilesProcessed());
            LoggingUtil.info("Total rows: " + result.getTotalRows());
            LoggingUtil.info("Total columns: " + result.getTotalColumns());
            if (result.getOutputFile() != null) {
                LoggingUtil.info("Output written to: " + result.getOutputFile());
            }
        } catch (ConsolidationException e) {
            LoggingUtil.error(e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            LoggingUtil.error("Error: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    static Properties loadDefaultProperties() {
        Properties defaultProps = new Properties();
        try (InputStream in = ConsolidationHub.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null) {
                defaultProps.load(in);
            }
        } catch (IOException e) {
            LoggingUtil.warn("Error loading default properties: " + e.getMessage());
        }
        LoggingUtil.initialize(defaultProps);
        return defaultProps;
    }

    /**
     * Read option defaults taken from the application properties.
     */
    static Map<String, Object> readDefaults(Properties properties) {
        Map<String, Object> defaults = new LinkedHashMap<>();
        String chunkSize = properties.getProperty("csv.chunksize");
        if (chunkSize != null && !chunkSize.trim().isEmpty()) {
            try {
                defaults.put("chunksize", Integer.parseInt(chunkSize.trim()));
            } catch (NumberFormatException e) {
                LoggingUtil.warn("Ignoring invalid csv.chunksize '" + chunkSize + "', using " +
                        CsvHandler.DEFAULT_CHUNK_SIZE);
            }
        }
        return defaults;
    }
}
