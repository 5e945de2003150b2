package com.sysmuse.consolidation;

/**
 * Invalid run configuration. Raised before any input file is touched.
 */
public class ConfigurationException extends ConsolidationException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
