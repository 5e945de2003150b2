package com.sysmuse.consolidation;

/**
 * Schema sampling found no columns in any eligible file.
 */
public class NoSchemaDetectedException extends ConsolidationException {

    public NoSchemaDetectedException(String message) {
        super(message);
    }
}
