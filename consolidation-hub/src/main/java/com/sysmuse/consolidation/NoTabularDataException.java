package com.sysmuse.consolidation;

/**
 * A keyed document that holds no array of records.
 */
public class NoTabularDataException extends ConsolidationException {

    public NoTabularDataException(String message) {
        super(message);
    }
}
