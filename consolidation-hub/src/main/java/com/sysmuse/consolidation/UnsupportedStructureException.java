package com.sysmuse.consolidation;

/**
 * A structured document whose root shape cannot be read as rows.
 */
public class UnsupportedStructureException extends ConsolidationException {

    public UnsupportedStructureException(String message) {
        super(message);
    }
}
