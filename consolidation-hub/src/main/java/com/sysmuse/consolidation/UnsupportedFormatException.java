package com.sysmuse.consolidation;

/**
 * No handler is registered for a file extension.
 */
public class UnsupportedFormatException extends ConsolidationException {

    private final String extension;

    public UnsupportedFormatException(String extension, String message) {
        super(message);
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
