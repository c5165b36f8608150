package com.saludsync.reps.exception;

/**
 * The export could not be turned into a table: unreadable bytes, no HTML table, or no rows/columns.
 * Always raised before any data is touched.
 */
public class RepsParsingException extends RuntimeException {

    private final String fileName;

    public RepsParsingException(String fileName, String message) {
        super(message);
        this.fileName = fileName;
    }

    public RepsParsingException(String fileName, String message, Throwable cause) {
        super(message, cause);
        this.fileName = fileName;
    }

    public String getFileName() { return fileName; }
}
