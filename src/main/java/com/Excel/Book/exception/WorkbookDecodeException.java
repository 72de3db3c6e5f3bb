package com.Excel.Book.exception;

/**
 * Raised when a package part exists but is not well-formed XML, or its root
 * element is not the one expected for that part.
 */
public class WorkbookDecodeException extends WorkbookException {

    private final String partPath;

    public WorkbookDecodeException(String partPath, String message) {
        super("Failed to decode " + partPath + ": " + message);
        this.partPath = partPath;
    }

    public WorkbookDecodeException(String partPath, Throwable cause) {
        super("Failed to decode " + partPath + ": " + cause.getMessage(), cause);
        this.partPath = partPath;
    }

    public String getPartPath() {
        return partPath;
    }
}
