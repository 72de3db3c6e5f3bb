package com.Excel.Book.exception;

/**
 * Base type for failures raised while reading or mutating the workbook part
 */
public class WorkbookException extends RuntimeException {

    public WorkbookException(String message) {
        super(message);
    }

    public WorkbookException(String message, Throwable cause) {
        super(message, cause);
    }
}
