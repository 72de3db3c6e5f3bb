package com.Excel.Book.exception;

public class WorkbookAlreadyExistsException extends WorkbookException {

    public WorkbookAlreadyExistsException(String name) {
        super("Workbook already exists: " + name);
    }
}
