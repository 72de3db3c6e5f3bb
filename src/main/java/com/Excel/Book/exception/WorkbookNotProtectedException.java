package com.Excel.Book.exception;

public class WorkbookNotProtectedException extends WorkbookException {

    public WorkbookNotProtectedException() {
        super("Workbook has no protection settings");
    }
}
