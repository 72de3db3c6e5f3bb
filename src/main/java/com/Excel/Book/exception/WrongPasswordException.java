package com.Excel.Book.exception;

public class WrongPasswordException extends WorkbookException {

    public WrongPasswordException() {
        super("Workbook protection password does not match");
    }
}
