package com.Excel.Book.exception;

public class UnsupportedHashAlgorithmException extends WorkbookException {

    private final String algorithmName;

    public UnsupportedHashAlgorithmException(String algorithmName) {
        super("Unsupported hash algorithm: " + algorithmName);
        this.algorithmName = algorithmName;
    }

    public String getAlgorithmName() {
        return algorithmName;
    }
}
