package com.Excel.Book.repository;

import java.util.List;

/**
 * Named byte parts of a spreadsheet package. Paths have no leading slash,
 * e.g. {@code xl/workbook.xml}.
 */
public interface PartStore {

    /**
     * Returns the part content, or an empty array when the part does not exist.
     */
    byte[] readPart(String path);

    void writePart(String path, byte[] data);

    boolean hasPart(String path);

    List<String> partNames();
}
