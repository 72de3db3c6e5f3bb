package com.Excel.Book.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A child of a part's root element that has no model, kept as the exact text
 * it was read with and written back unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RawElement {
    private String name;  // qualified name as written
    private String xml;
    private int rank;     // position in the root's child sequence
}
