package com.Excel.Book.model;

import com.Excel.Book.util.Namespaces;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A sheet reference in the workbook part. List order is tab order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Sheet {

    @JacksonXmlProperty(isAttribute = true, localName = "name")
    private String name;  // at most 31 characters

    @JacksonXmlProperty(isAttribute = true, localName = "sheetId")
    private Integer sheetId;

    @JacksonXmlProperty(isAttribute = true, localName = "state")
    private String state;  // visible, hidden or veryHidden

    @JacksonXmlProperty(isAttribute = true, localName = "id", namespace = Namespaces.RELATIONSHIPS)
    private String relationshipId;

    public Sheet(String name, int sheetId, String relationshipId) {
        this(name, sheetId, null, relationshipId);
    }
}
