package com.Excel.Book.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ContentTypeOverride {

    @JacksonXmlProperty(isAttribute = true, localName = "PartName")
    private String partName;  // absolute, e.g. /xl/workbook.xml

    @JacksonXmlProperty(isAttribute = true, localName = "ContentType")
    private String contentType;
}
