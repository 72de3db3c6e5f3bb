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
public class ContentTypeDefault {

    @JacksonXmlProperty(isAttribute = true, localName = "Extension")
    private String extension;

    @JacksonXmlProperty(isAttribute = true, localName = "ContentType")
    private String contentType;
}
