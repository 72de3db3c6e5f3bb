package com.Excel.Book.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FileVersion {

    @JacksonXmlProperty(isAttribute = true, localName = "appName")
    private String appName;

    @JacksonXmlProperty(isAttribute = true, localName = "lastEdited")
    private String lastEdited;

    @JacksonXmlProperty(isAttribute = true, localName = "lowestEdited")
    private String lowestEdited;

    @JacksonXmlProperty(isAttribute = true, localName = "rupBuild")
    private String rupBuild;

    @JacksonXmlProperty(isAttribute = true, localName = "codeName")
    private String codeName;
}
