package com.Excel.Book.model;

import com.Excel.Book.util.XmlBooleanDeserializer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DefinedName {

    @JacksonXmlProperty(isAttribute = true, localName = "name")
    private String name;

    @JacksonXmlProperty(isAttribute = true, localName = "localSheetId")
    private Integer localSheetId;

    @JsonDeserialize(using = XmlBooleanDeserializer.class)
    @JacksonXmlProperty(isAttribute = true, localName = "hidden")
    private Boolean hidden;

    @JacksonXmlText
    private String formula;

    @JacksonXmlProperty(isAttribute = true, localName = "comment")
    private String comment;

    @JacksonXmlProperty(isAttribute = true, localName = "customMenu")
    private String customMenu;

    @JacksonXmlProperty(isAttribute = true, localName = "description")
    private String description;

    @JacksonXmlProperty(isAttribute = true, localName = "help")
    private String help;

    @JacksonXmlProperty(isAttribute = true, localName = "statusBar")
    private String statusBar;

    @JacksonXmlProperty(isAttribute = true, localName = "function")
    private String function;

    @JacksonXmlProperty(isAttribute = true, localName = "vbProcedure")
    private String vbProcedure;

    @JacksonXmlProperty(isAttribute = true, localName = "xlm")
    private String xlm;

    @JacksonXmlProperty(isAttribute = true, localName = "functionGroupId")
    private String functionGroupId;

    @JacksonXmlProperty(isAttribute = true, localName = "shortcutKey")
    private String shortcutKey;

    @JacksonXmlProperty(isAttribute = true, localName = "publishToServer")
    private String publishToServer;

    @JacksonXmlProperty(isAttribute = true, localName = "workbookParameter")
    private String workbookParameter;
}
