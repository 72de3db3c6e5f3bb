package com.Excel.Book.model;

import com.Excel.Book.util.XmlBooleanDeserializer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The {@code workbookPr} element. Unset attributes are not written.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkbookPr {

    @JsonDeserialize(using = XmlBooleanDeserializer.class)
    @JacksonXmlProperty(isAttribute = true, localName = "date1904")
    private Boolean date1904;

    @JsonDeserialize(using = XmlBooleanDeserializer.class)
    @JacksonXmlProperty(isAttribute = true, localName = "filterPrivacy")
    private Boolean filterPrivacy;

    @JacksonXmlProperty(isAttribute = true, localName = "codeName")
    private String codeName;

    @JacksonXmlProperty(isAttribute = true, localName = "defaultThemeVersion")
    private Integer defaultThemeVersion;

    // not interpreted, written back as read
    @JacksonXmlProperty(isAttribute = true, localName = "dateCompatibility")
    private String dateCompatibility;

    @JacksonXmlProperty(isAttribute = true, localName = "showObjects")
    private String showObjects;

    @JacksonXmlProperty(isAttribute = true, localName = "showBorderUnselectedTables")
    private String showBorderUnselectedTables;

    @JacksonXmlProperty(isAttribute = true, localName = "promptedSolutions")
    private String promptedSolutions;

    @JacksonXmlProperty(isAttribute = true, localName = "showInkAnnotation")
    private String showInkAnnotation;

    @JacksonXmlProperty(isAttribute = true, localName = "backupFile")
    private String backupFile;

    @JacksonXmlProperty(isAttribute = true, localName = "saveExternalLinkValues")
    private String saveExternalLinkValues;

    @JacksonXmlProperty(isAttribute = true, localName = "updateLinks")
    private String updateLinks;

    @JacksonXmlProperty(isAttribute = true, localName = "hidePivotFieldList")
    private String hidePivotFieldList;

    @JacksonXmlProperty(isAttribute = true, localName = "showPivotChartFilter")
    private String showPivotChartFilter;

    @JacksonXmlProperty(isAttribute = true, localName = "allowRefreshQuery")
    private String allowRefreshQuery;

    @JacksonXmlProperty(isAttribute = true, localName = "publishItems")
    private String publishItems;

    @JacksonXmlProperty(isAttribute = true, localName = "checkCompatibility")
    private String checkCompatibility;

    @JacksonXmlProperty(isAttribute = true, localName = "autoCompressPictures")
    private String autoCompressPictures;

    @JacksonXmlProperty(isAttribute = true, localName = "refreshAllConnections")
    private String refreshAllConnections;
}
