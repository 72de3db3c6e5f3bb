package com.Excel.Book.model;

import com.Excel.Book.util.XmlBooleanDeserializer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CalcPr {

    @JacksonXmlProperty(isAttribute = true, localName = "calcId")
    private Integer calcId;

    @JsonDeserialize(using = XmlBooleanDeserializer.class)
    @JacksonXmlProperty(isAttribute = true, localName = "fullCalcOnLoad")
    private Boolean fullCalcOnLoad;

    // not interpreted, written back as read
    @JacksonXmlProperty(isAttribute = true, localName = "calcMode")
    private String calcMode;

    @JacksonXmlProperty(isAttribute = true, localName = "refMode")
    private String refMode;

    @JacksonXmlProperty(isAttribute = true, localName = "iterate")
    private String iterate;

    @JacksonXmlProperty(isAttribute = true, localName = "iterateCount")
    private String iterateCount;

    @JacksonXmlProperty(isAttribute = true, localName = "iterateDelta")
    private String iterateDelta;

    @JacksonXmlProperty(isAttribute = true, localName = "fullPrecision")
    private String fullPrecision;

    @JacksonXmlProperty(isAttribute = true, localName = "calcCompleted")
    private String calcCompleted;

    @JacksonXmlProperty(isAttribute = true, localName = "calcOnSave")
    private String calcOnSave;

    @JacksonXmlProperty(isAttribute = true, localName = "concurrentCalc")
    private String concurrentCalc;

    @JacksonXmlProperty(isAttribute = true, localName = "concurrentManualCount")
    private String concurrentManualCount;

    @JacksonXmlProperty(isAttribute = true, localName = "forceFullCalc")
    private String forceFullCalc;
}
