package com.Excel.Book.model;

import com.Excel.Book.util.XmlBooleanDeserializer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The {@code workbookProtection} element. Its presence marks the workbook as
 * protected; salt and hash are kept base64 encoded as they appear in the part.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkbookProtection {

    @JsonDeserialize(using = XmlBooleanDeserializer.class)
    @JacksonXmlProperty(isAttribute = true, localName = "lockStructure")
    private Boolean lockStructure;

    @JsonDeserialize(using = XmlBooleanDeserializer.class)
    @JacksonXmlProperty(isAttribute = true, localName = "lockWindows")
    private Boolean lockWindows;

    @JacksonXmlProperty(isAttribute = true, localName = "workbookAlgorithmName")
    private String algorithmName;

    @JacksonXmlProperty(isAttribute = true, localName = "workbookHashValue")
    private String hashValue;

    @JacksonXmlProperty(isAttribute = true, localName = "workbookSaltValue")
    private String saltValue;

    @JacksonXmlProperty(isAttribute = true, localName = "workbookSpinCount")
    private Integer spinCount;

    // revision protection is carried through untouched
    @JacksonXmlProperty(isAttribute = true, localName = "lockRevision")
    private String lockRevision;

    @JacksonXmlProperty(isAttribute = true, localName = "revisionsAlgorithmName")
    private String revisionsAlgorithmName;

    @JacksonXmlProperty(isAttribute = true, localName = "revisionsHashValue")
    private String revisionsHashValue;

    @JacksonXmlProperty(isAttribute = true, localName = "revisionsSaltValue")
    private String revisionsSaltValue;

    @JacksonXmlProperty(isAttribute = true, localName = "revisionsSpinCount")
    private String revisionsSpinCount;

    public WorkbookProtection(boolean lockStructure, boolean lockWindows) {
        this.lockStructure = lockStructure;
        this.lockWindows = lockWindows;
    }

    public boolean hasAlgorithm() {
        return algorithmName != null && !algorithmName.isEmpty();
    }
}
