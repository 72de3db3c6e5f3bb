package com.Excel.Book.model;

import com.Excel.Book.util.Namespaces;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * In-memory form of the workbook part ({@code xl/workbook.xml}).
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"fileVersion", "workbookPr", "AlternateContent", "workbookProtection",
        "bookViews", "sheets", "definedNames", "calcPr"})
@JacksonXmlRootElement(localName = "workbook", namespace = Namespaces.SPREADSHEET_MAIN)
public class Workbook {

    /**
     * Local names of the root's children in the order the schema requires.
     */
    public static final List<String> CHILD_ORDER = List.of(
            "fileVersion", "fileSharing", "workbookPr", "AlternateContent", "revisionPtr",
            "workbookProtection", "bookViews", "sheets", "functionGroups", "externalReferences",
            "definedNames", "calcPr", "oleSize", "customWorkbookViews", "pivotCaches", "smartTagPr",
            "smartTagTypes", "webPublishing", "fileRecoveryPr", "webPublishObjects", "extLst");

    /**
     * Children decoded into fields; every other child is kept as a {@link RawElement}.
     */
    public static final Set<String> MODELED_CHILDREN = Set.of(
            "fileVersion", "workbookPr", "AlternateContent", "workbookProtection",
            "bookViews", "sheets", "definedNames", "calcPr");

    @JacksonXmlProperty(localName = "fileVersion", namespace = Namespaces.SPREADSHEET_MAIN)
    private FileVersion fileVersion;

    @JacksonXmlProperty(localName = "workbookPr", namespace = Namespaces.SPREADSHEET_MAIN)
    private WorkbookPr workbookPr;

    // Re-emitted on write only, filled from decodeAlternateContent at flush time
    @JsonRawValue
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    @JacksonXmlProperty(localName = "AlternateContent", namespace = Namespaces.MARKUP_COMPATIBILITY)
    private String alternateContent;

    // Inner XML of mc:AlternateContent captured while decoding
    @JsonIgnore
    private String decodeAlternateContent;

    @JacksonXmlProperty(localName = "workbookProtection", namespace = Namespaces.SPREADSHEET_MAIN)
    private WorkbookProtection workbookProtection;

    @JacksonXmlElementWrapper(localName = "bookViews", namespace = Namespaces.SPREADSHEET_MAIN)
    @JacksonXmlProperty(localName = "workbookView", namespace = Namespaces.SPREADSHEET_MAIN)
    private List<BookView> bookViews;

    @JacksonXmlElementWrapper(localName = "sheets", namespace = Namespaces.SPREADSHEET_MAIN)
    @JacksonXmlProperty(localName = "sheet", namespace = Namespaces.SPREADSHEET_MAIN)
    private List<Sheet> sheets = new ArrayList<>();

    @JacksonXmlElementWrapper(localName = "definedNames", namespace = Namespaces.SPREADSHEET_MAIN)
    @JacksonXmlProperty(localName = "definedName", namespace = Namespaces.SPREADSHEET_MAIN)
    private List<DefinedName> definedNames;

    @JacksonXmlProperty(localName = "calcPr", namespace = Namespaces.SPREADSHEET_MAIN)
    private CalcPr calcPr;

    // externalReferences, pivotCaches, extLst and the like, written back as read
    @JsonIgnore
    private List<RawElement> preservedElements = new ArrayList<>();

    public void addSheet(Sheet sheet) {
        if (sheets == null) {
            sheets = new ArrayList<>();
        }
        sheets.add(sheet);
    }
}
