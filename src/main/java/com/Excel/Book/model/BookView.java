package com.Excel.Book.model;

import com.Excel.Book.util.Namespaces;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A {@code workbookView} entry of {@code bookViews}.
 */
// Field access only: Lombok's getXWindow() would otherwise surface as a second "xwindow" property
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class BookView {

    @JacksonXmlProperty(isAttribute = true, localName = "xWindow")
    private Integer xWindow;

    @JacksonXmlProperty(isAttribute = true, localName = "yWindow")
    private Integer yWindow;

    @JacksonXmlProperty(isAttribute = true, localName = "windowWidth")
    private Integer windowWidth;

    @JacksonXmlProperty(isAttribute = true, localName = "windowHeight")
    private Integer windowHeight;

    @JacksonXmlProperty(isAttribute = true, localName = "firstSheet")
    private Integer firstSheet;

    @JacksonXmlProperty(isAttribute = true, localName = "activeTab")
    private Integer activeTab;

    // kept as written
    @JacksonXmlProperty(isAttribute = true, localName = "visibility")
    private String visibility;

    @JacksonXmlProperty(isAttribute = true, localName = "minimized")
    private String minimized;

    @JacksonXmlProperty(isAttribute = true, localName = "showHorizontalScroll")
    private String showHorizontalScroll;

    @JacksonXmlProperty(isAttribute = true, localName = "showVerticalScroll")
    private String showVerticalScroll;

    @JacksonXmlProperty(isAttribute = true, localName = "showSheetTabs")
    private String showSheetTabs;

    @JacksonXmlProperty(isAttribute = true, localName = "tabRatio")
    private String tabRatio;

    @JacksonXmlProperty(isAttribute = true, localName = "autoFilterDateGrouping")
    private String autoFilterDateGrouping;

    @JacksonXmlProperty(isAttribute = true, localName = "uid", namespace = Namespaces.REVISION_2)
    private String uid;
}
