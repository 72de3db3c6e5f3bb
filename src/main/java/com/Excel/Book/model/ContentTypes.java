package com.Excel.Book.model;

import com.Excel.Book.util.Namespaces;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The {@code [Content_Types].xml} part.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"defaults", "overrides"})
@JacksonXmlRootElement(localName = "Types", namespace = Namespaces.CONTENT_TYPES)
public class ContentTypes {

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "Default", namespace = Namespaces.CONTENT_TYPES)
    private List<ContentTypeDefault> defaults = new ArrayList<>();

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "Override", namespace = Namespaces.CONTENT_TYPES)
    private List<ContentTypeOverride> overrides = new ArrayList<>();

    // Default and Override may be interleaved; the reader hands over one list
    // per run of adjacent elements, so runs are appended rather than replaced
    public void setDefaults(List<ContentTypeDefault> defaults) {
        if (defaults != null && defaults != this.defaults) {
            this.defaults.addAll(defaults);
        }
    }

    public void setOverrides(List<ContentTypeOverride> overrides) {
        if (overrides != null && overrides != this.overrides) {
            this.overrides.addAll(overrides);
        }
    }
}
