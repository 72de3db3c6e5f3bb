package com.Excel.Book.model;

import com.Excel.Book.util.Namespaces;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A relationship table ({@code .rels} part). Shared between callers of the
 * same package, so reads go through {@link #getLock()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "Relationships", namespace = Namespaces.PACKAGE_RELATIONSHIPS)
public class Relationships {

    @JsonIgnore
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @JacksonXmlElementWrapper(useWrapping = false)
    @JacksonXmlProperty(localName = "Relationship", namespace = Namespaces.PACKAGE_RELATIONSHIPS)
    private List<Relationship> relationships = new ArrayList<>();

    public ReadWriteLock getLock() {
        return lock;
    }

    public List<Relationship> getRelationships() {
        return relationships;
    }

    public void setRelationships(List<Relationship> relationships) {
        this.relationships = relationships != null ? relationships : new ArrayList<>();
    }
}
