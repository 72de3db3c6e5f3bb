package com.Excel.Book.repository;

import com.Excel.Book.model.ContentTypes;
import com.Excel.Book.model.Relationships;
import com.Excel.Book.model.Workbook;
import com.Excel.Book.model.XmlAttr;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An open spreadsheet package. Owns the parts and every decoded view of them:
 * relationship tables, content types, root namespace declarations and the
 * workbook part itself. Decoded views are loaded on first use by the services
 * and live as long as this handle.
 *
 * <p>Mutation is single-writer; only the relationship tables are read
 * concurrently and they carry their own lock.
 */
public class SpreadsheetPackage {

    private final PartStore parts;
    private final Map<String, Relationships> relationships = new ConcurrentHashMap<>();
    private final Map<String, List<XmlAttr>> xmlAttributes = new ConcurrentHashMap<>();
    private ContentTypes contentTypes;
    private Workbook workbook;

    public SpreadsheetPackage(PartStore parts) {
        this.parts = parts;
    }

    public PartStore getParts() {
        return parts;
    }

    /**
     * Decoded relationship tables keyed by {@code .rels} part path.
     */
    public Map<String, Relationships> getRelationships() {
        return relationships;
    }

    /**
     * Root element attributes and namespace declarations keyed by part path,
     * restored on every write of that part.
     */
    public Map<String, List<XmlAttr>> getXmlAttributes() {
        return xmlAttributes;
    }

    public ContentTypes getContentTypes() {
        return contentTypes;
    }

    public void setContentTypes(ContentTypes contentTypes) {
        this.contentTypes = contentTypes;
    }

    /**
     * The cached workbook part, or null when it has not been loaded yet.
     */
    public Workbook getWorkbook() {
        return workbook;
    }

    public void setWorkbook(Workbook workbook) {
        this.workbook = workbook;
    }
}
