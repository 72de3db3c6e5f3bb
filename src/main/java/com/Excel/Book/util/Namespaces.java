package com.Excel.Book.util;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Namespace URIs, relationship types and content types used by spreadsheet packages
 */
public final class Namespaces {

    public static final String SPREADSHEET_MAIN = "http://schemas.openxmlformats.org/spreadsheetml/2006/main";
    public static final String RELATIONSHIPS = "http://schemas.openxmlformats.org/officeDocument/2006/relationships";
    public static final String PACKAGE_RELATIONSHIPS = "http://schemas.openxmlformats.org/package/2006/relationships";
    public static final String CONTENT_TYPES = "http://schemas.openxmlformats.org/package/2006/content-types";
    public static final String MARKUP_COMPATIBILITY = "http://schemas.openxmlformats.org/markup-compatibility/2006";
    public static final String REVISION_2 = "http://schemas.microsoft.com/office/spreadsheetml/2015/revision2";

    public static final String RELATIONSHIP_OFFICE_DOCUMENT = RELATIONSHIPS + "/officeDocument";
    public static final String RELATIONSHIP_OFFICE_DOCUMENT_STRICT = "http://purl.oclc.org/ooxml/officeDocument/relationships/officeDocument";
    public static final String RELATIONSHIP_WORKSHEET = RELATIONSHIPS + "/worksheet";

    public static final String CONTENT_TYPE_WORKBOOK = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet.main+xml";
    public static final String CONTENT_TYPE_WORKSHEET = "application/vnd.openxmlformats-officedocument.spreadsheetml.worksheet+xml";

    public static final String XML_HEADER = "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>\n";

    /**
     * Conventional prefixes, used when re-emitting generated namespace bindings
     */
    public static final Map<String, String> CONVENTIONAL_PREFIXES;

    private static final Map<String, String> STRICT_TO_TRANSITIONAL = new LinkedHashMap<>();

    static {
        Map<String, String> prefixes = new LinkedHashMap<>();
        prefixes.put(RELATIONSHIPS, "r");
        prefixes.put(MARKUP_COMPATIBILITY, "mc");
        prefixes.put("http://schemas.microsoft.com/office/spreadsheetml/2009/9/ac", "x14ac");
        prefixes.put("http://schemas.microsoft.com/office/spreadsheetml/2010/11/main", "x15");
        prefixes.put("http://schemas.microsoft.com/office/spreadsheetml/2010/11/ac", "x15ac");
        prefixes.put("http://schemas.microsoft.com/office/spreadsheetml/2014/revision", "xr");
        prefixes.put("http://schemas.microsoft.com/office/spreadsheetml/2016/revision6", "xr6");
        prefixes.put("http://schemas.microsoft.com/office/spreadsheetml/2016/revision10", "xr10");
        prefixes.put(REVISION_2, "xr2");
        CONVENTIONAL_PREFIXES = Collections.unmodifiableMap(prefixes);

        STRICT_TO_TRANSITIONAL.put("http://purl.oclc.org/ooxml/spreadsheetml/main", SPREADSHEET_MAIN);
        STRICT_TO_TRANSITIONAL.put("http://purl.oclc.org/ooxml/officeDocument/relationships", RELATIONSHIPS);
        STRICT_TO_TRANSITIONAL.put("http://purl.oclc.org/ooxml/drawingml/main", "http://schemas.openxmlformats.org/drawingml/2006/main");
        STRICT_TO_TRANSITIONAL.put("http://purl.oclc.org/ooxml/officeDocument/math", "http://schemas.openxmlformats.org/officeDocument/2006/math");
    }

    private Namespaces() {
    }

    /**
     * Rewrite strict OOXML namespace URIs in a part to their transitional form.
     */
    public static byte[] strictToTransitional(byte[] data) {
        if (data == null || data.length == 0) {
            return data;
        }
        String xml = new String(data, StandardCharsets.UTF_8);
        if (!xml.contains("http://purl.oclc.org/ooxml/")) {
            return data;
        }
        for (Map.Entry<String, String> entry : STRICT_TO_TRANSITIONAL.entrySet()) {
            xml = xml.replace(entry.getKey(), entry.getValue());
        }
        return xml.getBytes(StandardCharsets.UTF_8);
    }

    public static boolean isOfficeDocumentRelationship(String type) {
        return RELATIONSHIP_OFFICE_DOCUMENT.equals(type) || RELATIONSHIP_OFFICE_DOCUMENT_STRICT.equals(type);
    }
}
