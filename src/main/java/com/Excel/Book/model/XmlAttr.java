package com.Excel.Book.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A root element attribute or namespace declaration as it appeared in the
 * original part, e.g. {@code xmlns:r} or {@code mc:Ignorable}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class XmlAttr {
    private String name;  // qualified name
    private String value;

    public boolean isNamespaceDeclaration() {
        return "xmlns".equals(name) || name.startsWith("xmlns:");
    }

    /**
     * Prefix bound by this declaration; empty for the default namespace.
     */
    public String declaredPrefix() {
        return "xmlns".equals(name) ? "" : name.substring("xmlns:".length());
    }
}
