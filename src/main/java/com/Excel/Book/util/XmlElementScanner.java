package com.Excel.Book.util;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Locates the root element of a part and its direct children as character
 * ranges of the text, so children can be copied or inserted verbatim.
 *
 * <p>Expects well-formed input. Comments, CDATA sections and processing
 * instructions are skipped, and quoted attribute values may contain {@code >}.
 */
public final class XmlElementScanner {

    private XmlElementScanner() {
    }

    /**
     * An element as a range of the scanned text.
     */
    @Getter
    @AllArgsConstructor
    public static class Element {
        private final String name;       // qualified name as written
        private final int start;
        private final int end;           // exclusive
        private final int contentStart;  // equals end for an empty element tag
        private final int contentEnd;

        public String getLocalName() {
            int colon = name.indexOf(':');
            return colon < 0 ? name : name.substring(colon + 1);
        }

        public boolean isEmptyTag() {
            return contentStart == end;
        }

        public String outerXml(String xml) {
            return xml.substring(start, end);
        }

        public String innerXml(String xml) {
            return xml.substring(contentStart, contentEnd);
        }
    }

    @Getter
    @AllArgsConstructor
    public static class Root {
        private final Element element;
        private final List<Element> children;
    }

    /**
     * The root element and its direct children, or null when the text has no
     * complete root element.
     */
    public static Root scan(String xml) {
        int pos = 0;
        while (true) {
            int lt = xml.indexOf('<', pos);
            if (lt < 0) {
                return null;
            }
            if (xml.startsWith("<?", lt)) {
                pos = skipPast(xml, lt, "?>");
            } else if (xml.startsWith("<!--", lt)) {
                pos = skipPast(xml, lt, "-->");
            } else if (xml.startsWith("<!", lt)) {
                pos = skipDeclaration(xml, lt);
            } else {
                return scanRoot(xml, lt);
            }
        }
    }

    private static Root scanRoot(String xml, int lt) {
        String name = readName(xml, lt + 1);
        int tagEnd = tagEnd(xml, lt);
        if (tagEnd < 0) {
            return null;
        }
        if (xml.charAt(tagEnd - 2) == '/') {
            return new Root(new Element(name, lt, tagEnd, tagEnd, tagEnd), Collections.emptyList());
        }
        List<Element> children = new ArrayList<>();
        int contentEnd = scanChildren(xml, tagEnd, children);
        if (contentEnd < 0) {
            return null;
        }
        int end = xml.indexOf('>', contentEnd) + 1;
        return new Root(new Element(name, lt, end, tagEnd, contentEnd), children);
    }

    /**
     * Collect direct children starting at {@code from}, returning the index of
     * the enclosing end tag, or -1 when the text ends first.
     */
    private static int scanChildren(String xml, int from, List<Element> children) {
        int pos = from;
        int depth = 0;
        String childName = null;
        int childStart = -1;
        int childContentStart = -1;
        while (true) {
            int lt = xml.indexOf('<', pos);
            if (lt < 0) {
                return -1;
            }
            if (xml.startsWith("<!--", lt)) {
                pos = skipPast(xml, lt, "-->");
                continue;
            }
            if (xml.startsWith("<![CDATA[", lt)) {
                pos = skipPast(xml, lt, "]]>");
                continue;
            }
            if (xml.startsWith("<?", lt)) {
                pos = skipPast(xml, lt, "?>");
                continue;
            }
            if (xml.startsWith("</", lt)) {
                int gt = xml.indexOf('>', lt);
                if (gt < 0) {
                    return -1;
                }
                if (depth == 0) {
                    return lt;
                }
                depth--;
                if (depth == 0) {
                    children.add(new Element(childName, childStart, gt + 1, childContentStart, lt));
                }
                pos = gt + 1;
                continue;
            }

            int gt = tagEnd(xml, lt);
            if (gt < 0) {
                return -1;
            }
            boolean emptyTag = xml.charAt(gt - 2) == '/';
            if (depth == 0) {
                childName = readName(xml, lt + 1);
                childStart = lt;
                childContentStart = gt;
                if (emptyTag) {
                    children.add(new Element(childName, lt, gt, gt, gt));
                } else {
                    depth = 1;
                }
            } else if (!emptyTag) {
                depth++;
            }
            pos = gt;
        }
    }

    /**
     * Index just past the {@code >} closing the tag opened at {@code lt}, or -1.
     */
    private static int tagEnd(String xml, int lt) {
        char quote = 0;
        for (int i = lt + 1; i < xml.length(); i++) {
            char c = xml.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '>') {
                return i + 1;
            }
        }
        return -1;
    }

    private static String readName(String xml, int from) {
        int i = from;
        while (i < xml.length()) {
            char c = xml.charAt(i);
            if (Character.isWhitespace(c) || c == '/' || c == '>') {
                break;
            }
            i++;
        }
        return xml.substring(from, i);
    }

    private static int skipPast(String xml, int from, String terminator) {
        int index = xml.indexOf(terminator, from);
        return index < 0 ? xml.length() : index + terminator.length();
    }

    // <!DOCTYPE ...> with an optional [internal subset]
    private static int skipDeclaration(String xml, int lt) {
        int gt = xml.indexOf('>', lt);
        int bracket = xml.indexOf('[', lt);
        if (bracket >= 0 && (gt < 0 || bracket < gt)) {
            int close = xml.indexOf(']', bracket);
            return close < 0 ? xml.length() : skipPast(xml, close, ">");
        }
        return gt < 0 ? xml.length() : gt + 1;
    }
}
