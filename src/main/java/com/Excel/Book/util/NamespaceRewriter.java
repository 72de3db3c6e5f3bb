package com.Excel.Book.util;

import com.Excel.Book.model.XmlAttr;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Brings serializer output back to the namespace conventions of the package.
 *
 * <p>The XML writer binds namespaces to generated prefixes ({@code wstxns1},
 * {@code wstxns2}, ...) wherever it first needs them. Spreadsheet consumers
 * expect the main namespace as the default namespace, relationship ids as
 * {@code r:id}, and the root element carrying the declarations and attributes
 * it had when the part was read (for instance {@code mc:Ignorable}).
 */
public final class NamespaceRewriter {

    private static final Pattern PREFIX_DECLARATION = Pattern.compile("\\sxmlns:([A-Za-z_][\\w.-]*)=\"([^\"]*)\"");
    private static final Pattern ANY_DECLARATION = Pattern.compile("\\s(xmlns(?::[A-Za-z_][\\w.-]*)?)=\"([^\"]*)\"");

    private NamespaceRewriter() {
    }

    /**
     * Rename generated prefixes, restore the root element from the registered
     * attributes, drop declarations the root already makes, and prepend the
     * XML declaration.
     *
     * @param xml            serializer output, without XML declaration
     * @param rootElement    local name of the root element
     * @param rootAttributes persisted root attributes, default namespace included
     */
    public static String restore(String xml, String rootElement, List<XmlAttr> rootAttributes) {
        Map<String, String> canonical = canonicalPrefixes(rootAttributes);

        Map<String, String> renames = new LinkedHashMap<>();
        Matcher declarations = PREFIX_DECLARATION.matcher(xml);
        while (declarations.find()) {
            String prefix = declarations.group(1);
            String target = canonical.get(declarations.group(2));
            if (target != null && !target.equals(prefix)) {
                renames.put(prefix, target);
            }
        }
        for (Map.Entry<String, String> rename : renames.entrySet()) {
            xml = renamePrefix(xml, rename.getKey(), rename.getValue());
        }

        Matcher root = Pattern.compile("<" + Pattern.quote(rootElement) + "(\\s[^>]*)?/?>").matcher(xml);
        if (!root.find()) {
            return Namespaces.XML_HEADER + xml;
        }
        String rootTag = buildRootTag(root.group(), rootElement, rootAttributes);
        String body = dropInScopeDeclarations(xml.substring(root.end()), rootAttributes);
        return Namespaces.XML_HEADER + xml.substring(0, root.start()) + rootTag + body;
    }

    /**
     * Namespace URI to the prefix it should be written with. The default
     * namespace maps to the empty prefix.
     */
    static Map<String, String> canonicalPrefixes(List<XmlAttr> rootAttributes) {
        Map<String, String> canonical = new HashMap<>(Namespaces.CONVENTIONAL_PREFIXES);
        for (XmlAttr attr : rootAttributes) {
            if (attr.isNamespaceDeclaration()) {
                canonical.put(attr.getValue(), attr.declaredPrefix());
            }
        }
        return canonical;
    }

    static String renamePrefix(String xml, String from, String to) {
        String quoted = Pattern.quote(from);
        String declaration = to.isEmpty() ? "xmlns=" : "xmlns:" + to + "=";
        xml = xml.replaceAll("(\\s)xmlns:" + quoted + "=", "$1" + Matcher.quoteReplacement(declaration));
        String elementPrefix = to.isEmpty() ? "" : to + ":";
        xml = xml.replaceAll("(</?)" + quoted + ":", "$1" + Matcher.quoteReplacement(elementPrefix));
        if (!to.isEmpty()) {
            // unprefixed attributes are in no namespace, so never strip an attribute prefix
            xml = xml.replaceAll("(\\s)" + quoted + ":([\\w.-]+=)", "$1" + Matcher.quoteReplacement(to + ":") + "$2");
        }
        return xml;
    }

    private static String buildRootTag(String generatedTag, String rootElement, List<XmlAttr> rootAttributes) {
        StringBuilder tag = new StringBuilder("<").append(rootElement);
        Map<String, String> written = new HashMap<>();
        for (XmlAttr attr : rootAttributes) {
            tag.append(' ').append(attr.getName()).append("=\"").append(escape(attr.getValue())).append('"');
            written.put(attr.getName(), attr.getValue());
        }
        // keep declarations the serializer put on the root that were not registered
        Matcher generated = ANY_DECLARATION.matcher(generatedTag);
        while (generated.find()) {
            if (!written.containsKey(generated.group(1))) {
                tag.append(' ').append(generated.group(1)).append("=\"").append(generated.group(2)).append('"');
                written.put(generated.group(1), generated.group(2));
            }
        }
        tag.append(generatedTag.endsWith("/>") ? "/>" : ">");
        return tag.toString();
    }

    private static String dropInScopeDeclarations(String body, List<XmlAttr> rootAttributes) {
        for (XmlAttr attr : rootAttributes) {
            if (attr.isNamespaceDeclaration()) {
                body = body.replace(" " + attr.getName() + "=\"" + escape(attr.getValue()) + "\"", "");
            }
        }
        return body;
    }

    static String escape(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace("\"", "&quot;");
    }
}
