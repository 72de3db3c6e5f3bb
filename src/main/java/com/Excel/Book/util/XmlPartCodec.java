package com.Excel.Book.util;

import com.Excel.Book.exception.WorkbookDecodeException;
import com.Excel.Book.exception.WorkbookException;
import com.Excel.Book.model.RawElement;
import com.Excel.Book.model.XmlAttr;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Decodes package parts into their models and encodes them back, with
 * namespace conventions restored on the way out.
 */
@Component
public class XmlPartCodec {

    private static final Logger logger = LoggerFactory.getLogger(XmlPartCodec.class);

    private final XMLInputFactory inputFactory;
    private final XmlMapper xmlMapper;

    public XmlPartCodec() {
        inputFactory = XMLInputFactory.newFactory();
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);

        xmlMapper = new XmlMapper(inputFactory);
        xmlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        xmlMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * True for a missing or whitespace-only part, which decodes to an empty model.
     */
    public static boolean isBlank(byte[] data) {
        if (data == null) {
            return true;
        }
        return new String(data, StandardCharsets.UTF_8).replace("\uFEFF", "").isBlank();
    }

    public <T> T decode(String path, byte[] data, Class<T> type) {
        logger.debug("Decoding {} ({} bytes) as {}", path, data.length, type.getSimpleName());
        try {
            return xmlMapper.readValue(data, type);
        } catch (IOException e) {
            throw new WorkbookDecodeException(path, e);
        }
    }

    /**
     * Serialize a part model, then rename generated prefixes and restore the
     * root element attributes registered for the part.
     */
    public byte[] encode(Object model, String rootElement, List<XmlAttr> rootAttributes) {
        try {
            String xml = xmlMapper.writeValueAsString(model);
            return NamespaceRewriter.restore(xml, rootElement, rootAttributes).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new WorkbookException("Failed to encode " + rootElement + ": " + e.getMessage(), e);
        }
    }

    /**
     * Encode a part model and put back the root children it has no model for,
     * each ahead of the first encoded child that follows it in
     * {@code childOrder}.
     */
    public byte[] encode(Object model, String rootElement, List<XmlAttr> rootAttributes,
                         List<RawElement> preserved, List<String> childOrder) {
        byte[] encoded = encode(model, rootElement, rootAttributes);
        if (preserved == null || preserved.isEmpty()) {
            return encoded;
        }
        String xml = insertRawElements(new String(encoded, StandardCharsets.UTF_8), preserved, childOrder);
        return xml.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Read the root element of a part, check its name and namespace, and
     * return its namespace declarations followed by its attributes.
     */
    public List<XmlAttr> readRootAttributes(String path, byte[] data, String expectedNamespace, String expectedLocalName) {
        XMLStreamReader reader = null;
        try {
            reader = inputFactory.createXMLStreamReader(new ByteArrayInputStream(data));
            while (reader.getEventType() != XMLStreamConstants.START_ELEMENT) {
                if (!reader.hasNext()) {
                    throw new WorkbookDecodeException(path, "no root element");
                }
                reader.next();
            }

            String namespace = reader.getNamespaceURI() == null ? "" : reader.getNamespaceURI();
            if (!expectedLocalName.equals(reader.getLocalName()) || !expectedNamespace.equals(namespace)) {
                throw new WorkbookDecodeException(path, String.format("expected root {%s}%s but found {%s}%s",
                        expectedNamespace, expectedLocalName, namespace, reader.getLocalName()));
            }

            List<XmlAttr> attributes = new ArrayList<>();
            for (int i = 0; i < reader.getNamespaceCount(); i++) {
                String prefix = reader.getNamespacePrefix(i);
                String name = (prefix == null || prefix.isEmpty()) ? "xmlns" : "xmlns:" + prefix;
                attributes.add(new XmlAttr(name, reader.getNamespaceURI(i)));
            }
            for (int i = 0; i < reader.getAttributeCount(); i++) {
                String prefix = reader.getAttributePrefix(i);
                String local = reader.getAttributeLocalName(i);
                String name = (prefix == null || prefix.isEmpty()) ? local : prefix + ":" + local;
                attributes.add(new XmlAttr(name, reader.getAttributeValue(i)));
            }
            return attributes;
        } catch (XMLStreamException e) {
            throw new WorkbookDecodeException(path, e);
        } finally {
            close(reader);
        }
    }

    /**
     * Inner XML of the {@code AlternateContent} child of the root element, or
     * null. Blocks nested deeper belong to their own elements.
     */
    public String extractAlternateContent(byte[] data) {
        if (isBlank(data)) {
            return null;
        }
        String xml = new String(data, StandardCharsets.UTF_8);
        XmlElementScanner.Root root = XmlElementScanner.scan(xml);
        if (root == null) {
            return null;
        }
        for (XmlElementScanner.Element child : root.getChildren()) {
            if ("AlternateContent".equals(child.getLocalName())) {
                return child.innerXml(xml);
            }
        }
        return null;
    }

    /**
     * Children of the root element whose local name is not in {@code modeled},
     * verbatim and ranked by {@code childOrder}. A child missing from
     * {@code childOrder} ranks right after the known child before it.
     */
    public List<RawElement> extractRawElements(byte[] data, Set<String> modeled, List<String> childOrder) {
        List<RawElement> raw = new ArrayList<>();
        if (isBlank(data)) {
            return raw;
        }
        String xml = new String(data, StandardCharsets.UTF_8);
        XmlElementScanner.Root root = XmlElementScanner.scan(xml);
        if (root == null) {
            return raw;
        }
        int[] ranks = ranks(root.getChildren(), childOrder);
        for (int i = 0; i < ranks.length; i++) {
            XmlElementScanner.Element child = root.getChildren().get(i);
            if (!modeled.contains(child.getLocalName())) {
                raw.add(new RawElement(child.getName(), child.outerXml(xml), ranks[i]));
            }
        }
        if (!raw.isEmpty()) {
            logger.debug("Keeping {} unmodeled elements verbatim", raw.size());
        }
        return raw;
    }

    static String insertRawElements(String xml, List<RawElement> preserved, List<String> childOrder) {
        XmlElementScanner.Root root = XmlElementScanner.scan(xml);
        if (root == null) {
            throw new WorkbookException("Encoded part has no root element");
        }
        XmlElementScanner.Element rootElement = root.getElement();
        List<XmlElementScanner.Element> children = root.getChildren();
        int[] ranks = ranks(children, childOrder);

        Map<Integer, StringBuilder> insertions = new TreeMap<>();
        for (RawElement element : preserved) {
            int at = rootElement.getContentEnd();
            for (int i = 0; i < ranks.length; i++) {
                if (ranks[i] > element.getRank()) {
                    at = children.get(i).getStart();
                    break;
                }
            }
            insertions.computeIfAbsent(at, key -> new StringBuilder()).append(element.getXml());
        }

        StringBuilder out = new StringBuilder(xml.length() + 256);
        if (rootElement.isEmptyTag()) {
            int slash = xml.lastIndexOf('/', rootElement.getEnd() - 1);
            out.append(xml, 0, slash).append('>');
            insertions.values().forEach(out::append);
            out.append("</").append(rootElement.getName()).append('>').append(xml, rootElement.getEnd(), xml.length());
            return out.toString();
        }
        int pos = 0;
        for (Map.Entry<Integer, StringBuilder> insertion : insertions.entrySet()) {
            out.append(xml, pos, insertion.getKey()).append(insertion.getValue());
            pos = insertion.getKey();
        }
        return out.append(xml, pos, xml.length()).toString();
    }

    // known children rank 2i by their index i, unknown ones one above the known child before them
    private static int[] ranks(List<XmlElementScanner.Element> children, List<String> childOrder) {
        int[] ranks = new int[children.size()];
        int lastKnown = -2;
        for (int i = 0; i < ranks.length; i++) {
            int index = childOrder.indexOf(children.get(i).getLocalName());
            if (index >= 0) {
                lastKnown = index * 2;
                ranks[i] = lastKnown;
            } else {
                ranks[i] = lastKnown + 1;
            }
        }
        return ranks;
    }

    private static void close(XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException e) {
            logger.warn("Failed to close XML reader: {}", e.getMessage());
        }
    }
}
