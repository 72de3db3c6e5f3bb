package com.Excel.Book.service;

import com.Excel.Book.model.Workbook;
import com.Excel.Book.model.XmlAttr;
import com.Excel.Book.repository.SpreadsheetPackage;
import com.Excel.Book.util.Namespaces;
import com.Excel.Book.util.XmlPartCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Loads the workbook part of a package once, keeps the decoded copy on the
 * package as the only source of truth, and writes it back on flush.
 */
@Service
public class WorkbookPartService {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookPartService.class);

    public static final String DEFAULT_WORKBOOK_PATH = "xl/workbook.xml";
    private static final String ROOT_ELEMENT = "workbook";

    private final WorkbookPathResolver pathResolver;
    private final RelationshipService relationshipService;
    private final ContentTypesService contentTypesService;
    private final XmlPartCodec codec;

    public WorkbookPartService(WorkbookPathResolver pathResolver, RelationshipService relationshipService,
                               ContentTypesService contentTypesService, XmlPartCodec codec) {
        this.pathResolver = pathResolver;
        this.relationshipService = relationshipService;
        this.contentTypesService = contentTypesService;
        this.codec = codec;
    }

    /**
     * Get the decoded workbook part, decoding it on first use. A missing or
     * empty part yields an empty workbook. Nothing is cached when decoding fails.
     */
    public Workbook getOrLoad(SpreadsheetPackage pkg) {
        Workbook cached = pkg.getWorkbook();
        if (cached != null) {
            return cached;
        }

        String path = pathResolver.resolveWorkbookPath(pkg);
        byte[] data = Namespaces.strictToTransitional(pkg.getParts().readPart(path));

        Workbook workbook;
        List<XmlAttr> rootAttributes;
        if (XmlPartCodec.isBlank(data)) {
            logger.info("Workbook part '{}' is missing or empty, starting from an empty workbook", path);
            workbook = new Workbook();
            rootAttributes = new ArrayList<>();
        } else {
            rootAttributes = codec.readRootAttributes(path, data, Namespaces.SPREADSHEET_MAIN, ROOT_ELEMENT);
            // written back as transitional
            rootAttributes.removeIf(attr -> "conformance".equals(attr.getName()));
            workbook = codec.decode(path, data, Workbook.class);
            workbook.setDecodeAlternateContent(codec.extractAlternateContent(data));
            workbook.setPreservedElements(
                    codec.extractRawElements(data, Workbook.MODELED_CHILDREN, Workbook.CHILD_ORDER));
            logger.info("Loaded workbook part '{}' with {} sheets", path,
                    workbook.getSheets() == null ? 0 : workbook.getSheets().size());
        }

        if (!pkg.getXmlAttributes().containsKey(path)) {
            pkg.getXmlAttributes().put(path, withRequiredNamespaces(rootAttributes));
        }
        pkg.setWorkbook(workbook);
        return workbook;
    }

    /**
     * Write the cached workbook back into the package. Does nothing when the
     * workbook was never loaded.
     */
    public void flush(SpreadsheetPackage pkg) {
        Workbook workbook = pkg.getWorkbook();
        if (workbook == null) {
            return;
        }

        if (workbook.getDecodeAlternateContent() != null) {
            workbook.setAlternateContent(workbook.getDecodeAlternateContent());
        }
        workbook.setDecodeAlternateContent(null);

        String path = pathResolver.resolveWorkbookPath(pkg);
        if (path.isEmpty()) {
            path = registerDefaultWorkbookPart(pkg);
        }

        List<XmlAttr> rootAttributes = pkg.getXmlAttributes()
                .computeIfAbsent(path, p -> withRequiredNamespaces(new ArrayList<>()));
        pkg.getParts().writePart(path, codec.encode(workbook, ROOT_ELEMENT, rootAttributes,
                workbook.getPreservedElements(), Workbook.CHILD_ORDER));
        logger.info("Saved workbook part '{}'", path);
    }

    /**
     * A package without an office document relationship gets one pointing at
     * the default workbook location.
     */
    private String registerDefaultWorkbookPart(SpreadsheetPackage pkg) {
        logger.info("Package has no workbook relationship, registering {}", DEFAULT_WORKBOOK_PATH);
        relationshipService.addRelationship(pkg, RelationshipService.PACKAGE_RELS_PATH,
                Namespaces.RELATIONSHIP_OFFICE_DOCUMENT, DEFAULT_WORKBOOK_PATH);
        contentTypesService.addOverride(pkg, "/" + DEFAULT_WORKBOOK_PATH, Namespaces.CONTENT_TYPE_WORKBOOK);

        List<XmlAttr> unplaced = pkg.getXmlAttributes().remove("");
        if (unplaced != null) {
            pkg.getXmlAttributes().putIfAbsent(DEFAULT_WORKBOOK_PATH, unplaced);
        }
        return DEFAULT_WORKBOOK_PATH;
    }

    /**
     * The main namespace as default namespace and the relationships namespace
     * as {@code r} are always declared on the root.
     */
    static List<XmlAttr> withRequiredNamespaces(List<XmlAttr> rootAttributes) {
        List<XmlAttr> attributes = new ArrayList<>(rootAttributes);
        boolean hasDefault = attributes.stream().anyMatch(attr -> "xmlns".equals(attr.getName()));
        if (!hasDefault) {
            attributes.add(0, new XmlAttr("xmlns", Namespaces.SPREADSHEET_MAIN));
        }
        boolean hasRelationships = attributes.stream()
                .anyMatch(attr -> attr.isNamespaceDeclaration() && Namespaces.RELATIONSHIPS.equals(attr.getValue()));
        boolean prefixTaken = attributes.stream().anyMatch(attr -> "xmlns:r".equals(attr.getName()));
        if (!hasRelationships && !prefixTaken) {
            attributes.add(new XmlAttr("xmlns:r", Namespaces.RELATIONSHIPS));
        }
        return attributes;
    }
}
