package com.Excel.Book.service;

import com.Excel.Book.exception.WorkbookDecodeException;
import com.Excel.Book.model.Relationship;
import com.Excel.Book.model.Relationships;
import com.Excel.Book.repository.SpreadsheetPackage;
import com.Excel.Book.util.Namespaces;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Locates the workbook part and its relationship part from the package-level
 * relationships. Paths are recomputed on every call, since the package
 * relationships can change while the package is being assembled.
 */
@Service
public class WorkbookPathResolver {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookPathResolver.class);

    private final RelationshipService relationshipService;

    public WorkbookPathResolver(RelationshipService relationshipService) {
        this.relationshipService = relationshipService;
    }

    /**
     * Path of the workbook part, e.g. {@code xl/workbook.xml}, or an empty
     * string when the package declares no office document.
     */
    public String resolveWorkbookPath(SpreadsheetPackage pkg) {
        Relationships rels;
        try {
            rels = relationshipService.getOrLoad(pkg, RelationshipService.PACKAGE_RELS_PATH);
        } catch (WorkbookDecodeException e) {
            logger.warn("Unreadable package relationships, workbook path unknown: {}", e.getMessage());
            return "";
        }
        if (rels == null) {
            return "";
        }

        rels.getLock().readLock().lock();
        try {
            for (Relationship rel : rels.getRelationships()) {
                if (Namespaces.isOfficeDocumentRelationship(rel.getType()) && rel.getTarget() != null) {
                    String target = rel.getTarget();
                    return target.startsWith("/") ? target.substring(1) : target;
                }
            }
        } finally {
            rels.getLock().readLock().unlock();
        }
        logger.debug("No office document relationship in {}", RelationshipService.PACKAGE_RELS_PATH);
        return "";
    }

    /**
     * Path of the workbook's relationship part, e.g. {@code xl/_rels/workbook.xml.rels}.
     */
    public String resolveWorkbookRelsPath(SpreadsheetPackage pkg) {
        return relsPathFor(resolveWorkbookPath(pkg));
    }

    /**
     * Relationship part path for a part: {@code <dir>/_rels/<base>.rels}, or
     * {@code _rels/<base>.rels} for a part at the package root. Empty for an
     * empty part path.
     */
    public static String relsPathFor(String partPath) {
        if (partPath == null || partPath.isEmpty()) {
            return "";
        }
        int slash = partPath.lastIndexOf('/');
        if (slash < 0) {
            return "_rels/" + partPath + ".rels";
        }
        String dir = partPath.substring(0, slash);
        String base = partPath.substring(slash + 1);
        String rels = dir + "/_rels/" + base + ".rels";
        return rels.startsWith("/") ? rels.substring(1) : rels;
    }
}
