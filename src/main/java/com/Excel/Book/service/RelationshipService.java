package com.Excel.Book.service;

import com.Excel.Book.model.Relationship;
import com.Excel.Book.model.Relationships;
import com.Excel.Book.model.XmlAttr;
import com.Excel.Book.repository.SpreadsheetPackage;
import com.Excel.Book.util.Namespaces;
import com.Excel.Book.util.XmlPartCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Reads, extends and writes back the relationship tables of a package.
 */
@Service
public class RelationshipService {

    private static final Logger logger = LoggerFactory.getLogger(RelationshipService.class);

    public static final String PACKAGE_RELS_PATH = "_rels/.rels";

    private static final List<XmlAttr> RELS_ROOT_ATTRIBUTES =
            List.of(new XmlAttr("xmlns", Namespaces.PACKAGE_RELATIONSHIPS));

    private final XmlPartCodec codec;

    public RelationshipService(XmlPartCodec codec) {
        this.codec = codec;
    }

    /**
     * Get the decoded relationship table at a {@code .rels} path, decoding it on
     * first use.
     *
     * @return the table, or null when the package has no such part
     */
    public Relationships getOrLoad(SpreadsheetPackage pkg, String relsPath) {
        Relationships cached = pkg.getRelationships().get(relsPath);
        if (cached != null) {
            return cached;
        }
        byte[] data = pkg.getParts().readPart(relsPath);
        if (XmlPartCodec.isBlank(data)) {
            logger.debug("No relationship part at {}", relsPath);
            return null;
        }
        Relationships decoded = codec.decode(relsPath, data, Relationships.class);
        Relationships existing = pkg.getRelationships().putIfAbsent(relsPath, decoded);
        logger.debug("Loaded {} relationships from {}", decoded.getRelationships().size(), relsPath);
        return existing != null ? existing : decoded;
    }

    /**
     * Append a relationship with the next free {@code rId<n>} id, creating the
     * table when the package has none at this path.
     *
     * @return the numeric part of the new id
     */
    public int addRelationship(SpreadsheetPackage pkg, String relsPath, String type, String target) {
        Relationships rels = getOrLoad(pkg, relsPath);
        if (rels == null) {
            Relationships created = new Relationships();
            rels = pkg.getRelationships().putIfAbsent(relsPath, created);
            if (rels == null) {
                rels = created;
            }
        }

        rels.getLock().writeLock().lock();
        try {
            int rid = 0;
            for (Relationship rel : rels.getRelationships()) {
                rid = Math.max(rid, parseRelationshipNumber(rel.getId()));
            }
            rid++;
            rels.getRelationships().add(new Relationship("rId" + rid, type, target, null));
            logger.info("Added relationship rId{} -> {} to {}", rid, target, relsPath);
            return rid;
        } finally {
            rels.getLock().writeLock().unlock();
        }
    }

    /**
     * Encode every loaded relationship table back into the package.
     */
    public void flush(SpreadsheetPackage pkg) {
        for (Map.Entry<String, Relationships> entry : pkg.getRelationships().entrySet()) {
            Relationships rels = entry.getValue();
            rels.getLock().readLock().lock();
            try {
                pkg.getParts().writePart(entry.getKey(), codec.encode(rels, "Relationships", RELS_ROOT_ATTRIBUTES));
            } finally {
                rels.getLock().readLock().unlock();
            }
        }
    }

    static int parseRelationshipNumber(String id) {
        if (id == null || !id.startsWith("rId")) {
            return 0;
        }
        try {
            return Integer.parseInt(id.substring(3));
        } catch (NumberFormatException e) {
            logger.debug("Ignoring non-numeric relationship id {}", id);
            return 0;
        }
    }
}
