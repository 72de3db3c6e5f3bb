package com.Excel.Book.service;

import com.Excel.Book.model.ContentTypeOverride;
import com.Excel.Book.model.ContentTypes;
import com.Excel.Book.model.XmlAttr;
import com.Excel.Book.repository.SpreadsheetPackage;
import com.Excel.Book.util.Namespaces;
import com.Excel.Book.util.XmlPartCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Maintains {@code [Content_Types].xml}.
 */
@Service
public class ContentTypesService {

    private static final Logger logger = LoggerFactory.getLogger(ContentTypesService.class);

    public static final String CONTENT_TYPES_PATH = "[Content_Types].xml";

    private static final List<XmlAttr> ROOT_ATTRIBUTES = List.of(new XmlAttr("xmlns", Namespaces.CONTENT_TYPES));

    private final XmlPartCodec codec;

    public ContentTypesService(XmlPartCodec codec) {
        this.codec = codec;
    }

    public ContentTypes getOrLoad(SpreadsheetPackage pkg) {
        if (pkg.getContentTypes() == null) {
            byte[] data = pkg.getParts().readPart(CONTENT_TYPES_PATH);
            pkg.setContentTypes(XmlPartCodec.isBlank(data)
                    ? new ContentTypes()
                    : codec.decode(CONTENT_TYPES_PATH, data, ContentTypes.class));
        }
        return pkg.getContentTypes();
    }

    /**
     * Declare the content type of a part. Does nothing when the part already
     * has an override.
     *
     * @param partName absolute part name, e.g. {@code /xl/worksheets/sheet2.xml}
     */
    public void addOverride(SpreadsheetPackage pkg, String partName, String contentType) {
        ContentTypes types = getOrLoad(pkg);
        boolean exists = types.getOverrides().stream()
                .anyMatch(override -> partName.equals(override.getPartName()));
        if (!exists) {
            types.getOverrides().add(new ContentTypeOverride(partName, contentType));
            logger.debug("Added content type override {} -> {}", partName, contentType);
        }
    }

    public void flush(SpreadsheetPackage pkg) {
        if (pkg.getContentTypes() != null) {
            pkg.getParts().writePart(CONTENT_TYPES_PATH, codec.encode(pkg.getContentTypes(), "Types", ROOT_ATTRIBUTES));
        }
    }
}
