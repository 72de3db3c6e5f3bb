package com.Excel.Book.service;

import com.Excel.Book.dto.SheetInfo;
import com.Excel.Book.model.Relationship;
import com.Excel.Book.model.Relationships;
import com.Excel.Book.model.Sheet;
import com.Excel.Book.model.Workbook;
import com.Excel.Book.repository.SpreadsheetPackage;
import com.Excel.Book.util.Namespaces;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Sheet list of the workbook part: registration of new sheets and lookup of
 * their worksheet parts.
 */
@Service
public class WorkbookSheetService {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookSheetService.class);

    public static final int MAX_SHEET_NAME_LENGTH = 31;
    private static final String INVALID_SHEET_NAME_CHARS = ":\\/?*[]";

    private static final String EMPTY_WORKSHEET = Namespaces.XML_HEADER
            + "<worksheet xmlns=\"" + Namespaces.SPREADSHEET_MAIN + "\" xmlns:r=\"" + Namespaces.RELATIONSHIPS + "\">"
            + "<dimension ref=\"A1\"/><sheetViews><sheetView workbookViewId=\"0\"/></sheetViews>"
            + "<sheetFormatPr defaultRowHeight=\"15\"/><sheetData/>"
            + "<pageMargins left=\"0.7\" right=\"0.7\" top=\"0.75\" bottom=\"0.75\" header=\"0.3\" footer=\"0.3\"/>"
            + "</worksheet>";

    private final WorkbookPartService workbookPartService;
    private final WorkbookPathResolver pathResolver;
    private final RelationshipService relationshipService;
    private final ContentTypesService contentTypesService;

    public WorkbookSheetService(WorkbookPartService workbookPartService, WorkbookPathResolver pathResolver,
                                RelationshipService relationshipService, ContentTypesService contentTypesService) {
        this.workbookPartService = workbookPartService;
        this.pathResolver = pathResolver;
        this.relationshipService = relationshipService;
        this.contentTypesService = contentTypesService;
    }

    /**
     * Append a sheet reference to the workbook part. Callers validate the name
     * and keep ids unique.
     */
    public void registerSheet(SpreadsheetPackage pkg, String name, int sheetId, int rid) {
        Workbook workbook = workbookPartService.getOrLoad(pkg);
        workbook.addSheet(new Sheet(name, sheetId, "rId" + rid));
        logger.debug("Registered sheet '{}' with sheetId {} and rId{}", name, sheetId, rid);
    }

    /**
     * Create an empty worksheet and add it to the end of the tab order.
     *
     * @return the zero-based index of the sheet; the existing index when a sheet
     * with the same name (ignoring case) already exists
     */
    public int newSheet(SpreadsheetPackage pkg, String name) {
        validateSheetName(name);

        Workbook workbook = workbookPartService.getOrLoad(pkg);
        int existing = getSheetIndex(workbook, name);
        if (existing >= 0) {
            logger.info("Sheet '{}' already exists at index {}", name, existing);
            return existing;
        }

        int sheetId = 0;
        for (Sheet sheet : sheets(workbook)) {
            if (sheet.getSheetId() != null) {
                sheetId = Math.max(sheetId, sheet.getSheetId());
            }
        }
        sheetId++;

        String partName = "xl/worksheets/sheet" + sheetId + ".xml";
        pkg.getParts().writePart(partName, EMPTY_WORKSHEET.getBytes(StandardCharsets.UTF_8));
        contentTypesService.addOverride(pkg, "/" + partName, Namespaces.CONTENT_TYPE_WORKSHEET);

        int rid = relationshipService.addRelationship(pkg, workbookRelsPath(pkg),
                Namespaces.RELATIONSHIP_WORKSHEET, "/" + partName);
        registerSheet(pkg, name, sheetId, rid);

        logger.info("Created sheet '{}' (sheetId {}, {})", name, sheetId, partName);
        return sheets(workbook).size() - 1;
    }

    /**
     * Sheet names in tab order.
     */
    public List<String> getSheetList(SpreadsheetPackage pkg) {
        List<String> names = new ArrayList<>();
        for (Sheet sheet : sheets(workbookPartService.getOrLoad(pkg))) {
            names.add(sheet.getName());
        }
        return names;
    }

    /**
     * Sheets in tab order with the worksheet part each one points to.
     */
    public List<SheetInfo> getSheetMap(SpreadsheetPackage pkg) {
        Workbook workbook = workbookPartService.getOrLoad(pkg);
        String workbookPath = pathResolver.resolveWorkbookPath(pkg);
        Relationships rels = relationshipService.getOrLoad(pkg, WorkbookPathResolver.relsPathFor(workbookPath));

        List<SheetInfo> result = new ArrayList<>();
        List<Sheet> sheets = sheets(workbook);
        for (int i = 0; i < sheets.size(); i++) {
            Sheet sheet = sheets.get(i);
            result.add(new SheetInfo(i, sheet.getName(), resolveTarget(rels, sheet.getRelationshipId(), workbookPath)));
        }
        return result;
    }

    static void validateSheetName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Sheet name cannot be empty");
        }
        if (name.codePointCount(0, name.length()) > MAX_SHEET_NAME_LENGTH) {
            throw new IllegalArgumentException("Sheet name cannot exceed " + MAX_SHEET_NAME_LENGTH + " characters");
        }
        for (char c : name.toCharArray()) {
            if (INVALID_SHEET_NAME_CHARS.indexOf(c) >= 0) {
                throw new IllegalArgumentException("Sheet name cannot contain any of " + INVALID_SHEET_NAME_CHARS);
            }
        }
        if (name.startsWith("'") || name.endsWith("'")) {
            throw new IllegalArgumentException("Sheet name cannot start or end with an apostrophe");
        }
    }

    private String workbookRelsPath(SpreadsheetPackage pkg) {
        String relsPath = pathResolver.resolveWorkbookRelsPath(pkg);
        return relsPath.isEmpty() ? WorkbookPathResolver.relsPathFor(WorkbookPartService.DEFAULT_WORKBOOK_PATH) : relsPath;
    }

    private static int getSheetIndex(Workbook workbook, String name) {
        List<Sheet> sheets = sheets(workbook);
        for (int i = 0; i < sheets.size(); i++) {
            if (name.equalsIgnoreCase(sheets.get(i).getName())) {
                return i;
            }
        }
        return -1;
    }

    private static List<Sheet> sheets(Workbook workbook) {
        return workbook.getSheets() == null ? List.of() : workbook.getSheets();
    }

    private static String resolveTarget(Relationships rels, String rid, String workbookPath) {
        if (rels == null || rid == null) {
            return "";
        }
        rels.getLock().readLock().lock();
        try {
            for (Relationship rel : rels.getRelationships()) {
                if (rid.equals(rel.getId()) && rel.getTarget() != null) {
                    String target = rel.getTarget();
                    if (target.startsWith("/")) {
                        return target.substring(1);
                    }
                    int slash = workbookPath.lastIndexOf('/');
                    return slash < 0 ? target : workbookPath.substring(0, slash + 1) + target;
                }
            }
        } finally {
            rels.getLock().readLock().unlock();
        }
        return "";
    }
}
