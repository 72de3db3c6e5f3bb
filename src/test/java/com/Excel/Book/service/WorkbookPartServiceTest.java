package com.Excel.Book.service;

import com.Excel.Book.dto.WorkbookPropsOptions;
import com.Excel.Book.exception.WorkbookDecodeException;
import com.Excel.Book.model.ContentTypeOverride;
import com.Excel.Book.model.RawElement;
import com.Excel.Book.model.Relationship;
import com.Excel.Book.model.Relationships;
import com.Excel.Book.model.Sheet;
import com.Excel.Book.model.Workbook;
import com.Excel.Book.model.XmlAttr;
import com.Excel.Book.repository.SpreadsheetPackage;
import com.Excel.Book.repository.ZipPartStore;
import com.Excel.Book.util.Namespaces;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.Excel.Book.service.PackageFixtures.emptyPackage;
import static com.Excel.Book.service.PackageFixtures.fixture;
import static com.Excel.Book.service.PackageFixtures.packageWithWorkbook;
import static com.Excel.Book.service.PackageFixtures.text;
import static com.Excel.Book.service.PackageFixtures.utf8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkbookPartServiceTest {

    private final PackageFixtures fixtures = new PackageFixtures();
    private final WorkbookPartService service = fixtures.workbookPartService;

    @Test
    void decodesWorkbookPart() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");

        Workbook workbook = service.getOrLoad(pkg);

        assertThat(workbook.getSheets()).extracting(Sheet::getName).containsExactly("Sheet1", "Data");
        assertThat(workbook.getSheets()).extracting(Sheet::getRelationshipId).containsExactly("rId1", "rId2");
        assertThat(workbook.getWorkbookPr().getFilterPrivacy()).isTrue();
        assertThat(workbook.getWorkbookPr().getDefaultThemeVersion()).isEqualTo(164011);
        assertThat(workbook.getBookViews()).hasSize(1);
        assertThat(workbook.getDefinedNames()).singleElement()
                .satisfies(name -> assertThat(name.getFormula()).isEqualTo("Sheet1!$A$1:$C$10"));
        assertThat(workbook.getDecodeAlternateContent()).contains("x15ac:absPath");
        assertThat(workbook.getAlternateContent()).isNull();
    }

    @Test
    void loadIsIdempotent() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");

        Workbook first = service.getOrLoad(pkg);
        first.getSheets().get(0).setName("Renamed");

        assertThat(service.getOrLoad(pkg)).isSameAs(first);
        assertThat(service.getOrLoad(pkg).getSheets().get(0).getName()).isEqualTo("Renamed");
    }

    @Test
    void recordsRootNamespacesOnFirstLoad() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");

        service.getOrLoad(pkg);

        List<XmlAttr> attributes = pkg.getXmlAttributes().get("xl/workbook.xml");
        assertThat(attributes).contains(
                new XmlAttr("xmlns", Namespaces.SPREADSHEET_MAIN),
                new XmlAttr("xmlns:r", Namespaces.RELATIONSHIPS),
                new XmlAttr("xmlns:mc", Namespaces.MARKUP_COMPATIBILITY),
                new XmlAttr("mc:Ignorable", "x15 xr xr6 xr10 xr2"));
    }

    @Test
    void emptyPartYieldsEmptyWorkbook() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");
        pkg.getParts().writePart("xl/workbook.xml", utf8("   \n"));

        Workbook workbook = service.getOrLoad(pkg);

        assertThat(workbook.getSheets()).isEmpty();
        assertThat(workbook.getWorkbookProtection()).isNull();
        assertThat(pkg.getXmlAttributes().get("xl/workbook.xml"))
                .contains(new XmlAttr("xmlns", Namespaces.SPREADSHEET_MAIN));
    }

    @Test
    void malformedPartFailsWithoutCaching() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");
        pkg.getParts().writePart("xl/workbook.xml", utf8("<workbook xmlns=\"" + Namespaces.SPREADSHEET_MAIN + "\"><sheets>"));

        assertThatThrownBy(() -> service.getOrLoad(pkg))
                .isInstanceOf(WorkbookDecodeException.class)
                .satisfies(e -> assertThat(((WorkbookDecodeException) e).getPartPath()).isEqualTo("xl/workbook.xml"));
        assertThat(pkg.getWorkbook()).isNull();
        assertThat(pkg.getXmlAttributes()).doesNotContainKey("xl/workbook.xml");
    }

    @Test
    void foreignRootElementIsRejected() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");
        pkg.getParts().writePart("xl/workbook.xml", utf8("<workbook xmlns=\"urn:not-a-spreadsheet\"/>"));

        assertThatThrownBy(() -> service.getOrLoad(pkg)).isInstanceOf(WorkbookDecodeException.class);
        assertThat(pkg.getWorkbook()).isNull();

        pkg.getParts().writePart("xl/workbook.xml", fixture("workbook.xml"));
        assertThat(service.getOrLoad(pkg).getSheets()).hasSize(2);
    }

    @Test
    void strictNamespacesAreReadAsTransitional() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook-strict.xml");

        Workbook workbook = service.getOrLoad(pkg);

        assertThat(workbook.getWorkbookPr().getDate1904()).isTrue();
        assertThat(workbook.getSheets()).singleElement()
                .satisfies(sheet -> assertThat(sheet.getRelationshipId()).isEqualTo("rId1"));
        assertThat(pkg.getXmlAttributes().get("xl/workbook.xml"))
                .extracting(XmlAttr::getName)
                .doesNotContain("conformance");
    }

    @Test
    void flushWithoutLoadLeavesPackageUntouched() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");
        byte[] before = pkg.getParts().readPart("xl/workbook.xml");

        service.flush(pkg);

        assertThat(pkg.getParts().readPart("xl/workbook.xml")).isEqualTo(before);
        assertThat(pkg.getRelationships()).isEmpty();
    }

    @Test
    void roundTripPreservesNamespacesAndAlternateContent() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");
        service.getOrLoad(pkg);

        SpreadsheetPackage reopened = fixtures.reopen(pkg);
        String xml = text(reopened.getParts().readPart("xl/workbook.xml"));

        assertThat(xml).startsWith(Namespaces.XML_HEADER);
        assertThat(xml).contains("<workbook xmlns=\"" + Namespaces.SPREADSHEET_MAIN + "\"");
        assertThat(xml).contains("mc:Ignorable=\"x15 xr xr6 xr10 xr2\"");
        assertThat(xml).contains("r:id=\"rId1\"");
        assertThat(xml).contains("<mc:AlternateContent");
        assertThat(xml).doesNotContain("wstxns").doesNotContain("xmlns=\"\"");

        Workbook decoded = service.getOrLoad(reopened);
        assertThat(decoded.getSheets()).extracting(Sheet::getName).containsExactly("Sheet1", "Data");
        assertThat(decoded.getDecodeAlternateContent()).contains("x15ac:absPath");
        assertThat(decoded.getDefinedNames()).hasSize(1);
        assertThat(decoded.getCalcPr().getCalcId()).isEqualTo(162913);
    }

    @Test
    void alternateContentIsNotDuplicatedOnRepeatedFlush() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");
        service.getOrLoad(pkg);

        service.flush(pkg);
        service.flush(pkg);

        String xml = text(pkg.getParts().readPart("xl/workbook.xml"));
        assertThat(xml.split("<mc:AlternateContent", -1)).hasSize(2);
        assertThat(pkg.getWorkbook().getDecodeAlternateContent()).isNull();
    }

    @Test
    void unmodeledChildrenAndAttributesSurviveFlush() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook-extended.xml");
        fixtures.propsService.setWorkbookProps(pkg, new WorkbookPropsOptions(true, null, null));

        SpreadsheetPackage reopened = fixtures.reopen(pkg);
        String xml = text(reopened.getParts().readPart("xl/workbook.xml"));

        assertThat(xml).contains(
                "<fileSharing readOnlyRecommended=\"1\" userName=\"Book Keeper\"/>",
                "<xr:revisionPtr revIDLastSave=\"0\" documentId=\"8_{0C4F1E3A-2B6D-4C1E-9F0A-1B2C3D4E5F60}\"",
                "<externalReferences><externalReference r:id=\"rId4\"/></externalReferences>",
                "<pivotCaches><pivotCache cacheId=\"7\" r:id=\"rId5\"/></pivotCaches>",
                "<fileRecoveryPr repairLoad=\"1\"/>",
                "<x15:workbookPr chartTrackingRefBase=\"1\"/>",
                "<xcalcf:feature name=\"microsoft.com:RD\"/>");
        assertThat(xml).contains("tabRatio=\"600\"", "visibility=\"hidden\"",
                "xr2:uid=\"{3F0D6C6B-7D5B-4F4E-8C0B-2E1D5A3B9C11}\"");
        assertThat(xml).contains("showObjects=\"placeholders\"", "date1904=\"true\"");
        assertThat(xml).contains("calcMode=\"manual\"", "iterate=\"1\"", "comment=\"lookup\"");
        assertThat(xml).doesNotContain("wstxns");

        assertThat(indexesOf(xml, "<fileVersion", "<fileSharing", "<workbookPr", "<mc:AlternateContent",
                "<xr:revisionPtr", "<bookViews", "<sheets", "<externalReferences", "<definedNames", "<calcPr",
                "<pivotCaches", "<fileRecoveryPr", "<extLst")).isSorted();
    }

    @Test
    void preservedChildrenAreWrittenOncePerFlush() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook-extended.xml");
        service.getOrLoad(pkg);

        service.flush(pkg);
        service.flush(pkg);

        String xml = text(pkg.getParts().readPart("xl/workbook.xml"));
        assertThat(xml.split("<pivotCaches>", -1)).hasSize(2);
        assertThat(xml.split("<extLst>", -1)).hasSize(2);
        assertThat(pkg.getWorkbook().getPreservedElements()).extracting(RawElement::getName)
                .containsExactly("fileSharing", "xr:revisionPtr", "externalReferences", "pivotCaches",
                        "fileRecoveryPr", "extLst");
    }

    @Test
    void packageWithoutWorkbookGetsDefaultPart() {
        SpreadsheetPackage pkg = emptyPackage();
        Workbook workbook = service.getOrLoad(pkg);
        workbook.addSheet(new Sheet("Only", 1, "rId1"));

        service.flush(pkg);
        fixtures.relationshipService.flush(pkg);
        fixtures.contentTypesService.flush(pkg);

        assertThat(pkg.getParts().hasPart(WorkbookPartService.DEFAULT_WORKBOOK_PATH)).isTrue();
        Relationships rels = pkg.getRelationships().get(RelationshipService.PACKAGE_RELS_PATH);
        assertThat(rels.getRelationships()).extracting(Relationship::getTarget)
                .containsExactly(WorkbookPartService.DEFAULT_WORKBOOK_PATH);
        assertThat(pkg.getContentTypes().getOverrides()).extracting(ContentTypeOverride::getPartName)
                .contains("/xl/workbook.xml");
        assertThat(pkg.getXmlAttributes()).doesNotContainKey("");

        SpreadsheetPackage reopened = new SpreadsheetPackage(copyOf(pkg));
        assertThat(fixtures.pathResolver.resolveWorkbookPath(reopened)).isEqualTo("xl/workbook.xml");
        assertThat(service.getOrLoad(reopened).getSheets()).extracting(Sheet::getName).containsExactly("Only");
    }

    @Test
    void requiredNamespacesAreAddedOnce() {
        List<XmlAttr> attributes = WorkbookPartService.withRequiredNamespaces(
                List.of(new XmlAttr("xmlns", Namespaces.SPREADSHEET_MAIN)));

        assertThat(attributes).containsExactly(
                new XmlAttr("xmlns", Namespaces.SPREADSHEET_MAIN),
                new XmlAttr("xmlns:r", Namespaces.RELATIONSHIPS));
        assertThat(WorkbookPartService.withRequiredNamespaces(attributes)).isEqualTo(attributes);
    }

    private static int[] indexesOf(String xml, String... markers) {
        int[] indexes = new int[markers.length];
        for (int i = 0; i < markers.length; i++) {
            indexes[i] = xml.indexOf(markers[i]);
            assertThat(indexes[i]).as(markers[i]).isNotNegative();
        }
        return indexes;
    }

    private static ZipPartStore copyOf(SpreadsheetPackage pkg) {
        ZipPartStore copy = new ZipPartStore();
        for (String name : pkg.getParts().partNames()) {
            copy.writePart(name, pkg.getParts().readPart(name));
        }
        return copy;
    }
}
