package com.Excel.Book.service;

import com.Excel.Book.dto.WorkbookPropsOptions;
import com.Excel.Book.model.Workbook;
import com.Excel.Book.model.WorkbookPr;
import com.Excel.Book.repository.SpreadsheetPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class WorkbookPropsService {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookPropsService.class);

    private final WorkbookPartService workbookPartService;

    public WorkbookPropsService(WorkbookPartService workbookPartService) {
        this.workbookPartService = workbookPartService;
    }

    /**
     * Set workbook properties. Only the non-null option fields are written; a
     * null options object changes nothing.
     */
    public void setWorkbookProps(SpreadsheetPackage pkg, WorkbookPropsOptions opts) {
        Workbook workbook = workbookPartService.getOrLoad(pkg);
        if (opts == null) {
            return;
        }
        if (workbook.getWorkbookPr() == null) {
            workbook.setWorkbookPr(new WorkbookPr());
        }
        WorkbookPr pr = workbook.getWorkbookPr();
        if (opts.getDate1904() != null) {
            pr.setDate1904(opts.getDate1904());
        }
        if (opts.getFilterPrivacy() != null) {
            pr.setFilterPrivacy(opts.getFilterPrivacy());
        }
        if (opts.getCodeName() != null) {
            pr.setCodeName(opts.getCodeName());
        }
        logger.info("Updated workbook properties: {}", opts);
    }

    /**
     * Get workbook properties. All fields are null when the workbook has no
     * properties element; otherwise unset attributes read as false or "".
     */
    public WorkbookPropsOptions getWorkbookProps(SpreadsheetPackage pkg) {
        WorkbookPr pr = workbookPartService.getOrLoad(pkg).getWorkbookPr();
        WorkbookPropsOptions opts = new WorkbookPropsOptions();
        if (pr != null) {
            opts.setDate1904(Boolean.TRUE.equals(pr.getDate1904()));
            opts.setFilterPrivacy(Boolean.TRUE.equals(pr.getFilterPrivacy()));
            opts.setCodeName(pr.getCodeName() == null ? "" : pr.getCodeName());
        }
        return opts;
    }
}
