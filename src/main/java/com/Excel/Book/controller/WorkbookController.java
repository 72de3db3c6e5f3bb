package com.Excel.Book.controller;

import com.Excel.Book.dto.SheetInfo;
import com.Excel.Book.dto.WorkbookPropsOptions;
import com.Excel.Book.dto.WorkbookProtectionOptions;
import com.Excel.Book.exception.UnsupportedHashAlgorithmException;
import com.Excel.Book.exception.WorkbookAlreadyExistsException;
import com.Excel.Book.exception.WorkbookDecodeException;
import com.Excel.Book.exception.WorkbookNotProtectedException;
import com.Excel.Book.exception.WrongPasswordException;
import com.Excel.Book.model.WorkbookProtection;
import com.Excel.Book.repository.SpreadsheetPackage;
import com.Excel.Book.service.WorkbookPropsService;
import com.Excel.Book.service.WorkbookProtectionService;
import com.Excel.Book.service.WorkbookSheetService;
import com.Excel.Book.service.WorkbookStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Function;

@RestController
@RequestMapping(value = "/workbooks", produces = MediaType.APPLICATION_JSON_VALUE)
public class WorkbookController {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookController.class);

    private final WorkbookStorageService storageService;
    private final WorkbookPropsService propsService;
    private final WorkbookProtectionService protectionService;
    private final WorkbookSheetService sheetService;

    private static final int LOCK_STRIPES = 64;

    // one open-modify-save cycle per stored workbook at a time; names share a stripe by hash
    private final Object[] workbookLocks = new Object[LOCK_STRIPES];

    public WorkbookController(WorkbookStorageService storageService, WorkbookPropsService propsService,
                              WorkbookProtectionService protectionService, WorkbookSheetService sheetService) {
        this.storageService = storageService;
        this.propsService = propsService;
        this.protectionService = protectionService;
        this.sheetService = sheetService;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            workbookLocks[i] = new Object();
        }
    }

    /**
     * Create a new workbook with a single empty sheet
     */
    @PostMapping("/{name}")
    public ResponseEntity<Object> createWorkbook(@PathVariable String name) {
        logger.info("Received create request for workbook '{}'", name);
        return handle(name, () -> {
            requireValidName(name);
            SpreadsheetPackage pkg;
            synchronized (lockFor(name)) {
                pkg = storageService.create(name);
            }
            Map<String, Object> response = new HashMap<>();
            response.put("status", "success");
            response.put("workbook", name);
            response.put("sheets", sheetService.getSheetList(pkg));
            return ResponseEntity.status(HttpStatus.CREATED).body(response);
        });
    }

    @GetMapping("/{name}/props")
    public ResponseEntity<Object> getProps(@PathVariable String name) {
        return withWorkbook(name, false, pkg -> ResponseEntity.ok(propsService.getWorkbookProps(pkg)));
    }

    @PutMapping(value = "/{name}/props", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Object> setProps(@PathVariable String name, @RequestBody WorkbookPropsOptions request) {
        logger.info("Updating properties of workbook '{}': {}", name, request);
        return withWorkbook(name, true, pkg -> {
            propsService.setWorkbookProps(pkg, request);
            return ResponseEntity.ok(propsService.getWorkbookProps(pkg));
        });
    }

    /**
     * Protect the workbook structure, optionally with a password
     */
    @PostMapping(value = "/{name}/protection", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Object> protect(@PathVariable String name, @RequestBody WorkbookProtectionOptions request) {
        logger.info("Protecting workbook '{}' - lockStructure: {}, lockWindows: {}, algorithm: {}",
                name, request.isLockStructure(), request.isLockWindows(), request.getAlgorithmName());
        return withWorkbook(name, true, pkg -> {
            protectionService.protectWorkbook(pkg, request);
            return ResponseEntity.ok(protectionStatus(pkg));
        });
    }

    /**
     * Remove protection. With a password the stored hash must match.
     */
    @DeleteMapping("/{name}/protection")
    public ResponseEntity<Object> unprotect(@PathVariable String name,
                                            @RequestParam(value = "password", required = false) String password) {
        logger.info("Unprotecting workbook '{}' (password supplied: {})", name, password != null);
        return withWorkbook(name, true, pkg -> {
            if (password == null) {
                protectionService.unprotectWorkbook(pkg);
            } else {
                protectionService.unprotectWorkbook(pkg, password);
            }
            return ResponseEntity.ok(protectionStatus(pkg));
        });
    }

    @GetMapping("/{name}/protection")
    public ResponseEntity<Object> getProtection(@PathVariable String name) {
        return withWorkbook(name, false, pkg -> ResponseEntity.ok(protectionStatus(pkg)));
    }

    @GetMapping("/{name}/sheets")
    public ResponseEntity<Object> getSheets(@PathVariable String name) {
        return withWorkbook(name, false, pkg -> {
            List<SheetInfo> sheets = sheetService.getSheetMap(pkg);
            return ResponseEntity.ok(Map.of(
                    "workbook", name,
                    "sheets", sheets,
                    "count", sheets.size()
            ));
        });
    }

    @PostMapping("/{name}/sheets/{sheet}")
    public ResponseEntity<Object> newSheet(@PathVariable String name, @PathVariable String sheet) {
        logger.info("Adding sheet '{}' to workbook '{}'", sheet, name);
        return withWorkbook(name, true, pkg -> {
            int index = sheetService.newSheet(pkg, sheet);
            return ResponseEntity.ok(Map.of(
                    "status", "success",
                    "sheet", sheet,
                    "index", index
            ));
        });
    }

    private ResponseEntity<Object> withWorkbook(String name, boolean save,
                                                Function<SpreadsheetPackage, ResponseEntity<Object>> action) {
        return handle(name, () -> {
            requireValidName(name);
            synchronized (lockFor(name)) {
                SpreadsheetPackage pkg = storageService.open(name);
                ResponseEntity<Object> response = action.apply(pkg);
                if (save) {
                    storageService.save(name, pkg);
                }
                return response;
            }
        });
    }

    private static void requireValidName(String name) {
        if (!WorkbookStorageService.isValidName(name)) {
            throw new IllegalArgumentException("Invalid workbook name: " + name);
        }
    }

    private Object lockFor(String name) {
        return workbookLocks[Math.floorMod(name.hashCode(), LOCK_STRIPES)];
    }

    private ResponseEntity<Object> handle(String name, Action action) {
        try {
            return action.run();
        } catch (NoSuchElementException e) {
            return error(HttpStatus.NOT_FOUND, "Workbook not found", e);
        } catch (UnsupportedHashAlgorithmException e) {
            return error(HttpStatus.BAD_REQUEST, "Unsupported hash algorithm", e);
        } catch (WrongPasswordException e) {
            return error(HttpStatus.FORBIDDEN, "Wrong password", e);
        } catch (WorkbookNotProtectedException e) {
            return error(HttpStatus.CONFLICT, "Workbook is not protected", e);
        } catch (WorkbookAlreadyExistsException e) {
            return error(HttpStatus.CONFLICT, "Workbook already exists", e);
        } catch (IllegalArgumentException e) {
            return error(HttpStatus.BAD_REQUEST, "Invalid request", e);
        } catch (WorkbookDecodeException e) {
            logger.warn("Workbook '{}' has an undecodable part {}: {}", name, e.getPartPath(), e.getMessage());
            return error(HttpStatus.UNPROCESSABLE_ENTITY, "Workbook part could not be decoded", e);
        } catch (Exception e) {
            logger.error("Unexpected error handling workbook '{}'", name, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", e);
        }
    }

    private static ResponseEntity<Object> error(HttpStatus status, String error, Exception e) {
        String message = e.getMessage() == null ? error : e.getMessage();
        return ResponseEntity.status(status).body(Map.of(
                "error", error,
                "message", message,
                "status", "error"
        ));
    }

    private Map<String, Object> protectionStatus(SpreadsheetPackage pkg) {
        WorkbookProtection protection = protectionService.getProtection(pkg);
        Map<String, Object> status = new HashMap<>();
        status.put("protected", protection != null);
        if (protection != null) {
            status.put("lockStructure", Boolean.TRUE.equals(protection.getLockStructure()));
            status.put("lockWindows", Boolean.TRUE.equals(protection.getLockWindows()));
            status.put("algorithmName", protection.getAlgorithmName() == null ? "" : protection.getAlgorithmName());
        }
        return status;
    }

    @FunctionalInterface
    private interface Action {
        ResponseEntity<Object> run() throws Exception;
    }
}
