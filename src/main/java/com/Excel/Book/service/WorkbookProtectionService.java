package com.Excel.Book.service;

import com.Excel.Book.dto.WorkbookProtectionOptions;
import com.Excel.Book.exception.WorkbookNotProtectedException;
import com.Excel.Book.exception.WrongPasswordException;
import com.Excel.Book.model.Workbook;
import com.Excel.Book.model.WorkbookProtection;
import com.Excel.Book.repository.SpreadsheetPackage;
import com.Excel.Book.security.PasswordHash;
import com.Excel.Book.security.PasswordHashAlgorithm;
import com.Excel.Book.security.PasswordHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * Records workbook structure protection. Protection is declarative: it is
 * written to the workbook part for spreadsheet applications to honour, not
 * enforced here.
 */
@Service
public class WorkbookProtectionService {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookProtectionService.class);

    public static final int WORKBOOK_PROTECTION_SPIN_COUNT = 100000;

    private final WorkbookPartService workbookPartService;
    private final PasswordHasher passwordHasher;

    public WorkbookProtectionService(WorkbookPartService workbookPartService, PasswordHasher passwordHasher) {
        this.workbookPartService = workbookPartService;
        this.passwordHasher = passwordHasher;
    }

    /**
     * Protect the workbook structure and windows. With a password, a salted
     * hash replaces any previous one; without, only the lock flags change.
     */
    public void protectWorkbook(SpreadsheetPackage pkg, WorkbookProtectionOptions opts) {
        Workbook workbook = workbookPartService.getOrLoad(pkg);
        if (opts == null) {
            opts = new WorkbookProtectionOptions();
        }

        // hash before touching the workbook so a failure leaves it as it was
        PasswordHash passwordHash = null;
        if (opts.getPassword() != null && !opts.getPassword().isEmpty()) {
            PasswordHashAlgorithm algorithm = (opts.getAlgorithmName() == null || opts.getAlgorithmName().isEmpty())
                    ? PasswordHashAlgorithm.DEFAULT
                    : PasswordHashAlgorithm.fromName(opts.getAlgorithmName());
            passwordHash = passwordHasher.derivePasswordHash(opts.getPassword(), algorithm, null,
                    WORKBOOK_PROTECTION_SPIN_COUNT);
        }

        if (workbook.getWorkbookProtection() == null) {
            workbook.setWorkbookProtection(new WorkbookProtection());
        }
        WorkbookProtection protection = workbook.getWorkbookProtection();
        protection.setLockStructure(opts.isLockStructure());
        protection.setLockWindows(opts.isLockWindows());

        if (passwordHash != null) {
            protection.setAlgorithmName(passwordHash.getAlgorithm().getAlgorithmName());
            protection.setSaltValue(passwordHash.getSaltBase64());
            protection.setHashValue(passwordHash.getHashBase64());
            protection.setSpinCount(passwordHash.getSpinCount());
        }
        logger.info("Protected workbook: lockStructure={}, lockWindows={}, algorithm={}",
                opts.isLockStructure(), opts.isLockWindows(), protection.getAlgorithmName());
    }

    /**
     * Remove workbook protection without checking any password.
     */
    public void unprotectWorkbook(SpreadsheetPackage pkg) {
        Workbook workbook = workbookPartService.getOrLoad(pkg);
        if (workbook.getWorkbookProtection() != null) {
            workbook.setWorkbookProtection(null);
            logger.info("Removed workbook protection without password verification");
        }
    }

    /**
     * Remove workbook protection after verifying the password against the
     * stored hash. Protection recorded without a hash accepts any password.
     *
     * @throws WorkbookNotProtectedException when the workbook is not protected
     * @throws WrongPasswordException        when the password does not match
     */
    public void unprotectWorkbook(SpreadsheetPackage pkg, String password) {
        Workbook workbook = workbookPartService.getOrLoad(pkg);
        WorkbookProtection protection = workbook.getWorkbookProtection();
        if (protection == null) {
            throw new WorkbookNotProtectedException();
        }

        if (protection.hasAlgorithm()) {
            PasswordHashAlgorithm algorithm = PasswordHashAlgorithm.fromName(protection.getAlgorithmName());
            byte[] salt = protection.getSaltValue() == null
                    ? new byte[0]
                    : Base64.getDecoder().decode(protection.getSaltValue());
            int spinCount = protection.getSpinCount() == null ? 0 : protection.getSpinCount();
            PasswordHash candidate = passwordHasher.derivePasswordHash(password, algorithm, salt, spinCount);

            String stored = protection.getHashValue() == null ? "" : protection.getHashValue();
            if (!MessageDigest.isEqual(candidate.getHashBase64().getBytes(StandardCharsets.US_ASCII),
                    stored.getBytes(StandardCharsets.US_ASCII))) {
                logger.warn("Workbook unprotect rejected: password does not match");
                throw new WrongPasswordException();
            }
        }

        workbook.setWorkbookProtection(null);
        logger.info("Removed workbook protection");
    }

    public boolean isProtected(SpreadsheetPackage pkg) {
        return workbookPartService.getOrLoad(pkg).getWorkbookProtection() != null;
    }

    /**
     * The stored protection record, or null when unprotected.
     */
    public WorkbookProtection getProtection(SpreadsheetPackage pkg) {
        return workbookPartService.getOrLoad(pkg).getWorkbookProtection();
    }
}
