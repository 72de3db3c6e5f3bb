package com.Excel.Book.service;

import com.Excel.Book.dto.WorkbookProtectionOptions;
import com.Excel.Book.exception.UnsupportedHashAlgorithmException;
import com.Excel.Book.exception.WorkbookNotProtectedException;
import com.Excel.Book.exception.WrongPasswordException;
import com.Excel.Book.model.WorkbookProtection;
import com.Excel.Book.repository.SpreadsheetPackage;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;

import static com.Excel.Book.service.PackageFixtures.packageWithWorkbook;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkbookProtectionServiceTest {

    private final PackageFixtures fixtures = new PackageFixtures();
    private final WorkbookProtectionService service = fixtures.protectionService;

    @Test
    void protectWithoutPasswordSetsOnlyFlags() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");

        service.protectWorkbook(pkg, new WorkbookProtectionOptions(null, null, true, false));

        WorkbookProtection protection = service.getProtection(pkg);
        assertThat(protection.getLockStructure()).isTrue();
        assertThat(protection.getLockWindows()).isFalse();
        assertThat(protection.hasAlgorithm()).isFalse();
        assertThat(protection.getHashValue()).isNull();
        assertThat(service.isProtected(pkg)).isTrue();
    }

    @Test
    void protectWithPasswordDefaultsToSha512() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");

        service.protectWorkbook(pkg, new WorkbookProtectionOptions("", "secret", true, true));

        WorkbookProtection protection = service.getProtection(pkg);
        assertThat(protection.getAlgorithmName()).isEqualTo("SHA-512");
        assertThat(protection.getSpinCount()).isEqualTo(WorkbookProtectionService.WORKBOOK_PROTECTION_SPIN_COUNT);
        assertThat(Base64.getDecoder().decode(protection.getSaltValue())).hasSize(16);
        assertThat(Base64.getDecoder().decode(protection.getHashValue())).hasSize(64);
    }

    @Test
    void storedHashMatchesIndependentComputation() throws Exception {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");

        service.protectWorkbook(pkg, new WorkbookProtectionOptions("MD5", "pw1", true, false));

        WorkbookProtection protection = service.getProtection(pkg);
        byte[] salt = Base64.getDecoder().decode(protection.getSaltValue());
        byte[] expected = isoHash("MD5", "pw1", salt, protection.getSpinCount());
        assertThat(protection.getHashValue()).isEqualTo(Base64.getEncoder().encodeToString(expected));
    }

    @Test
    void emptyPasswordKeepsExistingHash() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");
        service.protectWorkbook(pkg, new WorkbookProtectionOptions("SHA-256", "first", true, false));
        WorkbookProtection before = service.getProtection(pkg);
        String hash = before.getHashValue();
        String salt = before.getSaltValue();

        service.protectWorkbook(pkg, new WorkbookProtectionOptions(null, "", false, true));

        WorkbookProtection after = service.getProtection(pkg);
        assertThat(after.getHashValue()).isEqualTo(hash);
        assertThat(after.getSaltValue()).isEqualTo(salt);
        assertThat(after.getAlgorithmName()).isEqualTo("SHA-256");
        assertThat(after.getLockStructure()).isFalse();
        assertThat(after.getLockWindows()).isTrue();
    }

    @Test
    void unsupportedAlgorithmLeavesWorkbookUntouched() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");

        assertThatThrownBy(() -> service.protectWorkbook(pkg, new WorkbookProtectionOptions("SHA-3", "pw", true, true)))
                .isInstanceOf(UnsupportedHashAlgorithmException.class);
        assertThat(service.isProtected(pkg)).isFalse();
    }

    @Test
    void unprotectWithCorrectPassword() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");
        service.protectWorkbook(pkg, new WorkbookProtectionOptions("SHA-1", "open sesame", true, false));

        service.unprotectWorkbook(pkg, "open sesame");

        assertThat(service.isProtected(pkg)).isFalse();
    }

    @Test
    void unprotectWithWrongPasswordKeepsProtection() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");
        service.protectWorkbook(pkg, new WorkbookProtectionOptions("SHA-1", "open sesame", true, false));

        assertThatThrownBy(() -> service.unprotectWorkbook(pkg, "close sesame"))
                .isInstanceOf(WrongPasswordException.class);
        assertThat(service.isProtected(pkg)).isTrue();
    }

    @Test
    void unprotectVerifiesLegacyXorPassword() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");
        service.protectWorkbook(pkg, new WorkbookProtectionOptions("XOR", "legacy", true, false));

        WorkbookProtection protection = service.getProtection(pkg);
        assertThat(protection.getAlgorithmName()).isEqualTo("XOR");
        assertThat(protection.getSaltValue()).isNull();
        assertThatThrownBy(() -> service.unprotectWorkbook(pkg, "Legacy!"))
                .isInstanceOf(WrongPasswordException.class);

        service.unprotectWorkbook(pkg, "legacy");
        assertThat(service.isProtected(pkg)).isFalse();
    }

    @Test
    void unprotectWithPasswordRequiresProtection() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");

        assertThatThrownBy(() -> service.unprotectWorkbook(pkg, "anything"))
                .isInstanceOf(WorkbookNotProtectedException.class);
    }

    @Test
    void protectionWithoutHashAcceptsAnyPassword() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook-protected.xml");
        assertThat(service.isProtected(pkg)).isTrue();

        service.unprotectWorkbook(pkg, "whatever");

        assertThat(service.isProtected(pkg)).isFalse();
    }

    @Test
    void unprotectWithoutPasswordAlwaysRemoves() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");
        service.protectWorkbook(pkg, new WorkbookProtectionOptions(null, "secret", true, true));

        service.unprotectWorkbook(pkg);
        service.unprotectWorkbook(pkg);

        assertThat(service.isProtected(pkg)).isFalse();
        assertThat(service.getProtection(pkg)).isNull();
    }

    @Test
    void protectionSurvivesSaveAndVerifiesAfterReopen() {
        SpreadsheetPackage pkg = packageWithWorkbook("workbook.xml");
        service.protectWorkbook(pkg, new WorkbookProtectionOptions("SHA-384", "persisted", true, false));

        SpreadsheetPackage reopened = fixtures.reopen(pkg);

        WorkbookProtection protection = service.getProtection(reopened);
        assertThat(protection.getLockStructure()).isTrue();
        assertThat(protection.getAlgorithmName()).isEqualTo("SHA-384");
        assertThatThrownBy(() -> service.unprotectWorkbook(reopened, "wrong"))
                .isInstanceOf(WrongPasswordException.class);
        service.unprotectWorkbook(reopened, "persisted");
        assertThat(service.isProtected(reopened)).isFalse();
    }

    private static byte[] isoHash(String algorithm, String password, byte[] salt, int spinCount) throws Exception {
        MessageDigest digest = MessageDigest.getInstance(algorithm);
        digest.update(salt);
        byte[] hash = digest.digest(password.getBytes(StandardCharsets.UTF_16LE));
        for (int i = 0; i < spinCount; i++) {
            digest.update(hash);
            hash = digest.digest(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(i).array());
        }
        return hash;
    }
}
