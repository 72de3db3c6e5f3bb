package com.Excel.Book.security;

import com.Excel.Book.exception.UnsupportedHashAlgorithmException;
import org.apache.poi.poifs.crypt.HashAlgorithm;

/**
 * Hash algorithms accepted for workbook protection, keyed by the name stored
 * in the {@code workbookAlgorithmName} attribute.
 */
public enum PasswordHashAlgorithm {

    XOR("XOR", null),
    MD4("MD4", HashAlgorithm.md4),
    MD5("MD5", HashAlgorithm.md5),
    SHA_1("SHA-1", HashAlgorithm.sha1),
    SHA_256("SHA-256", HashAlgorithm.sha256),
    SHA_384("SHA-384", HashAlgorithm.sha384),
    SHA_512("SHA-512", HashAlgorithm.sha512);

    public static final PasswordHashAlgorithm DEFAULT = SHA_512;

    private final String algorithmName;
    private final HashAlgorithm digest;

    PasswordHashAlgorithm(String algorithmName, HashAlgorithm digest) {
        this.algorithmName = algorithmName;
        this.digest = digest;
    }

    public String getAlgorithmName() {
        return algorithmName;
    }

    /**
     * The POI digest, or null for the legacy XOR verifier.
     */
    HashAlgorithm getDigest() {
        return digest;
    }

    public boolean isLegacyXor() {
        return digest == null;
    }

    public static PasswordHashAlgorithm fromName(String name) {
        for (PasswordHashAlgorithm algorithm : values()) {
            if (algorithm.algorithmName.equals(name)) {
                return algorithm;
            }
        }
        throw new UnsupportedHashAlgorithmException(name);
    }
}
