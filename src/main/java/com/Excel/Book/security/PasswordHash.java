package com.Excel.Book.security;

import lombok.Getter;

import java.util.Base64;

/**
 * A derived password hash with the salt and spin count it was derived with.
 */
@Getter
public class PasswordHash {
    private final PasswordHashAlgorithm algorithm;
    private final byte[] hash;
    private final byte[] salt;  // empty for XOR
    private final int spinCount;

    public PasswordHash(PasswordHashAlgorithm algorithm, byte[] hash, byte[] salt, int spinCount) {
        this.algorithm = algorithm;
        this.hash = hash.clone();
        this.salt = salt.clone();
        this.spinCount = spinCount;
    }

    public byte[] getHash() {
        return hash.clone();
    }

    public byte[] getSalt() {
        return salt.clone();
    }

    public String getHashBase64() {
        return Base64.getEncoder().encodeToString(hash);
    }

    public String getSaltBase64() {
        return salt.length == 0 ? null : Base64.getEncoder().encodeToString(salt);
    }
}
