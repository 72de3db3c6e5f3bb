package com.Excel.Book.security;

/**
 * Derives protection password hashes.
 */
public interface PasswordHasher {

    /**
     * @param password  password to hash, 1 to 255 characters
     * @param algorithm digest to iterate
     * @param salt      salt to hash with, or null to generate a fresh one
     * @param spinCount number of extra hashing rounds
     */
    PasswordHash derivePasswordHash(String password, PasswordHashAlgorithm algorithm, byte[] salt, int spinCount);
}
