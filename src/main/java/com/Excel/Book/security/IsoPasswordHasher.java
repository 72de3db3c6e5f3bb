package com.Excel.Book.security;

import org.apache.poi.poifs.crypt.CryptoFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/**
 * ISO/IEC 29500 password hashing: the digest of salt followed by the UTF-16LE
 * password, re-hashed {@code spinCount} times with the little-endian round
 * number appended. XOR yields the legacy 16-bit verifier instead.
 */
@Component
public class IsoPasswordHasher implements PasswordHasher {

    private static final Logger logger = LoggerFactory.getLogger(IsoPasswordHasher.class);

    public static final int MAX_PASSWORD_LENGTH = 255;
    public static final int SALT_LENGTH = 16;

    private final SecureRandom random = new SecureRandom();

    @Override
    public PasswordHash derivePasswordHash(String password, PasswordHashAlgorithm algorithm, byte[] salt, int spinCount) {
        if (password == null || password.isEmpty() || password.length() > MAX_PASSWORD_LENGTH) {
            throw new IllegalArgumentException("Password length must be between 1 and " + MAX_PASSWORD_LENGTH + " characters");
        }
        if (spinCount < 0) {
            throw new IllegalArgumentException("Spin count must be non-negative");
        }

        if (algorithm.isLegacyXor()) {
            int verifier = CryptoFunctions.createXorVerifier1(password);
            byte[] hash = {(byte) (verifier >> 8), (byte) verifier};
            return new PasswordHash(algorithm, hash, new byte[0], 0);
        }

        byte[] saltBytes = salt;
        if (saltBytes == null) {
            saltBytes = new byte[SALT_LENGTH];
            random.nextBytes(saltBytes);
        }

        long started = System.nanoTime();
        byte[] hash = CryptoFunctions.hashPassword(password, algorithm.getDigest(), saltBytes, spinCount, false);
        logger.debug("Derived {} password hash with {} rounds in {} ms",
                algorithm.getAlgorithmName(), spinCount, (System.nanoTime() - started) / 1_000_000);
        return new PasswordHash(algorithm, hash, saltBytes, spinCount);
    }
}
