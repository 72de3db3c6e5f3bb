package com.Excel.Book.security;

import org.bouncycastle.crypto.digests.MD4Digest;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IsoPasswordHasherTest {

    private static final byte[] SALT = {
            1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12, 13, 14, 15, 16
    };

    private final IsoPasswordHasher hasher = new IsoPasswordHasher();

    @Test
    void sha512MatchesIteratedDigest() throws Exception {
        PasswordHash hash = hasher.derivePasswordHash("password", PasswordHashAlgorithm.SHA_512, SALT, 1000);

        assertThat(hash.getHash()).isEqualTo(iterate(MessageDigest.getInstance("SHA-512"), "password", SALT, 1000));
        assertThat(hash.getSalt()).isEqualTo(SALT);
        assertThat(hash.getSpinCount()).isEqualTo(1000);
    }

    @Test
    void md5WithoutRoundsIsSaltedDigest() throws Exception {
        PasswordHash hash = hasher.derivePasswordHash("pw1", PasswordHashAlgorithm.MD5, SALT, 0);

        MessageDigest md5 = MessageDigest.getInstance("MD5");
        md5.update(SALT);
        assertThat(hash.getHash()).isEqualTo(md5.digest("pw1".getBytes(StandardCharsets.UTF_16LE)));
    }

    @Test
    void md4IsSupported() {
        PasswordHash hash = hasher.derivePasswordHash("pw1", PasswordHashAlgorithm.MD4, SALT, 3);

        byte[] expected = md4(concat(SALT, "pw1".getBytes(StandardCharsets.UTF_16LE)));
        for (int i = 0; i < 3; i++) {
            expected = md4(concat(expected, littleEndian(i)));
        }
        assertThat(hash.getHash()).isEqualTo(expected);
    }

    @Test
    void freshSaltEveryTime() {
        PasswordHash first = hasher.derivePasswordHash("same", PasswordHashAlgorithm.SHA_256, null, 10);
        PasswordHash second = hasher.derivePasswordHash("same", PasswordHashAlgorithm.SHA_256, null, 10);

        assertThat(first.getSalt()).hasSize(IsoPasswordHasher.SALT_LENGTH);
        assertThat(first.getSalt()).isNotEqualTo(second.getSalt());
        assertThat(first.getHashBase64()).isNotEqualTo(second.getHashBase64());
    }

    @Test
    void hashMaterialCannotBeChangedThroughAccessors() {
        byte[] salt = SALT.clone();
        PasswordHash hash = hasher.derivePasswordHash("password", PasswordHashAlgorithm.SHA_512, salt, 10);
        String hashBefore = hash.getHashBase64();
        String saltBefore = hash.getSaltBase64();

        hash.getHash()[0] ^= 1;
        hash.getSalt()[0] ^= 1;
        salt[1] ^= 1;

        assertThat(hash.getHashBase64()).isEqualTo(hashBefore);
        assertThat(hash.getSaltBase64()).isEqualTo(saltBefore);
    }

    @Test
    void xorProducesTwoByteVerifierWithoutSalt() {
        PasswordHash hash = hasher.derivePasswordHash("legacy", PasswordHashAlgorithm.XOR, SALT, 100000);

        assertThat(hash.getHash()).hasSize(2);
        assertThat(hash.getSalt()).isEmpty();
        assertThat(hash.getSaltBase64()).isNull();
        assertThat(hash.getSpinCount()).isZero();
        assertThat(hasher.derivePasswordHash("legacy", PasswordHashAlgorithm.XOR, null, 0).getHash())
                .isEqualTo(hash.getHash());
    }

    @Test
    void rejectsPasswordsOutsideLengthLimits() {
        assertThatThrownBy(() -> hasher.derivePasswordHash("", PasswordHashAlgorithm.SHA_512, null, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> hasher.derivePasswordHash("x".repeat(256), PasswordHashAlgorithm.SHA_512, null, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(hasher.derivePasswordHash("x".repeat(255), PasswordHashAlgorithm.SHA_1, null, 1).getHash())
                .hasSize(20);
    }

    private static byte[] iterate(MessageDigest digest, String password, byte[] salt, int spinCount) {
        digest.update(salt);
        byte[] hash = digest.digest(password.getBytes(StandardCharsets.UTF_16LE));
        for (int i = 0; i < spinCount; i++) {
            digest.update(hash);
            hash = digest.digest(littleEndian(i));
        }
        return hash;
    }

    private static byte[] md4(byte[] input) {
        MD4Digest digest = new MD4Digest();
        digest.update(input, 0, input.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        return ByteBuffer.allocate(a.length + b.length).put(a).put(b).array();
    }

    private static byte[] littleEndian(int value) {
        return ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt(value).array();
    }
}
