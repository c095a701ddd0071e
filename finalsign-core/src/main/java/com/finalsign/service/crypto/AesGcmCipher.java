package com.finalsign.service.crypto;

import com.finalsign.exception.IntegrityException;
import lombok.Getter;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

/**
 * AES-256-GCM authenticated encryption.
 * <ul>
 * <li>12-byte random IV prepended to ciphertext</li>
 * <li>128-bit GCM authentication tag</li>
 * <li>Output: IV || ciphertext || tag</li>
 * </ul>
 * One instance holds the process-wide key and is safe to share between threads.
 */
public final class AesGcmCipher {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int KEY_LENGTH = 32;

    private final SecretKey secretKey;
    private final SecureRandom secureRandom = new SecureRandom();
    @Getter
    private final String keyId;

    public AesGcmCipher(byte[] key, String keyId) {
        if (key == null || key.length != KEY_LENGTH) {
            throw new IllegalArgumentException("Encryption key must be 32 bytes (64 hex characters)");
        }
        this.secretKey = new SecretKeySpec(key.clone(), "AES");
        this.keyId = keyId;
    }

    /**
     * Build from a 64-character hex key.
     */
    public static AesGcmCipher fromHex(String hexKey, String keyId) {
        if (hexKey == null || hexKey.isBlank()) {
            throw new IllegalArgumentException("Encryption key is required (64 hex characters)");
        }
        byte[] key;
        try {
            key = HexFormat.of().parseHex(hexKey.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid encryption key format", e);
        }
        return new AesGcmCipher(key, keyId);
    }

    public byte[] encrypt(byte[] plaintext) {
        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext);

            // Prepend IV to ciphertext
            byte[] combined = new byte[IV_LENGTH + ciphertext.length];
            System.arraycopy(iv, 0, combined, 0, IV_LENGTH);
            System.arraycopy(ciphertext, 0, combined, IV_LENGTH, ciphertext.length);
            return combined;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-256-GCM encryption failed", e);
        }
    }

    /**
     * @throws IntegrityException if the input is truncated or fails tag verification
     */
    public byte[] decrypt(byte[] combined) {
        if (combined == null || combined.length < IV_LENGTH + TAG_LENGTH_BITS / 8) {
            throw new IntegrityException("Encrypted data too short");
        }
        byte[] iv = Arrays.copyOfRange(combined, 0, IV_LENGTH);
        byte[] encrypted = Arrays.copyOfRange(combined, IV_LENGTH, combined.length);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            return cipher.doFinal(encrypted);
        } catch (AEADBadTagException e) {
            throw new IntegrityException("Authentication tag mismatch: data tampered or wrong key", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-256-GCM decryption failed", e);
        }
    }

    /**
     * Encrypt a string value.
     *
     * @return Base64(IV || ciphertext || tag)
     */
    public String encryptToBase64(String plaintext) {
        return Base64.getEncoder().encodeToString(encrypt(plaintext.getBytes(StandardCharsets.UTF_8)));
    }

    public String decryptFromBase64(String encoded) {
        byte[] combined;
        try {
            combined = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new IntegrityException("Encrypted value is not valid Base64", e);
        }
        return new String(decrypt(combined), StandardCharsets.UTF_8);
    }
}
