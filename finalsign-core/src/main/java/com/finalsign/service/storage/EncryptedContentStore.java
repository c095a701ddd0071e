package com.finalsign.service.storage;

import com.finalsign.exception.FinalSignException;
import com.finalsign.exception.IntegrityException;
import com.finalsign.exception.StorageException;
import com.finalsign.exception.ValidationException;
import com.finalsign.service.crypto.AesGcmCipher;
import com.finalsign.service.crypto.Sha256;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Confidential, tamper-evident object store for template and final PDFs.
 * <ul>
 * <li>SHA-256 of the plaintext is computed before encryption and returned to the caller,
 * so stored metadata can be checked without decrypting</li>
 * <li>Payloads are sealed with AES-256-GCM under the process-wide key; the IV travels
 * with the ciphertext</li>
 * <li>Every read verifies the authentication tag</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EncryptedContentStore {

    private final StorageService storageService;
    private final AesGcmCipher documentCipher;

    public StoredContent put(byte[] payload, String path, String mimeType) {
        if (payload == null) {
            throw new ValidationException("payload", "payload is required");
        }
        String contentHash = Sha256.hex(payload);
        byte[] sealed = documentCipher.encrypt(payload);
        try {
            storageService.upload(sealed, path, mimeType);
        } catch (FinalSignException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageException("Failed to store object: " + path, e);
        }
        log.debug("Stored encrypted object {} ({} bytes plaintext, hash={})", path, payload.length, contentHash);
        return StoredContent.builder()
                .bucket(storageService.location())
                .path(path)
                .contentHash(contentHash)
                .size(payload.length)
                .mimeType(mimeType)
                .build();
    }

    /**
     * @throws IntegrityException if the ciphertext fails authentication
     */
    public RetrievedContent get(String path) {
        byte[] sealed;
        try {
            sealed = storageService.download(path);
        } catch (FinalSignException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageException("Failed to read object: " + path, e);
        }
        byte[] plaintext;
        try {
            plaintext = documentCipher.decrypt(sealed);
        } catch (IntegrityException e) {
            log.error("INTEGRITY FAILURE reading {}: {}", path, e.getMessage());
            throw new IntegrityException("Integrity check failed for " + path, e);
        }
        return new RetrievedContent(plaintext, Sha256.hex(plaintext));
    }

    /**
     * Read and compare against the hash recorded when the object was stored.
     */
    public RetrievedContent getVerified(String path, String expectedHash) {
        RetrievedContent content = get(path);
        verify(content.getData(), expectedHash);
        return content;
    }

    public void verify(byte[] data, String expectedHash) {
        String actualHash = Sha256.hex(data);
        if (!actualHash.equalsIgnoreCase(expectedHash)) {
            log.error("INTEGRITY FAILURE: expected hash {}, got {}", expectedHash, actualHash);
            throw new IntegrityException("File integrity check failed: expected " + expectedHash
                    + ", got " + actualHash);
        }
    }

    /**
     * Best-effort removal.
     *
     * @return false if the object could not be deleted
     */
    public boolean delete(String path) {
        try {
            storageService.delete(path);
            return true;
        } catch (RuntimeException e) {
            log.warn("Failed to delete object {}: {}", path, e.getMessage());
            return false;
        }
    }

    public boolean exists(String path) {
        try {
            return storageService.exists(path);
        } catch (FinalSignException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StorageException("Failed to check object: " + path, e);
        }
    }
}
