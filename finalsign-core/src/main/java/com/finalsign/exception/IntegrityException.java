package com.finalsign.exception;

/**
 * Stored content failed authentication or hash verification: tampering, corruption or a
 * wrong key. Never retried.
 */
public class IntegrityException extends StorageException {

    public IntegrityException(String message) {
        super(ErrorKind.INTEGRITY, message, null);
    }

    public IntegrityException(String message, Throwable cause) {
        super(ErrorKind.INTEGRITY, message, cause);
    }
}
