package com.finalsign.exception;

/**
 * Content-store I/O failure. May be retried by the caller with backoff.
 */
public class StorageException extends FinalSignException {

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE, message, cause);
    }

    public StorageException(String message) {
        super(ErrorKind.STORAGE, message);
    }

    protected StorageException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
