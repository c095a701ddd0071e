package com.finalsign.exception;

/**
 * Coarse error categories exposed to callers. Storage and persistence failures are
 * reported by kind only, never by internal detail.
 */
public enum ErrorKind {
    VALIDATION(false),
    PERMISSION(false),
    NOT_FOUND(false),
    CONFLICT(false),
    STORAGE(true),
    INTEGRITY(false),
    PERSISTENCE(true);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
