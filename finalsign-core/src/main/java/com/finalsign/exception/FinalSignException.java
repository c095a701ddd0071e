package com.finalsign.exception;

import lombok.Getter;

/**
 * Base type for every failure raised by the signing core.
 */
@Getter
public abstract class FinalSignException extends RuntimeException {

    private final ErrorKind kind;

    protected FinalSignException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected FinalSignException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
