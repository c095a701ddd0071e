package com.finalsign.exception;

import lombok.Getter;

/**
 * State-machine violation or uniqueness clash.
 */
@Getter
public class ConflictException extends FinalSignException {

    private final String errorCode;

    public ConflictException(String errorCode, String message) {
        super(ErrorKind.CONFLICT, message);
        this.errorCode = errorCode;
    }
}
