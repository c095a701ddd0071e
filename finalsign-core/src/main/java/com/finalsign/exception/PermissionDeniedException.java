package com.finalsign.exception;

/**
 * The principal lacks the capability for the requested action.
 */
public class PermissionDeniedException extends FinalSignException {

    public PermissionDeniedException(String message) {
        super(ErrorKind.PERMISSION, message);
    }
}
