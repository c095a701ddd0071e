package com.finalsign.exception;

/**
 * Missing or inaccessible entity. Both cases share this type so that existence is not
 * leaked to callers outside the owning workspace.
 */
public class NotFoundException extends FinalSignException {

    public NotFoundException(String entityType, Object id) {
        super(ErrorKind.NOT_FOUND, entityType + " not found: " + id);
    }
}
