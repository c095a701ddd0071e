package com.finalsign.exception;

/**
 * Relational store failure. May be retried.
 */
public class PersistenceException extends FinalSignException {

    public PersistenceException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE, message, cause);
    }
}
