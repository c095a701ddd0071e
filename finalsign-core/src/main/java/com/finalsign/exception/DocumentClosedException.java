package com.finalsign.exception;

import com.finalsign.model.DocumentStatus;

import java.util.UUID;

/**
 * Thrown when a write targets a document that is completed, expired or cancelled.
 */
public class DocumentClosedException extends ConflictException {

    public DocumentClosedException(UUID documentId, DocumentStatus status) {
        super("DOCUMENT_CLOSED", "Document " + documentId + " is " + status.getValue()
                + " and no longer accepts changes");
    }
}
