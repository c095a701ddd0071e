package com.finalsign.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of audited lifecycle events.
 */
@Getter
@RequiredArgsConstructor
public enum AuditAction implements PersistedEnum {
    TEMPLATE_CREATED("template_created"),
    TEMPLATE_UPDATED("template_updated"),
    DOCUMENT_CREATED("document_created"),
    DOCUMENT_SENT("document_sent"),
    DOCUMENT_VIEWED("document_viewed"),
    FIELD_FILLED("field_filled"),
    DOCUMENT_SIGNED("document_signed"),
    DOCUMENT_COMPLETED("document_completed"),
    DOCUMENT_EXPIRED("document_expired"),
    DOCUMENT_CANCELLED("document_cancelled");

    private final String value;

    public static AuditAction fromValue(String value) {
        for (AuditAction action : values()) {
            if (action.value.equals(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown audit action: " + value);
    }
}
