package com.finalsign.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Document lifecycle states. {@code draft} and {@code scheduled} precede distribution;
 * {@code completed}, {@code expired} and {@code cancelled} are terminal.
 */
@Getter
@RequiredArgsConstructor
public enum DocumentStatus implements PersistedEnum {
    DRAFT("draft", false),
    SCHEDULED("scheduled", false),
    SENT("sent", false),
    IN_PROGRESS("in_progress", false),
    COMPLETED("completed", true),
    EXPIRED("expired", true),
    CANCELLED("cancelled", true);

    private final String value;
    private final boolean terminal;

    public boolean acceptsSubmissions() {
        return this == SENT || this == IN_PROGRESS;
    }

    public static DocumentStatus fromValue(String value) {
        for (DocumentStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown document status: " + value);
    }
}
