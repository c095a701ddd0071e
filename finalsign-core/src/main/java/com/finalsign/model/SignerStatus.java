package com.finalsign.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SignerStatus implements PersistedEnum {
    PENDING("pending"),
    VIEWED("viewed"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed");

    private final String value;

    public static SignerStatus fromValue(String value) {
        for (SignerStatus status : values()) {
            if (status.value.equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown signer status: " + value);
    }
}
