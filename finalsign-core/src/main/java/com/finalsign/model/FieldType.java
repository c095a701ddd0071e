package com.finalsign.model;

import com.finalsign.exception.ValidationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Closed set of fillable field types.
 */
@Getter
@RequiredArgsConstructor
public enum FieldType implements PersistedEnum {
    TEXT("text"),
    SIGNATURE("signature"),
    DATE("date"),
    CHECKBOX("checkbox"),
    EMAIL("email"),
    PHONE("phone");

    private final String value;

    public static FieldType fromValue(String value) {
        for (FieldType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new ValidationException("type", "invalid field type '" + value + "'. Must be one of: "
                + Arrays.stream(values()).map(FieldType::getValue).collect(Collectors.joining(", ")));
    }
}
