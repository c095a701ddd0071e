package com.finalsign.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A single field-level validation message.
 */
@Getter
@ToString
@AllArgsConstructor
public class FieldError {
    private final String field;
    private final String message;
}
