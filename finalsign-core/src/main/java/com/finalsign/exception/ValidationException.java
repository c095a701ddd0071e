package com.finalsign.exception;

import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Malformed or out-of-range input. Caller-fixable, never retried.
 */
@Getter
public class ValidationException extends FinalSignException {

    private final List<FieldError> fieldErrors;

    public ValidationException(List<FieldError> fieldErrors) {
        super(ErrorKind.VALIDATION, summarize(fieldErrors));
        this.fieldErrors = List.copyOf(fieldErrors);
    }

    public ValidationException(String field, String message) {
        this(List.of(new FieldError(field, message)));
    }

    private static String summarize(List<FieldError> errors) {
        return errors.stream()
                .map(e -> e.getField() + ": " + e.getMessage())
                .collect(Collectors.joining("; "));
    }
}
