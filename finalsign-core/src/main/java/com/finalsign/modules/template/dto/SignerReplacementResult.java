package com.finalsign.modules.template.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of replacing a template's signers. Replacing signers always removes every
 * field, so consumers must re-render field assignments.
 */
@Getter
@AllArgsConstructor
public class SignerReplacementResult {
    private final TemplateDetails template;
    private final int fieldsRemoved;

    public boolean isFieldsCleared() {
        return true;
    }
}
