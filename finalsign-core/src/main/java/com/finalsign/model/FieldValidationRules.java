package com.finalsign.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Optional constraints applied to a submitted value on top of its field type.
 * Persisted as a JSON document.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldValidationRules {

    private Integer minLength;
    private Integer maxLength;
    /** Java regular expression the whole value must match. */
    private String pattern;

    public static FieldValidationRules none() {
        return new FieldValidationRules();
    }
}
