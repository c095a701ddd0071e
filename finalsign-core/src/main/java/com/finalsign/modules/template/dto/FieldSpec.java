package com.finalsign.modules.template.dto;

import com.finalsign.model.FieldValidationRules;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A field as supplied by the caller. Position components are boxed so that a missing
 * component can be told apart from zero.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FieldSpec {
    private String name;
    private String type;
    /** Order of the signer role this field belongs to. */
    private Integer signerOrder;
    private String label;
    private String placeholder;
    private Double x;
    private Double y;
    private Double width;
    private Double height;
    private Integer page;
    @Builder.Default
    private boolean required = true;
    private FieldValidationRules validationRules;
}
