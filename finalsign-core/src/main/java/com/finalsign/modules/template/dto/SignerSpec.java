package com.finalsign.modules.template.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A signer role as supplied by the caller. {@code order} doubles as the role's reference
 * key for fields in the same request.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SignerSpec {
    private Integer order;
    private String name;
    /** Hex colour such as {@code #3B82F6}. */
    private String color;
}
