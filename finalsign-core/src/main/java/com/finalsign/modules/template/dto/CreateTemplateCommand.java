package com.finalsign.modules.template.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateTemplateCommand {
    private String name;
    private String description;
    private byte[] pdf;
    /** Page count reported by the uploader; values below 1 fall back to 1. */
    private Integer totalPages;
    @Builder.Default
    private List<SignerSpec> signers = new ArrayList<>();
    @Builder.Default
    private List<FieldSpec> fields = new ArrayList<>();
}
