package com.finalsign.modules.template.dto;

import com.finalsign.model.entity.Template;
import com.finalsign.model.entity.TemplateField;
import com.finalsign.model.entity.TemplateSigner;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * A template with its signers (by order) and fields.
 */
@Getter
@AllArgsConstructor
public class TemplateDetails {
    private final Template template;
    private final List<TemplateSigner> signers;
    private final List<TemplateField> fields;
}
