package com.finalsign.modules.document;

import com.finalsign.exception.ConflictException;
import com.finalsign.exception.NotFoundException;
import com.finalsign.model.entity.Document;
import com.finalsign.model.entity.Template;
import com.finalsign.repository.TemplateRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Resolves the template a document was created from. Documents keep working after the
 * template is deactivated, but not after its signers or fields were replaced: the rows
 * the document was bound to no longer exist.
 */
@Component
@RequiredArgsConstructor
public class TemplateBinding {

    private final TemplateRepository templateRepository;

    public Template requireUnchanged(Document document) {
        Template template = templateRepository.findById(document.getTemplateId())
                .orElseThrow(() -> new NotFoundException("Template", document.getTemplateId()));
        if (!Objects.equals(template.getVersion(), document.getTemplateVersion())) {
            throw new ConflictException("TEMPLATE_CHANGED", "Template " + template.getId()
                    + " changed after document " + document.getId() + " was created (version "
                    + document.getTemplateVersion() + " -> " + template.getVersion() + ")");
        }
        return template;
    }
}
