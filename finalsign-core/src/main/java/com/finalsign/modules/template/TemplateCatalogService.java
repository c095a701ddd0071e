package com.finalsign.modules.template;

import com.finalsign.exception.NotFoundException;
import com.finalsign.model.AuditAction;
import com.finalsign.model.FieldPosition;
import com.finalsign.model.FieldType;
import com.finalsign.model.FieldValidationRules;
import com.finalsign.model.RequestMetadata;
import com.finalsign.model.entity.Template;
import com.finalsign.model.entity.TemplateField;
import com.finalsign.model.entity.TemplateSigner;
import com.finalsign.modules.access.Action;
import com.finalsign.modules.access.AuthenticatedPrincipal;
import com.finalsign.modules.access.AuthorizationService;
import com.finalsign.modules.access.ProtectedResource;
import com.finalsign.modules.template.dto.CreateTemplateCommand;
import com.finalsign.modules.template.dto.FieldSpec;
import com.finalsign.modules.template.dto.SignerReplacementResult;
import com.finalsign.modules.template.dto.SignerSpec;
import com.finalsign.modules.template.dto.TemplateDetails;
import com.finalsign.modules.template.dto.TemplateSummary;
import com.finalsign.repository.TemplateFieldRepository;
import com.finalsign.repository.TemplateRepository;
import com.finalsign.repository.TemplateSignerRepository;
import com.finalsign.service.AuditService;
import com.finalsign.service.TransactionRunner;
import com.finalsign.service.storage.ContentPaths;
import com.finalsign.service.storage.EncryptedContentStore;
import com.finalsign.service.storage.StoredContent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Template catalog: creation, signer and field replacement, metadata edits and soft
 * deletion.
 * <ul>
 * <li>The PDF is stored before the database transaction opens and deleted again if the
 * transaction fails</li>
 * <li>Signers, fields and the version bump are written atomically</li>
 * <li>Replacing signers always removes every field of the template first</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateCatalogService {

    static final String PDF_MIME_TYPE = "application/pdf";

    private final TemplateRepository templateRepository;
    private final TemplateSignerRepository signerRepository;
    private final TemplateFieldRepository fieldRepository;
    private final EncryptedContentStore contentStore;
    private final TemplateRequestValidator validator;
    private final AuthorizationService authorizationService;
    private final AuditService auditService;
    private final TransactionRunner transactionRunner;

    public TemplateDetails createTemplate(AuthenticatedPrincipal principal, CreateTemplateCommand command,
            RequestMetadata request) {
        authorizationService.authorize(principal, Action.CREATE_TEMPLATE,
                ProtectedResource.workspace(principal.workspaceId()));
        validator.validateCreate(command);

        String path = ContentPaths.templatePath(principal.userId(), principal.workspaceId());
        StoredContent stored = contentStore.put(command.getPdf(), path, PDF_MIME_TYPE);

        TemplateDetails details;
        try {
            details = transactionRunner.inTransaction("create template", () -> {
                TemplateDetails created = persistNewTemplate(principal, command, stored);
                Template template = created.getTemplate();
                auditService.record(AuditAction.TEMPLATE_CREATED, null, template.getId(), principal.userId(),
                        request, Map.of(
                                "name", template.getName(),
                                "signerCount", created.getSigners().size(),
                                "fieldCount", created.getFields().size(),
                                "fileSize", stored.getSize()));
                return created;
            });
        } catch (RuntimeException e) {
            if (!contentStore.delete(path)) {
                log.error("ORPHANED template object {} after failed create (hash={}); needs manual cleanup",
                        path, stored.getContentHash());
            }
            throw e;
        }

        log.info("Template {} created in workspace {} by {} ({} signers, {} fields)",
                details.getTemplate().getId(), principal.workspaceId(), principal.userId(),
                details.getSigners().size(), details.getFields().size());
        return details;
    }

    public TemplateDetails replaceFields(AuthenticatedPrincipal principal, UUID templateId, List<FieldSpec> fields,
            RequestMetadata request) {
        return transactionRunner.inTransaction("replace template fields", () -> {
            Template template = loadForModification(principal, templateId);
            List<TemplateSigner> signers = signerRepository.findByTemplateIdOrderByOrderAsc(templateId);
            Map<Integer, UUID> signerIdByOrder = signers.stream()
                    .collect(Collectors.toMap(TemplateSigner::getOrder, TemplateSigner::getId));
            validator.validateFields(fields, signerIdByOrder.keySet());

            int removed = fieldRepository.deleteAllByTemplateId(templateId);
            List<TemplateField> saved = fieldRepository.saveAll(toFields(templateId, fields, signerIdByOrder));
            template.bumpVersion();
            template = templateRepository.save(template);

            auditService.record(AuditAction.TEMPLATE_UPDATED, null, templateId, principal.userId(), request,
                    Map.of("change", "fields_replaced", "fieldsRemoved", removed, "fieldCount", saved.size(),
                            "version", template.getVersion()));
            log.info("Template {} fields replaced: {} removed, {} added (version {})",
                    templateId, removed, saved.size(), template.getVersion());
            return new TemplateDetails(template, signers, saved);
        });
    }

    public SignerReplacementResult replaceSigners(AuthenticatedPrincipal principal, UUID templateId,
            List<SignerSpec> signers, RequestMetadata request) {
        validator.validateSigners(signers);
        return transactionRunner.inTransaction("replace template signers", () -> {
            Template template = loadForModification(principal, templateId);

            // fields point at the signer rows being replaced
            int fieldsRemoved = fieldRepository.deleteAllByTemplateId(templateId);
            signerRepository.deleteAllByTemplateId(templateId);
            List<TemplateSigner> saved = signerRepository.saveAll(toSigners(templateId, signers));
            template.bumpVersion();
            template = templateRepository.save(template);

            auditService.record(AuditAction.TEMPLATE_UPDATED, null, templateId, principal.userId(), request,
                    Map.of("change", "signers_replaced", "signerCount", saved.size(),
                            "fieldsRemoved", fieldsRemoved, "version", template.getVersion()));
            log.warn("Template {} signers replaced; {} field assignments removed (version {})",
                    templateId, fieldsRemoved, template.getVersion());
            return new SignerReplacementResult(new TemplateDetails(template, saved, List.of()), fieldsRemoved);
        });
    }

    public Template updateTemplateMetadata(AuthenticatedPrincipal principal, UUID templateId, String name,
            String description, RequestMetadata request) {
        validator.validateMetadata(name, description);
        return transactionRunner.inTransaction("update template", () -> {
            Template template = loadForModification(principal, templateId);
            template.setName(name.trim());
            template.setDescription(description);
            Template saved = templateRepository.save(template);
            auditService.record(AuditAction.TEMPLATE_UPDATED, null, templateId, principal.userId(), request,
                    Map.of("change", "metadata", "name", saved.getName()));
            return saved;
        });
    }

    /**
     * Soft delete. Content and history stay; documents created from the template keep
     * working.
     */
    public void deactivateTemplate(AuthenticatedPrincipal principal, UUID templateId, RequestMetadata request) {
        transactionRunner.runInTransaction("deactivate template", () -> {
            Template template = loadForModification(principal, templateId);
            template.setActive(false);
            templateRepository.save(template);
            auditService.record(AuditAction.TEMPLATE_UPDATED, null, templateId, principal.userId(), request,
                    Map.of("change", "deactivated"));
            log.info("Template {} deactivated by {}", templateId, principal.userId());
        });
    }

    public TemplateDetails getTemplate(AuthenticatedPrincipal principal, UUID templateId) {
        return transactionRunner.inTransaction("get template", () -> {
            Template template = templateRepository.findByIdAndWorkspaceIdAndActiveTrue(templateId,
                    principal.workspaceId()).orElseThrow(() -> new NotFoundException("Template", templateId));
            authorizationService.authorize(principal, Action.VIEW_TEMPLATE, resourceOf(template));
            return new TemplateDetails(template,
                    signerRepository.findByTemplateIdOrderByOrderAsc(templateId),
                    fieldRepository.findByTemplateIdOrderByNameAsc(templateId));
        });
    }

    /**
     * Active templates of the principal's workspace, newest first.
     */
    public List<TemplateSummary> listTemplates(AuthenticatedPrincipal principal) {
        authorizationService.authorize(principal, Action.VIEW_TEMPLATE,
                ProtectedResource.workspace(principal.workspaceId()));
        return transactionRunner.inTransaction("list templates", () -> templateRepository
                .findByWorkspaceIdAndActiveTrueOrderByCreatedAtDesc(principal.workspaceId())
                .stream()
                .map(t -> TemplateSummary.builder()
                        .id(t.getId())
                        .name(t.getName())
                        .description(t.getDescription())
                        .fileSize(t.getContent() != null ? t.getContent().getSize() : null)
                        .totalPages(t.getTotalPages())
                        .createdBy(t.getCreatedBy())
                        .signerCount(signerRepository.countByTemplateId(t.getId()))
                        .fieldCount(fieldRepository.countByTemplateId(t.getId()))
                        .version(t.getVersion())
                        .createdAt(t.getCreatedAt())
                        .updatedAt(t.getUpdatedAt())
                        .build())
                .collect(Collectors.toList()));
    }

    private TemplateDetails persistNewTemplate(AuthenticatedPrincipal principal, CreateTemplateCommand command,
            StoredContent stored) {
        Integer pages = command.getTotalPages();
        Template template = templateRepository.save(Template.builder()
                .name(command.getName().trim())
                .description(command.getDescription())
                .content(stored.toReference())
                .totalPages(pages != null && pages > 0 ? pages : 1)
                .createdBy(principal.userId())
                .workspaceId(principal.workspaceId())
                .active(true)
                .version(1)
                .build());

        List<TemplateSigner> signers = signerRepository.saveAll(toSigners(template.getId(), command.getSigners()));
        Map<Integer, UUID> signerIdByOrder = new HashMap<>();
        signers.forEach(s -> signerIdByOrder.put(s.getOrder(), s.getId()));
        List<TemplateField> fields = command.getFields() == null ? List.of()
                : fieldRepository.saveAll(toFields(template.getId(), command.getFields(), signerIdByOrder));
        return new TemplateDetails(template, signers, fields);
    }

    private Template loadForModification(AuthenticatedPrincipal principal, UUID templateId) {
        Template template = templateRepository.findByIdAndWorkspaceIdAndActiveTrue(templateId,
                principal.workspaceId()).orElseThrow(() -> new NotFoundException("Template", templateId));
        authorizationService.authorize(principal, Action.MODIFY_TEMPLATE, resourceOf(template));
        return template;
    }

    private static ProtectedResource resourceOf(Template template) {
        return new ProtectedResource(template.getWorkspaceId(), template.getCreatedBy());
    }

    private static List<TemplateSigner> toSigners(UUID templateId, List<SignerSpec> specs) {
        List<TemplateSigner> signers = new ArrayList<>();
        for (SignerSpec spec : specs) {
            signers.add(TemplateSigner.builder()
                    .templateId(templateId)
                    .order(spec.getOrder())
                    .name(spec.getName().trim())
                    .color(spec.getColor())
                    .build());
        }
        return signers;
    }

    private static List<TemplateField> toFields(UUID templateId, List<FieldSpec> specs,
            Map<Integer, UUID> signerIdByOrder) {
        List<TemplateField> fields = new ArrayList<>();
        if (specs == null) {
            return fields;
        }
        for (FieldSpec spec : specs) {
            fields.add(TemplateField.builder()
                    .templateId(templateId)
                    .signerId(signerIdByOrder.get(spec.getSignerOrder()))
                    .name(spec.getName())
                    .type(FieldType.fromValue(spec.getType()))
                    .label(spec.getLabel())
                    .placeholder(spec.getPlaceholder())
                    .position(FieldPosition.builder()
                            .x(spec.getX())
                            .y(spec.getY())
                            .width(spec.getWidth())
                            .height(spec.getHeight())
                            .page(spec.getPage() != null ? spec.getPage() : 1)
                            .build())
                    .required(spec.isRequired())
                    .validationRules(spec.getValidationRules() != null ? spec.getValidationRules()
                            : FieldValidationRules.none())
                    .version(1)
                    .build());
        }
        return fields;
    }
}
