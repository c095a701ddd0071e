package com.finalsign.modules.document;

import com.finalsign.config.FinalSignProperties;
import com.finalsign.exception.ConflictException;
import com.finalsign.exception.DocumentClosedException;
import com.finalsign.exception.FieldError;
import com.finalsign.exception.FinalSignException;
import com.finalsign.exception.NotFoundException;
import com.finalsign.exception.ValidationException;
import com.finalsign.model.AuditAction;
import com.finalsign.model.DocumentStatus;
import com.finalsign.model.EmailAddress;
import com.finalsign.model.RequestMetadata;
import com.finalsign.model.SignerStatus;
import com.finalsign.model.entity.Document;
import com.finalsign.model.entity.DocumentSigner;
import com.finalsign.model.entity.Template;
import com.finalsign.model.entity.TemplateField;
import com.finalsign.model.entity.TemplateSigner;
import com.finalsign.modules.access.Action;
import com.finalsign.modules.access.AuthenticatedPrincipal;
import com.finalsign.modules.access.AuthorizationService;
import com.finalsign.modules.access.ProtectedResource;
import com.finalsign.modules.document.dto.CreateDocumentCommand;
import com.finalsign.modules.document.dto.DocumentDetails;
import com.finalsign.modules.document.dto.RecipientSpec;
import com.finalsign.modules.notification.event.DocumentSentEvent;
import com.finalsign.modules.notification.event.RecipientInvitation;
import com.finalsign.modules.template.TemplateSnapshotHasher;
import com.finalsign.repository.DocumentRepository;
import com.finalsign.repository.DocumentSignerRepository;
import com.finalsign.repository.TemplateFieldRepository;
import com.finalsign.repository.TemplateRepository;
import com.finalsign.repository.TemplateSignerRepository;
import com.finalsign.service.AuditService;
import com.finalsign.service.TransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Document lifecycle: instantiation from a template, distribution, recipient views,
 * cancellation and expiry. Completion lives in
 * {@link com.finalsign.modules.signature.DocumentCompletionService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentService {

    private static final int MAX_NAME_LENGTH = 255;

    private final DocumentRepository documentRepository;
    private final DocumentSignerRepository signerRepository;
    private final TemplateRepository templateRepository;
    private final TemplateSignerRepository templateSignerRepository;
    private final TemplateFieldRepository templateFieldRepository;
    private final TemplateSnapshotHasher snapshotHasher;
    private final DocumentStateMachine stateMachine;
    private final AccessTokenGenerator tokenGenerator;
    private final AuthorizationService authorizationService;
    private final AuditService auditService;
    private final TransactionRunner transactionRunner;
    private final ApplicationEventPublisher eventPublisher;
    private final FinalSignProperties properties;

    /**
     * Instantiates a template for real recipients. The document starts in {@code draft},
     * or {@code scheduled} when requested, with one signer per template signer.
     */
    public DocumentDetails createDocument(AuthenticatedPrincipal principal, CreateDocumentCommand command,
            RequestMetadata request) {
        authorizationService.authorize(principal, Action.CREATE_DOCUMENT,
                ProtectedResource.workspace(principal.workspaceId()));
        OffsetDateTime now = OffsetDateTime.now();
        validateCreate(command, now);

        DocumentDetails details = transactionRunner.inTransaction("create document", () -> {
            Template template = templateRepository.findByIdAndWorkspaceIdAndActiveTrue(command.getTemplateId(),
                    principal.workspaceId()).orElseThrow(() -> new NotFoundException("Template", command.getTemplateId()));
            List<TemplateSigner> roles = templateSignerRepository.findByTemplateIdOrderByOrderAsc(template.getId());
            List<TemplateField> fields = templateFieldRepository.findByTemplateIdOrderByNameAsc(template.getId());
            Map<Integer, RecipientSpec> recipientsByOrder = bindRecipients(roles, command.getRecipients());

            Document document = documentRepository.save(Document.builder()
                    .templateId(template.getId())
                    .name(command.getName().trim())
                    .templateSnapshotHash(snapshotHasher.hash(template, roles, fields))
                    .templateVersion(template.getVersion())
                    .createdBy(principal.userId())
                    .workspaceId(principal.workspaceId())
                    .status(DocumentStatus.DRAFT)
                    .expiresAt(command.getExpiresAt() != null ? command.getExpiresAt()
                            : now.plusDays(properties.getDocuments().getDefaultExpiryDays()))
                    .build());
            if (command.isScheduled()) {
                stateMachine.transition(document, DocumentStatus.SCHEDULED);
                document = documentRepository.save(document);
            }

            Set<String> issued = new HashSet<>();
            List<DocumentSigner> signers = new ArrayList<>();
            for (TemplateSigner role : roles) {
                RecipientSpec recipient = recipientsByOrder.get(role.getOrder());
                String token = tokenGenerator.generateUnique(t -> issued.contains(t) || signerRepository.existsByAccessToken(t));
                issued.add(token);
                signers.add(DocumentSigner.builder()
                        .documentId(document.getId())
                        .templateSignerId(role.getId())
                        .order(role.getOrder())
                        .email(recipient.getEmail().trim())
                        .name(recipient.getName() != null ? recipient.getName().trim() : null)
                        .accessToken(token)
                        .status(SignerStatus.PENDING)
                        .build());
            }
            signers = signerRepository.saveAll(signers);

            auditService.record(AuditAction.DOCUMENT_CREATED, document.getId(), template.getId(),
                    principal.userId(), request, Map.of(
                            "name", document.getName(),
                            "status", document.getStatus().getValue(),
                            "templateVersion", document.getTemplateVersion(),
                            "signerCount", signers.size()));
            return new DocumentDetails(document, signers);
        });

        log.info("Document {} created from template {} in workspace {} ({} signers, status={})",
                details.getDocument().getId(), command.getTemplateId(), principal.workspaceId(),
                details.getSigners().size(), details.getDocument().getStatus().getValue());
        return details;
    }

    /**
     * Distributes the document: {@code draft}/{@code scheduled} to {@code sent}. Every
     * signer is checked for a usable access token before the invitation goes out. An overdue
     * document is expired instead, once the caller is authorized to manage it.
     */
    public DocumentDetails sendDocument(AuthenticatedPrincipal principal, UUID documentId, RequestMetadata request) {
        DocumentDetails sent = transactionRunner.inTransaction("send document", () -> {
            Document document = lockForManagement(principal, documentId);
            if (expireLocked(document, OffsetDateTime.now())) {
                return null;
            }
            stateMachine.transition(document, DocumentStatus.SENT);
            document.setSentAt(OffsetDateTime.now());
            document = documentRepository.save(document);

            List<DocumentSigner> signers = signerRepository.findByDocumentIdOrderByOrderAsc(documentId);
            if (signers.isEmpty()) {
                throw new ConflictException("NO_SIGNERS", "Document " + documentId + " has no signers");
            }
            for (DocumentSigner signer : signers) {
                if (!tokenGenerator.isWellFormed(signer.getAccessToken())) {
                    signer.setAccessToken(tokenGenerator.generateUnique(signerRepository::existsByAccessToken));
                    log.warn("Regenerated malformed access token for signer {} of document {}",
                            signer.getId(), documentId);
                }
            }
            signers = signerRepository.saveAll(signers);

            auditService.record(AuditAction.DOCUMENT_SENT, documentId, document.getTemplateId(), principal.userId(),
                    request, Map.of("recipientCount", signers.size()));
            eventPublisher.publishEvent(new DocumentSentEvent(documentId, document.getName(),
                    document.getWorkspaceId(), principal.userId(), signers.stream()
                            .map(s -> new RecipientInvitation(s.getOrder(), s.getEmail(), s.getName(), s.getAccessToken()))
                            .collect(Collectors.toList())));
            return new DocumentDetails(document, signers);
        });
        if (sent == null) {
            throw new DocumentClosedException(documentId, DocumentStatus.EXPIRED);
        }
        return sent;
    }

    /**
     * A recipient opened the document through their access link.
     */
    public DocumentSigner markViewed(String accessToken, RequestMetadata request) {
        DocumentSigner resolved = signerRepository.findByAccessToken(accessToken)
                .orElseThrow(() -> new NotFoundException("DocumentSigner", "access token"));
        expireDocument(resolved.getDocumentId(), OffsetDateTime.now());

        return transactionRunner.inTransaction("mark document viewed", () -> {
            Document document = documentRepository.findByIdForUpdate(resolved.getDocumentId())
                    .orElseThrow(() -> new NotFoundException("Document", resolved.getDocumentId()));
            stateMachine.requireAcceptsSubmissions(document);
            DocumentSigner signer = signerRepository.findById(resolved.getId())
                    .orElseThrow(() -> new NotFoundException("DocumentSigner", resolved.getId()));

            OffsetDateTime now = OffsetDateTime.now();
            if (signer.getViewedAt() == null) {
                signer.setViewedAt(now);
            }
            if (signer.getStatus() == SignerStatus.PENDING) {
                signer.setStatus(SignerStatus.VIEWED);
            }
            signer = signerRepository.save(signer);
            if (document.getStatus() == DocumentStatus.SENT) {
                stateMachine.markStarted(document);
                documentRepository.save(document);
            }

            auditService.record(AuditAction.DOCUMENT_VIEWED, document.getId(), document.getTemplateId(), null,
                    request, Map.of("signerId", signer.getId().toString(), "signerOrder", signer.getOrder()));
            return signer;
        });
    }

    public Document cancelDocument(AuthenticatedPrincipal principal, UUID documentId, RequestMetadata request) {
        return transactionRunner.inTransaction("cancel document", () -> {
            Document document = lockForManagement(principal, documentId);
            DocumentStatus previous = document.getStatus();
            stateMachine.transition(document, DocumentStatus.CANCELLED);
            document = documentRepository.save(document);
            auditService.record(AuditAction.DOCUMENT_CANCELLED, documentId, document.getTemplateId(),
                    principal.userId(), request, Map.of("previousStatus", previous.getValue()));
            return document;
        });
    }

    /**
     * Expires the document if it is still open and its deadline has passed. Used by the
     * external sweep and lazily before recipient-facing reads and writes.
     *
     * @return true if this call expired the document
     */
    public boolean expireDocument(UUID documentId, OffsetDateTime now) {
        return transactionRunner.inTransaction("expire document", () -> {
            Document document = documentRepository.findByIdForUpdate(documentId)
                    .orElseThrow(() -> new NotFoundException("Document", documentId));
            return expireLocked(document, now);
        });
    }

    private boolean expireLocked(Document document, OffsetDateTime now) {
        if (document.getStatus().isTerminal() || !document.isOverdue(now)) {
            return false;
        }
        DocumentStatus previous = document.getStatus();
        stateMachine.transition(document, DocumentStatus.EXPIRED);
        documentRepository.save(document);
        auditService.record(AuditAction.DOCUMENT_EXPIRED, document.getId(), document.getTemplateId(), null,
                RequestMetadata.NONE, Map.of("previousStatus", previous.getValue(),
                        "expiresAt", document.getExpiresAt().toString()));
        return true;
    }

    /**
     * Sweep entry point for an external scheduler. Each document expires in its own
     * transaction; one failure does not stop the sweep.
     *
     * @return number of documents expired
     */
    public int expireOverdue(OffsetDateTime now) {
        List<UUID> overdue = transactionRunner.inTransaction("find overdue documents",
                () -> documentRepository.findOverdueIds(stateMachine.nonTerminal(), now));
        int expired = 0;
        for (UUID documentId : overdue) {
            try {
                if (expireDocument(documentId, now)) {
                    expired++;
                }
            } catch (FinalSignException e) {
                log.warn("Failed to expire document {}: {}", documentId, e.getMessage());
            }
        }
        if (expired > 0) {
            log.info("Expiry sweep: {} of {} overdue documents expired", expired, overdue.size());
        }
        return expired;
    }

    public DocumentDetails getDocument(AuthenticatedPrincipal principal, UUID documentId) {
        Document document = loadVisible(principal, documentId);
        if (!document.getStatus().isTerminal() && document.isOverdue(OffsetDateTime.now())) {
            expireDocument(documentId, OffsetDateTime.now());
            document = loadVisible(principal, documentId);
        }
        List<DocumentSigner> signers = transactionRunner.inTransaction("load document signers",
                () -> signerRepository.findByDocumentIdOrderByOrderAsc(documentId));
        return new DocumentDetails(document, signers);
    }

    /**
     * Documents of the principal's workspace, newest first.
     */
    public List<Document> listDocuments(AuthenticatedPrincipal principal) {
        authorizationService.authorize(principal, Action.VIEW_DOCUMENT,
                ProtectedResource.workspace(principal.workspaceId()));
        return transactionRunner.inTransaction("list documents",
                () -> documentRepository.findByWorkspaceIdOrderByCreatedAtDesc(principal.workspaceId()));
    }

    private Document loadVisible(AuthenticatedPrincipal principal, UUID documentId) {
        Document document = transactionRunner.inTransaction("get document",
                () -> documentRepository.findByIdAndWorkspaceId(documentId, principal.workspaceId())
                        .orElseThrow(() -> new NotFoundException("Document", documentId)));
        authorizationService.authorize(principal, Action.VIEW_DOCUMENT, resourceOf(document));
        return document;
    }

    private Document lockForManagement(AuthenticatedPrincipal principal, UUID documentId) {
        Document document = documentRepository.findByIdForUpdate(documentId)
                .filter(d -> d.getWorkspaceId().equals(principal.workspaceId()))
                .orElseThrow(() -> new NotFoundException("Document", documentId));
        authorizationService.authorize(principal, Action.MANAGE_DOCUMENT, resourceOf(document));
        return document;
    }

    private static ProtectedResource resourceOf(Document document) {
        return new ProtectedResource(document.getWorkspaceId(), document.getCreatedBy());
    }

    private void validateCreate(CreateDocumentCommand command, OffsetDateTime now) {
        List<FieldError> errors = new ArrayList<>();
        if (command.getTemplateId() == null) {
            errors.add(new FieldError("templateId", "template is required"));
        }
        if (command.getName() == null || command.getName().isBlank()) {
            errors.add(new FieldError("name", "document name is required"));
        } else if (command.getName().trim().length() > MAX_NAME_LENGTH) {
            errors.add(new FieldError("name", "document name must be at most " + MAX_NAME_LENGTH + " characters"));
        }
        if (command.getExpiresAt() != null && !command.getExpiresAt().isAfter(now)) {
            errors.add(new FieldError("expiresAt", "expiry must be in the future"));
        }
        List<RecipientSpec> recipients = command.getRecipients();
        if (recipients == null || recipients.isEmpty()) {
            errors.add(new FieldError("recipients", "at least one recipient is required"));
        } else {
            Set<Integer> orders = new HashSet<>();
            Set<String> emails = new HashSet<>();
            for (int i = 0; i < recipients.size(); i++) {
                RecipientSpec r = recipients.get(i);
                String prefix = "recipients[" + i + "]";
                if (r == null) {
                    errors.add(new FieldError(prefix, "recipient is required"));
                    continue;
                }
                if (r.getOrder() == null || r.getOrder() <= 0) {
                    errors.add(new FieldError(prefix + ".order", "signer order must be positive"));
                } else if (!orders.add(r.getOrder())) {
                    errors.add(new FieldError(prefix + ".order", "duplicate signer order " + r.getOrder()));
                }
                String email = r.getEmail() != null ? r.getEmail().trim() : null;
                if (!EmailAddress.isValid(email)) {
                    errors.add(new FieldError(prefix + ".email", "invalid email address"));
                } else if (!emails.add(email.toLowerCase(Locale.ROOT))) {
                    errors.add(new FieldError(prefix + ".email", "duplicate recipient email"));
                }
                if (r.getName() != null && r.getName().trim().length() > MAX_NAME_LENGTH) {
                    errors.add(new FieldError(prefix + ".name", "recipient name too long"));
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    /**
     * Every template signer must be covered by exactly one recipient and no recipient may
     * name an order the template does not have.
     */
    private static Map<Integer, RecipientSpec> bindRecipients(List<TemplateSigner> roles,
            List<RecipientSpec> recipients) {
        if (roles.isEmpty()) {
            throw new ConflictException("TEMPLATE_HAS_NO_SIGNERS", "Template has no signers to bind");
        }
        Map<Integer, RecipientSpec> byOrder = new HashMap<>();
        recipients.forEach(r -> byOrder.put(r.getOrder(), r));
        List<FieldError> errors = new ArrayList<>();
        Set<Integer> roleOrders = new HashSet<>();
        for (TemplateSigner role : roles) {
            roleOrders.add(role.getOrder());
            if (!byOrder.containsKey(role.getOrder())) {
                errors.add(new FieldError("recipients", "no recipient for signer " + role.getOrder()
                        + " (" + role.getName() + ")"));
            }
        }
        for (Integer order : byOrder.keySet()) {
            if (!roleOrders.contains(order)) {
                errors.add(new FieldError("recipients", "template has no signer with order " + order));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return byOrder;
    }
}
