package com.finalsign.modules.signature;

import com.finalsign.exception.NotFoundException;
import com.finalsign.model.AuditAction;
import com.finalsign.model.DocumentStatus;
import com.finalsign.model.RequestMetadata;
import com.finalsign.model.entity.DigitalSignature;
import com.finalsign.model.entity.Document;
import com.finalsign.model.entity.DocumentSigner;
import com.finalsign.model.entity.FormSubmission;
import com.finalsign.model.entity.Template;
import com.finalsign.model.entity.TemplateField;
import com.finalsign.modules.notification.event.DocumentCompletedEvent;
import com.finalsign.repository.DigitalSignatureRepository;
import com.finalsign.repository.DocumentRepository;
import com.finalsign.repository.DocumentSignerRepository;
import com.finalsign.repository.FormSubmissionRepository;
import com.finalsign.repository.TemplateFieldRepository;
import com.finalsign.repository.TemplateRepository;
import com.finalsign.service.AuditService;
import com.finalsign.service.TransactionRunner;
import com.finalsign.service.crypto.Sha256;
import com.finalsign.service.storage.ContentPaths;
import com.finalsign.service.storage.EncryptedContentStore;
import com.finalsign.service.storage.StoredContent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The in_progress to completed transition.
 * <p>
 * Runs with the document row locked and re-checks completeness under that lock. The
 * status flip is a compare-and-set, so at most one caller stores a final document; a
 * caller that loses the race deletes the object it just stored. If the surrounding
 * transaction rolls back, the stored object is deleted as well.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentCompletionService {

    private final DocumentRepository documentRepository;
    private final DocumentSignerRepository signerRepository;
    private final TemplateRepository templateRepository;
    private final TemplateFieldRepository fieldRepository;
    private final FormSubmissionRepository submissionRepository;
    private final DigitalSignatureRepository signatureRepository;
    private final EncryptedContentStore contentStore;
    private final DocumentComposer composer;
    private final AuditService auditService;
    private final TransactionRunner transactionRunner;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Completes the document if every required field of every signer holds a value and
     * every signer has signed. Joins the caller's transaction when there is one.
     *
     * @return true if this call completed the document
     */
    public boolean tryComplete(UUID documentId) {
        return transactionRunner.inTransaction("complete document", () -> {
            Document document = documentRepository.findByIdForUpdate(documentId)
                    .orElseThrow(() -> new NotFoundException("Document", documentId));
            if (document.getStatus() != DocumentStatus.IN_PROGRESS) {
                log.debug("Document {} is {}, not completing", documentId, document.getStatus().getValue());
                return false;
            }

            List<DocumentSigner> signers = signerRepository.findByDocumentIdOrderByOrderAsc(documentId);
            List<TemplateField> fields = fieldRepository.findByTemplateIdOrderByNameAsc(document.getTemplateId());
            List<FormSubmission> submissions = submissionRepository.findByDocumentId(documentId);
            List<DigitalSignature> signatures = signatureRepository.findByDocumentId(documentId);
            if (!isComplete(signers, fields, submissions, signatures)) {
                return false;
            }

            Template template = templateRepository.findById(document.getTemplateId())
                    .orElseThrow(() -> new NotFoundException("Template", document.getTemplateId()));
            byte[] source = contentStore.getVerified(template.getContent().getKey(),
                    template.getContent().getContentHash()).getData();

            OffsetDateTime completedAt = OffsetDateTime.now();
            byte[] composed = composer.compose(source, manifest(document, template, completedAt, signers,
                    fields, submissions, signatures));
            String path = ContentPaths.finalDocumentPath(document.getCreatedBy(), document.getWorkspaceId(), documentId);
            StoredContent stored = contentStore.put(composed, path, composer.mimeType());
            deleteOnRollback(path);

            int updated = documentRepository.markCompleted(documentId, stored.getBucket(), stored.getPath(),
                    stored.getContentHash(), stored.getSize(), stored.getMimeType(), completedAt);
            if (updated == 0) {
                log.warn("Document {} was completed concurrently; discarding {}", documentId, path);
                contentStore.delete(path);
                return false;
            }
            signatureRepository.stampFinalHash(documentId, stored.getContentHash());

            auditService.record(AuditAction.DOCUMENT_COMPLETED, documentId, document.getTemplateId(), null,
                    RequestMetadata.NONE, Map.of(
                            "finalDocumentHash", stored.getContentHash(),
                            "fileSize", stored.getSize(),
                            "signerCount", signers.size()));
            eventPublisher.publishEvent(new DocumentCompletedEvent(documentId, document.getName(),
                    document.getWorkspaceId(), document.getCreatedBy(), stored.getContentHash(), completedAt,
                    signers.stream().map(DocumentSigner::getEmail).collect(Collectors.toList())));
            log.info("Document {} completed (hash={}, {} signers)", documentId, stored.getContentHash(),
                    signers.size());
            return true;
        });
    }

    /**
     * Every signer has exactly one signature and a value for each required field of
     * their role.
     */
    boolean isComplete(List<DocumentSigner> signers, List<TemplateField> fields, List<FormSubmission> submissions,
            List<DigitalSignature> signatures) {
        if (signers.isEmpty()) {
            return false;
        }
        Map<UUID, Long> signaturesBySigner = signatures.stream()
                .collect(Collectors.groupingBy(DigitalSignature::getDocumentSignerId, Collectors.counting()));
        Map<UUID, Set<UUID>> filledBySigner = submissions.stream()
                .filter(FormSubmission::hasValue)
                .collect(Collectors.groupingBy(FormSubmission::getDocumentSignerId,
                        Collectors.mapping(FormSubmission::getFieldId, Collectors.toSet())));

        for (DocumentSigner signer : signers) {
            if (signaturesBySigner.getOrDefault(signer.getId(), 0L) != 1L) {
                return false;
            }
            Set<UUID> filled = filledBySigner.getOrDefault(signer.getId(), Set.of());
            boolean missing = fields.stream()
                    .filter(TemplateField::isRequired)
                    .filter(f -> f.getSignerId().equals(signer.getTemplateSignerId()))
                    .anyMatch(f -> !filled.contains(f.getId()));
            if (missing) {
                return false;
            }
        }
        return true;
    }

    private void deleteOnRollback(String path) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status != STATUS_COMMITTED && !contentStore.delete(path)) {
                    log.error("ORPHANED final document object {} after rollback; needs manual cleanup", path);
                }
            }
        });
    }

    private CompletionManifest manifest(Document document, Template template, OffsetDateTime completedAt,
            List<DocumentSigner> signers, List<TemplateField> fields, List<FormSubmission> submissions,
            List<DigitalSignature> signatures) {
        Map<UUID, DigitalSignature> signatureBySigner = signatures.stream()
                .collect(Collectors.toMap(DigitalSignature::getDocumentSignerId, Function.identity()));
        Map<UUID, Integer> orderBySigner = new HashMap<>();
        signers.forEach(s -> orderBySigner.put(s.getId(), s.getOrder()));
        Set<UUID> knownFields = fields.stream().map(TemplateField::getId).collect(Collectors.toSet());

        return CompletionManifest.builder()
                .documentId(document.getId())
                .documentName(document.getName())
                .templateId(template.getId())
                .templateSnapshotHash(document.getTemplateSnapshotHash())
                .sourceContentHash(template.getContent().getContentHash())
                .completedAt(completedAt)
                .signers(signers.stream()
                        .map(s -> {
                            DigitalSignature sig = signatureBySigner.get(s.getId());
                            return CompletionManifest.SignerEntry.builder()
                                    .order(s.getOrder())
                                    .email(s.getEmail())
                                    .name(s.getName())
                                    .algorithm(sig.getAlgorithm())
                                    .signatureHash(Sha256.hex(sig.getSignature()))
                                    .signedAt(sig.getSignedAt())
                                    .build();
                        })
                        .collect(Collectors.toList()))
                .fields(submissions.stream()
                        .filter(FormSubmission::hasValue)
                        .filter(s -> knownFields.contains(s.getFieldId()))
                        .sorted(Comparator.comparing(FormSubmission::getFieldName))
                        .map(s -> CompletionManifest.FieldEntry.builder()
                                .signerOrder(orderBySigner.get(s.getDocumentSignerId()))
                                .fieldName(s.getFieldName())
                                .fieldType(s.getFieldType().getValue())
                                .submittedAt(s.getSubmittedAt())
                                .build())
                        .collect(Collectors.toList()))
                .build();
    }
}
