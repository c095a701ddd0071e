package com.finalsign.modules.submission;

import com.finalsign.exception.ConflictException;
import com.finalsign.exception.NotFoundException;
import com.finalsign.exception.ValidationException;
import com.finalsign.model.AuditAction;
import com.finalsign.model.RequestMetadata;
import com.finalsign.model.SignerStatus;
import com.finalsign.model.entity.Document;
import com.finalsign.model.entity.DocumentSigner;
import com.finalsign.model.entity.FormSubmission;
import com.finalsign.model.entity.TemplateField;
import com.finalsign.modules.access.Action;
import com.finalsign.modules.access.AuthenticatedPrincipal;
import com.finalsign.modules.access.AuthorizationService;
import com.finalsign.modules.access.ProtectedResource;
import com.finalsign.modules.document.DocumentService;
import com.finalsign.modules.document.DocumentStateMachine;
import com.finalsign.modules.document.TemplateBinding;
import com.finalsign.modules.submission.dto.SubmissionView;
import com.finalsign.repository.DocumentRepository;
import com.finalsign.repository.DocumentSignerRepository;
import com.finalsign.repository.FormSubmissionRepository;
import com.finalsign.repository.TemplateFieldRepository;
import com.finalsign.service.AuditService;
import com.finalsign.service.TransactionRunner;
import com.finalsign.service.crypto.AesGcmCipher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Per-recipient field values. Values are encrypted before they reach the database and
 * a resubmission overwrites the previous value.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubmissionService {

    private final DocumentRepository documentRepository;
    private final DocumentSignerRepository signerRepository;
    private final TemplateFieldRepository fieldRepository;
    private final FormSubmissionRepository submissionRepository;
    private final FieldValueValidator valueValidator;
    private final DocumentStateMachine stateMachine;
    private final DocumentService documentService;
    private final TemplateBinding templateBinding;
    private final AesGcmCipher documentCipher;
    private final AuthorizationService authorizationService;
    private final AuditService auditService;
    private final TransactionRunner transactionRunner;

    public FormSubmission submitField(UUID documentSignerId, UUID fieldId, String value, RequestMetadata request) {
        DocumentSigner resolved = signerRepository.findById(documentSignerId)
                .orElseThrow(() -> new NotFoundException("DocumentSigner", documentSignerId));
        return submit(resolved, fieldId, value, request);
    }

    public FormSubmission submitFieldByToken(String accessToken, UUID fieldId, String value, RequestMetadata request) {
        DocumentSigner resolved = signerRepository.findByAccessToken(accessToken)
                .orElseThrow(() -> new NotFoundException("DocumentSigner", "access token"));
        return submit(resolved, fieldId, value, request);
    }

    /**
     * Decrypted submissions of a document, for principals who may view it.
     */
    public List<SubmissionView> readSubmissions(AuthenticatedPrincipal principal, UUID documentId) {
        Document document = transactionRunner.inTransaction("load document",
                () -> documentRepository.findByIdAndWorkspaceId(documentId, principal.workspaceId())
                        .orElseThrow(() -> new NotFoundException("Document", documentId)));
        authorizationService.authorize(principal, Action.VIEW_DOCUMENT,
                new ProtectedResource(document.getWorkspaceId(), document.getCreatedBy()));

        List<FormSubmission> submissions = transactionRunner.inTransaction("read submissions",
                () -> submissionRepository.findByDocumentId(documentId));
        return submissions.stream()
                .sorted(Comparator.comparing(FormSubmission::getFieldName))
                .map(s -> SubmissionView.builder()
                        .documentSignerId(s.getDocumentSignerId())
                        .fieldId(s.getFieldId())
                        .fieldName(s.getFieldName())
                        .fieldType(s.getFieldType())
                        .value(s.hasValue() ? documentCipher.decryptFromBase64(s.getEncryptedValue()) : null)
                        .submittedBy(s.getSubmittedBy())
                        .submittedAt(s.getSubmittedAt())
                        .build())
                .collect(Collectors.toList());
    }

    private FormSubmission submit(DocumentSigner resolved, UUID fieldId, String value, RequestMetadata request) {
        UUID documentId = resolved.getDocumentId();
        documentService.expireDocument(documentId, OffsetDateTime.now());

        return transactionRunner.inTransaction("submit field", () -> {
            Document document = documentRepository.findByIdForUpdate(documentId)
                    .orElseThrow(() -> new NotFoundException("Document", documentId));
            stateMachine.requireAcceptsSubmissions(document);
            templateBinding.requireUnchanged(document);

            DocumentSigner signer = signerRepository.findById(resolved.getId())
                    .orElseThrow(() -> new NotFoundException("DocumentSigner", resolved.getId()));
            if (signer.getStatus() == SignerStatus.COMPLETED) {
                throw new ConflictException("SIGNER_COMPLETED",
                        "Signer " + signer.getId() + " has already signed; fields can no longer change");
            }
            TemplateField field = fieldRepository.findById(fieldId)
                    .orElseThrow(() -> new NotFoundException("TemplateField", fieldId));
            if (!field.getTemplateId().equals(document.getTemplateId())) {
                throw new ValidationException("fieldId", "field does not belong to this document");
            }
            if (!field.getSignerId().equals(signer.getTemplateSignerId())) {
                throw new ValidationException("fieldId", "field '" + field.getName()
                        + "' is not assigned to this signer");
            }

            String normalized = valueValidator.validate(field, value);

            FormSubmission submission = submissionRepository
                    .findByDocumentIdAndDocumentSignerIdAndFieldId(documentId, signer.getId(), fieldId)
                    .orElseGet(() -> FormSubmission.builder()
                            .documentId(documentId)
                            .documentSignerId(resolved.getId())
                            .fieldId(fieldId)
                            .build());
            submission.setFieldName(field.getName());
            submission.setFieldType(field.getType());
            submission.setEncryptedValue(normalized != null ? documentCipher.encryptToBase64(normalized) : null);
            submission.setEncryptionKeyId(documentCipher.getKeyId());
            submission.setSubmittedBy(signer.getEmail());
            submission.setSubmittedAt(OffsetDateTime.now());
            submission.setIpAddress(request != null ? request.ipAddress() : null);
            submission.setUserAgent(request != null ? request.userAgent() : null);
            FormSubmission saved = submissionRepository.save(submission);

            if (signer.getStatus() != SignerStatus.IN_PROGRESS) {
                signer.setStatus(SignerStatus.IN_PROGRESS);
                signerRepository.save(signer);
            }
            stateMachine.markStarted(document);
            documentRepository.save(document);

            auditService.record(AuditAction.FIELD_FILLED, documentId, document.getTemplateId(), null, request,
                    Map.of("fieldName", field.getName(),
                            "fieldType", field.getType().getValue(),
                            "signerOrder", signer.getOrder(),
                            "hasValue", normalized != null));
            log.debug("Field {} submitted for document {} by signer {}", field.getName(), documentId, signer.getId());
            return saved;
        });
    }
}
