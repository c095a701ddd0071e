package com.finalsign.modules.signature;

import com.finalsign.exception.ConflictException;
import com.finalsign.exception.NotFoundException;
import com.finalsign.exception.ValidationException;
import com.finalsign.model.AuditAction;
import com.finalsign.model.RequestMetadata;
import com.finalsign.model.SignerStatus;
import com.finalsign.model.entity.DigitalSignature;
import com.finalsign.model.entity.Document;
import com.finalsign.model.entity.DocumentSigner;
import com.finalsign.model.entity.FormSubmission;
import com.finalsign.model.entity.TemplateField;
import com.finalsign.modules.document.DocumentService;
import com.finalsign.modules.document.DocumentStateMachine;
import com.finalsign.modules.document.TemplateBinding;
import com.finalsign.modules.signature.dto.SignatureCommand;
import com.finalsign.repository.DigitalSignatureRepository;
import com.finalsign.repository.DocumentRepository;
import com.finalsign.repository.DocumentSignerRepository;
import com.finalsign.repository.FormSubmissionRepository;
import com.finalsign.repository.TemplateFieldRepository;
import com.finalsign.service.AuditService;
import com.finalsign.service.TransactionRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Records a recipient's signature.
 * <ul>
 * <li>All required fields of the signer's role must already hold a value</li>
 * <li>A signer signs once; a second attempt is rejected</li>
 * <li>The last signature completes the document in the same transaction</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SigningService {

    static final int MAX_ALGORITHM_LENGTH = 100;

    private final DocumentRepository documentRepository;
    private final DocumentSignerRepository signerRepository;
    private final TemplateFieldRepository fieldRepository;
    private final FormSubmissionRepository submissionRepository;
    private final DigitalSignatureRepository signatureRepository;
    private final DocumentStateMachine stateMachine;
    private final DocumentService documentService;
    private final TemplateBinding templateBinding;
    private final DocumentCompletionService completionService;
    private final AuditService auditService;
    private final TransactionRunner transactionRunner;

    public DigitalSignature signDocument(UUID documentSignerId, SignatureCommand command, RequestMetadata request) {
        validate(command);
        DocumentSigner resolved = signerRepository.findById(documentSignerId)
                .orElseThrow(() -> new NotFoundException("DocumentSigner", documentSignerId));
        UUID documentId = resolved.getDocumentId();
        documentService.expireDocument(documentId, OffsetDateTime.now());

        return transactionRunner.inTransaction("sign document", () -> {
            Document document = documentRepository.findByIdForUpdate(documentId)
                    .orElseThrow(() -> new NotFoundException("Document", documentId));
            stateMachine.requireAcceptsSubmissions(document);
            templateBinding.requireUnchanged(document);

            DocumentSigner signer = signerRepository.findById(documentSignerId)
                    .orElseThrow(() -> new NotFoundException("DocumentSigner", documentSignerId));
            if (signer.getStatus() == SignerStatus.COMPLETED
                    || signatureRepository.existsByDocumentIdAndDocumentSignerId(documentId, documentSignerId)) {
                throw new ConflictException("ALREADY_SIGNED",
                        "Signer " + documentSignerId + " has already signed document " + documentId);
            }

            List<String> missing = missingRequiredFields(document, signer);
            if (!missing.isEmpty()) {
                throw new ConflictException("REQUIRED_FIELDS_MISSING",
                        "Required fields not submitted: " + String.join(", ", missing));
            }

            OffsetDateTime now = OffsetDateTime.now();
            DigitalSignature signature = signatureRepository.save(DigitalSignature.builder()
                    .documentId(documentId)
                    .documentSignerId(documentSignerId)
                    .email(signer.getEmail())
                    .name(signer.getName())
                    .signature(command.getSignature())
                    .certificate(command.getCertificate())
                    .algorithm(command.getAlgorithm() != null && !command.getAlgorithm().isBlank()
                            ? command.getAlgorithm() : DigitalSignature.DEFAULT_ALGORITHM)
                    .signedAt(now)
                    .ipAddress(request != null ? request.ipAddress() : null)
                    .userAgent(request != null ? request.userAgent() : null)
                    .build());

            signer.setStatus(SignerStatus.COMPLETED);
            signer.setCompletedAt(now);
            signerRepository.save(signer);
            stateMachine.markStarted(document);
            documentRepository.save(document);

            auditService.record(AuditAction.DOCUMENT_SIGNED, documentId, document.getTemplateId(), null, request,
                    Map.of("signerOrder", signer.getOrder(), "algorithm", signature.getAlgorithm()));
            log.info("Document {} signed by signer {} (order {})", documentId, signer.getId(), signer.getOrder());

            if (completionService.tryComplete(documentId)) {
                // completion stamps the final hash with a bulk update; read the row back
                return signatureRepository.findById(signature.getId()).orElse(signature);
            }
            return signature;
        });
    }

    private List<String> missingRequiredFields(Document document, DocumentSigner signer) {
        Set<UUID> filled = submissionRepository.findByDocumentIdAndDocumentSignerId(document.getId(), signer.getId())
                .stream()
                .filter(FormSubmission::hasValue)
                .map(FormSubmission::getFieldId)
                .collect(Collectors.toSet());
        return fieldRepository.findByTemplateIdAndSignerId(document.getTemplateId(), signer.getTemplateSignerId())
                .stream()
                .filter(TemplateField::isRequired)
                .filter(f -> !filled.contains(f.getId()))
                .map(TemplateField::getName)
                .sorted()
                .collect(Collectors.toList());
    }

    private static void validate(SignatureCommand command) {
        if (command == null || command.getSignature() == null || command.getSignature().isBlank()) {
            throw new ValidationException("signature", "signature is required");
        }
        try {
            Base64.getDecoder().decode(command.getSignature().trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("signature", "signature must be Base64-encoded");
        }
        if (command.getAlgorithm() != null && command.getAlgorithm().length() > MAX_ALGORITHM_LENGTH) {
            throw new ValidationException("algorithm", "algorithm name too long");
        }
    }
}
