package com.finalsign.modules.signature;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finalsign.model.AuditAction;
import com.finalsign.model.ContentReference;
import com.finalsign.model.DocumentStatus;
import com.finalsign.model.FieldType;
import com.finalsign.model.SignerStatus;
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
import com.finalsign.service.storage.EncryptedContentStore;
import com.finalsign.service.storage.RetrievedContent;
import com.finalsign.service.storage.StoredContent;
import com.finalsign.support.TestTransactions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.finalsign.support.Fixtures.PDF;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DocumentCompletionServiceTest {

    private static final String SOURCE_HASH = "5".repeat(64);
    private static final String FINAL_HASH = "f".repeat(64);

    @Mock
    private DocumentRepository documentRepository;

    @Mock
    private DocumentSignerRepository signerRepository;

    @Mock
    private TemplateRepository templateRepository;

    @Mock
    private TemplateFieldRepository fieldRepository;

    @Mock
    private FormSubmissionRepository submissionRepository;

    @Mock
    private DigitalSignatureRepository signatureRepository;

    @Mock
    private EncryptedContentStore contentStore;

    @Mock
    private AuditService auditService;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Spy
    private DocumentComposer composer = new ManifestDocumentComposer(new ObjectMapper().findAndRegisterModules());

    @Spy
    private TransactionRunner transactionRunner = TestTransactions.directRunner();

    @InjectMocks
    private DocumentCompletionService completionService;

    private final UUID buyerRole = UUID.randomUUID();
    private final UUID sellerRole = UUID.randomUUID();
    private Template template;
    private Document document;
    private DocumentSigner buyer;
    private DocumentSigner seller;
    private TemplateField buyerDate;
    private TemplateField sellerSig;
    private TemplateField buyerNotes;
    private List<FormSubmission> submissions;
    private List<DigitalSignature> signatures;

    @BeforeEach
    void setUp() {
        template = Template.builder()
                .id(UUID.randomUUID())
                .version(1)
                .content(ContentReference.builder().key("templates/source.pdf").contentHash(SOURCE_HASH).build())
                .build();
        document = Document.builder()
                .id(UUID.randomUUID())
                .templateId(template.getId())
                .name("Sale of 12 Elm St")
                .createdBy(UUID.randomUUID())
                .workspaceId(UUID.randomUUID())
                .templateVersion(1)
                .status(DocumentStatus.IN_PROGRESS)
                .build();
        buyer = signer(1, buyerRole, "buyer@example.com");
        seller = signer(2, sellerRole, "seller@example.com");
        buyerDate = field("closing_date", buyerRole, true);
        sellerSig = field("seller_sig", sellerRole, true);
        buyerNotes = field("notes", buyerRole, false);
        submissions = new ArrayList<>(List.of(submission(buyer, buyerDate), submission(seller, sellerSig)));
        signatures = new ArrayList<>(List.of(signature(buyer), signature(seller)));
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    private DocumentSigner signer(int order, UUID roleId, String email) {
        return DocumentSigner.builder().id(UUID.randomUUID()).documentId(document.getId()).templateSignerId(roleId)
                .order(order).email(email).status(SignerStatus.COMPLETED).build();
    }

    private TemplateField field(String name, UUID roleId, boolean required) {
        return TemplateField.builder().id(UUID.randomUUID()).templateId(template.getId()).signerId(roleId)
                .name(name).type(FieldType.TEXT).required(required).build();
    }

    private FormSubmission submission(DocumentSigner signer, TemplateField field) {
        return FormSubmission.builder().documentId(document.getId()).documentSignerId(signer.getId())
                .fieldId(field.getId()).fieldName(field.getName()).fieldType(field.getType())
                .encryptedValue("ciphertext").submittedAt(OffsetDateTime.now()).build();
    }

    private DigitalSignature signature(DocumentSigner signer) {
        return DigitalSignature.builder().documentId(document.getId()).documentSignerId(signer.getId())
                .email(signer.getEmail()).signature("c2ln").algorithm(DigitalSignature.DEFAULT_ALGORITHM)
                .signedAt(OffsetDateTime.now()).build();
    }

    private void stubState() {
        when(documentRepository.findByIdForUpdate(document.getId())).thenReturn(Optional.of(document));
        when(signerRepository.findByDocumentIdOrderByOrderAsc(document.getId())).thenReturn(List.of(buyer, seller));
        when(fieldRepository.findByTemplateIdOrderByNameAsc(template.getId()))
                .thenReturn(List.of(buyerDate, buyerNotes, sellerSig));
        when(submissionRepository.findByDocumentId(document.getId())).thenReturn(submissions);
        when(signatureRepository.findByDocumentId(document.getId())).thenReturn(signatures);
    }

    private void stubStorage() {
        when(templateRepository.findById(template.getId())).thenReturn(Optional.of(template));
        when(contentStore.getVerified("templates/source.pdf", SOURCE_HASH))
                .thenReturn(new RetrievedContent(PDF, SOURCE_HASH));
        when(contentStore.put(any(byte[].class), anyString(), eq("application/pdf"))).thenAnswer(inv -> {
            byte[] data = inv.getArgument(0);
            return StoredContent.builder().bucket("docs").path(inv.getArgument(1)).contentHash(FINAL_HASH)
                    .size(data.length).mimeType("application/pdf").build();
        });
    }

    @Test
    @DisplayName("the last signature composes, stores and records the final document once")
    void completes() {
        stubState();
        stubStorage();
        when(documentRepository.markCompleted(eq(document.getId()), eq("docs"), anyString(), eq(FINAL_HASH),
                anyLong(), eq("application/pdf"), any(OffsetDateTime.class))).thenReturn(1);

        assertTrue(completionService.tryComplete(document.getId()));

        ArgumentCaptor<String> path = ArgumentCaptor.forClass(String.class);
        verify(contentStore, times(1)).put(any(byte[].class), path.capture(), eq("application/pdf"));
        assertTrue(path.getValue().startsWith("documents/"));
        verify(signatureRepository).stampFinalHash(document.getId(), FINAL_HASH);
        verify(auditService).record(eq(AuditAction.DOCUMENT_COMPLETED), eq(document.getId()), eq(template.getId()),
                isNull(), any(), anyMap());

        ArgumentCaptor<DocumentCompletedEvent> event = ArgumentCaptor.forClass(DocumentCompletedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertEquals(FINAL_HASH, event.getValue().finalDocumentHash());
        assertEquals(List.of("buyer@example.com", "seller@example.com"), event.getValue().recipientEmails());
        verify(contentStore, never()).delete(anyString());
    }

    @Test
    @DisplayName("losing the compare-and-set discards the freshly stored object")
    void lostRace() {
        stubState();
        stubStorage();
        when(documentRepository.markCompleted(any(), anyString(), anyString(), anyString(), anyLong(), anyString(),
                any())).thenReturn(0);
        when(contentStore.delete(anyString())).thenReturn(true);

        assertFalse(completionService.tryComplete(document.getId()));

        ArgumentCaptor<String> stored = ArgumentCaptor.forClass(String.class);
        verify(contentStore).put(any(byte[].class), stored.capture(), anyString());
        verify(contentStore).delete(stored.getValue());
        verify(signatureRepository, never()).stampFinalHash(any(), any());
        verifyNoInteractions(auditService, eventPublisher);
    }

    @Test
    void missingSignatureBlocksCompletion() {
        signatures.remove(1);
        stubState();

        assertFalse(completionService.tryComplete(document.getId()));

        verifyNoInteractions(contentStore, eventPublisher);
        verify(documentRepository, never()).markCompleted(any(), any(), any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("a required field with a null value does not count as submitted")
    void nullSubmissionBlocksCompletion() {
        submissions.get(1).setEncryptedValue(null);
        stubState();

        assertFalse(completionService.tryComplete(document.getId()));

        verifyNoInteractions(contentStore);
    }

    @Test
    void optionalFieldsAreNotNeeded() {
        assertTrue(completionService.isComplete(List.of(buyer, seller), List.of(buyerDate, buyerNotes, sellerSig),
                submissions, signatures));
    }

    @Test
    void duplicateSignaturesAreNotComplete() {
        signatures.add(signature(buyer));

        assertFalse(completionService.isComplete(List.of(buyer, seller), List.of(buyerDate, sellerSig),
                submissions, signatures));
    }

    @Test
    @DisplayName("only in_progress documents complete")
    void onlyInProgress() {
        document.setStatus(DocumentStatus.COMPLETED);
        when(documentRepository.findByIdForUpdate(document.getId())).thenReturn(Optional.of(document));

        assertFalse(completionService.tryComplete(document.getId()));

        verifyNoInteractions(signerRepository, contentStore);
    }

    @Test
    @DisplayName("a rolled back transaction deletes the stored final document")
    void rollbackDeletesObject() {
        TransactionSynchronizationManager.initSynchronization();
        stubState();
        stubStorage();
        when(documentRepository.markCompleted(any(), anyString(), anyString(), anyString(), anyLong(), anyString(),
                any())).thenReturn(1);
        when(contentStore.delete(anyString())).thenReturn(true);

        assertTrue(completionService.tryComplete(document.getId()));
        List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
        synchronizations.forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));

        verify(contentStore).delete(startsWith("documents/"));
    }
}
