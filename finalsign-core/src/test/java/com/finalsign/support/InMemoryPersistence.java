package com.finalsign.support;

import com.finalsign.model.ContentReference;
import com.finalsign.model.DocumentStatus;
import com.finalsign.model.entity.DigitalSignature;
import com.finalsign.model.entity.Document;
import com.finalsign.model.entity.DocumentAuditLog;
import com.finalsign.model.entity.DocumentSigner;
import com.finalsign.model.entity.FormSubmission;
import com.finalsign.model.entity.Template;
import com.finalsign.model.entity.TemplateField;
import com.finalsign.model.entity.TemplateSigner;
import com.finalsign.repository.DigitalSignatureRepository;
import com.finalsign.repository.DocumentAuditLogRepository;
import com.finalsign.repository.DocumentRepository;
import com.finalsign.repository.DocumentSignerRepository;
import com.finalsign.repository.FormSubmissionRepository;
import com.finalsign.repository.TemplateFieldRepository;
import com.finalsign.repository.TemplateRepository;
import com.finalsign.repository.TemplateSignerRepository;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Repository mocks backed by maps, for workflow tests that run the real services
 * without a database. Saved entities are stored by reference.
 */
@Getter
public class InMemoryPersistence {

    private final Map<UUID, Template> templates = new ConcurrentHashMap<>();
    private final Map<UUID, TemplateSigner> templateSigners = new ConcurrentHashMap<>();
    private final Map<UUID, TemplateField> templateFields = new ConcurrentHashMap<>();
    private final Map<UUID, Document> documents = new ConcurrentHashMap<>();
    private final Map<UUID, DocumentSigner> documentSigners = new ConcurrentHashMap<>();
    private final Map<UUID, FormSubmission> submissions = new ConcurrentHashMap<>();
    private final Map<UUID, DigitalSignature> signatures = new ConcurrentHashMap<>();
    private final List<DocumentAuditLog> auditLog = new ArrayList<>();

    private final TemplateRepository templateRepository = mock(TemplateRepository.class);
    private final TemplateSignerRepository templateSignerRepository = mock(TemplateSignerRepository.class);
    private final TemplateFieldRepository templateFieldRepository = mock(TemplateFieldRepository.class);
    private final DocumentRepository documentRepository = mock(DocumentRepository.class);
    private final DocumentSignerRepository documentSignerRepository = mock(DocumentSignerRepository.class);
    private final FormSubmissionRepository submissionRepository = mock(FormSubmissionRepository.class);
    private final DigitalSignatureRepository signatureRepository = mock(DigitalSignatureRepository.class);
    private final DocumentAuditLogRepository auditLogRepository = mock(DocumentAuditLogRepository.class);

    public InMemoryPersistence() {
        wireTemplates();
        wireDocuments();
        wireSubmissions();
        wireAudit();
    }

    private void wireTemplates() {
        when(templateRepository.save(any(Template.class))).thenAnswer(inv -> {
            Template t = inv.getArgument(0);
            if (t.getId() == null) {
                t.setId(UUID.randomUUID());
                t.setCreatedAt(OffsetDateTime.now());
            }
            templates.put(t.getId(), t);
            return t;
        });
        when(templateRepository.findById(any(UUID.class)))
                .thenAnswer(inv -> Optional.ofNullable(templates.get(inv.<UUID>getArgument(0))));
        when(templateRepository.findByIdAndWorkspaceIdAndActiveTrue(any(UUID.class), any(UUID.class)))
                .thenAnswer(inv -> Optional.ofNullable(templates.get(inv.<UUID>getArgument(0)))
                        .filter(t -> t.getWorkspaceId().equals(inv.getArgument(1)) && t.isActive()));

        when(templateSignerRepository.saveAll(any())).thenAnswer(inv -> saveAll(inv.getArgument(0),
                templateSigners, TemplateSigner::getId, (TemplateSigner s) -> s.setId(UUID.randomUUID())));
        when(templateSignerRepository.findByTemplateIdOrderByOrderAsc(any(UUID.class))).thenAnswer(inv ->
                select(templateSigners, s -> s.getTemplateId().equals(inv.getArgument(0)),
                        Comparator.comparing(TemplateSigner::getOrder)));
        when(templateSignerRepository.deleteAllByTemplateId(any(UUID.class))).thenAnswer(inv ->
                deleteWhere(templateSigners, s -> s.getTemplateId().equals(inv.getArgument(0))));

        when(templateFieldRepository.saveAll(any())).thenAnswer(inv -> saveAll(inv.getArgument(0),
                templateFields, TemplateField::getId, (TemplateField f) -> f.setId(UUID.randomUUID())));
        when(templateFieldRepository.findById(any(UUID.class)))
                .thenAnswer(inv -> Optional.ofNullable(templateFields.get(inv.<UUID>getArgument(0))));
        when(templateFieldRepository.findByTemplateIdOrderByNameAsc(any(UUID.class))).thenAnswer(inv ->
                select(templateFields, f -> f.getTemplateId().equals(inv.getArgument(0)),
                        Comparator.comparing(TemplateField::getName)));
        when(templateFieldRepository.findByTemplateIdAndSignerId(any(UUID.class), any(UUID.class))).thenAnswer(inv ->
                select(templateFields, f -> f.getTemplateId().equals(inv.getArgument(0))
                        && f.getSignerId().equals(inv.getArgument(1)), Comparator.comparing(TemplateField::getName)));
        when(templateFieldRepository.deleteAllByTemplateId(any(UUID.class))).thenAnswer(inv ->
                deleteWhere(templateFields, f -> f.getTemplateId().equals(inv.getArgument(0))));
    }

    private void wireDocuments() {
        when(documentRepository.save(any(Document.class))).thenAnswer(inv -> {
            Document d = inv.getArgument(0);
            if (d.getId() == null) {
                d.setId(UUID.randomUUID());
                d.setCreatedAt(OffsetDateTime.now());
            }
            documents.put(d.getId(), d);
            return d;
        });
        when(documentRepository.findById(any(UUID.class)))
                .thenAnswer(inv -> Optional.ofNullable(documents.get(inv.<UUID>getArgument(0))));
        when(documentRepository.findByIdForUpdate(any(UUID.class)))
                .thenAnswer(inv -> Optional.ofNullable(documents.get(inv.<UUID>getArgument(0))));
        when(documentRepository.findByIdAndWorkspaceId(any(UUID.class), any(UUID.class)))
                .thenAnswer(inv -> Optional.ofNullable(documents.get(inv.<UUID>getArgument(0)))
                        .filter(d -> d.getWorkspaceId().equals(inv.getArgument(1))));
        when(documentRepository.findOverdueIds(anyCollection(), any(OffsetDateTime.class))).thenAnswer(inv -> {
            Collection<DocumentStatus> statuses = inv.getArgument(0);
            OffsetDateTime now = inv.getArgument(1);
            return documents.values().stream()
                    .filter(d -> statuses.contains(d.getStatus()) && d.isOverdue(now))
                    .map(Document::getId)
                    .collect(Collectors.toList());
        });
        when(documentRepository.markCompleted(any(), any(), any(), any(), any(), any(), any())).thenCallRealMethod();
        when(documentRepository.compareAndComplete(any(), any(), any(), any(), any(), any(), any(), any(), any()))
                .thenAnswer(inv -> {
                    Document d = documents.get(inv.<UUID>getArgument(0));
                    if (d == null || d.getStatus() != inv.getArgument(1)) {
                        return 0;
                    }
                    d.setStatus(inv.getArgument(2));
                    d.setFinalContent(ContentReference.builder()
                            .bucket(inv.getArgument(3))
                            .key(inv.getArgument(4))
                            .contentHash(inv.getArgument(5))
                            .size(inv.getArgument(6))
                            .mimeType(inv.getArgument(7))
                            .build());
                    d.setCompletedAt(inv.getArgument(8));
                    return 1;
                });

        when(documentSignerRepository.saveAll(any())).thenAnswer(inv -> saveAll(inv.getArgument(0),
                documentSigners, DocumentSigner::getId, (DocumentSigner s) -> s.setId(UUID.randomUUID())));
        when(documentSignerRepository.save(any(DocumentSigner.class))).thenAnswer(inv -> {
            DocumentSigner s = inv.getArgument(0);
            documentSigners.put(s.getId(), s);
            return s;
        });
        when(documentSignerRepository.findById(any(UUID.class)))
                .thenAnswer(inv -> Optional.ofNullable(documentSigners.get(inv.<UUID>getArgument(0))));
        when(documentSignerRepository.findByAccessToken(anyString())).thenAnswer(inv -> documentSigners.values()
                .stream().filter(s -> s.getAccessToken().equals(inv.getArgument(0))).findFirst());
        when(documentSignerRepository.existsByAccessToken(anyString())).thenAnswer(inv -> documentSigners.values()
                .stream().anyMatch(s -> s.getAccessToken().equals(inv.getArgument(0))));
        when(documentSignerRepository.findByDocumentIdOrderByOrderAsc(any(UUID.class))).thenAnswer(inv ->
                select(documentSigners, s -> s.getDocumentId().equals(inv.getArgument(0)),
                        Comparator.comparing(DocumentSigner::getOrder)));
    }

    private void wireSubmissions() {
        when(submissionRepository.save(any(FormSubmission.class))).thenAnswer(inv -> {
            FormSubmission s = inv.getArgument(0);
            if (s.getId() == null) {
                s.setId(UUID.randomUUID());
            }
            submissions.put(s.getId(), s);
            return s;
        });
        when(submissionRepository.findByDocumentIdAndDocumentSignerIdAndFieldId(any(UUID.class), any(UUID.class),
                any(UUID.class))).thenAnswer(inv -> submissions.values().stream()
                        .filter(s -> s.getDocumentId().equals(inv.getArgument(0))
                                && s.getDocumentSignerId().equals(inv.getArgument(1))
                                && s.getFieldId().equals(inv.getArgument(2)))
                        .findFirst());
        when(submissionRepository.findByDocumentId(any(UUID.class))).thenAnswer(inv ->
                select(submissions, s -> s.getDocumentId().equals(inv.getArgument(0)),
                        Comparator.comparing(FormSubmission::getFieldName)));
        when(submissionRepository.findByDocumentIdAndDocumentSignerId(any(UUID.class), any(UUID.class)))
                .thenAnswer(inv -> select(submissions, s -> s.getDocumentId().equals(inv.getArgument(0))
                        && s.getDocumentSignerId().equals(inv.getArgument(1)),
                        Comparator.comparing(FormSubmission::getFieldName)));

        when(signatureRepository.save(any(DigitalSignature.class))).thenAnswer(inv -> {
            DigitalSignature s = inv.getArgument(0);
            if (s.getId() == null) {
                s.setId(UUID.randomUUID());
            }
            signatures.put(s.getId(), s);
            return s;
        });
        when(signatureRepository.findById(any(UUID.class)))
                .thenAnswer(inv -> Optional.ofNullable(signatures.get(inv.<UUID>getArgument(0))));
        when(signatureRepository.existsByDocumentIdAndDocumentSignerId(any(UUID.class), any(UUID.class)))
                .thenAnswer(inv -> signatures.values().stream().anyMatch(s ->
                        s.getDocumentId().equals(inv.getArgument(0))
                                && s.getDocumentSignerId().equals(inv.getArgument(1))));
        when(signatureRepository.findByDocumentId(any(UUID.class))).thenAnswer(inv ->
                select(signatures, s -> s.getDocumentId().equals(inv.getArgument(0)),
                        Comparator.comparing(DigitalSignature::getSignedAt)));
        when(signatureRepository.stampFinalHash(any(UUID.class), anyString())).thenAnswer(inv -> {
            List<DigitalSignature> matching = select(signatures,
                    s -> s.getDocumentId().equals(inv.getArgument(0)), Comparator.comparing(DigitalSignature::getSignedAt));
            matching.forEach(s -> s.setFinalDocumentHash(inv.getArgument(1)));
            return matching.size();
        });
    }

    private void wireAudit() {
        when(auditLogRepository.save(any(DocumentAuditLog.class))).thenAnswer(inv -> {
            DocumentAuditLog entry = inv.getArgument(0);
            synchronized (auditLog) {
                auditLog.add(entry);
            }
            return entry;
        });
    }

    private static <T> List<T> saveAll(Iterable<T> entities, Map<UUID, T> table, Function<T, UUID> id,
            Consumer<T> assignId) {
        List<T> saved = new ArrayList<>();
        for (T entity : entities) {
            if (id.apply(entity) == null) {
                assignId.accept(entity);
            }
            table.put(id.apply(entity), entity);
            saved.add(entity);
        }
        return saved;
    }

    private static <T> List<T> select(Map<UUID, T> table, Predicate<T> filter, Comparator<T> order) {
        return table.values().stream().filter(filter).sorted(order).collect(Collectors.toList());
    }

    private static <T> int deleteWhere(Map<UUID, T> table, Predicate<T> filter) {
        List<UUID> doomed = table.entrySet().stream()
                .filter(e -> filter.test(e.getValue()))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        doomed.forEach(table::remove);
        return doomed.size();
    }

    /**
     * Makes {@code findByIdForUpdate} block while another transaction holds the document row.
     */
    public void lockDocumentRows(RowLockTransactionManager transactionManager) {
        doAnswer(inv -> {
            UUID id = inv.getArgument(0);
            transactionManager.lock(id);
            return Optional.ofNullable(documents.get(id));
        }).when(documentRepository).findByIdForUpdate(any(UUID.class));
    }

    public long auditCount(Predicate<DocumentAuditLog> filter) {
        synchronized (auditLog) {
            return auditLog.stream().filter(filter).count();
        }
    }

    public List<DigitalSignature> signaturesOf(UUID documentId) {
        return signatures.values().stream()
                .filter(s -> Objects.equals(s.getDocumentId(), documentId))
                .collect(Collectors.toList());
    }
}
