package com.finalsign.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finalsign.config.FinalSignProperties;
import com.finalsign.model.AuditAction;
import com.finalsign.model.RequestMetadata;
import com.finalsign.model.entity.DocumentAuditLog;
import com.finalsign.repository.DocumentAuditLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Service for recording the document audit trail.
 * <p>
 * Entries are written in their own transaction after the surrounding business
 * transaction commits, so an entry exists only for actions that happened and an audit
 * outage never blocks signing. Write failures are logged, not thrown; repeated failures
 * escalate to ERROR.
 * </p>
 */
@Slf4j
@Service
public class AuditService {

    private final DocumentAuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate auditTransaction;
    private final int failureAlertThreshold;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    public AuditService(DocumentAuditLogRepository auditLogRepository, ObjectMapper objectMapper,
            PlatformTransactionManager transactionManager, FinalSignProperties properties) {
        this.auditLogRepository = auditLogRepository;
        this.objectMapper = objectMapper;
        this.auditTransaction = new TransactionTemplate(transactionManager);
        this.auditTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.failureAlertThreshold = properties.getAudit().getFailureAlertThreshold();
    }

    /**
     * Record an audit log entry.
     *
     * @param action     the lifecycle event
     * @param documentId affected document (nullable for template events)
     * @param templateId affected template (nullable)
     * @param userId     acting user (nullable for recipients and system actions)
     * @param request    client ip and user agent
     * @param details    arbitrary key-value details (serialized as JSONB)
     */
    public void record(AuditAction action, UUID documentId, UUID templateId, UUID userId,
            RequestMetadata request, Map<String, Object> details) {
        DocumentAuditLog entry = DocumentAuditLog.builder()
                .action(action)
                .documentId(documentId)
                .templateId(templateId)
                .userId(userId)
                .ipAddress(request != null ? request.ipAddress() : null)
                .userAgent(request != null ? request.userAgent() : null)
                .details(serialize(action, details))
                .build();

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    write(entry);
                }
            });
        } else {
            write(entry);
        }
    }

    int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    private void write(DocumentAuditLog entry) {
        try {
            auditTransaction.executeWithoutResult(status -> auditLogRepository.save(entry));
            consecutiveFailures.set(0);
            log.debug("Audit logged: action={}, document={}, template={}, user={}",
                    entry.getAction().getValue(), entry.getDocumentId(), entry.getTemplateId(), entry.getUserId());
        } catch (RuntimeException e) {
            int failures = consecutiveFailures.incrementAndGet();
            if (failures >= failureAlertThreshold) {
                log.error("AUDIT WRITE FAILING: {} consecutive failures, last action={}, document={}, template={}: {}",
                        failures, entry.getAction().getValue(), entry.getDocumentId(), entry.getTemplateId(),
                        e.getMessage(), e);
            } else {
                log.warn("Failed to write audit entry action={}, document={}: {}",
                        entry.getAction().getValue(), entry.getDocumentId(), e.getMessage());
            }
        }
    }

    private String serialize(AuditAction action, Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            // Still save without details rather than losing the audit entry
            log.error("Failed to serialize audit details for action={}: {}", action.getValue(), e.getMessage());
            return null;
        }
    }
}
