package com.finalsign.model.entity;

import com.finalsign.model.AuditAction;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Append-only lifecycle trail. Rows are never updated or deleted.
 */
@Entity
@Immutable
@Table(name = "document_audit_log")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentAuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "document_id", updatable = false)
    private UUID documentId;

    @Column(name = "template_id", updatable = false)
    private UUID templateId;

    @Column(name = "user_id", updatable = false)
    private UUID userId;

    @Column(name = "action", length = 100, nullable = false, updatable = false)
    private AuditAction action;

    /** JSONB column, stored as a raw JSON string. */
    @Column(name = "details", columnDefinition = "JSONB", updatable = false)
    private String details;

    @Column(name = "ip_address", columnDefinition = "INET", updatable = false)
    private String ipAddress;

    @Column(name = "user_agent", columnDefinition = "TEXT", updatable = false)
    private String userAgent;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
    }
}
