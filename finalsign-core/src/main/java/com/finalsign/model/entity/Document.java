package com.finalsign.model.entity;

import com.finalsign.model.ContentReference;
import com.finalsign.model.DocumentStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "documents")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "template_id", nullable = false, updatable = false)
    private UUID templateId;

    @Column(name = "name", nullable = false)
    private String name;

    /** Final signed document; null until completed. */
    @Embedded
    @AttributeOverrides({
            @AttributeOverride(name = "contentHash", column = @Column(name = "final_document_hash", length = 64)),
            @AttributeOverride(name = "size", column = @Column(name = "final_file_size")),
            @AttributeOverride(name = "mimeType", column = @Column(name = "final_mime_type", length = 100))
    })
    private ContentReference finalContent;

    /** Fingerprint of the template's signers and fields at instantiation. Never changes. */
    @Column(name = "template_snapshot_hash", length = 64, nullable = false, updatable = false)
    private String templateSnapshotHash;

    @Column(name = "template_version", updatable = false)
    private Integer templateVersion;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    @Column(name = "workspace_id", nullable = false)
    private UUID workspaceId;

    @Column(name = "status", length = 50, nullable = false)
    private DocumentStatus status;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    @Column(name = "sent_at")
    private OffsetDateTime sentAt;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @PrePersist
    protected void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null)
            createdAt = now;
        if (updatedAt == null)
            updatedAt = now;
        if (status == null)
            status = DocumentStatus.DRAFT;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }

    public String getFinalDocumentHash() {
        return finalContent != null ? finalContent.getContentHash() : null;
    }

    public boolean isOverdue(OffsetDateTime now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
