package com.finalsign.model.entity;

import com.finalsign.model.SignerStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "document_signers", uniqueConstraints = {
        @UniqueConstraint(name = "document_signers_unique_order", columnNames = { "document_id", "signer_order" }),
        @UniqueConstraint(name = "document_signers_unique_email", columnNames = { "document_id", "signer_email" })
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentSigner {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "document_id", nullable = false)
    private UUID documentId;

    @Column(name = "template_signer_id", nullable = false)
    private UUID templateSignerId;

    /** Copied from the template signer at instantiation. */
    @Column(name = "signer_order", nullable = false)
    private Integer order;

    @Column(name = "signer_email", nullable = false)
    private String email;

    @Column(name = "signer_name")
    private String name;

    @Column(name = "access_token", unique = true, nullable = false)
    private String accessToken;

    @Column(name = "status", length = 30, nullable = false)
    private SignerStatus status;

    @Column(name = "viewed_at")
    private OffsetDateTime viewedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
        if (status == null)
            status = SignerStatus.PENDING;
    }
}
