package com.finalsign.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "digital_signatures", uniqueConstraints = @UniqueConstraint(name = "digital_signatures_unique_signer", columnNames = {
        "document_id", "document_signer_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DigitalSignature {

    public static final String DEFAULT_ALGORITHM = "RSA-SHA256";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "document_id", nullable = false)
    private UUID documentId;

    @Column(name = "document_signer_id", nullable = false)
    private UUID documentSignerId;

    @Column(name = "signer_email", nullable = false)
    private String email;

    @Column(name = "signer_name")
    private String name;

    /** Set when the document completes; null while other signers are outstanding. */
    @Column(name = "final_document_hash", length = 64)
    private String finalDocumentHash;

    /** Base64-encoded signature artifact. */
    @Column(name = "digital_signature", columnDefinition = "TEXT", nullable = false)
    private String signature;

    /** PEM-encoded certificate. */
    @Column(name = "certificate", columnDefinition = "TEXT")
    private String certificate;

    @Column(name = "signature_algorithm", length = 100)
    private String algorithm;

    @Column(name = "signed_at")
    private OffsetDateTime signedAt;

    @Column(name = "ip_address", columnDefinition = "INET")
    private String ipAddress;

    @Column(name = "user_agent", columnDefinition = "TEXT")
    private String userAgent;

    @PrePersist
    protected void onCreate() {
        if (signedAt == null)
            signedAt = OffsetDateTime.now();
        if (algorithm == null)
            algorithm = DEFAULT_ALGORITHM;
    }
}
