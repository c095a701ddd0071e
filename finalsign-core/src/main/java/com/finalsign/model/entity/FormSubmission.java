package com.finalsign.model.entity;

import com.finalsign.model.FieldType;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "form_submissions", uniqueConstraints = @UniqueConstraint(name = "form_submissions_unique_field_per_signer", columnNames = {
        "document_id", "document_signer_id", "field_id" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FormSubmission {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "document_id", nullable = false)
    private UUID documentId;

    @Column(name = "document_signer_id", nullable = false)
    private UUID documentSignerId;

    @Column(name = "field_id", nullable = false)
    private UUID fieldId;

    @Column(name = "field_name", nullable = false)
    private String fieldName;

    @Column(name = "field_type", length = 50, nullable = false)
    private FieldType fieldType;

    /** Base64(IV || ciphertext || tag); null for an empty optional field. */
    @Column(name = "encrypted_value", columnDefinition = "TEXT")
    private String encryptedValue;

    @Column(name = "encryption_key_id")
    private String encryptionKeyId;

    @Column(name = "submitted_by")
    private String submittedBy;

    @Column(name = "submitted_at")
    private OffsetDateTime submittedAt;

    @Column(name = "ip_address", columnDefinition = "INET")
    private String ipAddress;

    @Column(name = "user_agent", columnDefinition = "TEXT")
    private String userAgent;

    @PrePersist
    protected void onCreate() {
        if (submittedAt == null)
            submittedAt = OffsetDateTime.now();
    }

    public boolean hasValue() {
        return encryptedValue != null;
    }
}
