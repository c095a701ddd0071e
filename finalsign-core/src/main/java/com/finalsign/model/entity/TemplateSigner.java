package com.finalsign.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "template_signers", uniqueConstraints = @UniqueConstraint(name = "template_signers_unique_order", columnNames = {
        "template_id", "signer_order" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TemplateSigner {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "template_id", nullable = false)
    private UUID templateId;

    /** Position in the canonical signing sequence, unique within the template. */
    @Column(name = "signer_order", nullable = false)
    private Integer order;

    @Column(name = "signer_name", nullable = false)
    private String name;

    @Column(name = "signer_color", length = 7)
    private String color;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
    }
}
