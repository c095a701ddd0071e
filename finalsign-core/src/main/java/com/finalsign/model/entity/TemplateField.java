package com.finalsign.model.entity;

import com.finalsign.model.FieldPosition;
import com.finalsign.model.FieldType;
import com.finalsign.model.FieldValidationRules;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "template_fields", uniqueConstraints = @UniqueConstraint(name = "template_fields_unique_name_per_template", columnNames = {
        "template_id", "field_name" }))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TemplateField {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "template_id", nullable = false)
    private UUID templateId;

    /** Always a signer of the same template. */
    @Column(name = "signer_id", nullable = false)
    private UUID signerId;

    @Column(name = "field_name", nullable = false)
    private String name;

    @Column(name = "field_type", length = 50, nullable = false)
    private FieldType type;

    @Column(name = "field_label")
    private String label;

    @Column(name = "placeholder_text")
    private String placeholder;

    @Embedded
    private FieldPosition position;

    @Column(name = "validation_rules", columnDefinition = "JSONB")
    private FieldValidationRules validationRules;

    @Column(name = "required")
    private Boolean required;

    @Column(name = "version")
    private Integer version;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null)
            createdAt = OffsetDateTime.now();
        if (required == null)
            required = true;
        if (version == null)
            version = 1;
        if (validationRules == null)
            validationRules = FieldValidationRules.none();
    }

    public boolean isRequired() {
        return Boolean.TRUE.equals(required);
    }
}
