package com.finalsign.model.entity;

import com.finalsign.model.ContentReference;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "templates")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Template {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Embedded
    private ContentReference content;

    @Column(name = "total_pages")
    private Integer totalPages;

    @Column(name = "created_by", nullable = false)
    private UUID createdBy;

    @Column(name = "workspace_id", nullable = false)
    private UUID workspaceId;

    @Column(name = "is_active")
    private Boolean active;

    /** Incremented whenever the signer set or the field set is replaced. */
    @Column(name = "version")
    private Integer version;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null)
            createdAt = now;
        if (updatedAt == null)
            updatedAt = now;
        if (active == null)
            active = true;
        if (version == null)
            version = 1;
        if (totalPages == null)
            totalPages = 1;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }

    public boolean isActive() {
        return Boolean.TRUE.equals(active);
    }

    public void bumpVersion() {
        version = (version == null ? 1 : version) + 1;
    }
}
