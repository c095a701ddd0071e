package com.finalsign.modules.template.dto;

import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * List view of a template.
 */
@Getter
@Builder
public class TemplateSummary {
    private UUID id;
    private String name;
    private String description;
    private Long fileSize;
    private Integer totalPages;
    private UUID createdBy;
    private long signerCount;
    private long fieldCount;
    private Integer version;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
