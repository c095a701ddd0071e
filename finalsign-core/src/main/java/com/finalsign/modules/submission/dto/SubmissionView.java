package com.finalsign.modules.submission.dto;

import com.finalsign.model.FieldType;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Decrypted submission as shown to the document owner.
 */
@Getter
@Builder
public class SubmissionView {
    private UUID documentSignerId;
    private UUID fieldId;
    private String fieldName;
    private FieldType fieldType;
    private String value;
    private String submittedBy;
    private OffsetDateTime submittedAt;
}
