package com.finalsign.modules.signature;

import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Evidence embedded into the final document: who signed what, when, and from which
 * template snapshot.
 */
@Getter
@Builder
public class CompletionManifest {

    private UUID documentId;
    private String documentName;
    private UUID templateId;
    private String templateSnapshotHash;
    private String sourceContentHash;
    private OffsetDateTime completedAt;
    private List<SignerEntry> signers;
    private List<FieldEntry> fields;

    @Getter
    @Builder
    public static class SignerEntry {
        private Integer order;
        private String email;
        private String name;
        private String algorithm;
        /** SHA-256 of the stored signature artifact. */
        private String signatureHash;
        private OffsetDateTime signedAt;
    }

    @Getter
    @Builder
    public static class FieldEntry {
        private Integer signerOrder;
        private String fieldName;
        private String fieldType;
        private OffsetDateTime submittedAt;
    }
}
