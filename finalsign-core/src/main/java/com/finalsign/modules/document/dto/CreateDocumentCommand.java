package com.finalsign.modules.document.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateDocumentCommand {
    private UUID templateId;
    private String name;
    @Builder.Default
    private List<RecipientSpec> recipients = new ArrayList<>();
    /** Defaults to now plus the configured expiry window. */
    private OffsetDateTime expiresAt;
    /** Park the document in {@code scheduled} instead of {@code draft}. */
    private boolean scheduled;
}
