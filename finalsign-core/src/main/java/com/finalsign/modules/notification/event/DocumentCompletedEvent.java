package com.finalsign.modules.notification.event;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record DocumentCompletedEvent(UUID documentId, String documentName, UUID workspaceId, UUID createdBy,
        String finalDocumentHash, OffsetDateTime completedAt, List<String> recipientEmails) {
}
