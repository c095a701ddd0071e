package com.finalsign.modules.notification.event;

import java.util.List;
import java.util.UUID;

public record DocumentSentEvent(UUID documentId, String documentName, UUID workspaceId, UUID sentBy,
        List<RecipientInvitation> recipients) {
}
