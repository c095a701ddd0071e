package com.finalsign.service.storage;

import java.util.UUID;

/**
 * Object path layout. Final documents always get a fresh path so nothing is overwritten.
 */
public final class ContentPaths {

    private ContentPaths() {
        // utility class
    }

    public static String templatePath(UUID userId, UUID workspaceId) {
        return String.format("templates/%s/%s/%s.pdf", userId, workspaceId, UUID.randomUUID());
    }

    public static String finalDocumentPath(UUID userId, UUID workspaceId, UUID documentId) {
        return String.format("documents/%s/%s/%s-%s-signed.pdf", userId, workspaceId, documentId,
                UUID.randomUUID());
    }
}
