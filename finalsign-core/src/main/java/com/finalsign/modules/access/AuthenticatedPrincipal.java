package com.finalsign.modules.access;

import java.util.Objects;
import java.util.UUID;

/**
 * Caller identity supplied by the identity/session collaborator. Trusted as given.
 */
public record AuthenticatedPrincipal(UUID userId, UUID workspaceId, WorkspaceRole role) {

    public AuthenticatedPrincipal {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(workspaceId, "workspaceId");
        Objects.requireNonNull(role, "role");
    }
}
