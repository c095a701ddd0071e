package com.finalsign.modules.access;

import java.util.UUID;

/**
 * Ownership facts of the resource an action targets.
 */
public record ProtectedResource(UUID workspaceId, UUID createdBy) {

    /** The principal's own workspace, for create actions. */
    public static ProtectedResource workspace(UUID workspaceId) {
        return new ProtectedResource(workspaceId, null);
    }
}
