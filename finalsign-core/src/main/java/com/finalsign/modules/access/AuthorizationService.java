package com.finalsign.modules.access;

import com.finalsign.exception.NotFoundException;
import com.finalsign.exception.PermissionDeniedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Single authorization entry point.
 * <ul>
 * <li>Resources outside the principal's workspace are reported as not found</li>
 * <li>Reads need {@link Capability#VIEW}, creates need {@link Capability#CREATE}</li>
 * <li>Modifications need {@link Capability#MANAGE_ANY}, or {@link Capability#MANAGE_OWN}
 * on a resource the principal created</li>
 * </ul>
 */
@Slf4j
@Service
public class AuthorizationService {

    public void authorize(AuthenticatedPrincipal principal, Action action, ProtectedResource resource) {
        if (!isAllowed(principal, action, resource)) {
            if (!principal.workspaceId().equals(resource.workspaceId())) {
                throw new NotFoundException("Resource", "outside workspace");
            }
            log.warn("Permission denied: user={} role={} action={}", principal.userId(),
                    principal.role().getValue(), action);
            throw new PermissionDeniedException("Insufficient permissions for " + action.name().toLowerCase());
        }
    }

    public boolean isAllowed(AuthenticatedPrincipal principal, Action action, ProtectedResource resource) {
        if (!principal.workspaceId().equals(resource.workspaceId())) {
            return false;
        }
        WorkspaceRole role = principal.role();
        if (action.isRead()) {
            return role.can(Capability.VIEW);
        }
        if (action.isCreate()) {
            return role.can(Capability.CREATE);
        }
        if (role.can(Capability.MANAGE_ANY)) {
            return true;
        }
        return role.can(Capability.MANAGE_OWN) && principal.userId().equals(resource.createdBy());
    }
}
