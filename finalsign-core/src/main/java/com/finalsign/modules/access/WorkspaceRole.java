package com.finalsign.modules.access;

import com.finalsign.model.PersistedEnum;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Workspace roles and the capabilities each grants. This table is the whole permission
 * matrix.
 */
@Getter
public enum WorkspaceRole implements PersistedEnum {
    OWNER("owner", EnumSet.allOf(Capability.class)),
    ADMIN("admin", EnumSet.allOf(Capability.class)),
    MEMBER("member", EnumSet.of(
            Capability.VIEW,
            Capability.CREATE,
            Capability.MANAGE_OWN)),
    VIEWER("viewer", EnumSet.of(Capability.VIEW));

    private final String value;
    private final Set<Capability> capabilities;

    WorkspaceRole(String value, Set<Capability> capabilities) {
        this.value = value;
        this.capabilities = Collections.unmodifiableSet(capabilities);
    }

    public boolean can(Capability capability) {
        return capabilities.contains(capability);
    }

    public static WorkspaceRole fromValue(String value) {
        for (WorkspaceRole role : values()) {
            if (role.value.equals(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown workspace role: " + value);
    }
}
