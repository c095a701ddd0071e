package com.finalsign.modules.access;

public enum Capability {
    /** Read templates, documents and their submissions in the workspace. */
    VIEW,
    /** Create templates and documents. */
    CREATE,
    /** Modify resources the principal created. */
    MANAGE_OWN,
    /** Modify any resource in the workspace. */
    MANAGE_ANY
}
