package com.finalsign.modules.access;

/**
 * Operations subject to authorization.
 */
public enum Action {
    VIEW_TEMPLATE,
    CREATE_TEMPLATE,
    MODIFY_TEMPLATE,
    VIEW_DOCUMENT,
    CREATE_DOCUMENT,
    MANAGE_DOCUMENT;

    boolean isRead() {
        return this == VIEW_TEMPLATE || this == VIEW_DOCUMENT;
    }

    boolean isCreate() {
        return this == CREATE_TEMPLATE || this == CREATE_DOCUMENT;
    }
}
