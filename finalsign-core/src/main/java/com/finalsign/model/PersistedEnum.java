package com.finalsign.model;

/**
 * Enum whose database and wire representation is a lower-case string.
 */
public interface PersistedEnum {

    String getValue();
}
