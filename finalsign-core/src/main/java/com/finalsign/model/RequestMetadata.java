package com.finalsign.model;

/**
 * Client network context recorded alongside submissions, signatures and audit rows.
 */
public record RequestMetadata(String ipAddress, String userAgent) {

    public static final RequestMetadata NONE = new RequestMetadata(null, null);
}
