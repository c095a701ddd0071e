package com.finalsign.service.storage;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Decrypted payload with its recomputed plaintext hash.
 */
@Getter
@AllArgsConstructor
public class RetrievedContent {

    private final byte[] data;
    private final String contentHash;

    public long getSize() {
        return data.length;
    }
}
