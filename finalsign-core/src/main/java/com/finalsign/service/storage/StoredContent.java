package com.finalsign.service.storage;

import com.finalsign.model.ContentReference;
import lombok.Builder;
import lombok.Getter;

/**
 * Result of {@link EncryptedContentStore#put}. Hash and size describe the plaintext.
 */
@Getter
@Builder
public class StoredContent {

    private final String bucket;
    private final String path;
    private final String contentHash;
    private final long size;
    private final String mimeType;

    public ContentReference toReference() {
        return ContentReference.builder()
                .bucket(bucket)
                .key(path)
                .contentHash(contentHash)
                .size(size)
                .mimeType(mimeType)
                .build();
    }
}
