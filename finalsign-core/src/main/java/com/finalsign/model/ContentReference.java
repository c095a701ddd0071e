package com.finalsign.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Location and plaintext fingerprint of an object in the encrypted content store.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContentReference {

    @Column(name = "s3_bucket")
    private String bucket;

    @Column(name = "s3_key")
    private String key;

    /** SHA-256 hex of the plaintext. */
    @Column(name = "content_hash", length = 64)
    private String contentHash;

    @Column(name = "file_size")
    private Long size;

    @Column(name = "mime_type", length = 100)
    private String mimeType;
}
