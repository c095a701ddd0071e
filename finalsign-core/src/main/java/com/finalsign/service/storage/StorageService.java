package com.finalsign.service.storage;

/**
 * Raw object storage beneath the encrypted content store. Implementations see only
 * ciphertext and never interpret it.
 */
public interface StorageService {

    /**
     * Write an object.
     *
     * @param data        bytes to store
     * @param key         path of the object
     * @param contentType MIME type recorded with the object
     * @return the key the object was stored under
     */
    String upload(byte[] data, String key, String contentType);

    /**
     * Read an object.
     *
     * @param key path of the object
     * @return raw bytes
     */
    byte[] download(String key);

    void delete(String key);

    boolean exists(String key);

    /** Bucket or root name recorded on content references. */
    String location();
}
