package com.finalsign.service.storage;

import com.finalsign.config.FinalSignProperties;
import com.finalsign.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;

/**
 * Local filesystem implementation of {@link StorageService}.
 * Active unless the {@code s3} profile is selected.
 */
@Slf4j
@Service
@Profile("!s3")
public class LocalStorageServiceImpl implements StorageService {

    private final Path storageRoot;
    private final String bucket;

    @Autowired
    public LocalStorageServiceImpl(FinalSignProperties properties) {
        this(Paths.get(properties.getStorage().getLocalRoot()), properties.getStorage().getBucket());
    }

    public LocalStorageServiceImpl(Path storageRoot, String bucket) {
        this.storageRoot = storageRoot.toAbsolutePath().normalize();
        this.bucket = bucket;
        try {
            Files.createDirectories(this.storageRoot);
            log.info("LocalStorageService initialized at {}", this.storageRoot);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create local storage directory: " + this.storageRoot, e);
        }
    }

    @Override
    public String upload(byte[] data, String key, String contentType) {
        Path filePath = resolve(key);
        try {
            Files.createDirectories(filePath.getParent());
            // CREATE_NEW: objects are write-once
            Files.write(filePath, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            log.debug("Uploaded {} ({} bytes, type={})", key, data.length, contentType);
            return key;
        } catch (IOException e) {
            throw new StorageException("Failed to upload object: " + key, e);
        }
    }

    @Override
    public byte[] download(String key) {
        Path filePath = resolve(key);
        if (!Files.exists(filePath)) {
            throw new StorageException("Object not found: " + key);
        }
        try {
            log.debug("Downloaded {}", key);
            return Files.readAllBytes(filePath);
        } catch (IOException e) {
            throw new StorageException("Failed to download object: " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        Path filePath = resolve(key);
        try {
            boolean deleted = Files.deleteIfExists(filePath);
            log.debug("Deleted {} (existed={})", key, deleted);
        } catch (IOException e) {
            throw new StorageException("Failed to delete object: " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.exists(resolve(key));
    }

    @Override
    public String location() {
        return bucket;
    }

    private Path resolve(String key) {
        // Prevent path-traversal attacks
        Path resolved = storageRoot.resolve(key).normalize();
        if (!resolved.startsWith(storageRoot) || resolved.equals(storageRoot)) {
            throw new SecurityException("Path traversal attempt detected: " + key);
        }
        return resolved;
    }
}
