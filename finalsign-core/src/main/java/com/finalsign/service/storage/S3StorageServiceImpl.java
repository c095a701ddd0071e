package com.finalsign.service.storage;

import com.finalsign.config.FinalSignProperties;
import com.finalsign.exception.StorageException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.ServerSideEncryption;

import java.util.Map;

/**
 * S3 (or S3-compatible) implementation of {@link StorageService}. Objects arrive already
 * encrypted; server-side AES256 is requested as an additional layer.
 */
@Slf4j
@Service
@Profile("s3")
public class S3StorageServiceImpl implements StorageService {

    private final S3Client s3Client;
    private final String bucket;

    public S3StorageServiceImpl(S3Client s3Client, FinalSignProperties properties) {
        this.s3Client = s3Client;
        this.bucket = properties.getStorage().getBucket();
        log.info("S3StorageService initialized for bucket {}", bucket);
    }

    @Override
    @CircuitBreaker(name = "contentStore", fallbackMethod = "uploadFallback")
    public String upload(byte[] data, String key, String contentType) {
        PutObjectRequest request = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType(contentType)
                .contentLength((long) data.length)
                .serverSideEncryption(ServerSideEncryption.AES256)
                .metadata(Map.of("encrypted", "true"))
                .build();
        s3Client.putObject(request, RequestBody.fromBytes(data));
        log.debug("Uploaded s3://{}/{} ({} bytes)", bucket, key, data.length);
        return key;
    }

    @Override
    @CircuitBreaker(name = "contentStore", fallbackMethod = "downloadFallback")
    public byte[] download(String key) {
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .build();
        try {
            byte[] data = s3Client.getObjectAsBytes(request).asByteArray();
            log.debug("Downloaded s3://{}/{}", bucket, key);
            return data;
        } catch (NoSuchKeyException e) {
            throw new StorageException("Object not found: " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
            log.debug("Deleted s3://{}/{}", bucket, key);
        } catch (SdkException e) {
            throw new StorageException("Failed to delete object: " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (SdkException e) {
            throw new StorageException("Failed to check object existence: " + key, e);
        }
    }

    @Override
    public String location() {
        return bucket;
    }

    @SuppressWarnings("unused")
    private String uploadFallback(byte[] data, String key, String contentType, Throwable t) {
        if (t instanceof StorageException se) {
            throw se;
        }
        throw new StorageException("Failed to upload object (content store unavailable): " + key, t);
    }

    @SuppressWarnings("unused")
    private byte[] downloadFallback(String key, Throwable t) {
        if (t instanceof StorageException se) {
            throw se;
        }
        throw new StorageException("Failed to download object (content store unavailable): " + key, t);
    }
}
