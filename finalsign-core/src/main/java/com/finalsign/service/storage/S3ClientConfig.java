package com.finalsign.service.storage;

import com.finalsign.config.FinalSignProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * Builds the {@link S3Client} for the {@code s3} profile. A configured endpoint switches
 * to path-style addressing, which MinIO requires.
 */
@Configuration
@Profile("s3")
public class S3ClientConfig {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(FinalSignProperties properties) {
        FinalSignProperties.S3 s3 = properties.getStorage().getS3();
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(s3.getRegion()))
                .credentialsProvider(DefaultCredentialsProvider.create());
        if (s3.getEndpoint() != null && !s3.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(s3.getEndpoint()))
                    .forcePathStyle(true);
        }
        return builder.build();
    }
}
