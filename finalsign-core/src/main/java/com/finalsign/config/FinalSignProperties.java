package com.finalsign.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Binds the {@code finalsign.*} YAML properties into a typed bean.
 */
@Getter
@Setter
@Configuration
@Validated
@ConfigurationProperties(prefix = "finalsign")
public class FinalSignProperties {

    @Valid
    private Storage storage = new Storage();
    @Valid
    private Encryption encryption = new Encryption();
    @Valid
    private Documents documents = new Documents();
    @Valid
    private Audit audit = new Audit();

    @Getter
    @Setter
    public static class Storage {
        /** Logical bucket recorded on every content reference. */
        @NotBlank
        private String bucket = "finalsign-documents";
        /** Root directory for the local filesystem backend. */
        private String localRoot = "/tmp/finalsign-storage";
        private S3 s3 = new S3();
    }

    @Getter
    @Setter
    public static class S3 {
        private String region = "us-east-1";
        /** Endpoint override, e.g. a MinIO URL. Enables path-style addressing when set. */
        private String endpoint;
    }

    @Getter
    @Setter
    public static class Encryption {
        /** 32-byte AES-256 key as 64 hex characters. */
        @NotBlank
        private String key;
        @NotBlank
        private String keyId = "primary";
    }

    @Getter
    @Setter
    public static class Documents {
        @Min(1)
        private int defaultExpiryDays = 30;
        @Min(32)
        private int accessTokenBytes = 32;
    }

    @Getter
    @Setter
    public static class Audit {
        /** Consecutive audit write failures before the failure is logged at ERROR. */
        @Min(1)
        private int failureAlertThreshold = 3;
    }
}
