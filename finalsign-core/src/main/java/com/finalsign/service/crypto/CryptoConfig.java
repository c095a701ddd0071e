package com.finalsign.service.crypto;

import com.finalsign.config.FinalSignProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the document encryption key once at startup. A missing or malformed key stops
 * the application.
 */
@Slf4j
@Configuration
public class CryptoConfig {

    @Bean
    public AesGcmCipher documentCipher(FinalSignProperties properties) {
        FinalSignProperties.Encryption encryption = properties.getEncryption();
        try {
            AesGcmCipher cipher = AesGcmCipher.fromHex(encryption.getKey(), encryption.getKeyId());
            log.info("Document encryption key loaded (keyId={})", encryption.getKeyId());
            return cipher;
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("finalsign.encryption.key is invalid: " + e.getMessage(), e);
        }
    }
}
