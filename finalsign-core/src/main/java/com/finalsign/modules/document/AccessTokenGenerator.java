package com.finalsign.modules.document;

import com.finalsign.config.FinalSignProperties;
import com.finalsign.exception.ConflictException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.function.Predicate;

/**
 * Opaque recipient credentials: random bytes from {@link SecureRandom}, base64url without
 * padding.
 */
@Component
public class AccessTokenGenerator {

    private static final int MAX_ATTEMPTS = 5;

    private final SecureRandom secureRandom = new SecureRandom();
    private final int tokenBytes;

    @Autowired
    public AccessTokenGenerator(FinalSignProperties properties) {
        this(properties.getDocuments().getAccessTokenBytes());
    }

    public AccessTokenGenerator(int tokenBytes) {
        if (tokenBytes < 32) {
            throw new IllegalArgumentException("Access tokens need at least 32 bytes of randomness");
        }
        this.tokenBytes = tokenBytes;
    }

    public String generate() {
        byte[] bytes = new byte[tokenBytes];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * @param taken returns true if a candidate is already assigned
     */
    public String generateUnique(Predicate<String> taken) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String token = generate();
            if (!taken.test(token)) {
                return token;
            }
        }
        throw new ConflictException("TOKEN_COLLISION", "Could not generate a unique access token");
    }

    /**
     * True if the token could have come from this generator.
     */
    public boolean isWellFormed(String token) {
        if (token == null || token.length() < (tokenBytes * 4 + 2) / 3) {
            return false;
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            boolean urlSafe = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '_';
            if (!urlSafe) {
                return false;
            }
        }
        return true;
    }
}
