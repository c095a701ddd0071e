package com.finalsign.modules.document;

import com.finalsign.exception.ConflictException;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AccessTokenGeneratorTest {

    private final AccessTokenGenerator generator = new AccessTokenGenerator(32);

    @Test
    void tokensCarry256BitsAndAreUrlSafe() {
        String token = generator.generate();

        assertEquals(43, token.length());
        assertEquals(32, Base64.getUrlDecoder().decode(token).length);
        assertTrue(token.matches("[A-Za-z0-9_-]+"));
        assertTrue(generator.isWellFormed(token));
    }

    @Test
    void tokensAreDistinct() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            assertTrue(seen.add(generator.generate()));
        }
    }

    @Test
    void rejectsWeakConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new AccessTokenGenerator(16));
    }

    @Test
    void retriesOnCollision() {
        AtomicInteger calls = new AtomicInteger();

        String token = generator.generateUnique(candidate -> calls.incrementAndGet() < 3);

        assertNotNull(token);
        assertEquals(3, calls.get());
    }

    @Test
    void givesUpAfterRepeatedCollisions() {
        ConflictException e = assertThrows(ConflictException.class, () -> generator.generateUnique(t -> true));

        assertEquals("TOKEN_COLLISION", e.getErrorCode());
    }

    @Test
    void malformedTokens() {
        assertFalse(generator.isWellFormed(null));
        assertFalse(generator.isWellFormed(""));
        assertFalse(generator.isWellFormed("short"));
        assertFalse(generator.isWellFormed("a".repeat(42) + "+"));
        assertFalse(generator.isWellFormed("a".repeat(42) + "="));
    }
}
