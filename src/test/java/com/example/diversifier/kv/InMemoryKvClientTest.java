package com.example.diversifier.kv;

import com.example.diversifier.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKvClientTest {

    private MutableClock clock;
    private InMemoryKvClient kvClient;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-10-01T10:00:00Z"));
        kvClient = new InMemoryKvClient(clock);
    }

    @Test
    void testGet_ExpiresExactlyAtTtl() {
        // Given
        kvClient.set("session:a", "v", Duration.ofSeconds(30));

        // When / Then
        clock.advance(Duration.ofSeconds(29));
        assertEquals(Optional.of("v"), kvClient.get("session:a"));
        clock.advance(Duration.ofSeconds(1));
        assertEquals(Optional.empty(), kvClient.get("session:a"));
    }

    @Test
    void testEvictExpired_RemovesEntriesThatAreNeverReadAgain() {
        // Given
        for (int i = 0; i < 100; i++) {
            kvClient.set("session:abandoned-" + i, "{}", Duration.ofMinutes(5));
        }
        kvClient.set("session:live", "{}", Duration.ofHours(1));
        kvClient.set("session:pinned", "{}", null);
        assertEquals(102, kvClient.size());

        // When
        clock.advance(Duration.ofMinutes(10));
        int evicted = kvClient.evictExpired();

        // Then
        assertEquals(100, evicted);
        assertEquals(2, kvClient.size());
        assertTrue(kvClient.get("session:live").isPresent());
        assertTrue(kvClient.get("session:pinned").isPresent());
    }

    @Test
    void testSet_OverwriteRefreshesTtl() {
        // Given
        kvClient.set("session:a", "v1", Duration.ofSeconds(30));
        clock.advance(Duration.ofSeconds(20));

        // When
        kvClient.set("session:a", "v2", Duration.ofSeconds(30));
        clock.advance(Duration.ofSeconds(20));

        // Then
        assertEquals(0, kvClient.evictExpired());
        assertEquals(Optional.of("v2"), kvClient.get("session:a"));
    }
}
