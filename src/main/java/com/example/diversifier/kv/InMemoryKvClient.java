package com.example.diversifier.kv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryKvClient implements KvClient {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryKvClient.class);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKvClient() {
        this(Clock.systemUTC());
    }

    public InMemoryKvClient(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) return Optional.empty();
        if (entry.isExpired(clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value);
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Instant expiresAt = (ttl == null || ttl.isZero() || ttl.isNegative()) ? null : clock.instant().plus(ttl);
        entries.put(key, new Entry(value, expiresAt));
    }

    @Override
    public void ping() {
        // always reachable
    }

    /**
     * Drops every entry whose TTL has run out, including keys that are never read again.
     */
    @Scheduled(fixedDelayString = "${app.session.sweep-interval-ms:60000}")
    public int evictExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int evicted = before - entries.size();
        if (evicted > 0) {
            logger.debug("Evicted {} expired session entries, {} left", evicted, entries.size());
        }
        return evicted;
    }

    public int size() {
        return entries.size();
    }

    private static final class Entry {
        private final String value;
        private final Instant expiresAt;

        private Entry(String value, Instant expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        // expired once now reaches expiresAt, same boundary as Session.isExpired
        private boolean isExpired(Instant now) {
            return expiresAt != null && !expiresAt.isAfter(now);
        }
    }
}
