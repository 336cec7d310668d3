package com.example.diversifier.session;

import com.example.diversifier.kv.KvClient;
import com.example.diversifier.model.Session;
import com.example.diversifier.model.Turn;
import com.example.diversifier.service.RecoverableCollaboratorFailure;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link SessionStore} keeping each session as one JSON value in a {@link KvClient}.
 *
 * <p>Appends are read-modify-write under a lock striped by session id, so two
 * appends to the same session never interleave. Every append rewrites the entry
 * with the full TTL; reads also drop sessions whose {@code lastUpdated + ttl}
 * has passed, in case the backend keeps entries longer than asked. An entry
 * that cannot be parsed fails reads but is overwritten by the next append.
 */
public class KvSessionStore implements SessionStore {

    private static final Logger logger = LoggerFactory.getLogger(KvSessionStore.class);

    static final String COLLABORATOR = "session-store";

    private final KvClient kvClient;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final String keyPrefix;
    private final Clock clock;
    private final ReentrantLock[] locks;
    private final long lockTimeoutMs;

    public KvSessionStore(KvClient kvClient, ObjectMapper objectMapper, Duration ttl, String keyPrefix,
                          Clock clock, int lockStripes, long lockTimeoutMs) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Session TTL must be positive: " + ttl);
        }
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
        this.keyPrefix = keyPrefix;
        this.clock = clock;
        this.lockTimeoutMs = lockTimeoutMs;
        this.locks = new ReentrantLock[Math.max(1, lockStripes)];
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    @Override
    public Optional<Session> getSession(String sessionId) {
        return read(sessionId, false);
    }

    @Override
    public Session appendTurn(String sessionId, Turn turn) {
        ReentrantLock lock = lockFor(sessionId);
        acquire(lock, sessionId);
        try {
            Instant now = clock.instant();
            Session current = read(sessionId, true).orElse(null);

            List<Turn> turns = new ArrayList<>();
            Instant createdAt = now;
            int nextNumber = 1;
            if (current != null) {
                turns.addAll(current.getTurns());
                createdAt = current.getCreatedAt() != null ? current.getCreatedAt() : now;
                nextNumber = current.lastTurnNumber() + 1;
            }
            turns.add(turn.toBuilder()
                    .turnNumber(nextNumber)
                    .timestamp(now)
                    .detectedCategories(copyOf(turn.getDetectedCategories()))
                    .recommendedIds(copyOf(turn.getRecommendedIds()))
                    .build());

            Session updated = Session.builder()
                    .id(sessionId)
                    .turns(turns)
                    .createdAt(createdAt)
                    .lastUpdated(now)
                    .ttl(ttl)
                    .build();
            write(updated);
            logger.debug("Appended turn {} to session {}", nextNumber, sessionId);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    private Optional<Session> read(String sessionId, boolean replaceUnreadable) {
        String raw;
        try {
            raw = kvClient.get(key(sessionId)).orElse(null);
        } catch (RuntimeException e) {
            throw new RecoverableCollaboratorFailure(COLLABORATOR, "read failed for session " + sessionId, e);
        }
        if (raw == null) {
            return Optional.empty();
        }
        Session session;
        try {
            session = objectMapper.readValue(raw, Session.class);
        } catch (JsonProcessingException e) {
            if (replaceUnreadable) {
                logger.warn("Session {} is unreadable, starting a fresh one: {}", sessionId, e.getOriginalMessage());
                return Optional.empty();
            }
            throw new RecoverableCollaboratorFailure(COLLABORATOR, "unreadable session " + sessionId, e);
        }
        if (session.isExpired(clock.instant())) {
            logger.debug("Session {} expired at {}", sessionId, session.getLastUpdated().plus(session.getTtl()));
            return Optional.empty();
        }
        if (session.getTurns() == null) {
            session.setTurns(List.of());
        }
        return Optional.of(session);
    }

    private void write(Session session) {
        String value;
        try {
            value = objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Session " + session.getId() + " cannot be serialized", e);
        }
        try {
            kvClient.set(key(session.getId()), value, ttl);
        } catch (RuntimeException e) {
            throw new RecoverableCollaboratorFailure(COLLABORATOR, "write failed for session " + session.getId(), e);
        }
    }

    private void acquire(ReentrantLock lock, String sessionId) {
        try {
            if (!lock.tryLock(lockTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw new RecoverableCollaboratorFailure(COLLABORATOR,
                        "append lock for session " + sessionId + " not acquired within " + lockTimeoutMs + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecoverableCollaboratorFailure(COLLABORATOR, "interrupted waiting for append lock", e);
        }
    }

    private ReentrantLock lockFor(String sessionId) {
        return locks[Math.floorMod(sessionId.hashCode(), locks.length)];
    }

    private String key(String sessionId) {
        return keyPrefix + sessionId;
    }

    private static List<String> copyOf(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
