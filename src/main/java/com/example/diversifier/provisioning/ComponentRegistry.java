package com.example.diversifier.provisioning;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide holder of long-lived collaborators, one instance per registered type.
 *
 * <p>{@link #get(Class)} reads the instance without locking, then takes the
 * type's own lock, re-checks and only then constructs, so concurrent first use
 * builds at most one instance. Each type has a circuit breaker around its
 * construction: after {@code failure-threshold} consecutive failures the
 * registry hands out the fallback immediately until {@code cooldown-ms} has
 * passed, then allows one new attempt.
 */
@Component
public class ComponentRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ComponentRegistry.class);

    private final ConcurrentMap<Class<?>, Entry<?>> entries = new ConcurrentHashMap<>();
    private final int failureThreshold;
    private final Duration cooldown;

    public ComponentRegistry(@Value("${app.provisioning.failure-threshold:3}") int failureThreshold,
                             @Value("${app.provisioning.cooldown-ms:60000}") long cooldownMs) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failure-threshold must be at least 1");
        }
        this.failureThreshold = failureThreshold;
        this.cooldown = Duration.ofMillis(cooldownMs);
    }

    /**
     * Registers (or replaces) how {@code type} is built. A replaced instance is closed.
     */
    public <T> void register(Class<T> type, ProvisioningSpec<T> spec) {
        Entry<?> previous = entries.put(type, new Entry<>(spec, newBreaker(type)));
        if (previous != null) {
            logger.info("Replaced provisioning spec for {}", type.getSimpleName());
            previous.release();
        }
    }

    public <T> T get(Class<T> type) {
        Entry<T> entry = entry(type);

        T existing = entry.instance;
        if (existing != null) {
            return existing;
        }

        if (!entry.breaker.tryAcquirePermission()) {
            logger.debug("Circuit for {} is {}, handing out fallback", type.getSimpleName(), entry.breaker.getState());
            return fallback(type, entry, null);
        }

        entry.lock.lock();
        try {
            existing = entry.instance;
            if (existing != null) {
                entry.breaker.releasePermission();
                return existing;
            }
            long start = System.nanoTime();
            try {
                T created = construct(type, entry.spec);
                entry.breaker.onSuccess(System.nanoTime() - start, TimeUnit.NANOSECONDS);
                entry.instance = created;
                logger.info("Provisioned {} as {}", type.getSimpleName(), created.getClass().getSimpleName());
                return created;
            } catch (RuntimeException e) {
                entry.breaker.onError(System.nanoTime() - start, TimeUnit.NANOSECONDS, e);
                logger.warn("Provisioning {} failed ({} state): {}", type.getSimpleName(),
                        entry.breaker.getState(), e.getMessage());
                return fallback(type, entry, e);
            }
        } finally {
            entry.lock.unlock();
        }
    }

    public boolean isProvisioned(Class<?> type) {
        Entry<?> entry = entries.get(type);
        return entry != null && entry.instance != null;
    }

    public CircuitBreaker.State circuitState(Class<?> type) {
        return entry(type).breaker.getState();
    }

    /**
     * Closes and forgets every provisioned instance and closes every circuit.
     * Registrations stay, so the next {@link #get(Class)} builds afresh.
     */
    @PreDestroy
    public void shutdown() {
        entries.values().forEach(Entry::release);
        logger.info("Component registry reset ({} registered types)", entries.size());
    }

    public Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        entries.forEach((type, entry) -> status.put(type.getSimpleName(), Map.of(
                "provisioned", entry.instance != null,
                "implementation", entry.instance != null ? entry.instance.getClass().getSimpleName() : "none",
                "circuitState", entry.breaker.getState().name(),
                "failedAttempts", entry.breaker.getMetrics().getNumberOfFailedCalls()
        )));
        return status;
    }

    private <T> T construct(Class<T> type, ProvisioningSpec<T> spec) {
        if (spec.preferred() != null) {
            try {
                return type.cast(spec.preferred().get());
            } catch (OptionalCapabilityMissingException | LinkageError e) {
                logger.info("Preferred variant of {} unavailable ({}), using baseline",
                        type.getSimpleName(), e.getMessage());
            }
        }
        return type.cast(spec.baseline().get());
    }

    private <T> T fallback(Class<T> type, Entry<T> entry, RuntimeException cause) {
        if (entry.spec.fallback() == null) {
            throw new IllegalStateException("No instance of " + type.getSimpleName() + " available", cause);
        }
        return type.cast(entry.spec.fallback().get());
    }

    @SuppressWarnings("unchecked")
    private <T> Entry<T> entry(Class<T> type) {
        Entry<T> entry = (Entry<T>) entries.get(type);
        if (entry == null) {
            throw new IllegalArgumentException("No provisioning spec registered for " + type.getName());
        }
        return entry;
    }

    private CircuitBreaker newBreaker(Class<?> type) {
        // a window of N calls at a 100% failure rate opens after N consecutive failures
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(cooldown)
                .permittedNumberOfCallsInHalfOpenState(1)
                .build();
        return CircuitBreaker.of("provision-" + type.getSimpleName(), config);
    }

    private static final class Entry<T> {
        private final ProvisioningSpec<T> spec;
        private final CircuitBreaker breaker;
        private final ReentrantLock lock = new ReentrantLock();
        private volatile T instance;

        private Entry(ProvisioningSpec<T> spec, CircuitBreaker breaker) {
            this.spec = spec;
            this.breaker = breaker;
        }

        private void release() {
            lock.lock();
            try {
                T current = instance;
                instance = null;
                if (current instanceof AutoCloseable) {
                    try {
                        ((AutoCloseable) current).close();
                    } catch (Exception e) {
                        logger.warn("Closing {} failed", current.getClass().getSimpleName(), e);
                    }
                }
                breaker.reset();
            } finally {
                lock.unlock();
            }
        }
    }
}
