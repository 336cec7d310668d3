package com.example.diversifier.provisioning;

import com.example.diversifier.catalog.CachingCandidatePoolSupplier;
import com.example.diversifier.catalog.CandidatePoolSupplier;
import com.example.diversifier.catalog.EmptyCandidatePoolSupplier;
import com.example.diversifier.catalog.MongoCandidatePoolSupplier;
import com.example.diversifier.kv.KvClient;
import com.example.diversifier.repo.CatalogItemRepo;
import com.example.diversifier.session.KvSessionStore;
import com.example.diversifier.session.SessionStore;
import com.example.diversifier.session.UnavailableSessionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;

/**
 * Tells the registry how to build the session store and the candidate pool supplier.
 */
@Component
public class ComponentRegistrations {

    static final String CAFFEINE_CLASS = "com.github.benmanes.caffeine.cache.Caffeine";

    private final ComponentRegistry registry;
    private final KvClient kvClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ObjectProvider<CatalogItemRepo> catalogItemRepo;

    @Value("${app.session.ttl-seconds:86400}")
    private long sessionTtlSeconds;

    @Value("${app.session.key-prefix:session:}")
    private String sessionKeyPrefix;

    @Value("${app.session.lock-stripes:64}")
    private int lockStripes;

    @Value("${app.session.lock-timeout-ms:2000}")
    private long lockTimeoutMs;

    @Value("${app.catalog.cache.enabled:true}")
    private boolean cacheEnabled;

    @Value("${app.catalog.cache.expire-after-write-seconds:60}")
    private long cacheExpireSeconds;

    @Value("${app.catalog.cache.maximum-size:1000}")
    private long cacheMaximumSize;

    public ComponentRegistrations(ComponentRegistry registry, KvClient kvClient, ObjectMapper objectMapper,
                                  Clock clock, ObjectProvider<CatalogItemRepo> catalogItemRepo) {
        this.registry = registry;
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.catalogItemRepo = catalogItemRepo;
    }

    @PostConstruct
    public void registerAll() {
        registry.register(SessionStore.class, ProvisioningSpec.<SessionStore>of(this::createSessionStore)
                .withFallback(() -> new UnavailableSessionStore("session store is not reachable")));

        registry.register(CandidatePoolSupplier.class, ProvisioningSpec.<CandidatePoolSupplier>of(this::createCatalogSupplier)
                .preferring(this::createCachedCatalogSupplier)
                .withFallback(EmptyCandidatePoolSupplier::new));
    }

    SessionStore createSessionStore() {
        kvClient.ping();
        return new KvSessionStore(kvClient, objectMapper, Duration.ofSeconds(sessionTtlSeconds), sessionKeyPrefix,
                clock, lockStripes, lockTimeoutMs);
    }

    CandidatePoolSupplier createCatalogSupplier() {
        return new MongoCandidatePoolSupplier(catalogItemRepo.getObject());
    }

    CandidatePoolSupplier createCachedCatalogSupplier() {
        if (!cacheEnabled) {
            throw new OptionalCapabilityMissingException("catalog near-cache (disabled)");
        }
        if (!ClassUtils.isPresent(CAFFEINE_CLASS, getClass().getClassLoader())) {
            throw new OptionalCapabilityMissingException("catalog near-cache (Caffeine not on classpath)");
        }
        return new CachingCandidatePoolSupplier(createCatalogSupplier(), Duration.ofSeconds(cacheExpireSeconds),
                cacheMaximumSize);
    }
}
