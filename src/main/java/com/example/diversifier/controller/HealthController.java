package com.example.diversifier.controller;

import com.example.diversifier.kv.InMemoryKvClient;
import com.example.diversifier.kv.KvClient;
import com.example.diversifier.provisioning.ComponentRegistry;
import com.example.diversifier.store.StoreClient;
import com.example.diversifier.taxonomy.TaxonomyProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final StoreClient storeClient;
    private final TaxonomyProvider taxonomyProvider;
    private final ComponentRegistry componentRegistry;

    public HealthController(KvClient kvClient, StoreClient storeClient, TaxonomyProvider taxonomyProvider,
                            ComponentRegistry componentRegistry) {
        this.kvClient = kvClient;
        this.storeClient = storeClient;
        this.taxonomyProvider = taxonomyProvider;
        this.componentRegistry = componentRegistry;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "conversational-diversifier");
        health.put("version", "0.1.0");
        health.put("taxonomyVersion", taxonomyProvider.currentTaxonomy().getVersion());
        health.put("components", componentRegistry.status());

        // sessions backend
        try {
            kvClient.ping();
            health.put("sessionStore", "UP");
            if (kvClient instanceof InMemoryKvClient) {
                health.put("sessionEntries", ((InMemoryKvClient) kvClient).size());
            }
        } catch (Exception e) {
            health.put("sessionStore", "DOWN");
            health.put("sessionStoreError", e.getMessage());
        }

        // catalog and audit trail
        try {
            storeClient.find("catalog_items", Map.of(), null, 1);
            health.put("mongodb", "UP");
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        return ResponseEntity.ok(health);
    }

    @GetMapping("/actuator/health")
    public ResponseEntity<Map<String, Object>> actuatorHealth() {
        return health();
    }
}
