package com.example.diversifier.taxonomy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the taxonomy from a Spring resource and swaps in a fresh copy on a fixed delay.
 * A reload that fails keeps serving the previous taxonomy.
 */
@Component
public class ClasspathTaxonomyProvider implements TaxonomyProvider {

    private static final Logger logger = LoggerFactory.getLogger(ClasspathTaxonomyProvider.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final AtomicReference<CategoryTaxonomy> current = new AtomicReference<>(CategoryTaxonomy.empty());

    @Value("${app.taxonomy.location:classpath:taxonomy/categories.json}")
    private String location;

    public ClasspathTaxonomyProvider(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void load() {
        try {
            current.set(read());
            logger.info("Loaded taxonomy {} from {}", current.get(), location);
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to load taxonomy from {}", location, e);
            throw new IllegalStateException("Failed to load category taxonomy from " + location, e);
        }
    }

    @Scheduled(fixedDelayString = "${app.taxonomy.reload-ms:300000}",
               initialDelayString = "${app.taxonomy.reload-ms:300000}")
    public void reload() {
        try {
            CategoryTaxonomy fresh = read();
            CategoryTaxonomy previous = current.getAndSet(fresh);
            if (!fresh.getVersion().equals(previous.getVersion())) {
                logger.info("Taxonomy refreshed from {} to {}", previous.getVersion(), fresh.getVersion());
            } else {
                logger.debug("Taxonomy {} reloaded", fresh.getVersion());
            }
        } catch (IOException | RuntimeException e) {
            logger.warn("Taxonomy reload from {} failed, keeping version {}", location, current.get().getVersion(), e);
        }
    }

    @Override
    public CategoryTaxonomy currentTaxonomy() {
        return current.get();
    }

    private CategoryTaxonomy read() throws IOException {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, TaxonomyDocument.class).toTaxonomy();
        }
    }
}
