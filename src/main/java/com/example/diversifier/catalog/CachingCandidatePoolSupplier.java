package com.example.diversifier.catalog;

import com.example.diversifier.model.Candidate;
import com.example.diversifier.model.CandidateContext;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.List;

/**
 * Near-cache in front of another supplier. Rankings are per category, not per
 * conversation, so the cache key is the category label alone.
 */
public class CachingCandidatePoolSupplier implements CandidatePoolSupplier {

    private final CandidatePoolSupplier delegate;
    private final Cache<String, List<Candidate>> cache;

    public CachingCandidatePoolSupplier(CandidatePoolSupplier delegate, Duration expireAfterWrite, long maximumSize) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(expireAfterWrite)
                .maximumSize(maximumSize)
                .build();
    }

    @Override
    public List<Candidate> fetchCandidates(String categoryLabel, CandidateContext context) {
        return cache.get(categoryLabel, label -> List.copyOf(delegate.fetchCandidates(label, context)));
    }
}
