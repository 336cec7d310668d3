package com.example.diversifier.service.tier;

import com.example.diversifier.catalog.CandidatePoolSupplier;
import com.example.diversifier.model.Candidate;
import com.example.diversifier.model.CandidateContext;
import com.example.diversifier.model.PseudoEvent;
import com.example.diversifier.service.CollaboratorGuard;
import com.example.diversifier.service.RecoverableCollaboratorFailure;
import com.example.diversifier.taxonomy.CategoryTaxonomy;
import lombok.Builder;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Everything one resolution needs, plus a per-request memo of eligible items per category.
 * Not thread-safe; one instance serves one request.
 */
@Getter
public class ResolutionContext {

    private static final Logger logger = LoggerFactory.getLogger(ResolutionContext.class);

    static final String SUPPLIER = "candidate-supplier";

    private final String userQuery;
    private final String language;
    private final int n;
    private final CategoryTaxonomy taxonomy;
    private final List<PseudoEvent> pseudoEvents;
    private final Set<String> exclusions;
    private final CandidateContext candidateContext;

    @Getter(lombok.AccessLevel.NONE)
    private final CandidatePoolSupplier supplier;
    @Getter(lombok.AccessLevel.NONE)
    private final CollaboratorGuard guard;
    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, List<String>> eligibleByCategory = new HashMap<>();
    @Getter(lombok.AccessLevel.NONE)
    private boolean supplierUnresponsive;

    @Builder
    private ResolutionContext(String userQuery, String language, int n, CategoryTaxonomy taxonomy,
                              List<PseudoEvent> pseudoEvents, Set<String> exclusions,
                              CandidateContext candidateContext, CandidatePoolSupplier supplier,
                              CollaboratorGuard guard) {
        this.userQuery = userQuery;
        this.language = language;
        this.n = n;
        this.taxonomy = taxonomy;
        this.pseudoEvents = pseudoEvents == null ? List.of() : List.copyOf(pseudoEvents);
        this.exclusions = exclusions == null ? Set.of() : Collections.unmodifiableSet(exclusions);
        this.candidateContext = candidateContext;
        this.supplier = supplier;
        this.guard = guard;
    }

    /**
     * Available, not excluded item ids of {@code category} in supplier order.
     * A category whose fetch fails counts as empty. Once the supplier times out or
     * is saturated, every category not fetched yet counts as empty for the rest of
     * the request, so one request waits for at most one timeout.
     */
    public List<String> eligibleItems(String category) {
        return eligibleByCategory.computeIfAbsent(category, this::fetchEligible);
    }

    private List<String> fetchEligible(String category) {
        if (supplierUnresponsive) {
            logger.debug("Skipping candidate pool for {}, supplier unresponsive", category);
            return List.of();
        }
        List<Candidate> candidates;
        try {
            candidates = guard.call(SUPPLIER, () -> supplier.fetchCandidates(category, candidateContext));
        } catch (RecoverableCollaboratorFailure e) {
            if (e.isUnresponsive()) {
                supplierUnresponsive = true;
            }
            logger.warn("Candidate pool for {} unavailable: {}", category, e.getMessage());
            return List.of();
        }
        if (candidates == null) {
            return List.of();
        }
        Set<String> eligible = new LinkedHashSet<>();
        for (Candidate candidate : candidates) {
            if (candidate != null && candidate.isAvailable() && candidate.getId() != null
                    && !exclusions.contains(candidate.getId())) {
                eligible.add(candidate.getId());
            }
        }
        logger.debug("Category {}: {} candidates, {} eligible", category, candidates.size(), eligible.size());
        return List.copyOf(eligible);
    }
}
