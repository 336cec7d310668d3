package com.example.diversifier.service;

import com.example.diversifier.catalog.CandidatePoolSupplier;
import com.example.diversifier.model.*;
import com.example.diversifier.provisioning.ComponentRegistry;
import com.example.diversifier.service.tier.ResolutionContext;
import com.example.diversifier.service.tier.TierStrategy;
import com.example.diversifier.session.SessionStore;
import com.example.diversifier.taxonomy.CategoryExtractor;
import com.example.diversifier.taxonomy.CategoryTaxonomy;
import com.example.diversifier.taxonomy.TaxonomyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Decides which categories to serve for one turn and how many slots each gets.
 *
 * <p>History is best effort: an unreachable or missing session is treated as a
 * fresh conversation. Tiers are tried in {@link Tier} order and the first one
 * that applies is used, even if its categories turn out to be empty.
 */
@Service
public class DiversificationResolver {

    private static final Logger logger = LoggerFactory.getLogger(DiversificationResolver.class);

    private final CategoryExtractor categoryExtractor;
    private final TaxonomyProvider taxonomyProvider;
    private final ComponentRegistry componentRegistry;
    private final CollaboratorGuard collaboratorGuard;
    private final SlotAllocator slotAllocator;
    private final List<TierStrategy> strategies;

    public DiversificationResolver(CategoryExtractor categoryExtractor, TaxonomyProvider taxonomyProvider,
                                   ComponentRegistry componentRegistry, CollaboratorGuard collaboratorGuard,
                                   SlotAllocator slotAllocator, List<TierStrategy> strategies) {
        this.categoryExtractor = categoryExtractor;
        this.taxonomyProvider = taxonomyProvider;
        this.componentRegistry = componentRegistry;
        this.collaboratorGuard = collaboratorGuard;
        this.slotAllocator = slotAllocator;
        this.strategies = strategies.stream()
                .sorted(Comparator.comparing(TierStrategy::tier))
                .collect(Collectors.toList());
    }

    public RecommendationResult resolve(String sessionId, String userQuery, int n, Set<String> explicitExclusions) {
        return resolve(sessionId, userQuery, n, explicitExclusions, null);
    }

    public RecommendationResult resolve(String sessionId, String userQuery, int n, Set<String> explicitExclusions,
                                        String language) {
        CategoryTaxonomy taxonomy = taxonomyProvider.currentTaxonomy();

        HistoryStatus historyStatus;
        Session session;
        try {
            Optional<Session> loaded = collaboratorGuard.call("session-store",
                    () -> componentRegistry.get(SessionStore.class).getSession(sessionId));
            session = loaded.orElseGet(() -> Session.empty(sessionId));
            historyStatus = loaded.isPresent() && !session.getTurns().isEmpty() ? HistoryStatus.LOADED : HistoryStatus.EMPTY;
        } catch (RecoverableCollaboratorFailure e) {
            logger.warn("Session {} history unavailable, resolving without it: {}", sessionId, e.getMessage());
            session = Session.empty(sessionId);
            historyStatus = HistoryStatus.UNAVAILABLE;
        }

        Set<String> exclusions = new LinkedHashSet<>();
        if (explicitExclusions != null) {
            exclusions.addAll(explicitExclusions);
        }
        exclusions.addAll(session.recommendedIds());

        List<PseudoEvent> pseudoEvents = derivePseudoEvents(session, taxonomy);

        ResolutionContext context = ResolutionContext.builder()
                .userQuery(userQuery)
                .language(language)
                .n(n)
                .taxonomy(taxonomy)
                .pseudoEvents(pseudoEvents)
                .exclusions(exclusions)
                .candidateContext(CandidateContext.builder()
                        .sessionId(sessionId)
                        .userQuery(userQuery)
                        .language(language)
                        .build())
                .supplier(componentRegistry.get(CandidatePoolSupplier.class))
                .guard(collaboratorGuard)
                .build();

        Tier tier = Tier.DIVERSE;
        List<String> categories = List.of();
        for (TierStrategy strategy : strategies) {
            Optional<List<String>> selected = strategy.selectCategories(context);
            if (selected.isPresent()) {
                tier = strategy.tier();
                categories = selected.get();
                break;
            }
        }
        logger.info("Session {}: tier {} with categories {} ({}, {} pseudo-events, {} exclusions)",
                sessionId, tier, categories, historyStatus, pseudoEvents.size(), exclusions.size());

        Map<String, List<String>> picks = slotAllocator.allocate(categories, n, context::eligibleItems);

        List<String> items = new ArrayList<>();
        Map<String, Integer> allocations = new LinkedHashMap<>();
        picks.forEach((category, picked) -> {
            items.addAll(picked);
            allocations.put(category, picked.size());
        });

        return RecommendationResult.builder()
                .items(List.copyOf(items))
                .tierUsed(tier)
                .categoriesUsed(List.copyOf(categories))
                .excludedCount(exclusions.size())
                .diagnostics(ResolutionDiagnostics.builder()
                        .historyStatus(historyStatus)
                        .pseudoEventCount(pseudoEvents.size())
                        .allocations(Collections.unmodifiableMap(allocations))
                        .taxonomyVersion(taxonomy.getVersion())
                        .build())
                .build();
    }

    /**
     * One event per category matched in each earlier query, re-extracted against the
     * current taxonomy so that renamed or removed labels drop out.
     */
    List<PseudoEvent> derivePseudoEvents(Session session, CategoryTaxonomy taxonomy) {
        List<PseudoEvent> events = new ArrayList<>();
        for (Turn turn : session.getTurns()) {
            for (String label : categoryExtractor.extract(turn.getUserQuery(), taxonomy)) {
                events.add(new PseudoEvent(label, turn.getTurnNumber()));
            }
            if (turn.getDetectedCategories() != null) {
                turn.getDetectedCategories().stream()
                        .filter(label -> !taxonomy.isConcrete(label))
                        .forEach(label -> logger.warn("Turn {} of session {} used category '{}' unknown to taxonomy {}",
                                turn.getTurnNumber(), session.getId(), label, taxonomy.getVersion()));
            }
        }
        return events;
    }
}
