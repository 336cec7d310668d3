package com.example.diversifier.service.tier;

import com.example.diversifier.model.PseudoEvent;
import com.example.diversifier.model.Tier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Ranks the categories of earlier turns by how often they came up.
 * Ties go to the category first seen in the earliest turn.
 */
@Component
public class PersonalizedStrategy implements TierStrategy {

    @Value("${app.resolver.max-personalized-categories:3}")
    private int maxCategories;

    @Override
    public Tier tier() {
        return Tier.PERSONALIZED;
    }

    @Override
    public Optional<List<String>> selectCategories(ResolutionContext context) {
        List<PseudoEvent> events = context.getPseudoEvents();
        if (events.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Stats> stats = new LinkedHashMap<>();
        for (PseudoEvent event : events) {
            stats.computeIfAbsent(event.getCategoryLabel(), label -> new Stats(stats.size(), event.getSourceTurnNumber()))
                    .record(event.getSourceTurnNumber());
        }

        List<String> ranked = stats.entrySet().stream()
                .sorted(Comparator.<Map.Entry<String, Stats>>comparingInt(e -> e.getValue().count).reversed()
                        .thenComparingInt(e -> e.getValue().earliestTurn)
                        .thenComparingInt(e -> e.getValue().firstSeen))
                .limit(Math.max(0, maxCategories))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        return Optional.of(ranked);
    }

    private static final class Stats {
        private final int firstSeen;
        private int earliestTurn;
        private int count;

        private Stats(int firstSeen, int turn) {
            this.firstSeen = firstSeen;
            this.earliestTurn = turn;
        }

        private void record(int turn) {
            count++;
            earliestTurn = Math.min(earliestTurn, turn);
        }
    }
}
