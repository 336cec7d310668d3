package com.example.diversifier.service.tier;

import com.example.diversifier.model.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Last resort: the best-stocked categories of the whole taxonomy.
 * Always applies, possibly with no categories at all.
 */
@Component
public class DiverseStrategy implements TierStrategy {

    private static final Logger logger = LoggerFactory.getLogger(DiverseStrategy.class);

    @Value("${app.resolver.max-diverse-categories:5}")
    private int maxCategories;

    @Override
    public Tier tier() {
        return Tier.DIVERSE;
    }

    @Override
    public Optional<List<String>> selectCategories(ResolutionContext context) {
        int limit = Math.min(context.getN(), maxCategories);
        if (limit <= 0) {
            return Optional.of(List.of());
        }

        List<String> order = new ArrayList<>(context.getTaxonomy().getConcreteCategories());
        Map<String, Integer> eligibleCounts = new HashMap<>();
        for (String category : order) {
            int count = context.eligibleItems(category).size();
            if (count > 0) {
                eligibleCounts.put(category, count);
            }
        }

        // stable sort keeps taxonomy order among equal counts
        List<String> selected = order.stream()
                .filter(eligibleCounts::containsKey)
                .sorted(Comparator.comparing(eligibleCounts::get, Comparator.reverseOrder()))
                .limit(limit)
                .collect(Collectors.toList());
        logger.debug("Diverse scan: {} of {} categories stocked, selected {}",
                eligibleCounts.size(), order.size(), selected);
        return Optional.of(selected);
    }
}
