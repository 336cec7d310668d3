package com.example.diversifier.service.tier;

import com.example.diversifier.model.Tier;
import com.example.diversifier.taxonomy.CategoryExtractor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Applies whenever the current query names at least one category.
 */
@Component
public class QueryDrivenStrategy implements TierStrategy {

    private final CategoryExtractor categoryExtractor;

    public QueryDrivenStrategy(CategoryExtractor categoryExtractor) {
        this.categoryExtractor = categoryExtractor;
    }

    @Override
    public Tier tier() {
        return Tier.QUERY_DRIVEN;
    }

    @Override
    public Optional<List<String>> selectCategories(ResolutionContext context) {
        List<String> detected = categoryExtractor.extract(context.getUserQuery(), context.getTaxonomy(),
                context.getLanguage());
        return detected.isEmpty() ? Optional.empty() : Optional.of(detected);
    }
}
