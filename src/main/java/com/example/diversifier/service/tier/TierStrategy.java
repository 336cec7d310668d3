package com.example.diversifier.service.tier;

import com.example.diversifier.model.Tier;

import java.util.List;
import java.util.Optional;

/**
 * One rung of the category selection ladder.
 */
public interface TierStrategy {

    Tier tier();

    /**
     * @return the categories to serve in priority order, or empty when this tier does not apply
     */
    Optional<List<String>> selectCategories(ResolutionContext context);
}
