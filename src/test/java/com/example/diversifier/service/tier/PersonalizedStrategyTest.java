package com.example.diversifier.service.tier;

import com.example.diversifier.model.PseudoEvent;
import com.example.diversifier.model.Tier;
import com.example.diversifier.taxonomy.CategoryTaxonomy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PersonalizedStrategyTest {

    private PersonalizedStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new PersonalizedStrategy();
        ReflectionTestUtils.setField(strategy, "maxCategories", 3);
    }

    @Test
    void testSelectCategories_NoHistoryDoesNotApply() {
        assertEquals(Optional.empty(), strategy.selectCategories(context(List.of())));
        assertEquals(Tier.PERSONALIZED, strategy.tier());
    }

    @Test
    void testSelectCategories_RanksByFrequency() {
        List<PseudoEvent> events = List.of(
                new PseudoEvent("FALDAS", 1),
                new PseudoEvent("ZAPATOS", 2),
                new PseudoEvent("ZAPATOS", 3),
                new PseudoEvent("TOPS", 3));

        List<String> selected = strategy.selectCategories(context(events)).orElseThrow();

        assertEquals(List.of("ZAPATOS", "FALDAS", "TOPS"), selected);
    }

    @Test
    void testSelectCategories_TieGoesToEarliestTurn() {
        List<PseudoEvent> events = List.of(
                new PseudoEvent("TOPS", 4),
                new PseudoEvent("FALDAS", 2),
                new PseudoEvent("ZAPATOS", 3));

        List<String> selected = strategy.selectCategories(context(events)).orElseThrow();

        assertEquals(List.of("FALDAS", "ZAPATOS", "TOPS"), selected);
    }

    @Test
    void testSelectCategories_SameTurnTieKeepsFirstAppearance() {
        List<PseudoEvent> events = List.of(
                new PseudoEvent("VESTIDOS LARGOS", 1),
                new PseudoEvent("VESTIDOS CORTOS", 1));

        assertEquals(List.of("VESTIDOS LARGOS", "VESTIDOS CORTOS"),
                strategy.selectCategories(context(events)).orElseThrow());
    }

    @Test
    void testSelectCategories_EveryCategoryOfAMultiCategoryTurnCounts() {
        // turn 1 named two categories, turn 2 repeated the second one
        List<PseudoEvent> events = List.of(
                new PseudoEvent("ZAPATOS", 1),
                new PseudoEvent("BOLSOS", 1),
                new PseudoEvent("BOLSOS", 2));

        assertEquals(List.of("BOLSOS", "ZAPATOS"), strategy.selectCategories(context(events)).orElseThrow());
    }

    @Test
    void testSelectCategories_CappedAtMaximum() {
        List<PseudoEvent> events = List.of(
                new PseudoEvent("A", 1), new PseudoEvent("B", 1), new PseudoEvent("C", 1),
                new PseudoEvent("D", 1), new PseudoEvent("E", 1));

        assertEquals(List.of("A", "B", "C"), strategy.selectCategories(context(events)).orElseThrow());
    }

    private static ResolutionContext context(List<PseudoEvent> events) {
        return ResolutionContext.builder()
                .n(5)
                .taxonomy(CategoryTaxonomy.empty())
                .pseudoEvents(events)
                .build();
    }
}
