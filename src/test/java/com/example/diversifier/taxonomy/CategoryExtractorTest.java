package com.example.diversifier.taxonomy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CategoryExtractorTest {

    private CategoryExtractor extractor;
    private CategoryTaxonomy taxonomy;

    @BeforeEach
    void setUp() {
        extractor = new CategoryExtractor();
        taxonomy = CategoryTaxonomy.builder("test-1")
                .concrete("VESTIDOS LARGOS", "es", "vestido largo", "vestido de noche")
                .concrete("VESTIDOS CORTOS", "es", "vestido corto")
                .concrete("ZAPATOS", "es", "zapatos", "sandalias")
                .keywords("ZAPATOS", "en", "shoes")
                .concrete("BOLSOS", "es", "bolso", "cartera")
                .keywords("BOLSOS", "en", "bag", "bags")
                .parent("VESTIDOS", List.of("VESTIDOS LARGOS", "VESTIDOS CORTOS"), "es", "vestido", "vestidos")
                .keywords("VESTIDOS", "en", "dress", "dresses")
                .build();
    }

    @Test
    void testExtract_ReturnsEveryMatchedCategory() {
        List<String> result = extractor.extract("Busco zapatos y un bolso", taxonomy);

        assertEquals(List.of("ZAPATOS", "BOLSOS"), result);
    }

    @Test
    void testExtract_ParentExpandsToAllChildren() {
        List<String> result = extractor.extract("elegant dresses for a wedding", taxonomy);

        assertEquals(List.of("VESTIDOS LARGOS", "VESTIDOS CORTOS"), result);
    }

    @Test
    void testExtract_LongerKeywordRanksFirst() {
        // "vestido de noche" (3 words) beats "sandalias" (1) and the parent expansion
        List<String> result = extractor.extract("sandalias para un vestido de noche", taxonomy);

        assertEquals(List.of("VESTIDOS LARGOS", "ZAPATOS", "VESTIDOS CORTOS"), result);
    }

    @Test
    void testExtract_IgnoresCaseAndAccents() {
        List<String> result = extractor.extract("  SANDÁLIAS   baratas ", taxonomy);

        assertEquals(List.of("ZAPATOS"), result);
    }

    @Test
    void testExtract_MatchesWholeWordsOnly() {
        assertTrue(extractor.extract("bagsy carteras", taxonomy).isEmpty());
    }

    @Test
    void testExtract_RestrictedToLanguage() {
        assertEquals(List.of("BOLSOS"), extractor.extract("bags y zapatos", taxonomy, "en"));
        assertEquals(List.of("ZAPATOS"), extractor.extract("bags y zapatos", taxonomy, "es"));
        assertTrue(extractor.extract("bags y zapatos", taxonomy, "fr").isEmpty());
    }

    @Test
    void testExtract_BlankOrUnmatchedTextIsEmpty() {
        assertTrue(extractor.extract("", taxonomy).isEmpty());
        assertTrue(extractor.extract("   ", taxonomy).isEmpty());
        assertTrue(extractor.extract(null, taxonomy).isEmpty());
        assertTrue(extractor.extract("something nice", taxonomy).isEmpty());
    }

    @Test
    void testExtract_DropsChildrenMissingFromTaxonomy() {
        CategoryTaxonomy drifted = CategoryTaxonomy.builder("drifted")
                .concrete("FALDAS", "es", "falda")
                .parent("ROPA", List.of("FALDAS", "BLUSAS"), "es", "ropa")
                .build();

        assertEquals(List.of("FALDAS"), extractor.extract("ropa de verano", drifted));
    }

    @Test
    void testExtract_IsDeterministic() {
        String query = "vestido corto con sandalias y bolso";

        List<String> first = extractor.extract(query, taxonomy);
        List<String> second = extractor.extract(query, taxonomy);

        assertEquals(first, second);
        assertThrows(UnsupportedOperationException.class, () -> first.add("X"));
    }
}
