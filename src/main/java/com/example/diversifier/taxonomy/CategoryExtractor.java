package com.example.diversifier.taxonomy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Maps free text to the concrete categories it mentions.
 *
 * <p>Every matching category is returned; a parent keyword contributes all of
 * its concrete children. Results are ordered by specificity (word count of the
 * longest matching keyword, halved for parent expansions) and then by the order
 * in which they were first detected. The extractor holds no state: the same
 * text, taxonomy and language always give the same list.
 */
@Component
public class CategoryExtractor {

    private static final Logger logger = LoggerFactory.getLogger(CategoryExtractor.class);

    private static final double PARENT_EXPANSION_WEIGHT = 0.5;

    public List<String> extract(String text, CategoryTaxonomy taxonomy) {
        return extract(text, taxonomy, null);
    }

    /**
     * @param language keyword language to search, or {@code null} for all of them
     * @return matched concrete labels without duplicates; empty when nothing matches
     */
    public List<String> extract(String text, CategoryTaxonomy taxonomy, String language) {
        if (text == null || text.isBlank() || taxonomy == null) {
            return List.of();
        }
        String normalized = TextNormalizer.normalize(text);

        Map<String, Double> specificity = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, List<KeywordPattern>>> byLanguage : taxonomy.getKeywords().entrySet()) {
            if (language != null && !language.equalsIgnoreCase(byLanguage.getKey())) {
                continue;
            }
            for (Map.Entry<String, List<KeywordPattern>> byLabel : byLanguage.getValue().entrySet()) {
                int longest = longestMatch(byLabel.getValue(), normalized);
                if (longest == 0) {
                    continue;
                }
                String label = byLabel.getKey();
                if (taxonomy.isParent(label)) {
                    expandParent(taxonomy, label, longest * PARENT_EXPANSION_WEIGHT, specificity);
                } else if (taxonomy.isConcrete(label)) {
                    specificity.merge(label, (double) longest, Math::max);
                } else {
                    logger.warn("Keyword label '{}' is neither concrete nor parent in taxonomy {}, ignoring",
                            label, taxonomy.getVersion());
                }
            }
        }

        if (specificity.isEmpty()) {
            logger.debug("No category detected in query: '{}'", abbreviate(text));
            return List.of();
        }

        List<String> ordered = new ArrayList<>(specificity.keySet());
        // List.sort is stable, so equal scores keep detection order
        ordered.sort(Comparator.comparing(specificity::get, Comparator.reverseOrder()));
        logger.debug("Detected categories {} in query: '{}'", ordered, abbreviate(text));
        return Collections.unmodifiableList(ordered);
    }

    private static int longestMatch(List<KeywordPattern> patterns, String normalizedText) {
        int longest = 0;
        for (KeywordPattern pattern : patterns) {
            if (pattern.getWordCount() > longest && pattern.matches(normalizedText)) {
                longest = pattern.getWordCount();
            }
        }
        return longest;
    }

    private static void expandParent(CategoryTaxonomy taxonomy, String parent, double score,
                                     Map<String, Double> specificity) {
        for (String child : taxonomy.childrenOf(parent)) {
            if (taxonomy.isConcrete(child)) {
                specificity.merge(child, score, Math::max);
            } else {
                logger.warn("Parent '{}' expands to '{}' which is not a concrete category in taxonomy {}, dropping",
                        parent, child, taxonomy.getVersion());
            }
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }
}
