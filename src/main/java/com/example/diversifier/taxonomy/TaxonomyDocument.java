package com.example.diversifier.taxonomy;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaxonomyDocument {
    private String version;
    private List<CategoryEntry> categories = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoryEntry {
        private String label;
        private String type; // concrete | parent
        private List<String> subcategories = new ArrayList<>();
        private Map<String, List<String>> keywords = new LinkedHashMap<>();
    }

    public CategoryTaxonomy toTaxonomy() {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Taxonomy document has no version");
        }
        CategoryTaxonomy.Builder builder = CategoryTaxonomy.builder(version);
        // concrete labels first so that parents may reference them in any order
        for (CategoryEntry entry : categories) {
            if ("concrete".equalsIgnoreCase(entry.getType())) {
                builder.concrete(entry.getLabel(), null);
                addKeywords(builder, entry);
            }
        }
        for (CategoryEntry entry : categories) {
            if ("parent".equalsIgnoreCase(entry.getType())) {
                builder.parent(entry.getLabel(), entry.getSubcategories() == null ? List.of() : entry.getSubcategories(), null);
                addKeywords(builder, entry);
            } else if (!"concrete".equalsIgnoreCase(entry.getType())) {
                throw new IllegalArgumentException("Unknown category type '" + entry.getType() + "' for " + entry.getLabel());
            }
        }
        return builder.build();
    }

    private static void addKeywords(CategoryTaxonomy.Builder builder, CategoryEntry entry) {
        if (entry.getKeywords() == null) return;
        entry.getKeywords().forEach((language, words) ->
                builder.keywords(entry.getLabel(), language, words.toArray(new String[0])));
    }
}
