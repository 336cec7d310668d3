package com.example.diversifier.taxonomy;

import java.util.*;

/**
 * Immutable category table: concrete labels, parent expansions and per-language keywords.
 * A refresh builds a new instance; readers never see a partially updated table.
 */
public final class CategoryTaxonomy {

    private final String version;
    private final Set<String> concreteCategories;
    private final Map<String, Set<String>> parentToChildren;
    private final Map<String, Map<String, List<KeywordPattern>>> keywords;

    private CategoryTaxonomy(Builder builder) {
        this.version = builder.version;
        this.concreteCategories = Collections.unmodifiableSet(new LinkedHashSet<>(builder.concreteCategories));
        Map<String, Set<String>> parents = new LinkedHashMap<>();
        builder.parentToChildren.forEach((parent, children) ->
                parents.put(parent, Collections.unmodifiableSet(new LinkedHashSet<>(children))));
        this.parentToChildren = Collections.unmodifiableMap(parents);
        Map<String, Map<String, List<KeywordPattern>>> byLanguage = new LinkedHashMap<>();
        builder.keywords.forEach((language, byLabel) -> {
            Map<String, List<KeywordPattern>> copy = new LinkedHashMap<>();
            byLabel.forEach((label, patterns) -> copy.put(label, List.copyOf(patterns)));
            byLanguage.put(language, Collections.unmodifiableMap(copy));
        });
        this.keywords = Collections.unmodifiableMap(byLanguage);
    }

    public static Builder builder(String version) {
        return new Builder(version);
    }

    public static CategoryTaxonomy empty() {
        return builder("empty").build();
    }

    public String getVersion() {
        return version;
    }

    /** Concrete labels in declaration order. */
    public Set<String> getConcreteCategories() {
        return concreteCategories;
    }

    public Map<String, Set<String>> getParentToChildren() {
        return parentToChildren;
    }

    public Map<String, Map<String, List<KeywordPattern>>> getKeywords() {
        return keywords;
    }

    public Set<String> languages() {
        return keywords.keySet();
    }

    public boolean isConcrete(String label) {
        return concreteCategories.contains(label);
    }

    public boolean isParent(String label) {
        return parentToChildren.containsKey(label);
    }

    public Set<String> childrenOf(String parent) {
        return parentToChildren.getOrDefault(parent, Set.of());
    }

    @Override
    public String toString() {
        return "CategoryTaxonomy{version=" + version + ", concrete=" + concreteCategories.size()
                + ", parents=" + parentToChildren.size() + ", languages=" + keywords.keySet() + "}";
    }

    public static final class Builder {
        private final String version;
        private final Set<String> concreteCategories = new LinkedHashSet<>();
        private final Map<String, List<String>> parentToChildren = new LinkedHashMap<>();
        private final Map<String, Map<String, List<KeywordPattern>>> keywords = new LinkedHashMap<>();

        private Builder(String version) {
            this.version = Objects.requireNonNull(version, "version");
        }

        public Builder concrete(String label, String language, String... words) {
            concreteCategories.add(label);
            return keywords(label, language, words);
        }

        public Builder parent(String label, List<String> children, String language, String... words) {
            if (concreteCategories.contains(label)) {
                throw new IllegalArgumentException("Label is already concrete: " + label);
            }
            parentToChildren.computeIfAbsent(label, k -> new ArrayList<>());
            for (String child : children) {
                if (!parentToChildren.get(label).contains(child)) {
                    parentToChildren.get(label).add(child);
                }
            }
            return keywords(label, language, words);
        }

        public Builder keywords(String label, String language, String... words) {
            if (language == null || words == null || words.length == 0) {
                return this;
            }
            List<KeywordPattern> patterns = keywords
                    .computeIfAbsent(language, k -> new LinkedHashMap<>())
                    .computeIfAbsent(label, k -> new ArrayList<>());
            for (String word : words) {
                KeywordPattern compiled = KeywordPattern.compile(word);
                if (!patterns.contains(compiled)) {
                    patterns.add(compiled);
                }
            }
            return this;
        }

        public CategoryTaxonomy build() {
            for (String parent : parentToChildren.keySet()) {
                if (concreteCategories.contains(parent)) {
                    throw new IllegalArgumentException("Label is both parent and concrete: " + parent);
                }
            }
            return new CategoryTaxonomy(this);
        }
    }
}
