package com.example.diversifier.taxonomy;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.regex.Pattern;

/**
 * A normalized keyword compiled to a whole-word pattern.
 */
@Getter
@ToString(of = "keyword")
@EqualsAndHashCode(of = "keyword")
public final class KeywordPattern {

    private final String keyword;
    private final Pattern pattern;
    private final int wordCount;

    private KeywordPattern(String keyword) {
        this.keyword = keyword;
        this.pattern = Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b");
        this.wordCount = keyword.split(" ").length;
    }

    public static KeywordPattern compile(String rawKeyword) {
        String normalized = TextNormalizer.normalize(rawKeyword);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Keyword is blank: '" + rawKeyword + "'");
        }
        return new KeywordPattern(normalized);
    }

    public boolean matches(String normalizedText) {
        return pattern.matcher(normalizedText).find();
    }
}
