package com.github.dimitryivaniuta.storefront.search;

import com.github.dimitryivaniuta.storefront.search.lexicon.KeywordCategory;

import java.util.List;
import java.util.Optional;

/**
 * Output of {@link QueryNormalizer}. Keywords keep query order and are distinct by term.
 */
public record NormalizedQuery(String canonicalText, List<Keyword> keywords, SearchIntent intent) {

    public NormalizedQuery {
        keywords = List.copyOf(keywords);
    }

    public boolean isBlank() {
        return canonicalText.isBlank();
    }

    public List<Keyword> positiveKeywords() {
        return keywords.stream().filter(k -> !k.negated()).toList();
    }

    public List<Keyword> negatedKeywords() {
        return keywords.stream().filter(Keyword::negated).toList();
    }

    public Optional<Keyword> firstPositive(KeywordCategory category) {
        return keywords.stream().filter(k -> !k.negated() && k.is(category)).findFirst();
    }
}
