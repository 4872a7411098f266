package com.github.dimitryivaniuta.storefront.search;

import com.github.dimitryivaniuta.storefront.search.lexicon.KeywordCategory;

/**
 * A normalized search term. {@code category} is null for content words the lexicon does not know.
 */
public record Keyword(String term, KeywordCategory category, boolean negated) {

    public boolean isCategorized() {
        return category != null;
    }

    public boolean is(KeywordCategory c) {
        return category == c;
    }
}
