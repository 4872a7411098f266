package com.github.dimitryivaniuta.storefront.api.dto;

import com.github.dimitryivaniuta.storefront.search.Keyword;

public record KeywordView(String term, String category, boolean negated) {

    public static KeywordView from(Keyword k) {
        return new KeywordView(k.term(), k.category() == null ? null : k.category().name(), k.negated());
    }
}
