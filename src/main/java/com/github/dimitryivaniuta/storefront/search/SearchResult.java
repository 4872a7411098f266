package com.github.dimitryivaniuta.storefront.search;

import com.github.dimitryivaniuta.storefront.catalog.CatalogItem;
import com.github.dimitryivaniuta.storefront.gateway.UpstreamResponse;

import java.util.List;

/**
 * Ranked matches plus the envelope of the upstream call that produced them. On upstream
 * failure {@code matches} is empty and {@code envelope} carries the error.
 */
public record SearchResult(List<ScoredMatch> matches, UpstreamResponse envelope, NormalizedQuery query) {

    public SearchResult {
        matches = List.copyOf(matches);
    }

    public List<CatalogItem> items() {
        return matches.stream().map(ScoredMatch::item).toList();
    }

    public boolean isSuccess() {
        return envelope.success();
    }
}
