package com.github.dimitryivaniuta.storefront.search;

import com.github.dimitryivaniuta.storefront.catalog.CatalogItem;

/**
 * @param rank 1-based position in the ranked result
 */
public record ScoredMatch(CatalogItem item, double similarityScore, boolean exactMatch, double businessWeight, int rank) {}
