package com.github.dimitryivaniuta.storefront.api.dto;

import com.github.dimitryivaniuta.storefront.search.ScoredMatch;

public record RankedProductView(
        int rank,
        double score,
        boolean exactMatch,
        ProductView product
) {

    public static RankedProductView from(ScoredMatch m) {
        return new RankedProductView(m.rank(), m.similarityScore(), m.exactMatch(), ProductView.from(m.item()));
    }
}
