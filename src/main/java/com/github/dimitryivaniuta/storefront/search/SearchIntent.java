package com.github.dimitryivaniuta.storefront.search;

/**
 * What the shopper asked for beyond plain keywords. Any field may be null.
 *
 * @param completeOutfit true when the query asks for an outfit or set rather than a single piece
 */
public record SearchIntent(Season season, Occasion occasion, PriceBand priceBand, boolean completeOutfit) {

    public static final SearchIntent NONE = new SearchIntent(null, null, null, false);
}
