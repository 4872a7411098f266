package com.github.dimitryivaniuta.storefront.search.lexicon;

public enum KeywordCategory {
    COLOR,
    GARMENT,
    SEASON,
    OCCASION,
    MATERIAL,
    PRICE,
    STYLE,
    AUDIENCE
}
