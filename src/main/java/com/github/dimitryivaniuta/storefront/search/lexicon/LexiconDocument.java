package com.github.dimitryivaniuta.storefront.search.lexicon;

import com.github.dimitryivaniuta.storefront.search.PriceBand;

import java.util.List;
import java.util.Map;

/** JSON shape of the lexicon resource. */
public record LexiconDocument(
        String negationToken,
        List<String> negations,
        List<String> fillers,
        Map<String, String> substitutions,
        Map<KeywordCategory, List<String>> categories,
        Map<String, PriceBand> priceBands
) {}
