package com.github.dimitryivaniuta.storefront.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * One upstream product. Only the fields used for ranking and filtering are lifted out;
 * the untouched upstream object stays available as {@code raw}.
 */
public record CatalogItem(
        String id,
        String name,
        BigDecimal price,
        double rating,
        int stockQuantity,
        String category,
        List<String> tags,
        boolean bestSeller,
        @JsonIgnore JsonNode raw
) {

    public CatalogItem {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean inStock() {
        return stockQuantity > 0;
    }

    /** Name, category and tags, lowercased and space separated. */
    @JsonIgnore
    public String searchableText() {
        StringBuilder sb = new StringBuilder();
        if (name != null) sb.append(name);
        if (category != null) sb.append(' ').append(category);
        for (String t : tags) sb.append(' ').append(t);
        return sb.toString().toLowerCase(Locale.ROOT).strip();
    }
}
