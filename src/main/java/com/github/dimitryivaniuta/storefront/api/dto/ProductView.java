package com.github.dimitryivaniuta.storefront.api.dto;

import com.github.dimitryivaniuta.storefront.catalog.CatalogItem;

import java.math.BigDecimal;
import java.util.List;

public record ProductView(
        String id,
        String name,
        BigDecimal price,
        double rating,
        int stockQuantity,
        String category,
        List<String> tags,
        boolean bestSeller
) {

    public static ProductView from(CatalogItem item) {
        return new ProductView(item.id(), item.name(), item.price(), item.rating(), item.stockQuantity(),
                item.category(), item.tags(), item.bestSeller());
    }
}
