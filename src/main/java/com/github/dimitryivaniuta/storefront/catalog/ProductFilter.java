package com.github.dimitryivaniuta.storefront.catalog;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Every filter the catalog's {@code /filter-products} endpoint understands, validated once.
 *
 * Null fields are simply not sent. {@code page} defaults to 1 and {@code pageSize} to 10.
 */
@Builder(toBuilder = true)
public record ProductFilter(
        String search,
        String productCode,
        List<String> colors,
        List<String> sizes,
        String material,
        String skuCode,
        String category,
        BigDecimal minPrice,
        BigDecimal maxPrice,
        Integer page,
        Integer pageSize
) {

    public static final int DEFAULT_PAGE_SIZE = 10;
    public static final int MAX_PAGE_SIZE = 100;

    public ProductFilter {
        page = page == null ? 1 : page;
        pageSize = pageSize == null ? DEFAULT_PAGE_SIZE : pageSize;
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1, got " + page);
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be within 1.." + MAX_PAGE_SIZE + ", got " + pageSize);
        }
        if (minPrice != null && minPrice.signum() < 0) {
            throw new IllegalArgumentException("minPrice must not be negative, got " + minPrice);
        }
        if (maxPrice != null && maxPrice.signum() < 0) {
            throw new IllegalArgumentException("maxPrice must not be negative, got " + maxPrice);
        }
        if (minPrice != null && maxPrice != null && minPrice.compareTo(maxPrice) > 0) {
            throw new IllegalArgumentException("minPrice " + minPrice + " is above maxPrice " + maxPrice);
        }
        colors = colors == null ? List.of() : colors.stream().filter(Objects::nonNull).toList();
        sizes = sizes == null ? List.of() : sizes.stream().filter(Objects::nonNull).toList();
    }

    public static ProductFilter ofPage(int page, int pageSize) {
        return ProductFilter.builder().page(page).pageSize(pageSize).build();
    }

    /** Upstream query parameters in key order; lists are comma separated. */
    public SortedMap<String, String> toParams() {
        SortedMap<String, String> p = new TreeMap<>();
        putText(p, "search", search);
        putText(p, "product_code", productCode);
        putList(p, "colors", colors);
        putList(p, "sizes", sizes);
        putText(p, "material", material);
        putText(p, "sku_code", skuCode);
        putText(p, "category", category);
        if (minPrice != null) p.put("min_price", minPrice.toPlainString());
        if (maxPrice != null) p.put("max_price", maxPrice.toPlainString());
        p.put("page", Integer.toString(page));
        p.put("page_size", Integer.toString(pageSize));
        return p;
    }

    private static void putText(Map<String, String> p, String key, String value) {
        if (value != null && !value.isBlank()) p.put(key, value.strip());
    }

    private static void putList(Map<String, String> p, String key, List<String> values) {
        List<String> clean = values.stream().filter(v -> !v.isBlank()).map(String::strip).toList();
        if (!clean.isEmpty()) p.put(key, String.join(",", clean));
    }
}
