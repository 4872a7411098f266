package com.github.dimitryivaniuta.storefront.catalog;

import com.github.dimitryivaniuta.storefront.gateway.CatalogEndpoint;
import com.github.dimitryivaniuta.storefront.gateway.CatalogGateway;
import com.github.dimitryivaniuta.storefront.gateway.UpstreamResponse;
import com.github.dimitryivaniuta.storefront.gateway.cache.CacheStrategy;
import com.github.dimitryivaniuta.storefront.gateway.error.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed product operations on top of {@link CatalogGateway}. Never throws for upstream
 * failures; argument errors throw {@link IllegalArgumentException}.
 */
@Slf4j
@RequiredArgsConstructor
public class CatalogClient {

    private final CatalogGateway gateway;

    public CatalogResult<List<CatalogItem>> listProducts(int page, int pageSize) {
        return list(CatalogEndpoint.LIST, ProductFilter.ofPage(page, pageSize).toParams(), CacheStrategy.MEDIUM_TERM);
    }

    /**
     * Reads one product from {@code /product-details/{id}}; a 404 there is retried once on the
     * legacy {@code /product/{id}} path.
     */
    public CatalogResult<Optional<CatalogItem>> productDetails(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("product id must not be blank");
        }
        Map<String, String> params = Map.of("id", id.strip());
        UpstreamResponse r = gateway.call(CatalogEndpoint.DETAIL, params, CacheStrategy.LONG_TERM);
        if (r.isFailure() && r.errorKind() == ErrorKind.UPSTREAM_CLIENT && r.statusCode() == 404) {
            log.debug("Product {} not found on {}, trying {}", id, CatalogEndpoint.DETAIL, CatalogEndpoint.DETAIL_LEGACY);
            r = gateway.call(CatalogEndpoint.DETAIL_LEGACY, params, CacheStrategy.LONG_TERM);
        }
        if (r.isFailure()) {
            return new CatalogResult<>(Optional.empty(), r);
        }
        return new CatalogResult<>(CatalogItemParser.parseOne(r.data()), r);
    }

    public CatalogResult<List<CatalogItem>> searchByText(String text, int page, int pageSize) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("search text must not be blank");
        }
        ProductFilter filter = ProductFilter.builder().search(text).page(page).pageSize(pageSize).build();
        return list(CatalogEndpoint.SEARCH, filter.toParams(), CacheStrategy.SHORT_TERM);
    }

    public CatalogResult<List<CatalogItem>> productsByCategory(String category, int page, int pageSize) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category must not be blank");
        }
        ProductFilter filter = ProductFilter.builder().category(category).page(page).pageSize(pageSize).build();
        return list(CatalogEndpoint.BY_CATEGORY, filter.toParams(), CacheStrategy.MEDIUM_TERM);
    }

    public CatalogResult<List<CatalogItem>> filterProducts(ProductFilter filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter must not be null");
        }
        return list(CatalogEndpoint.SEARCH, filter.toParams(), CacheStrategy.MEDIUM_TERM);
    }

    /**
     * Price filtering upstream is unreliable, so this reads a larger page (three times
     * {@code pageSize}, capped at {@link ProductFilter#MAX_PAGE_SIZE}) and filters locally,
     * bounds inclusive, then pages the filtered list.
     */
    public CatalogResult<List<CatalogItem>> productsByPriceRange(BigDecimal min, BigDecimal max, int page, int pageSize) {
        if (min == null || max == null) {
            throw new IllegalArgumentException("min and max price are required");
        }
        // validates bounds and paging
        ProductFilter.builder().minPrice(min).maxPrice(max).page(page).pageSize(pageSize).build();

        int pool = Math.min(ProductFilter.MAX_PAGE_SIZE, pageSize * 3);
        CatalogResult<List<CatalogItem>> wide = list(
                CatalogEndpoint.SEARCH, ProductFilter.ofPage(1, pool).toParams(), CacheStrategy.MEDIUM_TERM);
        if (!wide.isSuccess()) {
            return wide;
        }

        List<CatalogItem> inRange = wide.value().stream()
                .filter(i -> i.price() != null && i.price().compareTo(min) >= 0 && i.price().compareTo(max) <= 0)
                .toList();
        int from = Math.min(inRange.size(), (page - 1) * pageSize);
        int to = Math.min(inRange.size(), from + pageSize);
        return new CatalogResult<>(inRange.subList(from, to), wide.envelope());
    }

    private CatalogResult<List<CatalogItem>> list(CatalogEndpoint endpoint, Map<String, String> params, CacheStrategy strategy) {
        UpstreamResponse r = gateway.call(endpoint, params, strategy);
        if (r.isFailure()) {
            return new CatalogResult<>(List.of(), r);
        }
        return new CatalogResult<>(CatalogItemParser.parseList(r.data()), r);
    }
}
