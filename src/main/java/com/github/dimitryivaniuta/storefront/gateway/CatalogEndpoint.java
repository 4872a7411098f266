package com.github.dimitryivaniuta.storefront.gateway;

import java.util.Map;

/**
 * Logical read-only operations of the upstream catalog.
 *
 * Paths are relative to the configured base URL. A {@code {id}} segment is filled from
 * the parameter named by {@link #pathVariable()} and removed from the query string.
 */
public enum CatalogEndpoint {
    LIST("/products", null),
    DETAIL("/product-details/{id}", "id"),
    DETAIL_LEGACY("/product/{id}", "id"),
    SEARCH("/filter-products", null),
    BY_CATEGORY("/products", null);

    private final String pathTemplate;
    private final String pathVariable;

    CatalogEndpoint(String pathTemplate, String pathVariable) {
        this.pathTemplate = pathTemplate;
        this.pathVariable = pathVariable;
    }

    public String pathTemplate() {
        return pathTemplate;
    }

    public String pathVariable() {
        return pathVariable;
    }

    public boolean hasPathVariable() {
        return pathVariable != null;
    }

    /** Whether {@code params} carries a usable value for the path variable, if this endpoint has one. */
    public boolean acceptsParams(Map<String, String> params) {
        if (pathVariable == null) {
            return true;
        }
        String value = params == null ? null : params.get(pathVariable);
        return value != null && !value.isBlank();
    }

    // low-cardinality tag for metrics
    public String metricKey() {
        return name().toLowerCase(java.util.Locale.ROOT);
    }
}
