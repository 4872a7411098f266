package com.github.dimitryivaniuta.storefront.catalog;

import com.github.dimitryivaniuta.storefront.gateway.UpstreamResponse;

/**
 * Typed value plus the Gateway envelope it came from. On failure {@code value} is the
 * operation's empty value (empty list, empty optional), never null.
 */
public record CatalogResult<T>(T value, UpstreamResponse envelope) {

    public boolean isSuccess() {
        return envelope.success();
    }
}
