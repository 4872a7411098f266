package com.github.dimitryivaniuta.storefront.gateway.error;

/**
 * Request rejected before it reached the catalog, e.g. a detail lookup without an id.
 * Reported like a catalog 400: terminal, and no evidence about upstream health.
 */
public class InvalidCatalogRequestException extends UpstreamClientException {

    public InvalidCatalogRequestException(String message) {
        super(400, message);
    }
}
