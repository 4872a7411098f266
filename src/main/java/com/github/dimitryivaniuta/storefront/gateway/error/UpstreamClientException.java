package com.github.dimitryivaniuta.storefront.gateway.error;

/** 4xx from the catalog. Terminal: the same request will fail the same way. */
public class UpstreamClientException extends CatalogAccessException {

    public UpstreamClientException(int statusCode, String message) {
        this(statusCode, message, null);
    }

    public UpstreamClientException(int statusCode, String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_CLIENT, statusCode, message, cause);
    }

    public boolean isNotFound() {
        return getStatusCode() == 404;
    }
}
