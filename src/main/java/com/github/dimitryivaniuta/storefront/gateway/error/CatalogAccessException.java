package com.github.dimitryivaniuta.storefront.gateway.error;

import lombok.Getter;

/**
 * Base of every failure raised between the Gateway and the upstream catalog.
 * Never escapes the Gateway; it is folded into an {@code UpstreamResponse}.
 */
@Getter
public abstract class CatalogAccessException extends RuntimeException {

    private final ErrorKind errorKind;
    private final int statusCode;

    protected CatalogAccessException(ErrorKind errorKind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
        this.statusCode = statusCode;
    }

    public boolean isRetryable() {
        return errorKind.isRetryable();
    }
}
