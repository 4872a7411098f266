package com.github.dimitryivaniuta.storefront.gateway.error;

public class UpstreamServerException extends CatalogAccessException {

    public UpstreamServerException(int statusCode, String message) {
        this(statusCode, message, null);
    }

    public UpstreamServerException(int statusCode, String message, Throwable cause) {
        super(ErrorKind.UPSTREAM_SERVER, statusCode, message, cause);
    }
}
