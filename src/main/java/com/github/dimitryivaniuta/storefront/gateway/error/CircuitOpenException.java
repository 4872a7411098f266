package com.github.dimitryivaniuta.storefront.gateway.error;

public class CircuitOpenException extends CatalogAccessException {

    public CircuitOpenException(String message) {
        super(ErrorKind.CIRCUIT_OPEN, ErrorKind.CIRCUIT_OPEN.defaultStatus(), message, null);
    }
}
