package com.github.dimitryivaniuta.storefront.gateway.error;

/** Timeouts, refused or reset connections. */
public class TransientNetworkException extends CatalogAccessException {

    public TransientNetworkException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_NETWORK, ErrorKind.TRANSIENT_NETWORK.defaultStatus(), message, cause);
    }
}
