package com.github.dimitryivaniuta.storefront.gateway.error;

/** Caller interrupted the call or its deadline ran out. Never retried. */
public class CallCancelledException extends CatalogAccessException {

    public CallCancelledException(String message) {
        this(message, null);
    }

    public CallCancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, ErrorKind.CANCELLED.defaultStatus(), message, cause);
    }
}
