package com.github.dimitryivaniuta.storefront.web;

import com.github.dimitryivaniuta.storefront.gateway.UpstreamResponse;
import lombok.Getter;

/**
 * Raised by controllers when a catalog read came back as a failed envelope, so that
 * {@link GlobalExceptionHandler} can pick the HTTP status.
 */
@Getter
public class UpstreamFailureException extends RuntimeException {

    private final transient UpstreamResponse envelope;

    public UpstreamFailureException(UpstreamResponse envelope) {
        super(envelope.errorMessage());
        this.envelope = envelope;
    }
}
