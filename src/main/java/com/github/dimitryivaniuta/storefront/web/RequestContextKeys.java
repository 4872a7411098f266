package com.github.dimitryivaniuta.storefront.web;


public final class RequestContextKeys {
    private RequestContextKeys() {}

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    public static final String RETRY_AFTER_HEADER = "Retry-After";
}
