package com.github.dimitryivaniuta.storefront.gateway.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.dimitryivaniuta.storefront.gateway.CatalogEndpoint;

import java.util.Map;

/**
 * One raw request to the upstream catalog.
 *
 * Implementations throw the {@code gateway.error} taxonomy: transient network problems,
 * upstream 5xx, upstream 4xx, or cancellation when the calling thread is interrupted.
 */
public interface CatalogTransport {

    JsonNode fetch(CatalogEndpoint endpoint, Map<String, String> params);
}
