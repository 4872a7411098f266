package com.github.dimitryivaniuta.storefront.gateway.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.github.dimitryivaniuta.storefront.gateway.CatalogEndpoint;
import com.github.dimitryivaniuta.storefront.gateway.error.CallCancelledException;
import com.github.dimitryivaniuta.storefront.gateway.error.InvalidCatalogRequestException;
import com.github.dimitryivaniuta.storefront.gateway.error.TransientNetworkException;
import com.github.dimitryivaniuta.storefront.gateway.error.UpstreamClientException;
import com.github.dimitryivaniuta.storefront.gateway.error.UpstreamServerException;
import com.github.dimitryivaniuta.storefront.web.RequestContextKeys;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * HTTP/JSON GET transport over a {@link RestTemplate}.
 *
 * Query values are passed as URI variables so they are always strictly encoded
 * (Arabic text, {@code &}, {@code +}). The RestTemplate is expected to use an interruptible
 * request factory; an interrupted exchange surfaces as a {@link ResourceAccessException}
 * and is reported as cancellation.
 */
@Slf4j
public class RestCatalogTransport implements CatalogTransport {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String language;
    private final String userAgent;

    public RestCatalogTransport(RestTemplate restTemplate, String baseUrl, String language, String userAgent) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.baseUrl = trimTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl must not be null"));
        this.language = language;
        this.userAgent = userAgent;
    }

    @Override
    public JsonNode fetch(CatalogEndpoint endpoint, Map<String, String> params) {
        URI uri = buildUri(endpoint, params);
        HttpEntity<Void> entity = new HttpEntity<>(headers());

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(uri, HttpMethod.GET, entity, JsonNode.class);
            JsonNode body = response.getBody();
            return body == null ? NullNode.getInstance() : body;
        } catch (ResourceAccessException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CallCancelledException("Catalog call interrupted: " + endpoint, e);
            }
            throw new TransientNetworkException("Catalog unreachable: " + endpoint + " (" + e.getMessage() + ")", e);
        } catch (HttpServerErrorException e) {
            throw new UpstreamServerException(e.getStatusCode().value(),
                    "Catalog error " + e.getStatusCode().value() + " on " + endpoint, e);
        } catch (HttpClientErrorException e) {
            throw new UpstreamClientException(e.getStatusCode().value(),
                    "Catalog rejected " + endpoint + " with " + e.getStatusCode().value(), e);
        } catch (RestClientResponseException e) {
            throw new UpstreamServerException(502,
                    "Catalog answered with unexpected status " + e.getStatusCode().value() + " on " + endpoint, e);
        } catch (RestClientException e) {
            throw new UpstreamServerException(502, "Malformed catalog response on " + endpoint + ": " + e.getMessage(), e);
        }
    }

    URI buildUri(CatalogEndpoint endpoint, Map<String, String> params) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        Map<String, String> query = new TreeMap<>();
        if (params != null) {
            params.forEach((k, v) -> {
                if (k != null && v != null) query.put(k, v);
            });
        }

        Map<String, Object> vars = new HashMap<>();
        if (endpoint.hasPathVariable()) {
            String value = query.remove(endpoint.pathVariable());
            if (value == null || value.isBlank()) {
                throw new InvalidCatalogRequestException(endpoint + " requires parameter '" + endpoint.pathVariable() + "'");
            }
            vars.put(endpoint.pathVariable(), value);
        }

        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl + endpoint.pathTemplate());
        int i = 0;
        for (Map.Entry<String, String> e : query.entrySet()) {
            String var = "q" + i++;
            builder.queryParam(e.getKey(), "{" + var + "}");
            vars.put(var, e.getValue());
        }
        return builder.encode().buildAndExpand(vars).toUri();
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (language != null && !language.isBlank()) {
            headers.set(HttpHeaders.ACCEPT_LANGUAGE, language);
        }
        if (userAgent != null && !userAgent.isBlank()) {
            headers.set(HttpHeaders.USER_AGENT, userAgent);
        }
        String corr = MDC.get(RequestContextKeys.CORRELATION_ID_MDC_KEY);
        if (corr != null && !corr.isBlank()) {
            headers.set(RequestContextKeys.CORRELATION_ID_HEADER, corr);
        }
        return headers;
    }

    private static String trimTrailingSlash(String base) {
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }
}
