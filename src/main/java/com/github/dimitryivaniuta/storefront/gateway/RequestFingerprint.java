package com.github.dimitryivaniuta.storefront.gateway;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Cache key of a logical request: SHA-256 over the endpoint and its sorted parameters.
 * Parameter insertion order never changes the digest.
 */
public record RequestFingerprint(String value) {

    public RequestFingerprint {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static RequestFingerprint of(CatalogEndpoint endpoint, Map<String, String> params) {
        Objects.requireNonNull(endpoint, "endpoint must not be null");
        return new RequestFingerprint(sha256(canonical(endpoint, params)));
    }

    static String canonical(CatalogEndpoint endpoint, Map<String, String> params) {
        StringBuilder sb = new StringBuilder(endpoint.name()).append('?');
        if (params != null && !params.isEmpty()) {
            boolean first = true;
            for (Map.Entry<String, String> e : new TreeMap<>(params).entrySet()) {
                if (e.getValue() == null) continue;
                if (!first) sb.append('&');
                sb.append(encode(e.getKey())).append('=').append(encode(e.getValue()));
                first = false;
            }
        }
        return sb.toString();
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String sha256(String canonical) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return toHex(md.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] b) {
        StringBuilder sb = new StringBuilder(b.length * 2);
        for (byte x : b) sb.append(String.format("%02x", x));
        return sb.toString();
    }

    @Override
    public String toString() {
        return value;
    }
}
