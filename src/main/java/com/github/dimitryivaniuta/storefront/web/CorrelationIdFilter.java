package com.github.dimitryivaniuta.storefront.web;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts the caller's correlation id (or a fresh one) into the MDC for the duration of the
 * request. The catalog transport forwards it upstream, so one id ties both logs together.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CorrelationIdFilter implements Filter {

    private static final int MAX_LENGTH = 128;

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest request = (HttpServletRequest) req;
        HttpServletResponse response = (HttpServletResponse) res;

        String corr = sanitize(request.getHeader(RequestContextKeys.CORRELATION_ID_HEADER));
        if (corr == null) corr = UUID.randomUUID().toString();

        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, corr);
        response.setHeader(RequestContextKeys.CORRELATION_ID_HEADER, corr);

        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(RequestContextKeys.CORRELATION_ID_MDC_KEY);
        }
    }

    // the id ends up in an outbound header and in log lines
    static String sanitize(String raw) {
        if (raw == null) return null;
        String trimmed = raw.strip();
        if (trimmed.isEmpty() || trimmed.length() > MAX_LENGTH) return null;
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            boolean alnum = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (!(alnum || c == '-' || c == '_' || c == '.' || c == ':')) {
                return null;
            }
        }
        return trimmed;
    }
}
