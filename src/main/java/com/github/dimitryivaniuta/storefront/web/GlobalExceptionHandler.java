package com.github.dimitryivaniuta.storefront.web;

import com.github.dimitryivaniuta.storefront.gateway.UpstreamResponse;
import com.github.dimitryivaniuta.storefront.gateway.error.ErrorKind;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;

import static com.github.dimitryivaniuta.storefront.web.RequestContextKeys.CORRELATION_ID_MDC_KEY;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public record ApiError(
            Instant timestamp,
            int status,
            String error,
            String message,
            String path,
            String correlationId,
            String errorKind
    ) {}

    /**
     * RATE_LIMITED -> 429 + Retry-After, CIRCUIT_OPEN -> 503,
     * UPSTREAM_CLIENT -> the catalog's own 4xx, anything else -> 502.
     */
    @ExceptionHandler(UpstreamFailureException.class)
    public ResponseEntity<ApiError> handleUpstream(UpstreamFailureException ex, HttpServletRequest req) {
        UpstreamResponse env = ex.getEnvelope();
        HttpHeaders h = new HttpHeaders();
        ErrorKind kind = env.errorKind() == null ? ErrorKind.UPSTREAM_SERVER : env.errorKind();
        HttpStatus status;
        switch (kind) {
            case RATE_LIMITED -> {
                status = HttpStatus.TOO_MANY_REQUESTS;
                h.set(RequestContextKeys.RETRY_AFTER_HEADER, String.valueOf(env.retryAfterSeconds()));
            }
            case CIRCUIT_OPEN -> status = HttpStatus.SERVICE_UNAVAILABLE;
            case UPSTREAM_CLIENT -> {
                HttpStatus resolved = HttpStatus.resolve(env.statusCode());
                status = (resolved != null && resolved.is4xxClientError()) ? resolved : HttpStatus.BAD_REQUEST;
            }
            default -> status = HttpStatus.BAD_GATEWAY;
        }
        ApiError body = error(status, env.errorMessage(), req, kind.name());
        return new ResponseEntity<>(body, h, status);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleRse(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return ResponseEntity.status(status).body(error(status, ex.getReason(), req, null));
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            BindException.class,
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error(HttpStatus.BAD_REQUEST, "Validation failed: " + ex.getMessage(), req, null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(error(HttpStatus.BAD_REQUEST, ex.getMessage(), req, null));
    }

    @ExceptionHandler(org.springframework.web.servlet.resource.NoResourceFoundException.class)
    public ResponseEntity<ApiError> noResource(
            org.springframework.web.servlet.resource.NoResourceFoundException ex,
            HttpServletRequest request
    ) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(error(HttpStatus.NOT_FOUND, ex.getMessage(), request, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(error(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", req, null));
    }

    private ApiError error(HttpStatus status, String message, HttpServletRequest req, String errorKind) {
        return new ApiError(
                Instant.now(),
                status.value(),
                status.getReasonPhrase(),
                (message == null || message.isBlank()) ? status.getReasonPhrase() : message,
                req.getRequestURI(),
                MDC.get(CORRELATION_ID_MDC_KEY),
                errorKind
        );
    }
}
