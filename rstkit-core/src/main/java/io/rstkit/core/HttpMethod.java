package io.rstkit.core;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * HTTP request methods understood by the pipeline.
 *
 * <p>The first six constants are declared in canonical order. {@link #DISPATCHABLE} is the single
 * list used both to bind operations and to render the {@code Allow} header, so the two can never
 * disagree.
 */
public enum HttpMethod {
    HEAD,
    GET,
    PATCH,
    PUT,
    POST,
    DELETE,
    OPTIONS,
    TRACE,
    CONNECT,
    /** Any extension method. Never dispatched; the raw token is kept by the request. */
    OTHER;

    /** Methods that may be bound to an endpoint operation, in {@code Allow} order. */
    public static final List<HttpMethod> DISPATCHABLE = List.of(HEAD, GET, PATCH, PUT, POST, DELETE);

    /**
     * Case-insensitive lookup of a request method token.
     *
     * @param token method as sent on the wire
     * @return the method, or empty for extension methods
     */
    public static Optional<HttpMethod> lookup(String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        try {
            return Optional.of(valueOf(token.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Like {@link #lookup} but maps unknown tokens to {@link #OTHER}.
     */
    public static HttpMethod of(String token) {
        return lookup(token).orElse(OTHER);
    }

    /** True for methods that never modify the target resource. */
    public boolean isSafe() {
        return this == GET || this == HEAD || this == OPTIONS || this == TRACE;
    }
}
