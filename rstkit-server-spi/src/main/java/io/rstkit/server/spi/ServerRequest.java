package io.rstkit.server.spi;

import io.rstkit.core.Headers;
import io.rstkit.core.HttpMethod;

import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Framework-neutral request abstraction.
 */
public final class ServerRequest {
    private final HttpMethod method;
    private final String methodName;
    private final URI uri;
    private final Map<String, List<String>> headers;
    private final InputStream body; // may be null
    private final RouteVars routeVars;

    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body) {
        this(method, uri, headers, body, RouteVars.empty());
    }

    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers, InputStream body, RouteVars routeVars) {
        this(Objects.requireNonNull(method, "method"), method.name(), uri, headers, body, routeVars);
    }

    /**
     * Request for a method token as sent on the wire. Tokens outside {@link HttpMethod} map to
     * {@link HttpMethod#OTHER}.
     */
    public ServerRequest(String methodName, URI uri, Map<String, List<String>> headers, InputStream body, RouteVars routeVars) {
        this(HttpMethod.of(methodName), Objects.requireNonNull(methodName, "methodName"), uri, headers, body, routeVars);
    }

    private ServerRequest(HttpMethod method, String methodName, URI uri, Map<String, List<String>> headers,
                          InputStream body, RouteVars routeVars) {
        this.method = method;
        this.methodName = method == HttpMethod.OTHER ? methodName : method.name();
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = Objects.requireNonNull(headers, "headers");
        this.body = body;
        this.routeVars = Objects.requireNonNull(routeVars, "routeVars");
    }

    public HttpMethod method() {
        return method;
    }

    /** Method token; the extension token itself for {@link HttpMethod#OTHER}. */
    public String methodName() {
        return methodName;
    }

    public URI uri() {
        return uri;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public InputStream body() {
        return body;
    }

    public RouteVars routeVars() {
        return routeVars;
    }

    /**
     * First value of a header, ignoring the case of its name.
     */
    public Optional<String> header(String name) {
        return Headers.firstValue(headers, name);
    }
}
