package io.rstkit.server.spi;

import io.rstkit.core.Headers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Framework-neutral response abstraction.
 */
public final class ServerResponse {
    private final int status;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final ResponseBody body;

    public ServerResponse(int status, ResponseBody body) {
        this.status = status;
        this.body = body;
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public ResponseBody body() {
        return body;
    }

    public ServerResponse header(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    /**
     * Copies every header of {@code source}, appending to existing values.
     */
    public ServerResponse headers(Map<String, List<String>> source) {
        source.forEach((name, values) -> values.forEach(v -> header(name, v)));
        return this;
    }

    public Optional<String> firstHeader(String name) {
        return Headers.firstValue(headers, name);
    }

    /**
     * Same status and headers, with the body replaced.
     */
    public ServerResponse withBody(ResponseBody newBody) {
        return new ServerResponse(status, newBody).headers(headers);
    }
}
