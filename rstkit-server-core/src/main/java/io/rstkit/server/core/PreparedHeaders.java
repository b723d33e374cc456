package io.rstkit.server.core;

import io.rstkit.server.spi.ResponseBody;
import io.rstkit.server.spi.ServerResponse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Headers accumulated while a response is assembled, before its status is known.
 */
final class PreparedHeaders {
    private final Map<String, List<String>> headers = new LinkedHashMap<>();

    /** Replaces any value of {@code name}. */
    PreparedHeaders set(String name, String value) {
        List<String> values = new ArrayList<>(1);
        values.add(value);
        headers.put(name, values);
        return this;
    }

    /** Appends a value unless already present. */
    PreparedHeaders add(String name, String value) {
        List<String> values = headers.computeIfAbsent(name, k -> new ArrayList<>());
        if (!values.contains(value)) values.add(value);
        return this;
    }

    Optional<String> first(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
    }

    boolean contains(String name) {
        return headers.containsKey(name);
    }

    Map<String, List<String>> asMap() {
        return Collections.unmodifiableMap(headers);
    }

    ServerResponse toResponse(int status, ResponseBody body) {
        return new ServerResponse(status, body).headers(headers);
    }
}
