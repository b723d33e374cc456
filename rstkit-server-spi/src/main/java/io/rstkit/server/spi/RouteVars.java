package io.rstkit.server.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Variables extracted from the request path by the router, in path order.
 */
public final class RouteVars {

    private static final RouteVars EMPTY = new RouteVars(Map.of());

    private final Map<String, String> values;

    private RouteVars(Map<String, String> values) {
        this.values = values;
    }

    public static RouteVars empty() {
        return EMPTY;
    }

    /**
     * Copies {@code values}, keeping their iteration order.
     */
    public static RouteVars of(Map<String, String> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        return new RouteVars(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * Convenience factory taking alternating names and values.
     */
    public static RouteVars of(String... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("names and values must come in pairs");
        }
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            map.put(namesAndValues[i], namesAndValues[i + 1]);
        }
        return of(map);
    }

    /** Value of a variable, or the empty string when absent. */
    public String get(String name) {
        return values.getOrDefault(name, "");
    }

    public Optional<String> find(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RouteVars other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RouteVars" + values;
    }
}
