package io.rstkit.server.core;

import io.rstkit.core.HttpMethod;
import io.rstkit.server.spi.ServerRequest;
import io.rstkit.server.spi.ServerResponse;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dispatch table of an endpoint: one operation per supported method.
 *
 * <p>The allowed methods are derived from {@link HttpMethod#DISPATCHABLE}, the same list used to
 * fill the table, and computed once.
 */
final class MethodTable {

    @FunctionalInterface
    interface Operation {
        ServerResponse invoke(ServerRequest request) throws Exception;
    }

    private final Map<HttpMethod, Operation> operations;
    private final List<HttpMethod> allowed;

    MethodTable(Map<HttpMethod, Operation> operations) {
        EnumMap<HttpMethod, Operation> copy = new EnumMap<>(HttpMethod.class);
        for (HttpMethod method : HttpMethod.DISPATCHABLE) {
            Operation op = operations.get(method);
            if (op != null) copy.put(method, op);
        }
        this.operations = Collections.unmodifiableMap(copy);
        this.allowed = List.copyOf(copy.keySet());
    }

    Optional<Operation> lookup(HttpMethod method) {
        return Optional.ofNullable(operations.get(method));
    }

    /** Supported methods in canonical order. */
    List<HttpMethod> allowed() {
        return allowed;
    }
}
