package io.rstkit.server.spi;

/**
 * Implemented by endpoints allowing the DELETE method.
 */
@FunctionalInterface
public interface Deleter extends Endpoint {

    void delete(RouteVars vars, ServerRequest request) throws Exception;
}
