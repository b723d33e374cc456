package io.rstkit.server.spi;

/**
 * Implemented by endpoints allowing the POST method.
 */
@FunctionalInterface
public interface Poster extends Endpoint {

    /**
     * Creates a resource. The response is 201 Created with a {@code Location} header when the
     * result carries one.
     */
    Created post(RouteVars vars, ServerRequest request) throws Exception;
}
