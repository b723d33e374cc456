package io.rstkit.server.spi;

/**
 * Implemented by endpoints allowing the PUT method.
 */
@FunctionalInterface
public interface Putter extends Endpoint {

    /**
     * Returns the modified resource, or null to answer 200 without a body.
     */
    Resource put(RouteVars vars, ServerRequest request) throws Exception;
}
