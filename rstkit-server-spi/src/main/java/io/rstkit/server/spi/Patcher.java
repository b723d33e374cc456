package io.rstkit.server.spi;

/**
 * Implemented by endpoints allowing the PATCH method.
 *
 * <p>Implementations should reject stale writes before applying anything, typically with
 * {@code Conditions.hasWriteConflict(resource, request)} followed by
 * {@link io.rstkit.core.RestException.PreconditionFailed}.
 */
@FunctionalInterface
public interface Patcher extends Endpoint {

    /**
     * Returns the patched resource, or null to answer 200 without a body.
     */
    Resource patch(RouteVars vars, ServerRequest request) throws Exception;
}
