package io.rstkit.server.spi;

/**
 * Implemented by endpoints allowing the GET and HEAD methods.
 *
 * <pre>{@code
 * public Resource get(RouteVars vars, ServerRequest request) {
 *     Resource resource = database.find(vars.get("id"));
 *     if (resource == null) throw new RestException.NotFound();
 *     return resource;
 * }
 * }</pre>
 */
@FunctionalInterface
public interface Getter extends Endpoint {

    /**
     * Returns the resource, or null to answer 204 No Content.
     */
    Resource get(RouteVars vars, ServerRequest request) throws Exception;
}
