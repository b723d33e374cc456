package io.rstkit.server.spi;

/**
 * Access point exposing a resource.
 *
 * <p>An endpoint supports the methods of the operation interfaces it implements:
 * {@link Getter} (GET and HEAD), {@link Patcher}, {@link Putter}, {@link Poster} and
 * {@link Deleter}. The set must not change over the life of the endpoint.
 */
public interface Endpoint {
}
