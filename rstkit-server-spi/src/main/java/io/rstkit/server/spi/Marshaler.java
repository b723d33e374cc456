package io.rstkit.server.spi;

import java.util.List;

/**
 * Chooses and produces the representation of a value for a request.
 *
 * <p>Implementations throw {@link io.rstkit.core.RestException.NotAcceptable} when nothing in
 * {@link #alternatives()} satisfies the request's {@code Accept} header.
 */
public interface Marshaler {

    Representation marshal(Object value, ServerRequest request) throws Exception;

    /** Content types this marshaler can produce, most preferred first. */
    List<String> alternatives();
}
