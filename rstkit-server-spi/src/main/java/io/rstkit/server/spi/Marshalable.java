package io.rstkit.server.spi;

/**
 * Implemented by resources that encode themselves instead of going through the configured
 * {@link Marshaler}.
 */
public interface Marshalable {

    Representation marshal(ServerRequest request) throws Exception;
}
