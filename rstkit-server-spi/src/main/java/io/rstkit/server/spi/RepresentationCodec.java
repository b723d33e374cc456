package io.rstkit.server.spi;

/**
 * Content-Type specific encoder used by negotiating marshalers.
 *
 * <p>This SPI keeps the pipeline independent of any serialization library. Implementations may
 * live in separate modules and register through {@link RepresentationCodecProvider}.
 */
public interface RepresentationCodec {

    /**
     * Content-Type produced by this codec (e.g. {@code application/json}). Parameters such as
     * {@code charset} are allowed and ignored when matching.
     */
    String contentType();

    /**
     * Encodes a value.
     */
    byte[] encode(Object value) throws Exception;
}
