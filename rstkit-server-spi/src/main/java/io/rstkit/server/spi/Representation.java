package io.rstkit.server.spi;

import java.util.Objects;

/**
 * Encoded form of a resource.
 *
 * @param contentType value of the {@code Content-Type} header
 * @param bytes body bytes, possibly empty
 */
public record Representation(String contentType, byte[] bytes) {
    public Representation {
        Objects.requireNonNull(contentType, "contentType");
        bytes = bytes == null ? new byte[0] : bytes;
    }
}
