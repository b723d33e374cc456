package io.rstkit.server.spi;

import java.io.IOException;
import java.util.Optional;

/**
 * Content-coding collaborator.
 */
public interface Compression {

    /**
     * Picks a coding for a body.
     *
     * @param body the negotiated representation bytes
     * @param acceptEncoding the request's {@code Accept-Encoding}, may be null
     * @return the coding name, or empty to send the body as is
     */
    Optional<String> select(byte[] body, String acceptEncoding);

    /**
     * Applies a coding previously returned by {@link #select}.
     */
    byte[] encode(String coding, byte[] body) throws IOException;

    /**
     * Never compresses.
     */
    static Compression none() {
        return new Compression() {
            @Override
            public Optional<String> select(byte[] body, String acceptEncoding) {
                return Optional.empty();
            }

            @Override
            public byte[] encode(String coding, byte[] body) {
                return body;
            }
        };
    }
}
