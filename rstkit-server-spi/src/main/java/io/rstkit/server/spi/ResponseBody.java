package io.rstkit.server.spi;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Framework-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes, ResponseBody.Streaming {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {}

    /**
     * Body written by the transport on demand. The transport owns the stream.
     */
    record Streaming(BodyWriter writer) implements ResponseBody {}

    @FunctionalInterface
    interface BodyWriter {
        void writeTo(OutputStream out) throws IOException;
    }
}
