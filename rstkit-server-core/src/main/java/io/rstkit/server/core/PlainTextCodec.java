package io.rstkit.server.core;

import io.rstkit.core.HttpHeaders;
import io.rstkit.server.spi.RepresentationCodec;

import java.nio.charset.StandardCharsets;

/**
 * {@code text/plain} codec rendering {@link Object#toString()} as UTF-8.
 */
public final class PlainTextCodec implements RepresentationCodec {

    public static final PlainTextCodec INSTANCE = new PlainTextCodec();

    @Override
    public String contentType() {
        return HttpHeaders.CT_TEXT_PLAIN;
    }

    @Override
    public byte[] encode(Object value) {
        if (value instanceof byte[] bytes) return bytes;
        return String.valueOf(value).getBytes(StandardCharsets.UTF_8);
    }
}
