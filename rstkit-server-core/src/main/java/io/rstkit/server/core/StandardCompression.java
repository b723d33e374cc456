package io.rstkit.server.core;

import io.rstkit.server.spi.Compression;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Optional;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPOutputStream;

/**
 * {@link Compression} supporting {@code gzip} and {@code deflate}.
 *
 * <p>Bodies smaller than the threshold are sent as is; compressing them costs more than it saves.
 */
public final class StandardCompression implements Compression {

    public static final String GZIP = "gzip";
    public static final String DEFLATE = "deflate";

    /** Roughly one Ethernet frame of payload. */
    public static final int DEFAULT_THRESHOLD = 1400;

    private final int threshold;

    public StandardCompression() {
        this(DEFAULT_THRESHOLD);
    }

    public StandardCompression(int threshold) {
        if (threshold < 0) throw new IllegalArgumentException("threshold must be non-negative");
        this.threshold = threshold;
    }

    @Override
    public Optional<String> select(byte[] body, String acceptEncoding) {
        if (body == null || body.length == 0 || body.length < threshold) return Optional.empty();
        for (QualityList.Preference p : QualityList.parse(acceptEncoding)) {
            if (!p.acceptable()) continue;
            switch (p.value()) {
                case GZIP, "x-gzip", "*":
                    return Optional.of(GZIP);
                case DEFLATE:
                    return Optional.of(DEFLATE);
                case "identity":
                    return Optional.empty();
                default:
                    // unsupported coding, try the next preference
            }
        }
        return Optional.empty();
    }

    @Override
    public byte[] encode(String coding, byte[] body) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, body.length / 2));
        try (OutputStream out = open(coding, buffer)) {
            out.write(body);
        }
        return buffer.toByteArray();
    }

    private static OutputStream open(String coding, OutputStream target) throws IOException {
        return switch (coding) {
            case GZIP -> new GZIPOutputStream(target);
            case DEFLATE -> new DeflaterOutputStream(target);
            default -> throw new IllegalArgumentException("unsupported content coding: " + coding);
        };
    }
}
