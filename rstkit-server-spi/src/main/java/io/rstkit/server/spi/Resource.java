package io.rstkit.server.spi;

import java.time.Duration;
import java.time.Instant;

/**
 * A resource exposed by an endpoint.
 *
 * <p>Resources may additionally implement {@link Ranger} to serve partial content,
 * {@link Marshalable} to control their own encoding, or {@link DirectWriter} to take over the
 * response entirely (streaming, custom headers such as {@code Content-Disposition}).
 *
 * <p>The three values must describe the same snapshot of the data the resource carries.
 */
public interface Resource {

    /** Opaque validator identifying the current version; compared by exact match. */
    String etag();

    /** Last modification time. Only second precision is transmitted. */
    Instant lastModified();

    /** Caching lifetime. {@link Duration#ZERO} means no explicit freshness. */
    Duration ttl();
}
