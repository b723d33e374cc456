package io.rstkit.server.core;

import io.rstkit.server.spi.Resource;

import java.time.Duration;
import java.util.Optional;

/**
 * Cache-Control policy for representation responses.
 *
 * <p>{@code Expires} is always derived from {@link Resource#ttl()}; this hook lets integrations add
 * a {@code Cache-Control} directive as well.
 */
@FunctionalInterface
public interface CachePolicy {
    Optional<String> cacheControlFor(Resource resource);

    /** No {@code Cache-Control} header. */
    static CachePolicy none() {
        return resource -> Optional.empty();
    }

    /**
     * {@code <visibility>, max-age=<ttl seconds>} for resources with a positive TTL.
     *
     * @param visibility {@code public} or {@code private}
     */
    static CachePolicy maxAgeFromTtl(String visibility) {
        return resource -> {
            Duration ttl = resource.ttl();
            if (ttl == null || ttl.isZero() || ttl.isNegative()) return Optional.empty();
            return Optional.of(visibility + ", max-age=" + ttl.getSeconds());
        };
    }
}
