package io.rstkit.server.core;

import io.rstkit.core.HttpHeaders;
import io.rstkit.server.spi.RangeRequest;
import io.rstkit.server.spi.Ranger;
import io.rstkit.server.spi.Resource;
import io.rstkit.server.spi.ServerRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Range handling for the read path of resources implementing {@link Ranger}.
 *
 * <p>A malformed or invalid {@code Range}, or a failed {@code If-Range}, silently degrades to the
 * full representation. A well-formed range that selects nothing raises
 * {@link io.rstkit.core.RestException.RangeNotSatisfiable}.
 */
final class RangeNegotiator {

    private static final Logger LOG = LoggerFactory.getLogger(RangeNegotiator.class);

    private RangeNegotiator() {}

    /**
     * Sets {@code Accept-Ranges} for rangeable resources, whether or not the request asks for a range.
     */
    static void advertise(Resource resource, PreparedHeaders headers) {
        if (resource instanceof Ranger ranger) {
            headers.set(HttpHeaders.ACCEPT_RANGES, String.join(", ", ranger.units()));
        }
    }

    /**
     * Selects what to write for a GET or HEAD: the partial resource when a range applies, the
     * resource itself otherwise. Sets {@code Vary: Range} and, for a strict subset,
     * {@code Content-Range}.
     */
    static Resource select(Resource resource, ServerRequest request, PreparedHeaders headers) throws Exception {
        if (!(resource instanceof Ranger ranger)) return resource;
        Optional<String> raw = request.header(HttpHeaders.RANGE);
        if (raw.isEmpty()) return resource;
        headers.add(HttpHeaders.VARY, HttpHeaders.RANGE);

        Optional<RangeRequest> parsed = RangeHeader.parse(raw.get());
        if (parsed.isEmpty() || !parsed.get().isValidFor(ranger)) {
            LOG.debug("Ignoring unusable Range header '{}'", raw.get());
            return resource;
        }
        if (!Conditions.ifRangeHolds(resource, request)) {
            LOG.debug("If-Range does not match current version {}, serving full representation", resource.etag());
            return resource;
        }

        RangeRequest adjusted = parsed.get().adjust(ranger.count());
        Ranger.Slice slice = ranger.range(adjusted);
        if (!slice.contentRange().isComplete()) {
            headers.set(HttpHeaders.CONTENT_RANGE, slice.contentRange().toString());
        }
        return slice.partial();
    }
}
