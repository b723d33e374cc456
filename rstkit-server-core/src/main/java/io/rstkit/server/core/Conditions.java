package io.rstkit.server.core;

import io.rstkit.core.Headers;
import io.rstkit.core.HttpDates;
import io.rstkit.core.HttpHeaders;
import io.rstkit.server.spi.Resource;
import io.rstkit.server.spi.ServerRequest;

import java.time.Instant;
import java.util.Optional;

/**
 * Evaluation of conditional request headers against a resource.
 *
 * <p>Write conflicts and cache revalidation are separate questions and are answered by separate
 * methods. Dates are compared at the second precision HTTP transmits.
 */
public final class Conditions {

    private Conditions() {}

    /**
     * Detects a stale write. Call before applying a PUT or PATCH:
     * <pre>{@code
     * Resource current = store.find(vars.get("id"));
     * if (Conditions.hasWriteConflict(current, request)) {
     *     throw new RestException.PreconditionFailed();
     * }
     * }</pre>
     *
     * @return true if {@code If-Unmodified-Since} is earlier than the last modification, or
     *         {@code If-Match} names another version
     */
    public static boolean hasWriteConflict(Resource resource, ServerRequest request) {
        Optional<Instant> since = HttpDates.parse(request.header(HttpHeaders.IF_UNMODIFIED_SINCE).orElse(null));
        if (since.isPresent() && since.get().isBefore(lastModified(resource))) {
            return true;
        }
        Optional<String> etag = Headers.nonBlank(request.headers(), HttpHeaders.IF_MATCH);
        return etag.isPresent() && !etag.get().equals(resource.etag());
    }

    /**
     * True if the client already holds the current version, in which case a GET or HEAD is
     * answered with 304 Not Modified.
     */
    public static boolean isNotModified(Resource resource, ServerRequest request) {
        Optional<Instant> since = HttpDates.parse(request.header(HttpHeaders.IF_MODIFIED_SINCE).orElse(null));
        if (since.isPresent() && !since.get().isBefore(lastModified(resource))) {
            return true;
        }
        String noneMatch = request.header(HttpHeaders.IF_NONE_MATCH).orElse("");
        for (String tag : noneMatch.split(";")) {
            String t = tag.trim();
            if (!t.isEmpty() && t.equals(resource.etag())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Evaluates {@code If-Range}, which holds either a date or an ETag.
     *
     * @return true if the header is absent, names the current ETag, or carries exactly the last
     *         modification date
     */
    public static boolean ifRangeHolds(Resource resource, ServerRequest request) {
        Optional<String> raw = Headers.nonBlank(request.headers(), HttpHeaders.IF_RANGE);
        if (raw.isEmpty()) return true;
        Optional<Instant> date = HttpDates.parse(raw.get());
        if (date.isPresent() && date.get().equals(lastModified(resource))) {
            return true;
        }
        return raw.get().equals(resource.etag());
    }

    private static Instant lastModified(Resource resource) {
        return HttpDates.truncate(resource.lastModified());
    }
}
