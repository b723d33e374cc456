package io.rstkit.server.core;

import io.rstkit.core.HttpDates;
import io.rstkit.core.HttpHeaders;
import io.rstkit.core.HttpMethod;
import io.rstkit.server.spi.Compression;
import io.rstkit.server.spi.DirectWriter;
import io.rstkit.server.spi.Marshalable;
import io.rstkit.server.spi.Marshaler;
import io.rstkit.server.spi.Representation;
import io.rstkit.server.spi.Resource;
import io.rstkit.server.spi.ResponseBody;
import io.rstkit.server.spi.ServerRequest;
import io.rstkit.server.spi.ServerResponse;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Assembles the response for a resource.
 *
 * <p>Order of work:
 * <ol>
 *   <li>revalidation ({@link #notModified}); PUT and PATCH always answer 200 and skip it</li>
 *   <li>{@code Vary: Accept}, {@code Last-Modified}, {@code ETag}, {@code Expires}, optional {@code Cache-Control}</li>
 *   <li>hand-off to {@link DirectWriter} resources</li>
 *   <li>representation and {@code Content-Type}</li>
 *   <li>content coding</li>
 *   <li>status: 201 for POST, 200 for PUT and PATCH, 204 for an empty body, 206 with a
 *       {@code Content-Range}, else 200</li>
 *   <li>body dropped for HEAD</li>
 * </ol>
 */
final class ResponseWriter {

    private final Marshaler marshaler;
    private final Compression compression;
    private final CachePolicy cachePolicy;
    private final Clock clock;

    ResponseWriter(Marshaler marshaler, Compression compression, CachePolicy cachePolicy, Clock clock) {
        this.marshaler = Objects.requireNonNull(marshaler, "marshaler");
        this.compression = Objects.requireNonNull(compression, "compression");
        this.cachePolicy = Objects.requireNonNull(cachePolicy, "cachePolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * 304 response if the client's cached copy is current. Headers prepared so far are kept.
     */
    Optional<ServerResponse> notModified(Resource resource, ServerRequest request, PreparedHeaders headers) {
        HttpMethod method = request.method();
        if (method == HttpMethod.PUT || method == HttpMethod.PATCH || !Conditions.isNotModified(resource, request)) {
            return Optional.empty();
        }
        return Optional.of(headers.toResponse(304, new ResponseBody.Empty()));
    }

    ServerResponse write(Resource resource, ServerRequest request, PreparedHeaders headers) throws Exception {
        headers.add(HttpHeaders.VARY, HttpHeaders.ACCEPT);
        headers.set(HttpHeaders.LAST_MODIFIED, HttpDates.format(resource.lastModified()));
        headers.set(HttpHeaders.ETAG, resource.etag());
        headers.set(HttpHeaders.EXPIRES, HttpDates.format(HttpDates.offset(clock.instant(), resource.ttl())));
        cachePolicy.cacheControlFor(resource).ifPresent(cc -> headers.set(HttpHeaders.CACHE_CONTROL, cc));

        if (resource instanceof DirectWriter direct) {
            return writeDirect(direct, request, headers);
        }

        Representation rep = resource instanceof Marshalable self
                ? self.marshal(request)
                : marshaler.marshal(resource, request);
        headers.set(HttpHeaders.CONTENT_TYPE, rep.contentType());

        byte[] body = rep.bytes();
        Optional<String> coding = compression.select(body, request.header(HttpHeaders.ACCEPT_ENCODING).orElse(null));
        if (coding.isPresent()) {
            body = compression.encode(coding.get(), body);
            headers.set(HttpHeaders.CONTENT_ENCODING, coding.get());
            headers.add(HttpHeaders.VARY, HttpHeaders.ACCEPT_ENCODING);
        }

        int status = status(request.method(), body, headers);
        if (status != 204) {
            headers.set(HttpHeaders.CONTENT_LENGTH, Integer.toString(body.length));
        }
        if (request.method() == HttpMethod.HEAD || body.length == 0) {
            return headers.toResponse(status, new ResponseBody.Empty());
        }
        return headers.toResponse(status, new ResponseBody.Bytes(body));
    }

    private static int status(HttpMethod method, byte[] body, PreparedHeaders headers) {
        if (method == HttpMethod.POST) return 201;
        if (method == HttpMethod.PUT || method == HttpMethod.PATCH) return 200;
        if (body.length == 0) return 204;
        if (headers.contains(HttpHeaders.CONTENT_RANGE)) return 206;
        return 200;
    }

    private static ServerResponse writeDirect(DirectWriter direct, ServerRequest request, PreparedHeaders headers) throws Exception {
        ServerResponse resp = direct.write(request, headers.asMap());
        if (resp == null) {
            throw new IllegalStateException("DirectWriter " + direct.getClass().getName() + " returned no response");
        }
        for (Map.Entry<String, List<String>> e : headers.asMap().entrySet()) {
            if (resp.firstHeader(e.getKey()).isEmpty()) {
                e.getValue().forEach(v -> resp.header(e.getKey(), v));
            }
        }
        return request.method() == HttpMethod.HEAD ? resp.withBody(new ResponseBody.Empty()) : resp;
    }
}
