package io.rstkit.server.core;

import io.rstkit.core.HttpHeaders;
import io.rstkit.core.HttpMethod;
import io.rstkit.core.RestException;
import io.rstkit.server.spi.Compression;
import io.rstkit.server.spi.Created;
import io.rstkit.server.spi.Deleter;
import io.rstkit.server.spi.EndpointCapabilities;
import io.rstkit.server.spi.Getter;
import io.rstkit.server.spi.Marshaler;
import io.rstkit.server.spi.Poster;
import io.rstkit.server.spi.Resource;
import io.rstkit.server.spi.ResponseBody;
import io.rstkit.server.spi.RouteVars;
import io.rstkit.server.spi.ServerRequest;
import io.rstkit.server.spi.ServerResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Framework-neutral HTTP handler serving one endpoint.
 *
 * <p>The endpoint's operations are detected once, at construction. Requests are dispatched by
 * method; OPTIONS is answered from the detected capabilities without calling any operation.
 * Operations signal failures by throwing {@link RestException}; anything else becomes a 500.
 *
 * <p>Use {@link #builder(Object)} to create instances with custom configuration:
 * <pre>{@code
 * EndpointHandler handler = EndpointHandler.builder(new DocumentEndpoint(store))
 *     .marshaler(new NegotiatingMarshaler(registry))
 *     .compression(new StandardCompression(512))
 *     .cachePolicy(CachePolicy.maxAgeFromTtl("public"))
 *     .build();
 * }</pre>
 *
 * <p>Instances are immutable and may serve concurrent requests.
 */
public final class EndpointHandler {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointHandler.class);

    private final MethodTable table;
    private final ResponseWriter writer;
    private final ErrorResponses errors;
    private final String allowHeader;
    private final String alternativesHeader;

    /**
     * Creates a new builder for configuring a handler.
     *
     * @param endpoint object implementing any of the operation interfaces, or an
     *                 {@link EndpointCapabilities} (required)
     * @return a new builder instance
     */
    public static Builder builder(Object endpoint) {
        return new Builder(endpoint);
    }

    public EndpointHandler(Object endpoint) {
        this(builder(endpoint));
    }

    private EndpointHandler(Builder builder) {
        Marshaler marshaler = builder.marshaler != null
                ? builder.marshaler
                : new NegotiatingMarshaler(ServiceLoaderCodecRegistry.defaultRegistry());
        Compression compression = builder.compression != null ? builder.compression : new StandardCompression();
        CachePolicy cachePolicy = builder.cachePolicy != null ? builder.cachePolicy : CachePolicy.none();
        Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();

        this.writer = new ResponseWriter(marshaler, compression, cachePolicy, clock);
        this.errors = new ErrorResponses(marshaler);
        this.table = bind(EndpointCapabilities.of(builder.endpoint));
        this.allowHeader = table.allowed().stream().map(Enum::name).collect(Collectors.joining(", "));
        this.alternativesHeader = String.join(";", marshaler.alternatives());
    }

    /**
     * Builder for {@link EndpointHandler}.
     */
    public static final class Builder {
        private final Object endpoint;
        private Marshaler marshaler;
        private Compression compression;
        private CachePolicy cachePolicy;
        private Clock clock;

        private Builder(Object endpoint) {
            this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        }

        /** Sets the marshaler. Default: {@link NegotiatingMarshaler} over the ServiceLoader codecs. */
        public Builder marshaler(Marshaler marshaler) {
            this.marshaler = marshaler;
            return this;
        }

        /** Sets the content coding collaborator. Default: {@link StandardCompression}. */
        public Builder compression(Compression compression) {
            this.compression = compression;
            return this;
        }

        /** Sets the Cache-Control policy. Default: {@link CachePolicy#none()}. */
        public Builder cachePolicy(CachePolicy cachePolicy) {
            this.cachePolicy = cachePolicy;
            return this;
        }

        /** Sets the clock used for {@code Expires}. Default: system UTC. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Builds the handler with the configured settings. */
        public EndpointHandler build() {
            return new EndpointHandler(this);
        }
    }

    /**
     * Methods the endpoint supports, in canonical order.
     */
    public List<HttpMethod> allowedMethods() {
        return table.allowed();
    }

    public ServerResponse handle(ServerRequest req) {
        try {
            if (req.method() == HttpMethod.OPTIONS) {
                return handleOptions();
            }
            Optional<MethodTable.Operation> op = table.lookup(req.method());
            if (op.isEmpty()) {
                if (table.allowed().isEmpty()) throw new RestException.NotFound();
                throw new RestException.MethodNotAllowed(req.methodName(), table.allowed());
            }
            return op.get().invoke(req);
        } catch (RestException e) {
            LOG.debug("{} {} -> {} {}", req.methodName(), req.uri(), e.status(), e.getMessage());
            return errors.render(e, req);
        } catch (Exception e) {
            LOG.error("{} {} failed", req.methodName(), req.uri(), e);
            return errors.render(new RestException.InternalServerError("The server could not complete the request.", e), req);
        }
    }

    private MethodTable bind(EndpointCapabilities caps) {
        Map<HttpMethod, MethodTable.Operation> ops = new EnumMap<>(HttpMethod.class);
        caps.findGetter().ifPresent(g -> {
            ops.put(HttpMethod.HEAD, req -> handleGet(g, req));
            ops.put(HttpMethod.GET, req -> handleGet(g, req));
        });
        caps.findPatcher().ifPresent(p -> ops.put(HttpMethod.PATCH, req -> handleModify(p.patch(req.routeVars(), req), req)));
        caps.findPutter().ifPresent(p -> ops.put(HttpMethod.PUT, req -> handleModify(p.put(req.routeVars(), req), req)));
        caps.findPoster().ifPresent(p -> ops.put(HttpMethod.POST, req -> handlePost(p, req)));
        caps.findDeleter().ifPresent(d -> ops.put(HttpMethod.DELETE, req -> handleDelete(d, req)));
        return new MethodTable(ops);
    }

    private ServerResponse handleOptions() {
        ServerResponse resp = new ServerResponse(204, new ResponseBody.Empty())
                .header(HttpHeaders.ALLOW, allowHeader);
        if (!alternativesHeader.isEmpty()) {
            resp.header(HttpHeaders.CONTENT_TYPE, alternativesHeader);
        }
        return resp;
    }

    private ServerResponse handleGet(Getter getter, ServerRequest req) throws Exception {
        RouteVars vars = req.routeVars();
        Resource resource = getter.get(vars, req);
        if (resource == null) {
            return new ServerResponse(204, new ResponseBody.Empty());
        }

        PreparedHeaders headers = new PreparedHeaders();
        RangeNegotiator.advertise(resource, headers);
        Optional<ServerResponse> notModified = writer.notModified(resource, req, headers);
        if (notModified.isPresent()) {
            return notModified.get();
        }

        Resource selected = RangeNegotiator.select(resource, req, headers);
        return writer.write(selected, req, headers);
    }

    private ServerResponse handleModify(Resource resource, ServerRequest req) throws Exception {
        if (resource == null) {
            return new ServerResponse(200, new ResponseBody.Empty());
        }
        return writer.write(resource, req, new PreparedHeaders());
    }

    private ServerResponse handlePost(Poster poster, ServerRequest req) throws Exception {
        Created created = poster.post(req.routeVars(), req);
        PreparedHeaders headers = new PreparedHeaders();
        if (created != null && created.hasLocation()) {
            headers.set(HttpHeaders.LOCATION, created.location());
        }
        if (created == null || created.resource() == null) {
            return headers.toResponse(201, new ResponseBody.Empty());
        }
        Optional<ServerResponse> notModified = writer.notModified(created.resource(), req, headers);
        if (notModified.isPresent()) {
            return notModified.get();
        }
        return writer.write(created.resource(), req, headers);
    }

    private ServerResponse handleDelete(Deleter deleter, ServerRequest req) throws Exception {
        deleter.delete(req.routeVars(), req);
        return new ServerResponse(204, new ResponseBody.Empty());
    }
}
