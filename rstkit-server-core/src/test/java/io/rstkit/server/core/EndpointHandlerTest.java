package io.rstkit.server.core;

import io.rstkit.core.HttpHeaders;
import io.rstkit.core.HttpMethod;
import io.rstkit.core.RestException;
import io.rstkit.server.spi.Created;
import io.rstkit.server.spi.Deleter;
import io.rstkit.server.spi.DirectWriter;
import io.rstkit.server.spi.EndpointCapabilities;
import io.rstkit.server.spi.Getter;
import io.rstkit.server.spi.Marshalable;
import io.rstkit.server.spi.Patcher;
import io.rstkit.server.spi.Poster;
import io.rstkit.server.spi.Putter;
import io.rstkit.server.spi.Representation;
import io.rstkit.server.spi.Resource;
import io.rstkit.server.spi.ResponseBody;
import io.rstkit.server.spi.RouteVars;
import io.rstkit.server.spi.ServerRequest;
import io.rstkit.server.spi.ServerResponse;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.zip.GZIPInputStream;

import static io.rstkit.server.core.TestSupport.bodyBytes;
import static io.rstkit.server.core.TestSupport.bodyText;
import static io.rstkit.server.core.TestSupport.firstHeader;
import static io.rstkit.server.core.TestSupport.handler;
import static io.rstkit.server.core.TestSupport.request;
import static org.assertj.core.api.Assertions.assertThat;

class EndpointHandlerTest {

    @Test
    void getWritesRepresentationWithValidators() {
        EndpointHandler handler = handler((Getter) (vars, req) -> Note.of("hello", "\"v1\"")).build();

        ServerResponse resp = handler.handle(request(HttpMethod.GET));

        assertThat(resp.status()).isEqualTo(200);
        assertThat(bodyText(resp)).isEqualTo("hello");
        assertThat(firstHeader(resp, HttpHeaders.ETAG)).isEqualTo("\"v1\"");
        assertThat(firstHeader(resp, HttpHeaders.LAST_MODIFIED)).isEqualTo("Mon, 01 Jan 2024 00:00:00 GMT");
        assertThat(firstHeader(resp, HttpHeaders.EXPIRES)).isEqualTo("Sat, 01 Jun 2024 12:01:00 GMT");
        assertThat(firstHeader(resp, HttpHeaders.CONTENT_TYPE)).isEqualTo(HttpHeaders.CT_TEXT_PLAIN);
        assertThat(firstHeader(resp, HttpHeaders.CONTENT_LENGTH)).isEqualTo("5");
        assertThat(resp.headers().get(HttpHeaders.VARY)).containsExactly(HttpHeaders.ACCEPT);
        assertThat(resp.headers()).doesNotContainKey(HttpHeaders.ACCEPT_RANGES);
        assertThat(resp.headers()).doesNotContainKey(HttpHeaders.CACHE_CONTROL);
    }

    @Test
    void operationsReceiveRouteVars() {
        AtomicReference<RouteVars> seen = new AtomicReference<>();
        EndpointHandler handler = handler((Getter) (vars, req) -> {
            seen.set(vars);
            return Note.of("x", "\"v1\"");
        }).build();

        handler.handle(request(HttpMethod.GET));

        assertThat(seen.get().get("id")).isEqualTo("1");
    }

    @Test
    void matchingIfNoneMatchReturnsNotModified() {
        EndpointHandler handler = handler((Getter) (vars, req) -> Note.of("hello", "\"v1\"")).build();

        ServerResponse resp = handler.handle(request(HttpMethod.GET, HttpHeaders.IF_NONE_MATCH, "\"v1\""));

        assertThat(resp.status()).isEqualTo(304);
        assertThat(resp.body()).isInstanceOf(ResponseBody.Empty.class);
        assertThat(resp.headers()).doesNotContainKey(HttpHeaders.CONTENT_LENGTH);
    }

    @Test
    void ifNoneMatchListIsSplitOnSemicolons() {
        EndpointHandler handler = handler((Getter) (vars, req) -> Note.of("hello", "\"v1\"")).build();

        ServerResponse hit = handler.handle(request(HttpMethod.GET, HttpHeaders.IF_NONE_MATCH, "\"v0\"; \"v1\""));
        ServerResponse miss = handler.handle(request(HttpMethod.GET, HttpHeaders.IF_NONE_MATCH, "\"v0\";\"v2\""));

        assertThat(hit.status()).isEqualTo(304);
        assertThat(miss.status()).isEqualTo(200);
    }

    @Test
    void ifModifiedSinceComparesAtSecondPrecision() {
        Note note = new Note("hello", "\"v1\"", Instant.parse("2024-01-01T00:00:00.750Z"), Duration.ofSeconds(60));
        EndpointHandler handler = handler((Getter) (vars, req) -> note).build();

        ServerResponse same = handler.handle(request(HttpMethod.GET,
                HttpHeaders.IF_MODIFIED_SINCE, "Mon, 01 Jan 2024 00:00:00 GMT"));
        ServerResponse older = handler.handle(request(HttpMethod.GET,
                HttpHeaders.IF_MODIFIED_SINCE, "Sun, 31 Dec 2023 23:59:59 GMT"));

        assertThat(same.status()).isEqualTo(304);
        assertThat(older.status()).isEqualTo(200);
    }

    @Test
    void headMatchesGetWithoutBody() {
        EndpointHandler handler = handler((Getter) (vars, req) -> Note.of("hello", "\"v1\""))
                .cachePolicy(CachePolicy.maxAgeFromTtl("public"))
                .build();

        ServerResponse get = handler.handle(request(HttpMethod.GET));
        ServerResponse head = handler.handle(request(HttpMethod.HEAD));

        assertThat(head.status()).isEqualTo(get.status());
        assertThat(head.headers()).isEqualTo(get.headers());
        assertThat(head.body()).isInstanceOf(ResponseBody.Empty.class);
        assertThat(firstHeader(head, HttpHeaders.CACHE_CONTROL)).isEqualTo("public, max-age=60");
    }

    @Test
    void getWithoutResourceReturnsNoContent() {
        EndpointHandler handler = handler((Getter) (vars, req) -> null).build();

        ServerResponse resp = handler.handle(request(HttpMethod.GET));

        assertThat(resp.status()).isEqualTo(204);
        assertThat(resp.body()).isInstanceOf(ResponseBody.Empty.class);
    }

    @Test
    void optionsAdvertisesCapabilitiesWithoutInvokingOperations() {
        AtomicInteger calls = new AtomicInteger();
        EndpointCapabilities endpoint = EndpointCapabilities.builder()
                .get((vars, req) -> {
                    calls.incrementAndGet();
                    return Note.of("x", "\"v1\"");
                })
                .delete((vars, req) -> calls.incrementAndGet())
                .build();
        EndpointHandler handler = handler(endpoint).build();

        ServerResponse first = handler.handle(request(HttpMethod.OPTIONS));
        ServerResponse second = handler.handle(request(HttpMethod.OPTIONS));

        assertThat(first.status()).isEqualTo(204);
        assertThat(firstHeader(first, HttpHeaders.ALLOW)).isEqualTo("HEAD, GET, DELETE");
        assertThat(firstHeader(first, HttpHeaders.CONTENT_TYPE)).isEqualTo(HttpHeaders.CT_TEXT_PLAIN);
        assertThat(second.headers()).isEqualTo(first.headers());
        assertThat(calls).hasValue(0);
    }

    @Test
    void allowListsEveryOperationInCanonicalOrder() {
        EndpointHandler handler = handler(new FullEndpoint()).build();

        ServerResponse resp = handler.handle(request(HttpMethod.OPTIONS));

        assertThat(firstHeader(resp, HttpHeaders.ALLOW)).isEqualTo("HEAD, GET, PATCH, PUT, POST, DELETE");
        assertThat(handler.allowedMethods()).containsExactlyElementsOf(HttpMethod.DISPATCHABLE);
    }

    @Test
    void unsupportedMethodIsRejectedWithAllow() {
        EndpointHandler handler = handler((Getter) (vars, req) -> Note.of("x", "\"v1\"")).build();

        ServerResponse resp = handler.handle(request(HttpMethod.DELETE));

        assertThat(resp.status()).isEqualTo(405);
        assertThat(firstHeader(resp, HttpHeaders.ALLOW)).isEqualTo("HEAD, GET");
        assertThat(firstHeader(resp, HttpHeaders.CACHE_CONTROL)).isEqualTo("no-store");
        assertThat(bodyText(resp)).startsWith("405 Method Not Allowed");
    }

    @Test
    void endpointWithoutOperationsIsNotFound() {
        EndpointHandler handler = handler(new Object()).build();

        ServerResponse get = handler.handle(request(HttpMethod.GET));
        ServerResponse options = handler.handle(request(HttpMethod.OPTIONS));

        assertThat(get.status()).isEqualTo(404);
        assertThat(get.headers()).doesNotContainKey(HttpHeaders.ALLOW);
        assertThat(options.status()).isEqualTo(204);
        assertThat(firstHeader(options, HttpHeaders.ALLOW)).isEmpty();
    }

    @Test
    void traceIsNeverDispatched() {
        EndpointHandler handler = handler(new FullEndpoint()).build();

        ServerResponse resp = handler.handle(request(HttpMethod.TRACE));

        assertThat(resp.status()).isEqualTo(405);
    }

    @Test
    void extensionMethodIsRejectedWithAllow() {
        EndpointHandler handler = handler((Getter) (vars, req) -> Note.of("x", "\"v1\"")).build();
        ServerRequest propfind = new ServerRequest("PROPFIND", TestSupport.URI_DOC, Map.of(), null, RouteVars.empty());

        ServerResponse resp = handler.handle(propfind);

        assertThat(propfind.method()).isEqualTo(HttpMethod.OTHER);
        assertThat(resp.status()).isEqualTo(405);
        assertThat(firstHeader(resp, HttpHeaders.ALLOW)).isEqualTo("HEAD, GET");
        assertThat(bodyText(resp)).contains("PROPFIND");
    }

    @Test
    void extensionMethodOnEmptyEndpointIsNotFound() {
        ServerRequest propfind = new ServerRequest("PROPFIND", TestSupport.URI_DOC, Map.of(), null, RouteVars.empty());

        ServerResponse resp = handler(new Object()).build().handle(propfind);

        assertThat(resp.status()).isEqualTo(404);
        assertThat(resp.headers()).doesNotContainKey(HttpHeaders.ALLOW);
    }

    @Test
    void postWithCurrentIfNoneMatchIsNotModified() {
        EndpointCapabilities endpoint = EndpointCapabilities.builder()
                .post((vars, req) -> new Created(Note.of("created", "\"v1\""), "/docs/3"))
                .build();
        EndpointHandler handler = handler(endpoint).build();

        ServerResponse current = handler.handle(request(HttpMethod.POST, HttpHeaders.IF_NONE_MATCH, "\"v1\""));
        ServerResponse stale = handler.handle(request(HttpMethod.POST, HttpHeaders.IF_NONE_MATCH, "\"v0\""));

        assertThat(current.status()).isEqualTo(304);
        assertThat(current.body()).isInstanceOf(ResponseBody.Empty.class);
        assertThat(stale.status()).isEqualTo(201);
        assertThat(bodyText(stale)).isEqualTo("created");
    }

    @Test
    void putIsNeverAnsweredNotModified() {
        EndpointCapabilities endpoint = EndpointCapabilities.builder()
                .put((vars, req) -> Note.of("stored", "\"v1\""))
                .build();

        ServerResponse resp = handler(endpoint).build().handle(request(HttpMethod.PUT, HttpHeaders.IF_NONE_MATCH, "\"v1\""));

        assertThat(resp.status()).isEqualTo(200);
        assertThat(bodyText(resp)).isEqualTo("stored");
    }

    @Test
    void expiresIsCappedAtLatestHttpDate() {
        Note forever = new Note("x", "\"v1\"", Note.MODIFIED, Duration.ofDays(365L * 20_000));
        EndpointHandler handler = handler((Getter) (vars, req) -> forever).build();

        ServerResponse resp = handler.handle(request(HttpMethod.GET));

        assertThat(firstHeader(resp, HttpHeaders.EXPIRES)).isEqualTo("Fri, 31 Dec 9999 23:59:59 GMT");
    }

    @Test
    void postCreatesWithLocation() {
        FullEndpoint endpoint = new FullEndpoint();
        EndpointHandler handler = handler(endpoint).build();

        ServerResponse resp = handler.handle(request(HttpMethod.POST, "second".getBytes(StandardCharsets.UTF_8)));

        assertThat(resp.status()).isEqualTo(201);
        assertThat(firstHeader(resp, HttpHeaders.LOCATION)).isEqualTo("/docs/2");
        assertThat(firstHeader(resp, HttpHeaders.ETAG)).isEqualTo("\"p1\"");
        assertThat(bodyText(resp)).isEqualTo("second");
    }

    @Test
    void postWithoutResourceStillCreates() {
        EndpointCapabilities endpoint = EndpointCapabilities.builder()
                .post((vars, req) -> Created.at("/docs/9"))
                .build();

        ServerResponse resp = handler(endpoint).build().handle(request(HttpMethod.POST));

        assertThat(resp.status()).isEqualTo(201);
        assertThat(firstHeader(resp, HttpHeaders.LOCATION)).isEqualTo("/docs/9");
        assertThat(resp.body()).isInstanceOf(ResponseBody.Empty.class);
    }

    @Test
    void putAlwaysAnswersOk() {
        EndpointCapabilities endpoint = EndpointCapabilities.builder()
                .put((vars, req) -> null)
                .patch((vars, req) -> Note.of("patched", "\"v2\""))
                .build();
        EndpointHandler handler = handler(endpoint).build();

        ServerResponse put = handler.handle(request(HttpMethod.PUT));
        ServerResponse patch = handler.handle(request(HttpMethod.PATCH));

        assertThat(put.status()).isEqualTo(200);
        assertThat(put.body()).isInstanceOf(ResponseBody.Empty.class);
        assertThat(patch.status()).isEqualTo(200);
        assertThat(firstHeader(patch, HttpHeaders.ETAG)).isEqualTo("\"v2\"");
        assertThat(bodyText(patch)).isEqualTo("patched");
    }

    @Test
    void stalePatchIsRejectedAndLeavesResourceUnchanged() {
        FullEndpoint endpoint = new FullEndpoint();
        EndpointHandler handler = handler(endpoint).build();

        ServerResponse resp = handler.handle(request(HttpMethod.PATCH, "new".getBytes(StandardCharsets.UTF_8),
                HttpHeaders.IF_MATCH, "\"v2\""));

        assertThat(resp.status()).isEqualTo(412);
        assertThat(endpoint.current.get().text()).isEqualTo("first");

        ServerResponse fresh = handler.handle(request(HttpMethod.PATCH, "new".getBytes(StandardCharsets.UTF_8),
                HttpHeaders.IF_MATCH, "\"v1\""));
        assertThat(fresh.status()).isEqualTo(200);
        assertThat(endpoint.current.get().text()).isEqualTo("new");
    }

    @Test
    void deleteReturnsNoContent() {
        FullEndpoint endpoint = new FullEndpoint();

        ServerResponse resp = handler(endpoint).build().handle(request(HttpMethod.DELETE));

        assertThat(resp.status()).isEqualTo(204);
        assertThat(endpoint.current.get()).isNull();
    }

    @Test
    void restExceptionFromOperationBecomesErrorResponse() {
        EndpointHandler handler = handler((Getter) (vars, req) -> {
            throw new RestException.NotFound("no document 1");
        }).build();

        ServerResponse resp = handler.handle(request(HttpMethod.GET));

        assertThat(resp.status()).isEqualTo(404);
        assertThat(bodyText(resp)).isEqualTo("404 Not Found: no document 1");
        assertThat(firstHeader(resp, HttpHeaders.CONTENT_TYPE)).isEqualTo(HttpHeaders.CT_TEXT_PLAIN);
        assertThat(firstHeader(resp, HttpHeaders.CACHE_CONTROL)).isEqualTo("no-store");
    }

    @Test
    void unexpectedExceptionBecomesInternalServerError() {
        EndpointHandler handler = handler((Getter) (vars, req) -> {
            throw new IllegalStateException("store offline");
        }).build();

        ServerResponse resp = handler.handle(request(HttpMethod.GET));

        assertThat(resp.status()).isEqualTo(500);
        assertThat(bodyText(resp)).doesNotContain("store offline");
    }

    @Test
    void errorOnHeadHasNoBody() {
        EndpointHandler handler = handler((Getter) (vars, req) -> {
            throw new RestException.Forbidden("private");
        }).build();

        ServerResponse resp = handler.handle(request(HttpMethod.HEAD));

        assertThat(resp.status()).isEqualTo(403);
        assertThat(resp.body()).isInstanceOf(ResponseBody.Empty.class);
        assertThat(firstHeader(resp, HttpHeaders.CONTENT_LENGTH)).isNotEqualTo("0");
    }

    @Test
    void unacceptableMediaTypeIsRejected() {
        EndpointHandler handler = handler((Getter) (vars, req) -> Note.of("hello", "\"v1\"")).build();

        ServerResponse resp = handler.handle(request(HttpMethod.GET, HttpHeaders.ACCEPT, "application/xml"));

        assertThat(resp.status()).isEqualTo(406);
        assertThat(firstHeader(resp, HttpHeaders.CONTENT_TYPE)).isEqualTo(HttpHeaders.CT_TEXT_PLAIN);
        assertThat(bodyText(resp)).contains("text/plain");
    }

    @Test
    void marshalableResourceProducesItsOwnRepresentation() {
        EndpointHandler handler = handler((Getter) (vars, req) -> new Card("ada")).build();

        ServerResponse resp = handler.handle(request(HttpMethod.GET, HttpHeaders.ACCEPT, "application/xml"));

        assertThat(resp.status()).isEqualTo(200);
        assertThat(firstHeader(resp, HttpHeaders.CONTENT_TYPE)).isEqualTo("text/vcard");
        assertThat(bodyText(resp)).isEqualTo("FN:ada");
        assertThat(firstHeader(resp, HttpHeaders.ETAG)).isEqualTo("\"card\"");
    }

    @Test
    void emptyRepresentationOnGetIsNoContent() {
        EndpointHandler handler = handler((Getter) (vars, req) -> Note.of("", "\"e\"")).build();

        ServerResponse resp = handler.handle(request(HttpMethod.GET));

        assertThat(resp.status()).isEqualTo(204);
        assertThat(resp.headers()).doesNotContainKey(HttpHeaders.CONTENT_LENGTH);
        assertThat(firstHeader(resp, HttpHeaders.ETAG)).isEqualTo("\"e\"");
    }

    @Test
    void directWriterReceivesPreparedHeaders() throws Exception {
        EndpointHandler handler = handler((Getter) (vars, req) -> new Download()).build();

        ServerResponse resp = handler.handle(request(HttpMethod.GET));

        assertThat(resp.status()).isEqualTo(200);
        assertThat(firstHeader(resp, "Content-Disposition")).isEqualTo("attachment");
        assertThat(firstHeader(resp, HttpHeaders.ETAG)).isEqualTo("\"dl\"");
        assertThat(firstHeader(resp, HttpHeaders.CONTENT_TYPE)).isEqualTo(HttpHeaders.CT_OCTET_STREAM);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ((ResponseBody.Streaming) resp.body()).writer().writeTo(out);
        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("raw bytes, etag \"dl\"");

        ServerResponse head = handler.handle(request(HttpMethod.HEAD));
        assertThat(head.body()).isInstanceOf(ResponseBody.Empty.class);
        assertThat(firstHeader(head, "Content-Disposition")).isEqualTo("attachment");
    }

    @Test
    void directWriterReturningNothingIsServerError() {
        Download broken = new Download() {
            @Override
            public ServerResponse write(ServerRequest request, Map<String, List<String>> prepared) {
                return null;
            }
        };
        EndpointHandler handler = handler((Getter) (vars, req) -> broken).build();

        assertThat(handler.handle(request(HttpMethod.GET)).status()).isEqualTo(500);
    }

    @Test
    void compressesWhenClientAcceptsGzip() throws Exception {
        String text = "a".repeat(64);
        EndpointHandler handler = handler((Getter) (vars, req) -> Note.of(text, "\"v1\""))
                .compression(new StandardCompression(16))
                .build();

        ServerResponse resp = handler.handle(request(HttpMethod.GET, HttpHeaders.ACCEPT_ENCODING, "br, gzip;q=0.8"));

        assertThat(firstHeader(resp, HttpHeaders.CONTENT_ENCODING)).isEqualTo("gzip");
        assertThat(resp.headers().get(HttpHeaders.VARY)).containsExactly(HttpHeaders.ACCEPT, HttpHeaders.ACCEPT_ENCODING);
        byte[] compressed = bodyBytes(resp);
        assertThat(firstHeader(resp, HttpHeaders.CONTENT_LENGTH)).isEqualTo(Integer.toString(compressed.length));
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo(text);
        }
    }

    @Test
    void handlerIsSafeForConcurrentRequests() throws Exception {
        EndpointHandler handler = handler((Getter) (vars, req) -> Note.of("hello", "\"v1\"")).build();
        List<Thread> threads = new ArrayList<>();
        AtomicInteger ok = new AtomicInteger();
        for (int i = 0; i < 8; i++) {
            Thread t = new Thread(() -> {
                for (int j = 0; j < 100; j++) {
                    if (handler.handle(request(HttpMethod.GET)).status() == 200) ok.incrementAndGet();
                }
            });
            threads.add(t);
            t.start();
        }
        for (Thread t : threads) t.join();

        assertThat(ok).hasValue(800);
    }

    /** Every operation over a single stored note. */
    static final class FullEndpoint implements Getter, Patcher, Putter, Poster, Deleter {

        final AtomicReference<Note> current = new AtomicReference<>(Note.of("first", "\"v1\""));

        @Override
        public Resource get(RouteVars vars, ServerRequest request) {
            return current.get();
        }

        @Override
        public Resource patch(RouteVars vars, ServerRequest request) throws Exception {
            Note note = current.get();
            if (Conditions.hasWriteConflict(note, request)) {
                throw new RestException.PreconditionFailed();
            }
            Note updated = Note.of(new String(request.body().readAllBytes(), StandardCharsets.UTF_8), "\"v2\"");
            current.set(updated);
            return updated;
        }

        @Override
        public Resource put(RouteVars vars, ServerRequest request) throws Exception {
            return patch(vars, request);
        }

        @Override
        public Created post(RouteVars vars, ServerRequest request) throws Exception {
            Note created = Note.of(new String(request.body().readAllBytes(), StandardCharsets.UTF_8), "\"p1\"");
            return new Created(created, "/docs/2");
        }

        @Override
        public void delete(RouteVars vars, ServerRequest request) {
            current.set(null);
        }
    }

    record Card(String name) implements Resource, Marshalable {
        @Override
        public String etag() {
            return "\"card\"";
        }

        @Override
        public Instant lastModified() {
            return Note.MODIFIED;
        }

        @Override
        public Duration ttl() {
            return Duration.ZERO;
        }

        @Override
        public Representation marshal(ServerRequest request) {
            return new Representation("text/vcard", ("FN:" + name).getBytes(StandardCharsets.UTF_8));
        }
    }

    static class Download implements Resource, DirectWriter {
        @Override
        public String etag() {
            return "\"dl\"";
        }

        @Override
        public Instant lastModified() {
            return Note.MODIFIED;
        }

        @Override
        public Duration ttl() {
            return Duration.ofMinutes(5);
        }

        @Override
        public ServerResponse write(ServerRequest request, Map<String, List<String>> prepared) {
            String etag = prepared.get(HttpHeaders.ETAG).get(0);
            byte[] bytes = ("raw bytes, etag " + etag).getBytes(StandardCharsets.UTF_8);
            return new ServerResponse(200, new ResponseBody.Streaming(out -> out.write(bytes)))
                    .header(HttpHeaders.CONTENT_TYPE, HttpHeaders.CT_OCTET_STREAM)
                    .header("Content-Disposition", "attachment");
        }
    }
}
