package io.rstkit.server.core;

import io.rstkit.core.HttpHeaders;
import io.rstkit.core.HttpMethod;
import io.rstkit.core.RestException;
import io.rstkit.server.spi.Marshaler;
import io.rstkit.server.spi.Representation;
import io.rstkit.server.spi.ResponseBody;
import io.rstkit.server.spi.ServerRequest;
import io.rstkit.server.spi.ServerResponse;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Maps a {@link RestException} to its response.
 *
 * <p>The body is an {@link ErrorDocument} in the representation the client asked for, or
 * plain text when nothing acceptable exists. Error responses are never cached.
 */
final class ErrorResponses {

    private final Marshaler marshaler;

    ErrorResponses(Marshaler marshaler) {
        this.marshaler = Objects.requireNonNull(marshaler, "marshaler");
    }

    ServerResponse render(RestException error, ServerRequest request) {
        ErrorDocument doc = new ErrorDocument(error.status(), error.reason(), error.getMessage());
        Representation rep = represent(doc, request);

        ResponseBody body = request.method() == HttpMethod.HEAD
                ? new ResponseBody.Empty()
                : new ResponseBody.Bytes(rep.bytes());
        ServerResponse resp = new ServerResponse(error.status(), body)
                .header(HttpHeaders.CONTENT_TYPE, rep.contentType())
                .header(HttpHeaders.CONTENT_LENGTH, Integer.toString(rep.bytes().length))
                .header(HttpHeaders.CACHE_CONTROL, "no-store");

        if (error instanceof RestException.MethodNotAllowed notAllowed) {
            resp.header(HttpHeaders.ALLOW, notAllowed.allowed().stream().map(Enum::name).collect(Collectors.joining(", ")));
        } else if (error instanceof RestException.RangeNotSatisfiable unsatisfiable) {
            resp.header(HttpHeaders.CONTENT_RANGE, unsatisfiable.unit() + " */" + unsatisfiable.count());
        }
        return resp;
    }

    private Representation represent(ErrorDocument doc, ServerRequest request) {
        try {
            return marshaler.marshal(doc, request);
        } catch (Exception e) {
            return new Representation(PlainTextCodec.INSTANCE.contentType(), PlainTextCodec.INSTANCE.encode(doc));
        }
    }
}
