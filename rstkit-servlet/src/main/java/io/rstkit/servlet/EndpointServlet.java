package io.rstkit.servlet;

import io.rstkit.server.core.EndpointHandler;
import io.rstkit.server.spi.ResponseBody;
import io.rstkit.server.spi.ServerRequest;
import io.rstkit.server.spi.ServerResponse;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serves one endpoint through the Servlet API.
 *
 * <p>The request body is passed through unread; operations consume it as they need.
 */
public final class EndpointServlet extends HttpServlet {

    private static final Logger LOG = LoggerFactory.getLogger(EndpointServlet.class);

    private final transient EndpointHandler handler;
    private final transient RouteVarsResolver routeVars;

    public EndpointServlet(EndpointHandler handler) {
        this(handler, RouteVarsResolver.none());
    }

    public EndpointServlet(EndpointHandler handler, RouteVarsResolver routeVars) {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.routeVars = Objects.requireNonNull(routeVars, "routeVars");
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        ServerResponse engineResp;
        try {
            engineResp = handler.handle(toEngineRequest(req));
        } catch (Exception e) {
            LOG.error("Could not adapt {} {}", req.getMethod(), req.getRequestURI(), e);
            resp.sendError(500);
            return;
        }

        resp.setStatus(engineResp.status());
        engineResp.headers().forEach((k, vals) -> vals.forEach(v -> resp.addHeader(k, v)));

        ResponseBody body = engineResp.body();
        if (body instanceof ResponseBody.Bytes bytes) {
            OutputStream out = resp.getOutputStream();
            out.write(bytes.bytes());
            out.flush();
        } else if (body instanceof ResponseBody.Streaming streaming) {
            OutputStream out = resp.getOutputStream();
            streaming.writer().writeTo(out);
            out.flush();
        }
    }

    private ServerRequest toEngineRequest(HttpServletRequest req) throws Exception {
        URI uri = new URI(req.getRequestURL().toString() + (req.getQueryString() == null ? "" : "?" + req.getQueryString()));

        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, Collections.list(req.getHeaders(name)));
        }

        return new ServerRequest(req.getMethod(), uri, headers, req.getInputStream(), routeVars.resolve(req));
    }
}
