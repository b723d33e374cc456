package io.rstkit.servlet;

import io.rstkit.server.spi.RouteVars;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Supplies the route variables of a request. Routing itself belongs to the host application.
 */
@FunctionalInterface
public interface RouteVarsResolver {

    RouteVars resolve(HttpServletRequest request);

    static RouteVarsResolver none() {
        return request -> RouteVars.empty();
    }
}
