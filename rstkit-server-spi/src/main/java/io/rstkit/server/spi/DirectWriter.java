package io.rstkit.server.spi;

import java.util.List;
import java.util.Map;

/**
 * Escape hatch for resources that produce their own response.
 *
 * <p>Marshaling, compression and status selection are skipped. The validator headers computed
 * so far ({@code ETag}, {@code Last-Modified}, {@code Expires}, {@code Vary}) are passed in and
 * merged into the returned response unless it sets them itself. Use
 * {@link ResponseBody.Streaming} for chunked output.
 */
@FunctionalInterface
public interface DirectWriter {

    ServerResponse write(ServerRequest request, Map<String, List<String>> prepared) throws Exception;
}
