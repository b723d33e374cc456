/**
 * Server-side SPI for rstkit.
 *
 * <p>Applications implement {@link io.rstkit.server.spi.Resource} for the things they serve and
 * any of {@link io.rstkit.server.spi.Getter}, {@link io.rstkit.server.spi.Patcher},
 * {@link io.rstkit.server.spi.Putter}, {@link io.rstkit.server.spi.Poster} and
 * {@link io.rstkit.server.spi.Deleter} for the endpoints exposing them. Optional resource
 * capabilities ({@link io.rstkit.server.spi.Ranger}, {@link io.rstkit.server.spi.Marshalable},
 * {@link io.rstkit.server.spi.DirectWriter}) are detected per request.
 *
 * <p>The SPI is blocking and minimal; framework integrations adapt
 * {@link io.rstkit.server.spi.ServerRequest} and {@link io.rstkit.server.spi.ServerResponse}.
 */
package io.rstkit.server.spi;
