/**
 * Framework-neutral response pipeline for rstkit.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.rstkit.server.core.EndpointHandler} (method dispatch and error mapping)</li>
 *   <li>{@link io.rstkit.server.core.Conditions} (conditional request evaluation)</li>
 *   <li>{@code RangeNegotiator} (single range requests)</li>
 *   <li>{@code ResponseWriter} (header assembly and status selection)</li>
 *   <li>Default collaborators: {@link io.rstkit.server.core.NegotiatingMarshaler},
 *       {@link io.rstkit.server.core.StandardCompression}, {@link io.rstkit.server.core.CachePolicy}</li>
 * </ul>
 *
 * <p>Framework integrations adapt {@link io.rstkit.server.spi.ServerRequest} and
 * {@link io.rstkit.server.spi.ServerResponse} to their HTTP runtimes.
 */
package io.rstkit.server.core;
