/**
 * HTTP primitives shared by the rstkit server modules.
 *
 * <p>This module contains no server bindings and no third-party dependencies. It models the
 * protocol-level pieces every other module agrees on:
 * <ul>
 *   <li>{@link io.rstkit.core.HttpMethod} (canonical method order)</li>
 *   <li>{@link io.rstkit.core.HttpHeaders} and {@link io.rstkit.core.Headers} (header names and lookup)</li>
 *   <li>{@link io.rstkit.core.HttpDates} (fixed HTTP date format)</li>
 *   <li>{@link io.rstkit.core.RestException} (error taxonomy, one status per kind)</li>
 * </ul>
 */
package io.rstkit.core;
