package io.rstkit.server.spi;

/**
 * Result of a {@link Poster}.
 *
 * @param resource the created resource, or null to answer without a body
 * @param location URI of the new resource, or null/empty to omit {@code Location}
 */
public record Created(Resource resource, String location) {

    public static Created at(String location) {
        return new Created(null, location);
    }

    public boolean hasLocation() {
        return location != null && !location.isEmpty();
    }
}
