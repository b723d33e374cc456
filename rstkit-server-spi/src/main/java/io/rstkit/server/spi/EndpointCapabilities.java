package io.rstkit.server.spi;

import java.util.Optional;

/**
 * The operations an endpoint provides, resolved once.
 *
 * <p>Obtain one either by detection on an object implementing the operation interfaces
 * ({@link #of(Object)}) or from lambdas through {@link #builder()}:
 * <pre>{@code
 * EndpointCapabilities endpoint = EndpointCapabilities.builder()
 *     .get((vars, req) -> store.find(vars.get("id")))
 *     .delete((vars, req) -> store.remove(vars.get("id")))
 *     .build();
 * }</pre>
 */
public record EndpointCapabilities(Getter getter, Patcher patcher, Putter putter, Poster poster, Deleter deleter)
        implements Endpoint {

    /**
     * Detects the operation interfaces implemented by {@code endpoint}.
     */
    public static EndpointCapabilities of(Object endpoint) {
        if (endpoint instanceof EndpointCapabilities caps) return caps;
        return new EndpointCapabilities(
                endpoint instanceof Getter g ? g : null,
                endpoint instanceof Patcher p ? p : null,
                endpoint instanceof Putter p ? p : null,
                endpoint instanceof Poster p ? p : null,
                endpoint instanceof Deleter d ? d : null
        );
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Getter> findGetter() {
        return Optional.ofNullable(getter);
    }

    public Optional<Patcher> findPatcher() {
        return Optional.ofNullable(patcher);
    }

    public Optional<Putter> findPutter() {
        return Optional.ofNullable(putter);
    }

    public Optional<Poster> findPoster() {
        return Optional.ofNullable(poster);
    }

    public Optional<Deleter> findDeleter() {
        return Optional.ofNullable(deleter);
    }

    /**
     * Builder for {@link EndpointCapabilities}.
     */
    public static final class Builder {
        private Getter getter;
        private Patcher patcher;
        private Putter putter;
        private Poster poster;
        private Deleter deleter;

        private Builder() {}

        public Builder get(Getter getter) {
            this.getter = getter;
            return this;
        }

        public Builder patch(Patcher patcher) {
            this.patcher = patcher;
            return this;
        }

        public Builder put(Putter putter) {
            this.putter = putter;
            return this;
        }

        public Builder post(Poster poster) {
            this.poster = poster;
            return this;
        }

        public Builder delete(Deleter deleter) {
            this.deleter = deleter;
            return this;
        }

        public EndpointCapabilities build() {
            return new EndpointCapabilities(getter, patcher, putter, poster, deleter);
        }
    }
}
