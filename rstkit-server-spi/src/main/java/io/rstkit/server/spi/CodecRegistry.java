package io.rstkit.server.spi;

import java.util.*;

/**
 * Registry that resolves a {@link RepresentationCodec} for a given Content-Type.
 *
 * <p>Use {@link #builder()} to create a registry with explicit codec registration:
 * <pre>{@code
 * CodecRegistry registry = CodecRegistry.builder()
 *     .register(new JacksonJsonCodec())
 *     .build();
 * }</pre>
 *
 * <p>This approach avoids ServiceLoader, which keeps native-image builds simple.
 */
public interface CodecRegistry {

    /**
     * Find a codec for the given content type; parameters are ignored.
     *
     * @param contentType the content type (e.g. "application/json")
     * @return the codec if registered
     */
    Optional<RepresentationCodec> find(String contentType);

    /**
     * Registered codecs, in registration order (the first is the default representation).
     */
    List<RepresentationCodec> codecs();

    /**
     * Creates a new builder for constructing a registry with explicit codec registration.
     *
     * @return a new builder
     */
    static Builder builder() {
        return new Builder();
    }

    /**
     * Lower-cased media type without parameters.
     */
    static String normalizeContentType(String contentType) {
        if (contentType == null) return "";
        int semi = contentType.indexOf(';');
        String base = semi >= 0 ? contentType.substring(0, semi) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Builder for creating a {@link CodecRegistry} with explicit codec registration.
     */
    final class Builder {
        private final Map<String, RepresentationCodec> codecs = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Register a codec. A later codec for the same content type replaces the earlier one.
         *
         * @param codec the codec to register
         * @return this builder
         */
        public Builder register(RepresentationCodec codec) {
            Objects.requireNonNull(codec, "codec");
            String ct = codec.contentType();
            if (ct == null || ct.isBlank()) {
                throw new IllegalArgumentException("codec contentType must not be null or blank");
            }
            codecs.put(normalizeContentType(ct), codec);
            return this;
        }

        /**
         * Register multiple codecs.
         *
         * @param codecs the codecs to register
         * @return this builder
         */
        public Builder registerAll(Iterable<? extends RepresentationCodec> codecs) {
            for (RepresentationCodec codec : codecs) {
                register(codec);
            }
            return this;
        }

        /**
         * Build the registry.
         *
         * @return an immutable registry containing the registered codecs
         */
        public CodecRegistry build() {
            Map<String, RepresentationCodec> snapshot = Collections.unmodifiableMap(new LinkedHashMap<>(codecs));
            List<RepresentationCodec> ordered = List.copyOf(snapshot.values());
            return new CodecRegistry() {
                @Override
                public Optional<RepresentationCodec> find(String contentType) {
                    String normalized = normalizeContentType(contentType);
                    if (normalized.isEmpty()) return Optional.empty();
                    return Optional.ofNullable(snapshot.get(normalized));
                }

                @Override
                public List<RepresentationCodec> codecs() {
                    return ordered;
                }
            };
        }
    }
}
