package io.rstkit.server.core;

import io.rstkit.core.HttpHeaders;
import io.rstkit.core.RestException;
import io.rstkit.server.spi.CodecRegistry;
import io.rstkit.server.spi.Marshaler;
import io.rstkit.server.spi.Representation;
import io.rstkit.server.spi.RepresentationCodec;
import io.rstkit.server.spi.ServerRequest;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * {@link Marshaler} choosing among the codecs of a {@link CodecRegistry} from the request's
 * {@code Accept} header.
 *
 * <p>Media ranges are tried by descending quality; {@code type/*} and {@code *}{@code /*} match the
 * first registered codec of that type. Types listed with {@code q=0} are never chosen. A request
 * without {@code Accept} gets the first registered codec.
 */
public final class NegotiatingMarshaler implements Marshaler {

    private final CodecRegistry registry;
    private final List<String> alternatives;

    public NegotiatingMarshaler(CodecRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.alternatives = registry.codecs().stream().map(RepresentationCodec::contentType).toList();
    }

    @Override
    public Representation marshal(Object value, ServerRequest request) throws Exception {
        String accept = request.header(HttpHeaders.ACCEPT).orElse(null);
        RepresentationCodec codec = choose(accept).orElseThrow(() -> new RestException.NotAcceptable(alternatives));
        return new Representation(codec.contentType(), codec.encode(value));
    }

    @Override
    public List<String> alternatives() {
        return alternatives;
    }

    Optional<RepresentationCodec> choose(String accept) {
        List<RepresentationCodec> codecs = registry.codecs();
        if (codecs.isEmpty()) return Optional.empty();
        if (accept == null || accept.isBlank()) return Optional.of(codecs.get(0));

        List<QualityList.Preference> prefs = QualityList.parse(accept);
        Set<String> refused = new HashSet<>();
        for (QualityList.Preference p : prefs) {
            if (!p.acceptable()) refused.add(CodecRegistry.normalizeContentType(p.value()));
        }
        for (QualityList.Preference p : prefs) {
            if (!p.acceptable()) continue;
            String range = CodecRegistry.normalizeContentType(p.value());
            for (RepresentationCodec codec : codecs) {
                String type = CodecRegistry.normalizeContentType(codec.contentType());
                if (!refused.contains(type) && matches(range, type)) return Optional.of(codec);
            }
        }
        return Optional.empty();
    }

    private static boolean matches(String range, String type) {
        if (range.equals("*/*") || range.equals("*")) return true;
        if (range.endsWith("/*")) return type.startsWith(range.substring(0, range.length() - 1));
        return range.equals(type);
    }
}
