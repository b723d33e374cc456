package io.rstkit.server.core;

import io.rstkit.server.spi.CodecRegistry;
import io.rstkit.server.spi.RepresentationCodec;
import io.rstkit.server.spi.RepresentationCodecProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * {@link CodecRegistry} backed by {@link java.util.ServiceLoader}.
 *
 * <p>Resolves:
 * <ul>
 *   <li>codecs contributed by registered {@link RepresentationCodecProvider}s, in discovery order</li>
 *   <li>{@code text/plain} via {@link PlainTextCodec} unless a provider supplies one</li>
 * </ul>
 */
public final class ServiceLoaderCodecRegistry implements CodecRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(ServiceLoaderCodecRegistry.class);

    private final Map<String, RepresentationCodec> byContentType;
    private final List<RepresentationCodec> ordered;

    public ServiceLoaderCodecRegistry(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Map<String, RepresentationCodec> map = new LinkedHashMap<>();

        ServiceLoader<RepresentationCodecProvider> loader = ServiceLoader.load(RepresentationCodecProvider.class, cl);
        for (RepresentationCodecProvider p : loader) {
            for (RepresentationCodec c : p.codecs()) {
                if (c == null || c.contentType() == null) continue;
                String normalized = CodecRegistry.normalizeContentType(c.contentType());
                if (!normalized.isEmpty()) {
                    LOG.debug("Registered {} codec from {}", normalized, p.getClass().getName());
                    map.put(normalized, c);
                }
            }
        }
        map.putIfAbsent(CodecRegistry.normalizeContentType(PlainTextCodec.INSTANCE.contentType()), PlainTextCodec.INSTANCE);
        this.byContentType = Collections.unmodifiableMap(map);
        this.ordered = List.copyOf(map.values());
    }

    public static ServiceLoaderCodecRegistry defaultRegistry() {
        return new ServiceLoaderCodecRegistry(Thread.currentThread().getContextClassLoader());
    }

    @Override
    public Optional<RepresentationCodec> find(String contentType) {
        String normalized = CodecRegistry.normalizeContentType(contentType);
        if (normalized.isEmpty()) return Optional.empty();
        return Optional.ofNullable(byContentType.get(normalized));
    }

    @Override
    public List<RepresentationCodec> codecs() {
        return ordered;
    }
}
