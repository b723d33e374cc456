package io.rstkit.server.spi;

import java.util.List;

/**
 * ServiceLoader provider for {@link RepresentationCodec}.
 *
 * <p>Modules such as {@code rstkit-json-jackson} register implementations via
 * {@code META-INF/services}.
 */
public interface RepresentationCodecProvider {
    List<RepresentationCodec> codecs();
}
