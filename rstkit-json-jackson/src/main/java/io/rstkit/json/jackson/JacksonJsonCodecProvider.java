package io.rstkit.json.jackson;

import io.rstkit.server.spi.RepresentationCodec;
import io.rstkit.server.spi.RepresentationCodecProvider;

import java.util.List;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements RepresentationCodecProvider {
    @Override
    public List<RepresentationCodec> codecs() {
        return List.of(new JacksonJsonCodec());
    }
}
