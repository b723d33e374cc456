package io.rstkit.json.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.rstkit.server.spi.RepresentationCodec;

import java.util.Objects;

/**
 * Jackson implementation of {@link RepresentationCodec} for {@code application/json}.
 */
public final class JacksonJsonCodec implements RepresentationCodec {

    public static final String CONTENT_TYPE = "application/json";

    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default mapper.
     */
    public JacksonJsonCodec() {
        this(JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build());
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public String contentType() {
        return CONTENT_TYPE;
    }

    @Override
    public byte[] encode(Object value) throws JsonEncodingException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new JsonEncodingException("Failed to serialize " + (value == null ? "null" : value.getClass().getName()), e);
        }
    }
}
