package io.contractrpc.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.json.spi.JsonException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * {@link JsonCodec} on a Jackson {@link ObjectMapper}.
 *
 * <p>Trees are read as {@code LinkedHashMap}/{@code ArrayList} structures, so schemas never see Jackson
 * types. The default mapper rejects trailing content after the first JSON value, which makes
 * {@code {"a":1} junk} a malformed body rather than {@code {"a":1}}.
 */
public final class JacksonJsonCodec implements JsonCodec {

    private final ObjectMapper mapper;

    public JacksonJsonCodec() {
        this(new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS));
    }

    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    @Override
    public byte[] writeBytes(Object value) throws JsonException {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw writeFailure(value, e);
        }
    }

    @Override
    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw writeFailure(value, e);
        }
    }

    @Override
    public Object readTree(byte[] data) throws JsonException {
        try {
            return mapper.readValue(data, Object.class);
        } catch (IOException e) {
            throw readFailure(e);
        }
    }

    @Override
    public Object readTree(String json) throws JsonException {
        try {
            return mapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw readFailure(e);
        }
    }

    @Override
    public Object readTree(InputStream input) throws JsonException {
        try {
            return mapper.readValue(input, Object.class);
        } catch (IOException e) {
            throw readFailure(e);
        }
    }

    @Override
    public <T> T convert(Object value, Class<T> type) throws JsonException {
        try {
            return mapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new JsonException("Cannot bind value to " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private static JsonException writeFailure(Object value, JsonProcessingException e) {
        String type = value == null ? "null" : value.getClass().getSimpleName();
        return new JsonException("Cannot write " + type + " as JSON: " + e.getOriginalMessage(), e);
    }

    private static JsonException readFailure(IOException e) {
        String detail = e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
        return new JsonException("Malformed JSON: " + detail, e);
    }
}
