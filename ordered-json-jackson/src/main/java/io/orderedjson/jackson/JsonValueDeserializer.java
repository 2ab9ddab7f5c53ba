package io.orderedjson.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.orderedjson.core.JsonException;
import io.orderedjson.core.JsonValue;
import io.orderedjson.core.OrderedMapCodec;

import java.io.IOException;

/**
 * Reads any JSON value into the matching {@link JsonValue} variant. JSON {@code null}
 * becomes {@link JsonValue#NULL} rather than a Java {@code null}.
 */
final class JsonValueDeserializer extends StdDeserializer<JsonValue> {
    private static final long serialVersionUID = 1L;

    private final transient OrderedMapCodec codec;

    JsonValueDeserializer(OrderedMapCodec codec) {
        super(JsonValue.class);
        this.codec = codec;
    }

    @Override
    public JsonValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        try {
            return codec.readValue(p);
        } catch (JsonException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }

    @Override
    public JsonValue getNullValue(DeserializationContext ctxt) {
        return JsonValue.NULL;
    }
}
