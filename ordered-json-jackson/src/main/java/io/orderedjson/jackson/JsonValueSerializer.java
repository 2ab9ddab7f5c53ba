package io.orderedjson.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.orderedjson.core.JsonException;
import io.orderedjson.core.JsonValue;
import io.orderedjson.core.OrderedMapCodec;

import java.io.IOException;

/**
 * Writes any {@link JsonValue} variant in its natural JSON form.
 */
final class JsonValueSerializer extends StdSerializer<JsonValue> {
    private static final long serialVersionUID = 1L;

    private final transient OrderedMapCodec codec;

    JsonValueSerializer(OrderedMapCodec codec) {
        super(JsonValue.class);
        this.codec = codec;
    }

    @Override
    public void serialize(JsonValue value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        try {
            codec.writeValue(gen, value);
        } catch (JsonException e) {
            throw JsonMappingException.from(gen, e.getMessage(), e);
        }
    }
}
