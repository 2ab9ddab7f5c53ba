package io.orderedjson.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.orderedjson.core.JsonException;
import io.orderedjson.core.OrderedMap;
import io.orderedjson.core.OrderedMapCodec;

import java.io.IOException;

/**
 * Writes an {@link OrderedMap} as a JSON object in key order.
 */
final class OrderedMapSerializer extends StdSerializer<OrderedMap> {
    private static final long serialVersionUID = 1L;

    private final transient OrderedMapCodec codec;

    OrderedMapSerializer(OrderedMapCodec codec) {
        super(OrderedMap.class);
        this.codec = codec;
    }

    @Override
    public void serialize(OrderedMap value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        try {
            codec.writeObject(gen, value);
        } catch (JsonException e) {
            throw JsonMappingException.from(gen, e.getMessage(), e);
        }
    }

    @Override
    public boolean isEmpty(SerializerProvider provider, OrderedMap value) {
        return value == null || value.isEmpty();
    }
}
