package io.orderedjson.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.orderedjson.core.JsonException;
import io.orderedjson.core.OrderedMap;
import io.orderedjson.core.OrderedMapCodec;

import java.io.IOException;

/**
 * Reads a JSON object into an {@link OrderedMap}, keeping member order.
 */
final class OrderedMapDeserializer extends StdDeserializer<OrderedMap> {
    private static final long serialVersionUID = 1L;

    private final transient OrderedMapCodec codec;

    OrderedMapDeserializer(OrderedMapCodec codec) {
        super(OrderedMap.class);
        this.codec = codec;
    }

    @Override
    public OrderedMap deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        if (p.currentToken() != JsonToken.START_OBJECT) {
            return (OrderedMap) ctxt.handleUnexpectedToken(OrderedMap.class, p);
        }
        try {
            return codec.readObject(p);
        } catch (JsonException e) {
            throw JsonMappingException.from(p, e.getMessage(), e);
        }
    }
}
