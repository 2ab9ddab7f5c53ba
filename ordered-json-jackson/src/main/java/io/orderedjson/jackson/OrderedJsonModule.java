package io.orderedjson.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.orderedjson.core.JsonValue;
import io.orderedjson.core.OrderedMap;
import io.orderedjson.core.OrderedMapCodec;

import java.util.Objects;

/**
 * Jackson module that reads and writes {@link OrderedMap} and {@link JsonValue} through
 * {@link OrderedMapCodec}, so member order survives databind round trips.
 *
 * <p>Register it explicitly:
 * <pre>{@code
 * ObjectMapper mapper = new ObjectMapper().registerModule(new OrderedJsonModule());
 * }</pre>
 * or let {@code ObjectMapper.findAndRegisterModules()} pick it up through {@code ServiceLoader}.
 */
public final class OrderedJsonModule extends SimpleModule {
    private static final long serialVersionUID = 1L;

    public OrderedJsonModule() {
        this(OrderedMapCodec.defaults());
    }

    public OrderedJsonModule(OrderedMapCodec codec) {
        super("OrderedJsonModule", Version.unknownVersion());
        Objects.requireNonNull(codec, "codec");
        addSerializer(OrderedMap.class, new OrderedMapSerializer(codec));
        addSerializer(JsonValue.class, new JsonValueSerializer(codec));
        addDeserializer(OrderedMap.class, new OrderedMapDeserializer(codec));
        addDeserializer(JsonValue.class, new JsonValueDeserializer(codec));
    }
}
