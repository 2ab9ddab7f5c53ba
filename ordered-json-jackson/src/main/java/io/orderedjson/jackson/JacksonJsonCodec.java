package io.orderedjson.jackson;

import com.fasterxml.jackson.core.exc.StreamReadException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.orderedjson.core.JsonException;
import io.orderedjson.core.OrderedMap;
import io.orderedjson.core.OrderedMapCodec;

import java.util.List;
import java.util.Objects;

/**
 * {@link ObjectMapper}-backed codec for application objects that contain {@link OrderedMap}
 * or {@link io.orderedjson.core.JsonValue} fields.
 *
 * <p>The mapper has {@link OrderedJsonModule} registered. Failures are reported as
 * {@link JsonException}; when the underlying failure came from the ordered codec, its typed
 * exception ({@link JsonException.Malformed}, {@link JsonException.Unencodable}) is rethrown as is.
 */
public final class JacksonJsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a codec with a fresh ObjectMapper and the default ordered codec.
     */
    public JacksonJsonCodec() {
        this(new ObjectMapper());
    }

    /**
     * Creates a codec around a caller-configured ObjectMapper.
     * @param mapper the ObjectMapper to use; {@link OrderedJsonModule} is registered on it
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this(mapper, OrderedMapCodec.defaults());
    }

    /**
     * Creates a codec around a caller-configured ObjectMapper and ordered codec.
     */
    public JacksonJsonCodec(ObjectMapper mapper, OrderedMapCodec codec) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.mapper.registerModule(new OrderedJsonModule(Objects.requireNonNull(codec, "codec")));
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    public String writeString(Object value) throws JsonException {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw failure("Failed to serialize object to string", e);
        }
    }

    public <T> T readValue(String json, Class<T> type) throws JsonException {
        try {
            return mapper.readValue(json, type);
        } catch (Exception e) {
            throw failure("Failed to deserialize string to " + type.getName(), e);
        }
    }

    /**
     * Deserializes a JSON array to a list of typed objects.
     */
    public <T> List<T> readList(String json, Class<T> elementType) throws JsonException {
        try {
            return mapper.readValue(json, mapper.getTypeFactory().constructCollectionType(List.class, elementType));
        } catch (Exception e) {
            throw failure("Failed to deserialize string to List<" + elementType.getName() + ">", e);
        }
    }

    /**
     * Reads a JSON object into an {@link OrderedMap} through the mapper.
     */
    public OrderedMap readMap(String json) throws JsonException {
        return readValue(json, OrderedMap.class);
    }

    private static JsonException failure(String message, Exception e) {
        boolean malformed = false;
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof JsonException typed) {
                return typed;
            }
            malformed |= t instanceof StreamReadException;
        }
        return malformed ? new JsonException.Malformed(message, e) : new JsonException(message, e);
    }
}
