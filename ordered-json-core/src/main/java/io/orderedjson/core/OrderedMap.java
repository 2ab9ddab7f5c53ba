package io.orderedjson.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;

/**
 * A map from string keys to {@link JsonValue}s that keeps keys in the order they were added.
 *
 * <p>Entries can be read by key or by position. Keys are appended by {@link #set(String, JsonValue)}
 * and can be inserted at a position with {@link #setAt(int, String, JsonValue)}; replacing the value
 * of an existing key never moves it.
 *
 * <p>Serialization goes through {@link OrderedMapCodec}, which writes members in key order and
 * decodes objects without reordering them.
 *
 * <p>A map cannot be stored in itself. Cycles through other maps are not detected here:
 * {@link #copy()}, {@link #toJava()}, {@link #equals(Object)} and {@link #hashCode()} recurse into
 * nested maps and fail with {@link StackOverflowError} on a cyclic structure, while the codec
 * reports it as {@link JsonException.Unencodable}.
 *
 * <p>This class is not thread-safe. Callers that share an instance across threads must guard it
 * externally, e.g. with a {@link java.util.concurrent.locks.ReadWriteLock}.
 */
public final class OrderedMap implements JsonValue {
    private static final Logger log = LoggerFactory.getLogger(OrderedMap.class);

    // order and entries always hold the same key set
    private final List<String> order = new ArrayList<>();
    private final Map<String, JsonValue> entries = new HashMap<>();

    public OrderedMap() {
    }

    /**
     * Decodes a JSON object with the default codec.
     *
     * @throws JsonException if the text is not a well-formed JSON object
     */
    public static OrderedMap parse(String json) throws JsonException {
        return OrderedMapCodec.defaults().decode(json);
    }

    /**
     * Returns the value stored under {@code key}, or empty if the key is absent.
     */
    public Optional<JsonValue> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Returns the value at {@code pos} in key order, or empty if {@code pos} is outside
     * {@code [0, size())}.
     */
    public Optional<JsonValue> getAt(int pos) {
        if (pos < 0 || pos >= order.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(order.get(pos)));
    }

    public Optional<OrderedMap> getMap(String key) {
        return get(key).filter(OrderedMap.class::isInstance).map(OrderedMap.class::cast);
    }

    public Optional<JsonValue.Array> getArray(String key) {
        return get(key).filter(JsonValue.Array.class::isInstance).map(JsonValue.Array.class::cast);
    }

    public Optional<String> getString(String key) {
        return get(key).filter(JsonValue.Text.class::isInstance).map(v -> ((JsonValue.Text) v).value());
    }

    /**
     * Stores {@code value} under {@code key}. A new key is appended to the end of the order;
     * an existing key keeps its position. A {@code null} value is stored as {@link JsonValue#NULL}.
     *
     * @throws IllegalArgumentException if {@code value} is this map
     */
    public OrderedMap set(String key, JsonValue value) {
        Objects.requireNonNull(key, "key");
        checkNotSelf(value);
        if (!entries.containsKey(key)) {
            order.add(key);
        }
        entries.put(key, value == null ? JsonValue.NULL : value);
        return this;
    }

    /**
     * Converts {@code value} with {@link JsonValue#of(Object)} and stores it.
     */
    public OrderedMap set(String key, Object value) {
        return set(key, JsonValue.of(value));
    }

    /**
     * Inserts a new key at {@code index} or replaces the value of an existing key.
     *
     * <p>An index of {@code -1} or at least {@link #size()} appends like {@link #set(String, JsonValue)}.
     * An existing key only has its value replaced; its position is not changed. For a new key a
     * negative index below {@code -size()} inserts at the front, and any other negative index is
     * resolved as {@code size() + index + 1}, so {@code -2} inserts before the last key.
     *
     * @throws IllegalArgumentException if {@code value} is this map
     */
    public OrderedMap setAt(int index, String key, JsonValue value) {
        Objects.requireNonNull(key, "key");
        checkNotSelf(value);
        int n = entries.size();
        if (index == -1 || index >= n) {
            return set(key, value);
        }
        if (!entries.containsKey(key)) {
            if (index < -n) {
                index = 0;
            }
            if (index < 0) {
                index = n + index + 1;
            }
            order.add(index, key);
        }
        entries.put(key, value == null ? JsonValue.NULL : value);
        return this;
    }

    public OrderedMap setAt(int index, String key, Object value) {
        return setAt(index, key, JsonValue.of(value));
    }

    private void checkNotSelf(JsonValue value) {
        if (value == this) {
            throw new IllegalArgumentException("an ordered map cannot contain itself");
        }
    }

    /**
     * Removes {@code key}. Does nothing if the key is absent.
     */
    public OrderedMap delete(String key) {
        if (key == null || !entries.containsKey(key)) {
            return this;
        }
        order.remove(key);
        entries.remove(key);
        return this;
    }

    /**
     * Removes the key at {@code offset}. Does nothing if {@code offset} is outside {@code [0, size())}.
     */
    public OrderedMap deleteAt(int offset) {
        if (offset < 0 || offset >= order.size()) {
            return this;
        }
        return delete(order.get(offset));
    }

    public void clear() {
        order.clear();
        entries.clear();
    }

    /**
     * Returns a snapshot of the keys in order.
     */
    public List<String> keys() {
        return List.copyOf(order);
    }

    /**
     * Returns a snapshot of the values in key order.
     */
    public List<JsonValue> values() {
        List<JsonValue> values = new ArrayList<>(order.size());
        for (String key : order) {
            values.add(entries.get(key));
        }
        return List.copyOf(values);
    }

    public boolean exists(String key) {
        return key != null && entries.containsKey(key);
    }

    /**
     * Returns the position of {@code key} in the order, or -1 if it is absent.
     */
    public int indexOf(String key) {
        return order.indexOf(key);
    }

    public int size() {
        return order.size();
    }

    public boolean isEmpty() {
        return order.isEmpty();
    }

    public void forEach(BiConsumer<String, JsonValue> action) {
        Objects.requireNonNull(action, "action");
        for (String key : order) {
            action.accept(key, entries.get(key));
        }
    }

    /**
     * Returns a deep copy. Nested maps are copied, including maps held inside arrays.
     */
    public OrderedMap copy() {
        OrderedMap copy = new OrderedMap();
        for (String key : order) {
            copy.set(key, copyOf(entries.get(key)));
        }
        return copy;
    }

    private static JsonValue copyOf(JsonValue value) {
        if (value instanceof OrderedMap nested) {
            return nested.copy();
        }
        if (value instanceof JsonValue.Array array) {
            List<JsonValue> elements = new ArrayList<>(array.size());
            for (JsonValue e : array.elements()) elements.add(copyOf(e));
            return new JsonValue.Array(elements);
        }
        return value;
    }

    /**
     * Encodes this map as compact JSON with the default codec.
     *
     * @throws JsonException.Unencodable if a contained value has no JSON form
     */
    public String toJson() throws JsonException {
        return OrderedMapCodec.defaults().encode(this);
    }

    // live views for the codec, read-only
    List<String> orderView() {
        return Collections.unmodifiableList(order);
    }

    JsonValue entry(String key) {
        return entries.get(key);
    }

    @Override
    public JsonValueType type() {
        return JsonValueType.OBJECT;
    }

    @Override
    public Object toJava() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String key : order) {
            out.put(key, entries.get(key).toJava());
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OrderedMap other)) return false;
        return order.equals(other.order) && entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return 31 * order.hashCode() + entries.hashCode();
    }

    /**
     * Returns the compact JSON form, or an empty string if the map cannot be encoded.
     */
    @Override
    public String toString() {
        try {
            return toJson();
        } catch (JsonException e) {
            log.warn("Failed to encode ordered map: {}", e.getMessage());
            return "";
        }
    }
}
