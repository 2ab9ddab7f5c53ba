package io.orderedjson.core;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A JSON value held by an {@link OrderedMap}: null, boolean, number, string, array, or a nested
 * ordered object.
 *
 * <p>Arrays are immutable snapshots. Nested objects are {@link OrderedMap} instances and are
 * mutable like any other map.
 */
public sealed interface JsonValue permits OrderedMap, JsonValue.Null, JsonValue.Bool,
        JsonValue.Numeric, JsonValue.Text, JsonValue.Array {

    Null NULL = new Null();
    Bool TRUE = new Bool(true);
    Bool FALSE = new Bool(false);

    /**
     * Returns the kind of this value.
     */
    JsonValueType type();

    /**
     * Converts this value into plain Java objects: {@code null}, {@link Boolean}, {@link Number},
     * {@link String}, {@code LinkedHashMap<String, Object>} or {@code ArrayList<Object>}.
     */
    Object toJava();

    static JsonValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static JsonValue of(long value) {
        return new Numeric(value);
    }

    static JsonValue of(double value) {
        return new Numeric(value);
    }

    static JsonValue of(char value) {
        return new Text(String.valueOf(value));
    }

    static JsonValue of(String value) {
        return value == null ? NULL : new Text(value);
    }

    static Array array(JsonValue... elements) {
        return new Array(Arrays.asList(elements));
    }

    /**
     * Converts a plain Java object into a {@code JsonValue}.
     *
     * <p>Maps keep their iteration order and have their keys converted with
     * {@link String#valueOf(Object)}. Iterables and Java arrays become {@link Array}s.
     *
     * @throws IllegalArgumentException if the object (or something nested in it) has no JSON form
     */
    static JsonValue of(Object value) {
        if (value == null) return NULL;
        if (value instanceof JsonValue json) return json;
        if (value instanceof Boolean b) return of(b.booleanValue());
        if (value instanceof Number n) return new Numeric(n);
        if (value instanceof CharSequence s) return new Text(s.toString());
        if (value instanceof Character c) return new Text(String.valueOf(c));
        if (value instanceof Map<?, ?> map) {
            OrderedMap nested = new OrderedMap();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                nested.set(String.valueOf(e.getKey()), of(e.getValue()));
            }
            return nested;
        }
        if (value instanceof Iterable<?> items) {
            List<JsonValue> elements = new ArrayList<>();
            for (Object item : items) elements.add(of(item));
            return new Array(elements);
        }
        if (value.getClass().isArray()) {
            int length = java.lang.reflect.Array.getLength(value);
            List<JsonValue> elements = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                elements.add(of(java.lang.reflect.Array.get(value, i)));
            }
            return new Array(elements);
        }
        throw new IllegalArgumentException("no JSON representation for " + value.getClass().getName());
    }

    /**
     * JSON {@code null}. Use {@link JsonValue#NULL}.
     */
    record Null() implements JsonValue {
        @Override
        public JsonValueType type() {
            return JsonValueType.NULL;
        }

        @Override
        public Object toJava() {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record Bool(boolean value) implements JsonValue {
        @Override
        public JsonValueType type() {
            return JsonValueType.BOOLEAN;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    /**
     * A JSON number. Integral boxes, and a {@link BigInteger} that fits in a long, are widened to
     * {@link Long}; {@link Float} is widened to {@link Double}. Other {@link BigInteger} and
     * {@link BigDecimal} values are kept as is.
     *
     * <p>Equality is by numeric value, not by boxed type: {@code 5}, {@code 5.0} and
     * {@code new BigDecimal("5.00")} are equal. Non-finite doubles are equal only to themselves.
     */
    record Numeric(Number value) implements JsonValue {
        private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
        private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

        public Numeric {
            Objects.requireNonNull(value, "value");
            if (value instanceof Integer || value instanceof Short || value instanceof Byte
                    || value instanceof AtomicInteger || value instanceof AtomicLong) {
                value = value.longValue();
            } else if (value instanceof Float) {
                value = value.doubleValue();
            } else if (value instanceof BigInteger big) {
                if (big.compareTo(LONG_MIN) >= 0 && big.compareTo(LONG_MAX) <= 0) {
                    value = big.longValue();
                }
            } else if (!(value instanceof Long || value instanceof Double || value instanceof BigDecimal)) {
                throw new IllegalArgumentException("unsupported number type: " + value.getClass().getName());
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Numeric other)) {
                return false;
            }
            if (!isFinite() || !other.isFinite()) {
                return value.equals(other.value);
            }
            return decimal().compareTo(other.decimal()) == 0;
        }

        @Override
        public int hashCode() {
            return isFinite() ? decimal().stripTrailingZeros().hashCode() : value.hashCode();
        }

        private boolean isFinite() {
            return !(value instanceof Double d) || Double.isFinite(d);
        }

        private BigDecimal decimal() {
            if (value instanceof BigDecimal d) {
                return d;
            }
            if (value instanceof BigInteger i) {
                return new BigDecimal(i);
            }
            if (value instanceof Double d) {
                return BigDecimal.valueOf(d);
            }
            return BigDecimal.valueOf(value.longValue());
        }

        @Override
        public JsonValueType type() {
            return JsonValueType.NUMBER;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    record Text(String value) implements JsonValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public JsonValueType type() {
            return JsonValueType.STRING;
        }

        @Override
        public Object toJava() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * An immutable JSON array. {@code null} elements are stored as {@link JsonValue#NULL}.
     */
    record Array(List<JsonValue> elements) implements JsonValue {
        public Array {
            Objects.requireNonNull(elements, "elements");
            List<JsonValue> copy = new ArrayList<>(elements.size());
            for (JsonValue e : elements) copy.add(e == null ? NULL : e);
            elements = Collections.unmodifiableList(copy);
        }

        public int size() {
            return elements.size();
        }

        public JsonValue get(int index) {
            return elements.get(index);
        }

        @Override
        public JsonValueType type() {
            return JsonValueType.ARRAY;
        }

        @Override
        public Object toJava() {
            List<Object> out = new ArrayList<>(elements.size());
            for (JsonValue e : elements) out.add(e.toJava());
            return out;
        }
    }
}
