package io.orderedjson.core;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.core.StreamWriteConstraints;
import com.fasterxml.jackson.core.io.JsonEOFException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Streaming JSON codec for {@link OrderedMap}.
 *
 * <p>Encoding writes object members in key order. Decoding walks the jackson-core token stream
 * with a recursive descent parser and adds members with {@link OrderedMap#set(String, JsonValue)}
 * as they arrive, so the source order is kept. A repeated key keeps its first position and takes
 * the last value.
 *
 * <p>Mapping of JSON to values:
 * <ul>
 *   <li>objects become {@link OrderedMap}</li>
 *   <li>arrays become {@link JsonValue.Array}</li>
 *   <li>integers become {@link Long}, or {@link BigInteger} when out of range</li>
 *   <li>fractions become {@link Double}, or {@link BigDecimal} when so configured or when the
 *       value overflows a double</li>
 * </ul>
 *
 * <p>Instances are immutable and may be shared between threads. The codec never closes a
 * caller-supplied stream, reader or writer.
 */
public final class OrderedMapCodec {
    private static final Logger log = LoggerFactory.getLogger(OrderedMapCodec.class);

    /**
     * Default nesting limit for both directions, matching jackson-core's default read constraint.
     */
    public static final int DEFAULT_MAX_NESTING_DEPTH = 1000;

    private static final OrderedMapCodec DEFAULTS = builder().build();

    private final JsonFactory factory;
    private final int maxNestingDepth;
    private final boolean bigDecimalForFloats;

    private OrderedMapCodec(JsonFactory factory, int maxNestingDepth, boolean bigDecimalForFloats) {
        this.factory = factory;
        this.maxNestingDepth = maxNestingDepth;
        this.bigDecimalForFloats = bigDecimalForFloats;
    }

    /**
     * Returns the shared codec with default settings.
     */
    public static OrderedMapCodec defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int maxNestingDepth() {
        return maxNestingDepth;
    }

    public boolean bigDecimalForFloats() {
        return bigDecimalForFloats;
    }

    // ===== Encoding =====

    /**
     * Encodes {@code map} as compact JSON text.
     *
     * @throws JsonException.Unencodable if a value has no JSON form
     */
    public String encode(OrderedMap map) throws JsonException {
        return render(map, false);
    }

    /**
     * Encodes {@code map} as indented JSON text.
     */
    public String encodePretty(OrderedMap map) throws JsonException {
        return render(map, true);
    }

    /**
     * Encodes {@code map} as UTF-8 JSON bytes.
     */
    public byte[] encodeBytes(OrderedMap map) throws JsonException {
        Objects.requireNonNull(map, "map");
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonGenerator gen = factory.createGenerator(out, JsonEncoding.UTF8)) {
            writeObject(gen, map, 1);
        } catch (IOException e) {
            throw new JsonException("Failed to encode map to bytes", e);
        }
        return out.toByteArray();
    }

    /**
     * Encodes {@code map} to {@code writer}. Nothing is written if encoding fails.
     */
    public void encode(OrderedMap map, Writer writer) throws JsonException {
        Objects.requireNonNull(writer, "writer");
        String text = encode(map);
        try {
            writer.write(text);
            writer.flush();
        } catch (IOException e) {
            throw new JsonException("Failed to write encoded map", e);
        }
    }

    /**
     * Encodes {@code map} to {@code out} as UTF-8. Nothing is written if encoding fails.
     */
    public void encode(OrderedMap map, OutputStream out) throws JsonException {
        Objects.requireNonNull(out, "out");
        byte[] bytes = encodeBytes(map);
        try {
            out.write(bytes);
            out.flush();
        } catch (IOException e) {
            throw new JsonException("Failed to write encoded map", e);
        }
    }

    /**
     * Writes {@code map} as a JSON object to an existing generator.
     */
    public void writeObject(JsonGenerator gen, OrderedMap map) throws IOException, JsonException {
        Objects.requireNonNull(gen, "gen");
        Objects.requireNonNull(map, "map");
        writeObject(gen, map, 1);
    }

    /**
     * Writes any {@link JsonValue} to an existing generator.
     */
    public void writeValue(JsonGenerator gen, JsonValue value) throws IOException, JsonException {
        Objects.requireNonNull(gen, "gen");
        writeValue(gen, value == null ? JsonValue.NULL : value, 0);
    }

    private String render(OrderedMap map, boolean pretty) throws JsonException {
        Objects.requireNonNull(map, "map");
        StringWriter out = new StringWriter();
        try (JsonGenerator gen = factory.createGenerator(out)) {
            if (pretty) {
                gen.useDefaultPrettyPrinter();
            }
            writeObject(gen, map, 1);
        } catch (IOException e) {
            throw new JsonException("Failed to encode map", e);
        }
        return out.toString();
    }

    private void writeObject(JsonGenerator gen, OrderedMap map, int depth) throws IOException, JsonException {
        checkWriteDepth(depth);
        gen.writeStartObject();
        for (String key : map.orderView()) {
            gen.writeFieldName(key);
            writeValue(gen, map.entry(key), depth);
        }
        gen.writeEndObject();
    }

    private void writeValue(JsonGenerator gen, JsonValue value, int depth) throws IOException, JsonException {
        if (value instanceof OrderedMap map) {
            writeObject(gen, map, depth + 1);
        } else if (value instanceof JsonValue.Array array) {
            checkWriteDepth(depth + 1);
            gen.writeStartArray();
            for (JsonValue element : array.elements()) {
                writeValue(gen, element, depth + 1);
            }
            gen.writeEndArray();
        } else if (value instanceof JsonValue.Text text) {
            gen.writeString(text.value());
        } else if (value instanceof JsonValue.Numeric numeric) {
            writeNumber(gen, numeric.value());
        } else if (value instanceof JsonValue.Bool bool) {
            gen.writeBoolean(bool.value());
        } else {
            gen.writeNull();
        }
    }

    private static void writeNumber(JsonGenerator gen, Number number) throws IOException, JsonException {
        if (number instanceof Long l) {
            gen.writeNumber(l);
        } else if (number instanceof Double d) {
            if (d.isNaN() || d.isInfinite()) {
                throw new JsonException.Unencodable("unsupported value: " + d);
            }
            gen.writeNumber(d);
        } else if (number instanceof BigInteger bi) {
            gen.writeNumber(bi);
        } else {
            gen.writeNumber((BigDecimal) number);
        }
    }

    private void checkWriteDepth(int depth) throws JsonException {
        if (depth > maxNestingDepth) {
            throw new JsonException.Unencodable("nesting depth exceeds " + maxNestingDepth
                    + " (does the map contain itself?)");
        }
    }

    // ===== Decoding =====

    /**
     * Decodes a JSON object.
     *
     * @throws JsonException.Malformed if the text is not a single well-formed JSON object
     */
    public OrderedMap decode(String json) throws JsonException {
        Objects.requireNonNull(json, "json");
        OrderedMap target = new OrderedMap();
        decode(f -> f.createParser(json), target);
        return target;
    }

    public OrderedMap decode(byte[] json) throws JsonException {
        Objects.requireNonNull(json, "json");
        OrderedMap target = new OrderedMap();
        decode(f -> f.createParser(json), target);
        return target;
    }

    public OrderedMap decode(Reader reader) throws JsonException {
        Objects.requireNonNull(reader, "reader");
        OrderedMap target = new OrderedMap();
        decode(f -> f.createParser(reader), target);
        return target;
    }

    public OrderedMap decode(InputStream input) throws JsonException {
        Objects.requireNonNull(input, "input");
        OrderedMap target = new OrderedMap();
        decode(f -> f.createParser(input), target);
        return target;
    }

    /**
     * Decodes a JSON object into an existing map. Members are added with
     * {@link OrderedMap#set(String, JsonValue)} as they are read; on failure the map keeps whatever
     * was read before the error and should be discarded.
     */
    public void decodeInto(String json, OrderedMap target) throws JsonException {
        Objects.requireNonNull(json, "json");
        Objects.requireNonNull(target, "target");
        decode(f -> f.createParser(json), target);
    }

    /**
     * Decodes any single JSON value (object, array or scalar).
     */
    public JsonValue decodeValue(String json) throws JsonException {
        Objects.requireNonNull(json, "json");
        try (JsonParser p = open(f -> f.createParser(json))) {
            JsonToken t = p.nextToken();
            if (t == null) {
                throw new JsonException.Malformed("empty input");
            }
            JsonValue value = valueOf(p, t, 0);
            expectEnd(p);
            return value;
        } catch (JsonException e) {
            log.debug("Rejected JSON value: {}", e.getMessage());
            throw e;
        } catch (IOException e) {
            throw translate(e);
        }
    }

    /**
     * Reads a JSON object from a parser positioned on (or just before) its {@code START_OBJECT}
     * token. On return the parser is positioned on the matching {@code END_OBJECT}.
     */
    public OrderedMap readObject(JsonParser p) throws IOException, JsonException {
        Objects.requireNonNull(p, "p");
        JsonToken t = p.hasCurrentToken() ? p.currentToken() : p.nextToken();
        if (t != JsonToken.START_OBJECT) {
            throw new JsonException.Malformed("expect JSON object open with '{'" + at(p));
        }
        OrderedMap map = new OrderedMap();
        readMembers(p, map, 1);
        return map;
    }

    /**
     * Reads one JSON value from a parser positioned on (or just before) its first token.
     * On return the parser is positioned on the value's last token.
     */
    public JsonValue readValue(JsonParser p) throws IOException, JsonException {
        Objects.requireNonNull(p, "p");
        JsonToken t = p.hasCurrentToken() ? p.currentToken() : p.nextToken();
        return valueOf(p, t, 0);
    }

    private void decode(ParserSource source, OrderedMap target) throws JsonException {
        try (JsonParser p = open(source)) {
            readDocument(p, target);
        } catch (JsonException e) {
            log.debug("Rejected JSON object: {}", e.getMessage());
            throw e;
        } catch (IOException e) {
            JsonException translated = translate(e);
            log.debug("Rejected JSON object: {}", translated.getMessage());
            throw translated;
        }
    }

    private JsonParser open(ParserSource source) throws IOException {
        JsonParser p = source.open(factory);
        p.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
        return p;
    }

    private void readDocument(JsonParser p, OrderedMap target) throws IOException, JsonException {
        JsonToken t = p.nextToken();
        if (t != JsonToken.START_OBJECT) {
            throw new JsonException.Malformed("expect JSON object open with '{'" + at(p));
        }
        readMembers(p, target, 1);
        expectEnd(p);
    }

    // Reads members up to and including the closing '}' of the current object.
    private void readMembers(JsonParser p, OrderedMap target, int depth) throws IOException, JsonException {
        while (true) {
            JsonToken t = nextKey(p);
            if (t == JsonToken.END_OBJECT) {
                return;
            }
            if (t == null) {
                throw new JsonException.Malformed("expect JSON object close with '}'" + at(p));
            }
            if (t != JsonToken.FIELD_NAME) {
                throw new JsonException.NonStringKey("key must be a string, got " + t + at(p));
            }
            String key = p.currentName();
            target.set(key, valueOf(p, p.nextToken(), depth));
        }
    }

    private static JsonToken nextKey(JsonParser p) throws IOException, JsonException {
        try {
            return p.nextToken();
        } catch (JsonEOFException e) {
            throw new JsonException.Malformed("expect JSON object close with '}'" + at(p), e);
        } catch (JsonParseException e) {
            // the tokenizer reads the separator after a name in the same step
            String reason = e.getOriginalMessage();
            if (p.currentToken() != JsonToken.FIELD_NAME && reason != null && reason.contains("field name")) {
                throw new JsonException.NonStringKey("key must be a string" + at(p), e);
            }
            throw new JsonException.Malformed(reason + at(p), e);
        }
    }

    private JsonValue valueOf(JsonParser p, JsonToken t, int depth) throws IOException, JsonException {
        if (t == null) {
            throw new JsonException.Malformed("unexpected end of input" + at(p));
        }
        switch (t) {
            case START_ARRAY:
                checkReadDepth(p, depth + 1);
                return readArray(p, depth + 1);
            case START_OBJECT: {
                checkReadDepth(p, depth + 1);
                OrderedMap nested = new OrderedMap();
                readMembers(p, nested, depth + 1);
                return nested;
            }
            case END_OBJECT:
                throw new JsonException.Malformed("unexpected '}'" + at(p));
            case END_ARRAY:
                throw new JsonException.Malformed("unexpected ']'" + at(p));
            case VALUE_STRING:
                return new JsonValue.Text(p.getText());
            case VALUE_NUMBER_INT:
                return new JsonValue.Numeric(p.getNumberType() == JsonParser.NumberType.BIG_INTEGER
                        ? p.getBigIntegerValue()
                        : p.getLongValue());
            case VALUE_NUMBER_FLOAT:
                return new JsonValue.Numeric(floatValue(p));
            case VALUE_TRUE:
                return JsonValue.TRUE;
            case VALUE_FALSE:
                return JsonValue.FALSE;
            case VALUE_NULL:
                return JsonValue.NULL;
            default:
                throw new JsonException.Malformed("unexpected token " + t + at(p));
        }
    }

    private JsonValue.Array readArray(JsonParser p, int depth) throws IOException, JsonException {
        List<JsonValue> elements = new ArrayList<>();
        while (true) {
            JsonToken t = p.nextToken();
            // end of array is only meaningful here
            if (t == JsonToken.END_ARRAY) {
                return new JsonValue.Array(elements);
            }
            elements.add(valueOf(p, t, depth));
        }
    }

    private Number floatValue(JsonParser p) throws IOException {
        if (bigDecimalForFloats) {
            return p.getDecimalValue();
        }
        double d = p.getDoubleValue();
        return Double.isInfinite(d) ? p.getDecimalValue() : d;
    }

    private void checkReadDepth(JsonParser p, int depth) throws JsonException {
        if (depth > maxNestingDepth) {
            throw new JsonException.Malformed("nesting depth exceeds " + maxNestingDepth + at(p));
        }
    }

    private static void expectEnd(JsonParser p) throws IOException, JsonException {
        JsonToken trailing = p.nextToken();
        if (trailing != null) {
            throw new JsonException.Malformed("unexpected trailing content " + trailing + at(p));
        }
    }

    private static JsonException translate(IOException e) {
        if (e instanceof JsonProcessingException jpe) {
            JsonLocation loc = jpe.getLocation();
            String where = loc == null ? "" : " at line " + loc.getLineNr() + ", column " + loc.getColumnNr();
            return new JsonException.Malformed(jpe.getOriginalMessage() + where, e);
        }
        return new JsonException("Failed to read JSON input", e);
    }

    private static String at(JsonParser p) {
        JsonLocation loc = p.currentLocation();
        return " at line " + loc.getLineNr() + ", column " + loc.getColumnNr();
    }

    @FunctionalInterface
    private interface ParserSource {
        JsonParser open(JsonFactory factory) throws IOException;
    }

    /**
     * Builder for {@link OrderedMapCodec}.
     */
    public static final class Builder {
        private JsonFactory jsonFactory;
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
        private boolean bigDecimalForFloats;

        private Builder() {
        }

        /**
         * Uses a caller-configured factory instead of the default one. The factory's own
         * stream constraints still apply and may reject input before the codec's depth check.
         */
        public Builder jsonFactory(JsonFactory jsonFactory) {
            this.jsonFactory = Objects.requireNonNull(jsonFactory, "jsonFactory");
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            if (maxNestingDepth < 1) {
                throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
            }
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        /**
         * Decodes fractional numbers as {@link BigDecimal} instead of {@link Double}.
         */
        public Builder bigDecimalForFloats(boolean bigDecimalForFloats) {
            this.bigDecimalForFloats = bigDecimalForFloats;
            return this;
        }

        public OrderedMapCodec build() {
            JsonFactory resolved = jsonFactory;
            if (resolved == null) {
                // one level of headroom so the codec's own check reports the overflow
                int limit = maxNestingDepth + 1;
                resolved = JsonFactory.builder()
                        .streamReadConstraints(StreamReadConstraints.builder().maxNestingDepth(limit).build())
                        .streamWriteConstraints(StreamWriteConstraints.builder().maxNestingDepth(limit).build())
                        .build();
            }
            return new OrderedMapCodec(resolved, maxNestingDepth, bigDecimalForFloats);
        }
    }
}
