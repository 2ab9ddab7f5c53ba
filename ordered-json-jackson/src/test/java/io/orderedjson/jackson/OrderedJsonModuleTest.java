package io.orderedjson.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.orderedjson.core.JsonException;
import io.orderedjson.core.JsonValue;
import io.orderedjson.core.OrderedMap;
import io.orderedjson.core.OrderedMapCodec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderedJsonModuleTest {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new OrderedJsonModule());

    @Test
    void writesMapFieldInKeyOrder() throws Exception {
        OrderedMap payload = new OrderedMap().set("z", 1).set("a", List.of(true)).set("m", new OrderedMap().set("k", "v"));

        String json = mapper.writeValueAsString(new Envelope("e1", payload));

        assertThat(json).contains("\"payload\":{\"z\":1,\"a\":[true],\"m\":{\"k\":\"v\"}}");
    }

    @Test
    void readsMapFieldWithoutReordering() throws Exception {
        Envelope envelope = mapper.readValue("{\"id\":\"e2\",\"payload\":{\"b\":1,\"a\":{\"y\":2,\"x\":3}}}", Envelope.class);

        assertThat(envelope.id()).isEqualTo("e2");
        assertThat(envelope.payload().keys()).containsExactly("b", "a");
        assertThat(envelope.payload().getMap("a").orElseThrow().keys()).containsExactly("y", "x");
    }

    @Test
    void roundTripsThroughMapper() throws Exception {
        Envelope original = new Envelope("e3", new OrderedMap().set("c", 3).setAt(0, "a", 1).set("b", null));

        Envelope decoded = mapper.readValue(mapper.writeValueAsString(original), Envelope.class);

        assertThat(decoded).isEqualTo(original);
    }

    @Test
    void readsAndWritesTopLevelMap() throws Exception {
        OrderedMap map = mapper.readValue("{\"b\":1,\"a\":2,\"b\":3}", OrderedMap.class);

        assertThat(map.keys()).containsExactly("b", "a");
        assertThat(mapper.writeValueAsString(map)).isEqualTo("{\"b\":3,\"a\":2}");
    }

    @Test
    void handlesJsonValueFields() throws Exception {
        Holder array = mapper.readValue("{\"value\":[1,\"x\",{\"q\":null}]}", Holder.class);
        Holder nullValue = mapper.readValue("{\"value\":null}", Holder.class);

        assertThat(array.value()).isEqualTo(JsonValue.array(JsonValue.of(1), JsonValue.of("x"),
                new OrderedMap().set("q", null)));
        assertThat(nullValue.value()).isSameAs(JsonValue.NULL);
        assertThat(mapper.writeValueAsString(new Holder(JsonValue.of("s")))).isEqualTo("{\"value\":\"s\"}");
        assertThat(mapper.writeValueAsString(JsonValue.array(JsonValue.TRUE, JsonValue.NULL))).isEqualTo("[true,null]");
    }

    @Test
    void emptyMapIsOmittedUnderNonEmptyInclusion() throws Exception {
        ObjectMapper nonEmpty = new ObjectMapper()
                .registerModule(new OrderedJsonModule())
                .setSerializationInclusion(JsonInclude.Include.NON_EMPTY);

        assertThat(nonEmpty.writeValueAsString(new Envelope("e4", new OrderedMap()))).isEqualTo("{\"id\":\"e4\"}");
    }

    @Test
    void rejectsNonObjectForMap() {
        assertThatThrownBy(() -> mapper.readValue("{\"id\":\"e5\",\"payload\":[1]}", Envelope.class))
                .isInstanceOf(JsonMappingException.class);
    }

    @Test
    void surfacesCodecErrorsAsCause() {
        OrderedMap bad = new OrderedMap().set("nan", Double.NaN);

        assertThatThrownBy(() -> mapper.writeValueAsString(bad))
                .isInstanceOf(JsonMappingException.class)
                .hasRootCauseInstanceOf(JsonException.Unencodable.class);
    }

    @Test
    void usesConfiguredCodec() {
        ObjectMapper shallow = new ObjectMapper()
                .registerModule(new OrderedJsonModule(OrderedMapCodec.builder().maxNestingDepth(1).build()));

        assertThatThrownBy(() -> shallow.readValue("{\"a\":{\"b\":1}}", OrderedMap.class))
                .isInstanceOf(JsonMappingException.class)
                .hasRootCauseInstanceOf(JsonException.Malformed.class);
    }

    @Test
    void registeredThroughServiceLoader() throws Exception {
        ObjectMapper discovered = new ObjectMapper().findAndRegisterModules();

        OrderedMap map = discovered.readValue("{\"z\":1,\"a\":2}", OrderedMap.class);

        assertThat(map.keys()).containsExactly("z", "a");
        assertThat(discovered.writeValueAsString(map)).isEqualTo("{\"z\":1,\"a\":2}");
    }

    public record Envelope(String id, OrderedMap payload) {
    }

    public record Holder(JsonValue value) {
    }
}
