package io.orderedjson.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.orderedjson.core.JsonException;
import io.orderedjson.core.OrderedMap;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    @Test
    void readMapKeepsOrder() throws Exception {
        OrderedMap map = codec.readMap("{\"z\":[1,2],\"a\":{\"y\":true,\"x\":false}}");

        assertThat(map.keys()).containsExactly("z", "a");
        assertThat(codec.writeString(map)).isEqualTo("{\"z\":[1,2],\"a\":{\"y\":true,\"x\":false}}");
    }

    @Test
    void readsAndWritesPojosWithOrderedFields() throws Exception {
        Event event = new Event("created", new OrderedMap().set("b", 1).set("a", "x"));

        String json = codec.writeString(event);

        assertThat(json).isEqualTo("{\"type\":\"created\",\"data\":{\"b\":1,\"a\":\"x\"}}");
        assertThat(codec.readValue(json, Event.class)).isEqualTo(event);
    }

    @Test
    void readListKeepsElementOrderAndMemberOrder() throws Exception {
        List<OrderedMap> maps = codec.readList("[{\"b\":1,\"a\":2},{\"c\":3}]", OrderedMap.class);

        assertThat(maps).hasSize(2);
        assertThat(maps.get(0).keys()).containsExactly("b", "a");
        assertThat(maps.get(1).keys()).containsExactly("c");
    }

    @Test
    void rethrowsTypedCodecErrors() {
        assertThatThrownBy(() -> codec.readMap("{1:2}"))
                .isInstanceOf(JsonException.NonStringKey.class);
        assertThatThrownBy(() -> codec.writeString(new OrderedMap().set("x", Double.NEGATIVE_INFINITY)))
                .isInstanceOf(JsonException.Unencodable.class);
    }

    @Test
    void wrapsOtherFailures() {
        assertThatThrownBy(() -> codec.readMap("[1]"))
                .isInstanceOf(JsonException.class)
                .hasMessageContaining(OrderedMap.class.getName());
        assertThatThrownBy(() -> codec.readValue("{\"type\":", Event.class))
                .isInstanceOf(JsonException.Malformed.class);
    }

    @Test
    void registersModuleOnCallerMapper() throws Exception {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        JacksonJsonCodec custom = new JacksonJsonCodec(mapper);

        String json = custom.writeString(new OrderedMap().set("b", 1).set("a", 2));

        assertThat(custom.getMapper()).isSameAs(mapper);
        assertThat(json).contains("\n");
        assertThat(json.indexOf("\"b\"")).isLessThan(json.indexOf("\"a\""));
        assertThat(mapper.readValue(json, OrderedMap.class).keys()).containsExactly("b", "a");
    }

    public record Event(String type, OrderedMap data) {
    }
}
