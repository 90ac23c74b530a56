package io.contractrpc.json.jackson;

import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.json.spi.JsonCodecs;
import io.contractrpc.json.spi.JsonException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonJsonCodecTest {

    private final JsonCodec codec = new JacksonJsonCodec();

    @Test
    void readTreeProducesPlainJavaValues() throws Exception {
        Object tree = codec.readTree("{\"a\":[1,\"x\",true,null],\"b\":{\"c\":1.5}}");
        assertThat(tree).isInstanceOf(Map.class);
        Map<?, ?> map = (Map<?, ?>) tree;
        assertThat(map.get("a")).isInstanceOf(List.class);
        assertThat(map.get("a")).isEqualTo(Arrays.asList(1, "x", true, null));
        assertThat(map.get("b")).isEqualTo(Map.of("c", 1.5));
    }

    @Test
    void readTreeRejectsMalformedJson() {
        assertThatThrownBy(() -> codec.readTree("{not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(JsonException.class);
    }

    @Test
    void readTreeRejectsTrailingContent() {
        assertThatThrownBy(() -> codec.readTree("{\"a\":1} junk"))
                .isInstanceOf(JsonException.class)
                .hasMessageStartingWith("Malformed JSON");
    }

    @Test
    void writeKeepsMapOrder() throws Exception {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("z", 1);
        value.put("a", "b");
        assertThat(codec.writeString(value)).isEqualTo("{\"z\":1,\"a\":\"b\"}");
    }

    @Test
    void discoverFindsJacksonProvider() {
        assertThat(JsonCodecs.discover()).isInstanceOf(JacksonJsonCodec.class);
    }
}
