package io.contractrpc.core;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HeadersTest {

    @Test
    void firstValueIsCaseInsensitive() {
        Map<String, List<String>> headers = Map.of("Content-Type", List.of("application/json"));
        assertThat(Headers.firstValue(headers, "content-type")).hasValue("application/json");
        assertThat(Headers.firstValue(headers, "accept")).isEmpty();
    }

    @Test
    void flattenLowerCasesAndJoinsRepeats() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("X-Trace", List.of("a", "b"));
        headers.put("Authorization", List.of("Bearer t"));
        assertThat(Headers.flatten(headers))
                .containsEntry("x-trace", "a, b")
                .containsEntry("authorization", "Bearer t");
    }

    @Test
    void mediaTypeStripsParameters() {
        assertThat(Headers.mediaType("Application/JSON; charset=utf-8")).isEqualTo("application/json");
        assertThat(Headers.mediaType(null)).isEmpty();
        assertThat(Headers.mediaTypeParameter("multipart/form-data; boundary=\"xyz\"", "boundary")).hasValue("xyz");
    }
}
