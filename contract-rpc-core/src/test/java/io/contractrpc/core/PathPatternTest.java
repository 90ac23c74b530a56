package io.contractrpc.core;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathPatternTest {

    @Test
    void matchCapturesNamedSegments() {
        PathPattern p = PathPattern.compile("/users/:id/posts/:postId");
        assertThat(p.match("/users/42/posts/7")).hasValue(Map.of("id", "42", "postId", "7"));
    }

    @Test
    void matchRequiresSameSegmentCount() {
        PathPattern p = PathPattern.compile("/users/:id/posts/:postId");
        assertThat(p.match("/users/42")).isEmpty();
        assertThat(p.match("/users/42/posts/7/extra")).isEmpty();
    }

    @Test
    void literalSegmentsMustMatchExactly() {
        PathPattern p = PathPattern.compile("/users/:id");
        assertThat(p.match("/accounts/1")).isEmpty();
        assertThat(p.match("/users/1")).hasValue(Map.of("id", "1"));
    }

    @Test
    void patternWithoutParametersMatchesOnlyItself() {
        PathPattern p = PathPattern.compile("/health");
        assertThat(p.match("/health")).hasValue(Map.of());
        assertThat(p.match("/health/")).isEmpty();
        assertThat(p.parameterNames()).isEmpty();
    }

    @Test
    void interpolateThenMatchReturnsSameValues() {
        PathPattern p = PathPattern.compile("/orgs/:org/repos/:repo/issues/:n");
        List<Map<String, String>> samples = List.of(
                Map.of("org", "acme", "repo", "rocket", "n", "1"),
                Map.of("org", "a-b_c", "repo", "x.y", "n", "999"),
                Map.of("org", "%20", "repo", "~", "n", "0"));
        for (Map<String, String> values : samples) {
            String path = p.interpolate(values);
            assertThat(p.match(path)).hasValue(values);
        }
    }

    @Test
    void interpolateLeavesMissingPlaceholders() {
        PathPattern p = PathPattern.compile("/users/:id/posts/:postId");
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", 42);
        assertThat(p.interpolate(values)).isEqualTo("/users/42/posts/:postId");
    }

    @Test
    void toOpenApiPathUsesBraces() {
        assertThat(PathPattern.compile("/users/:id/posts/:postId").toOpenApiPath())
                .isEqualTo("/users/{id}/posts/{postId}");
        assertThat(PathPattern.compile("/users/:id").parameterNames()).containsExactly("id");
    }

    @Test
    void compileRejectsInvalidPatterns() {
        assertThatThrownBy(() -> PathPattern.compile("users/:id")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PathPattern.compile("/users/:")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PathPattern.compile("/a/:id/b/:id")).isInstanceOf(IllegalArgumentException.class);
    }
}
