package io.contractrpc.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BasePathTest {

    @Test
    void normalizesSlashes() {
        assertThat(BasePath.of("api/").value()).isEqualTo("/api");
        assertThat(BasePath.of("/").value()).isEmpty();
        assertThat(BasePath.of(null)).isSameAs(BasePath.root());
    }

    @Test
    void stripRemovesPrefixOnSegmentBoundary() {
        BasePath base = BasePath.of("/api");
        assertThat(base.strip("/api/users")).hasValue("/users");
        assertThat(base.strip("/api")).hasValue("/");
        assertThat(base.strip("/apiary")).isEmpty();
        assertThat(BasePath.root().strip("/users")).hasValue("/users");
        assertThat(base.prepend("/users")).isEqualTo("/api/users");
    }
}
