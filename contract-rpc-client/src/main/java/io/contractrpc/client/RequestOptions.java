package io.contractrpc.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-call input: path parameters, query parameters, extra headers and an optional JSON body.
 *
 * <pre>{@code
 * RequestOptions.builder()
 *     .param("id", 42)
 *     .query("include", List.of("posts", "likes"))
 *     .header("X-Request-Id", "abc")
 *     .body(Map.of("name", "Ada"))
 *     .build();
 * }</pre>
 */
public final class RequestOptions {

    private static final RequestOptions NONE = builder().build();

    private final Map<String, Object> params;
    private final Map<String, Object> query;
    private final Map<String, String> headers;
    private final Object body;

    private RequestOptions(Builder b) {
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(b.params));
        this.query = Collections.unmodifiableMap(new LinkedHashMap<>(b.query));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.body = b.body;
    }

    public static RequestOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> params() {
        return params;
    }

    /**
     * Values are strings, numbers or booleans; {@link Iterable} values become repeated keys.
     */
    public Map<String, Object> query() {
        return query;
    }

    public Map<String, String> headers() {
        return headers;
    }

    /**
     * @return the body to send as JSON, {@code null} when the request has none
     */
    public Object body() {
        return body;
    }

    public static final class Builder {
        private final Map<String, Object> params = new LinkedHashMap<>();
        private final Map<String, Object> query = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Object body;

        private Builder() {}

        public Builder param(String name, Object value) {
            params.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder params(Map<String, ?> values) {
            values.forEach(this::param);
            return this;
        }

        public Builder query(String name, Object value) {
            query.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder query(Map<String, ?> values) {
            values.forEach(this::query);
            return this;
        }

        public Builder header(String name, String value) {
            headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder headers(Map<String, String> values) {
            values.forEach(this::header);
            return this;
        }

        public Builder body(Object body) {
            this.body = body;
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(this);
        }
    }
}
