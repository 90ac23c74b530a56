package io.contractrpc.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered set of named endpoints.
 *
 * <p>Built once at startup and shared freely afterwards; no synchronization is needed to read it.
 * When two endpoints accept the same method and path, the one registered first wins and the later one is
 * unreachable. Overlapping patterns are not detected.
 *
 * <pre>{@code
 * Contract contract = Contract.builder()
 *     .endpoint(StandardEndpoint.builder("getUser", HttpMethod.GET, "/users/:id")
 *         .response(200, userSchema)
 *         .build())
 *     .endpoint(PushEventEndpoint.builder("logs", "/logs").event("log", logSchema).build())
 *     .build();
 * }</pre>
 */
public final class Contract {

    private final Map<String, EndpointDefinition> byName;
    private final List<EndpointDefinition> ordered;

    private Contract(Map<String, EndpointDefinition> byName) {
        this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
        this.ordered = List.copyOf(byName.values());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return endpoints in registration order
     */
    public List<EndpointDefinition> endpoints() {
        return ordered;
    }

    public Optional<EndpointDefinition> endpoint(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Set<String> names() {
        return byName.keySet();
    }

    /**
     * Finds the first endpoint (in registration order) accepting {@code method} and {@code path}.
     */
    public Optional<RouteMatch> match(HttpMethod method, String path) {
        return match(method, path, EnumSet.allOf(TransportKind.class));
    }

    /**
     * Same as {@link #match(HttpMethod, String)} restricted to the given transport kinds.
     */
    public Optional<RouteMatch> match(HttpMethod method, String path, Set<TransportKind> kinds) {
        for (EndpointDefinition e : ordered) {
            if (!kinds.contains(e.kind()) || e.method() != method) continue;
            Optional<Map<String, String>> params = e.path().match(path);
            if (params.isPresent()) {
                return Optional.of(new RouteMatch(e, params.get()));
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Contract" + byName.keySet();
    }

    public static final class Builder {
        private final Map<String, EndpointDefinition> endpoints = new LinkedHashMap<>();

        private Builder() {}

        /**
         * @throws IllegalArgumentException if an endpoint with the same name is already registered
         */
        public Builder endpoint(EndpointDefinition endpoint) {
            Objects.requireNonNull(endpoint, "endpoint");
            if (endpoints.putIfAbsent(endpoint.name(), endpoint) != null) {
                throw new IllegalArgumentException("duplicate endpoint name: " + endpoint.name());
            }
            return this;
        }

        public Builder endpoints(Iterable<? extends EndpointDefinition> all) {
            List<EndpointDefinition> copy = new ArrayList<>();
            all.forEach(copy::add);
            copy.forEach(this::endpoint);
            return this;
        }

        public Contract build() {
            return new Contract(endpoints);
        }
    }
}
