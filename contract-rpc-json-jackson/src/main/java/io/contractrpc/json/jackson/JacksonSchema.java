package io.contractrpc.json.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import io.contractrpc.core.Issue;
import io.contractrpc.core.ParseResult;
import io.contractrpc.core.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * {@link Schema} backed by Jackson data binding.
 *
 * <p>The decoded wire value is bound to {@code type} with {@link ObjectMapper#convertValue(Object, Class)}.
 * Binding failures become issues whose path follows Jackson's reference chain. Scalar coercion is left on,
 * so a path parameter {@code "42"} binds to an {@code int} field.
 *
 * <pre>{@code
 * record CreateUser(String name, int age) {}
 *
 * Schema<CreateUser> body = JacksonSchema.of(CreateUser.class)
 *     .refine(u -> !u.name().isBlank(), "name must not be blank", "name");
 * }</pre>
 *
 * @param <T> bound type
 */
public final class JacksonSchema<T> implements Schema<T> {

    private static final ObjectMapper DEFAULT_MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final Class<T> type;
    private final ObjectMapper mapper;
    private final List<Refinement<T>> refinements;

    private JacksonSchema(Class<T> type, ObjectMapper mapper, List<Refinement<T>> refinements) {
        this.type = type;
        this.mapper = mapper;
        this.refinements = refinements;
    }

    public static <T> JacksonSchema<T> of(Class<T> type) {
        return of(type, DEFAULT_MAPPER);
    }

    public static <T> JacksonSchema<T> of(Class<T> type, ObjectMapper mapper) {
        return new JacksonSchema<>(Objects.requireNonNull(type, "type"), Objects.requireNonNull(mapper, "mapper"), List.of());
    }

    /**
     * Returns a copy of this schema with an extra check run after a successful bind.
     */
    public JacksonSchema<T> refine(Predicate<? super T> check, String message, Object... path) {
        List<Refinement<T>> next = new ArrayList<>(refinements);
        next.add(new Refinement<>(check, Issue.custom(message, path)));
        return new JacksonSchema<>(type, mapper, List.copyOf(next));
    }

    public Class<T> type() {
        return type;
    }

    @Override
    public ParseResult<T> parse(Object input) {
        if (input == null) {
            return ParseResult.failure(new Issue("invalid_type", List.of(), "Required"));
        }
        T value;
        try {
            value = mapper.convertValue(input, type);
        } catch (IllegalArgumentException e) {
            return ParseResult.failure(toIssue(e));
        }
        if (value == null) {
            return ParseResult.failure(new Issue("invalid_type", List.of(), "Required"));
        }
        List<Issue> issues = new ArrayList<>();
        for (Refinement<T> r : refinements) {
            if (!r.check().test(value)) issues.add(r.issue());
        }
        return issues.isEmpty() ? ParseResult.success(value) : ParseResult.failure(issues);
    }

    private static Issue toIssue(IllegalArgumentException e) {
        if (!(e.getCause() instanceof JsonMappingException jme)) {
            return new Issue("custom", List.of(), e.getMessage());
        }
        List<Object> path = new ArrayList<>();
        for (JsonMappingException.Reference ref : jme.getPath()) {
            if (ref.getFieldName() != null) {
                path.add(ref.getFieldName());
            } else if (ref.getIndex() >= 0) {
                path.add(ref.getIndex());
            }
        }
        String code;
        if (jme instanceof UnrecognizedPropertyException) {
            code = "unrecognized_keys";
        } else if (jme instanceof MismatchedInputException) {
            code = "invalid_type";
        } else {
            code = "custom";
        }
        return new Issue(code, path, jme.getOriginalMessage());
    }

    @Override
    public String toString() {
        return "JacksonSchema[" + type.getSimpleName() + "]";
    }

    private record Refinement<T>(Predicate<? super T> check, Issue issue) {}
}
