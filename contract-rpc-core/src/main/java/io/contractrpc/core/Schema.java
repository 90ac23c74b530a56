package io.contractrpc.core;

/**
 * Opaque validation capability.
 *
 * <p>The engine hands a schema the decoded wire value (a plain JSON tree, a parameter map, raw text, ...)
 * and gets back either the typed value or a list of {@link Issue}s. How the check is performed is
 * entirely up to the implementation.
 *
 * @param <T> the typed value produced on success
 */
@FunctionalInterface
public interface Schema<T> {

    ParseResult<T> parse(Object input);

    /**
     * A schema that accepts every input unchanged.
     */
    static Schema<Object> any() {
        return ParseResult::success;
    }
}
