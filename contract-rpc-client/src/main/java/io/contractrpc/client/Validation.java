package io.contractrpc.client;

import io.contractrpc.core.ParseResult;
import io.contractrpc.core.Schema;

final class Validation {
    private Validation() {}

    /**
     * @return the value produced by {@code schema}
     * @throws ClientValidationException if the schema rejects {@code input}
     */
    static Object check(String field, Schema<?> schema, Object input) {
        ParseResult<?> result = schema.parse(input);
        if (result instanceof ParseResult.Failure<?> failure) {
            throw new ClientValidationException(field, failure.issues());
        }
        return ((ParseResult.Success<?>) result).value();
    }
}
