package io.contractrpc.core;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link Schema#parse(Object)}: either the typed value or the issues found.
 */
public sealed interface ParseResult<T> permits ParseResult.Success, ParseResult.Failure {

    static <T> ParseResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseResult<T> failure(List<Issue> issues) {
        return new Failure<>(issues);
    }

    static <T> ParseResult<T> failure(Issue issue) {
        return new Failure<>(List.of(issue));
    }

    boolean isSuccess();

    record Success<T>(T value) implements ParseResult<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure<T>(List<Issue> issues) implements ParseResult<T> {
        public Failure {
            Objects.requireNonNull(issues, "issues");
            if (issues.isEmpty()) throw new IllegalArgumentException("a failure needs at least one issue");
            issues = List.copyOf(issues);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
