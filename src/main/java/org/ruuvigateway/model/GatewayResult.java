package org.ruuvigateway.model;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of one step of the fetch-decode pipeline: either a value or a classified failure.
 * <p>
 * Failures are returned rather than thrown so the poll driver can branch on them
 * without any exception crossing a cycle boundary.
 *
 * @param <T> type of the success value
 */
public sealed interface GatewayResult<T> permits GatewayResult.Ok, GatewayResult.Failed {

    static <T> GatewayResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> GatewayResult<T> failed(FailureKind kind, String message) {
        return new Failed<>(kind, message);
    }

    boolean isOk();

    /**
     * Applies {@code next} to a success value; failures pass through unchanged.
     */
    <R> GatewayResult<R> then(Function<? super T, GatewayResult<R>> next);

    record Ok<T>(T value) implements GatewayResult<T> {
        public Ok {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public <R> GatewayResult<R> then(Function<? super T, GatewayResult<R>> next) {
            return next.apply(value);
        }
    }

    record Failed<T>(FailureKind kind, String message) implements GatewayResult<T> {
        public Failed {
            Objects.requireNonNull(kind, "kind");
            message = (message == null) ? "" : message;
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public <R> GatewayResult<R> then(Function<? super T, GatewayResult<R>> next) {
            return new Failed<>(kind, message);
        }
    }
}
