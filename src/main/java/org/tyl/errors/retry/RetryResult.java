package org.tyl.errors.retry;

import java.util.Objects;

/**
 * The outcome of one attempt of a retried operation.
 *
 * @param <T> the type of the successful value
 * @param <E> the type of the error
 */
public sealed interface RetryResult<T, E> permits RetryResult.Success, RetryResult.Retry, RetryResult.Failed {

    /**
     * The operation succeeded.
     */
    record Success<T, E>(T value) implements RetryResult<T, E> {
    }

    /**
     * The operation failed but should be retried.
     */
    record Retry<T, E>(E error) implements RetryResult<T, E> {
        public Retry {
            Objects.requireNonNull(error, "error must not be null");
        }
    }

    /**
     * The operation failed and should not be retried.
     */
    record Failed<T, E>(E error) implements RetryResult<T, E> {
        public Failed {
            Objects.requireNonNull(error, "error must not be null");
        }
    }

    static <T, E> RetryResult<T, E> success(T value) {
        return new Success<>(value);
    }

    /**
     * Turns an error into {@link Retry} or {@link Failed}, as the error itself decides.
     *
     * @param error the error of the failed attempt
     * @param attempt the number of attempts made so far
     */
    static <T, E extends RetryableError> RetryResult<T, E> classify(E error, int attempt) {
        Objects.requireNonNull(error, "error must not be null");
        return error.shouldRetry(attempt) ? new Retry<>(error) : new Failed<>(error);
    }

    default boolean isSuccess() {
        return this instanceof Success<?, ?>;
    }

    default boolean shouldRetry() {
        return this instanceof Retry<?, ?>;
    }
}
