package org.tyl.errors;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The result of a TYL operation that may fail.
 * Either {@link Ok} containing a value, or {@link Err} containing a {@link TylError}.
 *
 * @param <T> the type of the successful value
 */
public sealed interface TylResult<T> permits TylResult.Ok, TylResult.Err {

    /**
     * A successful result.
     *
     * @param value the successful value
     */
    record Ok<T>(T value) implements TylResult<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public boolean isErr() {
            return false;
        }

        @Override
        public Optional<TylError> error() {
            return Optional.empty();
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public <U> TylResult<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }

        @Override
        public <U> TylResult<U> flatMap(Function<? super T, ? extends TylResult<U>> mapper) {
            Objects.requireNonNull(mapper);
            return mapper.apply(value);
        }

        @Override
        public TylResult<T> mapErr(Function<? super TylError, ? extends TylError> mapper) {
            return this;
        }

        @Override
        public TylResult<T> recover(Function<? super TylError, ? extends T> recovery) {
            return this;
        }
    }

    /**
     * A failed result.
     *
     * @param cause the error
     */
    record Err<T>(TylError cause) implements TylResult<T> {

        public Err {
            Objects.requireNonNull(cause, "cause must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public boolean isErr() {
            return true;
        }

        @Override
        public Optional<TylError> error() {
            return Optional.of(cause);
        }

        @Override
        public T getOrThrow() {
            throw new TylException(cause);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier);
            return supplier.get();
        }

        @Override
        public <U> TylResult<U> map(Function<? super T, ? extends U> mapper) {
            return new Err<>(cause);
        }

        @Override
        public <U> TylResult<U> flatMap(Function<? super T, ? extends TylResult<U>> mapper) {
            return new Err<>(cause);
        }

        @Override
        public TylResult<T> mapErr(Function<? super TylError, ? extends TylError> mapper) {
            Objects.requireNonNull(mapper);
            return new Err<>(mapper.apply(cause));
        }

        @Override
        public TylResult<T> recover(Function<? super TylError, ? extends T> recovery) {
            Objects.requireNonNull(recovery);
            return new Ok<>(recovery.apply(cause));
        }
    }

    boolean isOk();
    boolean isErr();

    /**
     * The error, if this result failed.
     */
    Optional<TylError> error();

    T getOrThrow();
    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    <U> TylResult<U> map(Function<? super T, ? extends U> mapper);
    <U> TylResult<U> flatMap(Function<? super T, ? extends TylResult<U>> mapper);
    TylResult<T> mapErr(Function<? super TylError, ? extends TylError> mapper);

    TylResult<T> recover(Function<? super TylError, ? extends T> recovery);

    static <T> TylResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> TylResult<T> err(TylError error) {
        return new Err<>(error);
    }
}
