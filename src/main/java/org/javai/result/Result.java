package org.javai.result;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Represents the result of an operation that may fail.
 * Either {@link Success} containing a value, or {@link Failure} containing an error.
 *
 * <p>The value and error types are independent. A failure is an ordinary value that
 * flows through a chain of combinators; it is never thrown. Exceptions only become
 * failures at a {@link org.javai.result.boundary.Boundary}.
 *
 * <p>Combinators never mutate a result. A combinator that does not touch a channel
 * hands back the identical instance for it: a failure passed through {@link #map}
 * is the same object, re-typed.
 *
 * <pre>{@code
 * Result<String, String> result = Result.<Integer, String>success(5)
 *     .map(x -> x * 2)
 *     .bind(x -> x > 5 ? Result.success(x.toString()) : Result.failure("too small"));
 * }</pre>
 *
 * <p>Every combinator taking a continuation has an {@code Async} sibling accepting a
 * continuation that returns a {@link CompletionStage}; those return an {@link AsyncResult}.
 *
 * @param <T> The type of the successful value
 * @param <E> The type of the error
 */
public sealed interface Result<T, E> permits Result.Success, Result.Failure {

    /**
     * A successful result containing a value.
     *
     * @param value the successful value, may be {@code null}
     */
    record Success<T, E>(T value) implements Result<T, E> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public boolean isFailure() {
            return false;
        }

        @Override
        public E error() {
            throw new InvalidResultAccessException("Result is successful", this);
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
        public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper, "mapper must not be null");
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U, E> bind(Function<? super T, ? extends Result<U, E>> mapper) {
            Objects.requireNonNull(mapper, "mapper must not be null");
            return Objects.requireNonNull(mapper.apply(value), "mapper must not return null");
        }

        @Override
        public <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper) {
            Objects.requireNonNull(mapper, "mapper must not be null");
            return retype();
        }

        @Override
        public <R> R match(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
            Objects.requireNonNull(onSuccess, "onSuccess must not be null");
            Objects.requireNonNull(onFailure, "onFailure must not be null");
            return onSuccess.apply(value);
        }

        @Override
        public Result<T, E> bindIf(Predicate<? super T> predicate, Function<? super T, ? extends Result<T, E>> continuation) {
            Objects.requireNonNull(predicate, "predicate must not be null");
            Objects.requireNonNull(continuation, "continuation must not be null");
            if (predicate.test(value)) {
                return this;
            }
            return Objects.requireNonNull(continuation.apply(value), "continuation must not return null");
        }

        @Override
        public Result<T, E> ensure(Predicate<? super T> predicate, E error) {
            Objects.requireNonNull(predicate, "predicate must not be null");
            Objects.requireNonNull(error, "error must not be null");
            return predicate.test(value) ? this : new Failure<>(error);
        }

        @Override
        public Result<T, E> tap(Consumer<? super T> action) {
            Objects.requireNonNull(action, "action must not be null");
            action.accept(value);
            return this;
        }

        @Override
        public Result<T, E> tapError(Consumer<? super E> action) {
            Objects.requireNonNull(action, "action must not be null");
            return this;
        }

        @Override
        public Result<T, E> recover(Function<? super E, ? extends T> recovery) {
            Objects.requireNonNull(recovery, "recovery must not be null");
            return this;
        }

        // A success carries no error, so the error type parameter is phantom.
        @SuppressWarnings("unchecked")
        private <F> Result<T, F> retype() {
            return (Result<T, F>) (Result<T, ?>) this;
        }
    }

    /**
     * A failed result containing an error.
     *
     * @param error the error, never {@code null}
     */
    record Failure<T, E>(E error) implements Result<T, E> {

        /**
         * Canonical constructor with validation.
         */
        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public boolean isFailure() {
            return true;
        }

        @Override
        public T value() {
            throw new InvalidResultAccessException("Result is not successful", this);
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public T getOrElseGet(Supplier<? extends T> supplier) {
            Objects.requireNonNull(supplier, "supplier must not be null");
            return supplier.get();
        }

        @Override
        public <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper, "mapper must not be null");
            return retype();
        }

        @Override
        public <U> Result<U, E> bind(Function<? super T, ? extends Result<U, E>> mapper) {
            Objects.requireNonNull(mapper, "mapper must not be null");
            return retype();
        }

        @Override
        public <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper) {
            Objects.requireNonNull(mapper, "mapper must not be null");
            return new Failure<>(mapper.apply(error));
        }

        @Override
        public <R> R match(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
            Objects.requireNonNull(onSuccess, "onSuccess must not be null");
            Objects.requireNonNull(onFailure, "onFailure must not be null");
            return onFailure.apply(error);
        }

        @Override
        public Result<T, E> bindIf(Predicate<? super T> predicate, Function<? super T, ? extends Result<T, E>> continuation) {
            Objects.requireNonNull(predicate, "predicate must not be null");
            Objects.requireNonNull(continuation, "continuation must not be null");
            return this;
        }

        @Override
        public Result<T, E> ensure(Predicate<? super T> predicate, E error) {
            Objects.requireNonNull(predicate, "predicate must not be null");
            return this;
        }

        @Override
        public Result<T, E> tap(Consumer<? super T> action) {
            Objects.requireNonNull(action, "action must not be null");
            return this;
        }

        @Override
        public Result<T, E> tapError(Consumer<? super E> action) {
            Objects.requireNonNull(action, "action must not be null");
            action.accept(error);
            return this;
        }

        @Override
        public Result<T, E> recover(Function<? super E, ? extends T> recovery) {
            Objects.requireNonNull(recovery, "recovery must not be null");
            return new Success<>(recovery.apply(error));
        }

        // A failure carries no value, so the value type parameter is phantom.
        @SuppressWarnings("unchecked")
        private <U> Result<U, E> retype() {
            return (Result<U, E>) (Result<?, E>) this;
        }
    }

    // Query methods
    boolean isSuccess();
    boolean isFailure();

    // Value extraction

    /**
     * Returns the successful value.
     *
     * @throws InvalidResultAccessException if this is a {@link Failure}
     */
    T value();

    /**
     * Returns the error.
     *
     * @throws InvalidResultAccessException if this is a {@link Success}
     */
    E error();

    T getOrElse(T defaultValue);
    T getOrElseGet(Supplier<? extends T> supplier);

    // Transformations

    /**
     * Transforms the value of a success. A failure is returned unchanged and the
     * mapper is never invoked.
     */
    <U> Result<U, E> map(Function<? super T, ? extends U> mapper);

    /**
     * Chains an operation that may itself fail. A failure short-circuits and the
     * mapper is never invoked. Also known as flatMap.
     */
    <U> Result<U, E> bind(Function<? super T, ? extends Result<U, E>> mapper);

    /**
     * Transforms the error of a failure. A success is returned unchanged.
     */
    <F> Result<T, F> mapError(Function<? super E, ? extends F> mapper);

    /**
     * Reduces this result to a single value by invoking exactly one of the two functions.
     */
    <R> R match(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure);

    /**
     * Applies {@code continuation} to a success only when {@code predicate} is <em>false</em>.
     *
     * <p>Note the polarity: the predicate answers "is the value already acceptable?".
     * When it returns {@code true} the original success is returned unchanged and the
     * continuation is skipped. When it returns {@code false} the continuation runs and
     * its result replaces this one. On a failure neither function is invoked.
     *
     * <pre>{@code
     * // Only extract JSON when the payload is not already JSON
     * payload.bindIf(p -> p.startsWith("{"), p -> extractJson(p));
     * }</pre>
     */
    Result<T, E> bindIf(Predicate<? super T> predicate, Function<? super T, ? extends Result<T, E>> continuation);

    /**
     * Turns a success into a failure carrying {@code error} when the value does not
     * satisfy {@code predicate}. A failure is returned unchanged.
     */
    Result<T, E> ensure(Predicate<? super T> predicate, E error);

    // Side effects

    /**
     * Runs {@code action} on the value of a success and returns this same instance.
     */
    Result<T, E> tap(Consumer<? super T> action);

    /**
     * Runs {@code action} on the error of a failure and returns this same instance.
     */
    Result<T, E> tapError(Consumer<? super E> action);

    // Recovery
    Result<T, E> recover(Function<? super E, ? extends T> recovery);

    // Asynchronous continuations

    /**
     * Lifts this result into an already completed {@link AsyncResult}.
     */
    default AsyncResult<T, E> toAsync() {
        return AsyncResult.completed(this);
    }

    default <U> AsyncResult<U, E> mapAsync(Function<? super T, ? extends CompletionStage<U>> mapper) {
        return toAsync().mapAsync(mapper);
    }

    default <U> AsyncResult<U, E> bindAsync(Function<? super T, ? extends CompletionStage<Result<U, E>>> mapper) {
        return toAsync().bindAsync(mapper);
    }

    default <F> AsyncResult<T, F> mapErrorAsync(Function<? super E, ? extends CompletionStage<F>> mapper) {
        return toAsync().mapErrorAsync(mapper);
    }

    default <R> CompletableFuture<R> matchAsync(
            Function<? super T, ? extends CompletionStage<R>> onSuccess,
            Function<? super E, ? extends CompletionStage<R>> onFailure) {
        return toAsync().matchAsync(onSuccess, onFailure);
    }

    /**
     * Asynchronous form of {@link #bindIf}. The predicate keeps the same polarity:
     * {@code true} skips the continuation.
     */
    default AsyncResult<T, E> bindIfAsync(
            Predicate<? super T> predicate,
            Function<? super T, ? extends CompletionStage<Result<T, E>>> continuation) {
        return toAsync().bindIfAsync(predicate, continuation);
    }

    /**
     * Form of {@link #bindIf} whose predicate is itself asynchronous. A predicate
     * completing with {@code true} skips the continuation.
     */
    default AsyncResult<T, E> bindIfAsyncPredicate(
            Function<? super T, ? extends CompletionStage<Boolean>> predicate,
            Function<? super T, ? extends CompletionStage<Result<T, E>>> continuation) {
        return toAsync().bindIfAsyncPredicate(predicate, continuation);
    }

    default AsyncResult<T, E> tapAsync(Function<? super T, ? extends CompletionStage<?>> action) {
        return toAsync().tapAsync(action);
    }

    default AsyncResult<T, E> tapErrorAsync(Function<? super E, ? extends CompletionStage<?>> action) {
        return toAsync().tapErrorAsync(action);
    }

    // Static factories
    static <E> Result<Void, E> success() {
        return new Success<>(null);
    }

    static <T, E> Result<T, E> success(T value) {
        return new Success<>(value);
    }

    static <T, E> Result<T, E> failure(E error) {
        return new Failure<>(error);
    }
}
