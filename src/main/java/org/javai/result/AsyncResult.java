package org.javai.result;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A {@link Result} that is not available yet.
 *
 * <p>An AsyncResult wraps a {@link CompletableFuture} of a Result and offers the same
 * combinators as Result itself. Each combinator accepts either a synchronous
 * continuation ({@code map}, {@code bind}, ...) or one returning a {@link CompletionStage}
 * ({@code mapAsync}, {@code bindAsync}, ...). Both return a new AsyncResult.
 *
 * <p>Steps of a chain run strictly in the order written: a step starts only once the
 * result before it, and everything that step awaits, has completed. No threads are
 * created here; continuations run wherever the underlying futures complete.
 *
 * <p>Exceptions thrown by a continuation are not turned into failures. They complete
 * the AsyncResult exceptionally, and {@link #join()} rethrows them wrapped in a
 * {@link java.util.concurrent.CompletionException}. Use
 * {@link org.javai.result.boundary.Boundary#callAsync} to capture exceptions as failures.
 *
 * <pre>{@code
 * AsyncResult<User, String> user = userIds.lookup(id)        // AsyncResult<Long, String>
 *     .bindAsync(userId -> repository.fetch(userId))         // CompletionStage<Result<User, String>>
 *     .ensure(User::isActive, "inactive user")
 *     .tapAsync(u -> audit.recordAccess(u));
 * }</pre>
 *
 * @param <T> The type of the successful value
 * @param <E> The type of the error
 */
public final class AsyncResult<T, E> {

    private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);

    private final CompletableFuture<Result<T, E>> future;

    private AsyncResult(CompletableFuture<Result<T, E>> future) {
        this.future = future;
    }

    /**
     * Wraps a stage that will complete with a result.
     *
     * @param stage the pending result, must not complete with {@code null}
     * @return an AsyncResult completing with the stage's result
     */
    public static <T, E> AsyncResult<T, E> of(CompletionStage<? extends Result<T, E>> stage) {
        Objects.requireNonNull(stage, "stage must not be null");
        return new AsyncResult<>(stage.<Result<T, E>>thenApply(
                result -> Objects.requireNonNull(result, "stage must not complete with null")).toCompletableFuture());
    }

    public static <T, E> AsyncResult<T, E> completed(Result<T, E> result) {
        Objects.requireNonNull(result, "result must not be null");
        return new AsyncResult<>(CompletableFuture.completedFuture(result));
    }

    public static <T, E> AsyncResult<T, E> success(T value) {
        return completed(Result.success(value));
    }

    public static <T, E> AsyncResult<T, E> failure(E error) {
        return completed(Result.failure(error));
    }

    // Awaiting

    /**
     * Waits for the result.
     *
     * @return the completed result
     * @throws java.util.concurrent.CompletionException if a step of the chain threw, or
     *         an upstream future was cancelled (the cause is then a CancellationException)
     */
    public Result<T, E> join() {
        return future.join();
    }

    /**
     * Returns a future completing with the result. Completing the returned future
     * does not affect this AsyncResult.
     */
    public CompletableFuture<Result<T, E>> toCompletableFuture() {
        return future.copy();
    }

    // Transformations

    public <U> AsyncResult<U, E> map(Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        return mapAsync(value -> CompletableFuture.<U>completedFuture(mapper.apply(value)));
    }

    public <U> AsyncResult<U, E> mapAsync(Function<? super T, ? extends CompletionStage<U>> mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        return this.<U, E>then(result -> {
            if (result.isFailure()) {
                return CompletableFuture.completedStage(passFailure(result));
            }
            return mapper.apply(result.value()).thenApply(mapped -> Result.<U, E>success(mapped));
        });
    }

    public <U> AsyncResult<U, E> bind(Function<? super T, ? extends Result<U, E>> mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        return bindAsync(value -> CompletableFuture.<Result<U, E>>completedFuture(mapper.apply(value)));
    }

    public <U> AsyncResult<U, E> bindAsync(Function<? super T, ? extends CompletionStage<Result<U, E>>> mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        return this.<U, E>then(result -> {
            if (result.isFailure()) {
                return CompletableFuture.completedStage(passFailure(result));
            }
            return mapper.apply(result.value());
        });
    }

    public <F> AsyncResult<T, F> mapError(Function<? super E, ? extends F> mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        return mapErrorAsync(error -> CompletableFuture.<F>completedFuture(mapper.apply(error)));
    }

    public <F> AsyncResult<T, F> mapErrorAsync(Function<? super E, ? extends CompletionStage<F>> mapper) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        return this.<T, F>then(result -> {
            if (result.isSuccess()) {
                return CompletableFuture.completedStage(passSuccess(result));
            }
            return mapper.apply(result.error()).thenApply(mapped -> Result.<T, F>failure(mapped));
        });
    }

    public <R> CompletableFuture<R> match(Function<? super T, ? extends R> onSuccess, Function<? super E, ? extends R> onFailure) {
        Objects.requireNonNull(onSuccess, "onSuccess must not be null");
        Objects.requireNonNull(onFailure, "onFailure must not be null");
        return matchAsync(
                value -> CompletableFuture.<R>completedFuture(onSuccess.apply(value)),
                error -> CompletableFuture.<R>completedFuture(onFailure.apply(error)));
    }

    public <R> CompletableFuture<R> matchAsync(
            Function<? super T, ? extends CompletionStage<R>> onSuccess,
            Function<? super E, ? extends CompletionStage<R>> onFailure) {
        Objects.requireNonNull(onSuccess, "onSuccess must not be null");
        Objects.requireNonNull(onFailure, "onFailure must not be null");
        return future.thenCompose(result -> {
            if (result.isSuccess()) {
                return onSuccess.apply(result.value());
            }
            return onFailure.apply(result.error());
        });
    }

    /**
     * See {@link Result#bindIf}: a predicate returning {@code true} skips the continuation.
     */
    public AsyncResult<T, E> bindIf(Predicate<? super T> predicate, Function<? super T, ? extends Result<T, E>> continuation) {
        Objects.requireNonNull(continuation, "continuation must not be null");
        return bindIfAsync(predicate, value -> CompletableFuture.<Result<T, E>>completedFuture(continuation.apply(value)));
    }

    public AsyncResult<T, E> bindIfAsync(
            Predicate<? super T> predicate,
            Function<? super T, ? extends CompletionStage<Result<T, E>>> continuation) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return bindIfAsyncPredicate(value -> CompletableFuture.completedFuture(predicate.test(value)), continuation);
    }

    public AsyncResult<T, E> bindIfAsyncPredicate(
            Function<? super T, ? extends CompletionStage<Boolean>> predicate,
            Function<? super T, ? extends CompletionStage<Result<T, E>>> continuation) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(continuation, "continuation must not be null");
        return this.<T, E>then(result -> {
            if (result.isFailure()) {
                return CompletableFuture.completedStage(result);
            }
            T value = result.value();
            return predicate.apply(value).thenCompose(skip -> {
                if (Objects.requireNonNull(skip, "predicate must not complete with null")) {
                    return CompletableFuture.completedStage(result);
                }
                return continuation.apply(value);
            });
        });
    }

    public AsyncResult<T, E> ensure(Predicate<? super T> predicate, E error) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        Objects.requireNonNull(error, "error must not be null");
        return this.<T, E>then(result -> CompletableFuture.completedStage(result.ensure(predicate, error)));
    }

    public AsyncResult<T, E> recover(Function<? super E, ? extends T> recovery) {
        Objects.requireNonNull(recovery, "recovery must not be null");
        return this.<T, E>then(result -> CompletableFuture.completedStage(result.recover(recovery)));
    }

    // Side effects

    public AsyncResult<T, E> tap(Consumer<? super T> action) {
        Objects.requireNonNull(action, "action must not be null");
        return tapAsync(value -> {
            action.accept(value);
            return DONE;
        });
    }

    /**
     * Runs {@code action} on the value of a success and completes, once the action's
     * stage has completed, with the identical result instance.
     */
    public AsyncResult<T, E> tapAsync(Function<? super T, ? extends CompletionStage<?>> action) {
        Objects.requireNonNull(action, "action must not be null");
        return this.<T, E>then(result -> {
            if (result.isFailure()) {
                return CompletableFuture.completedStage(result);
            }
            return action.apply(result.value()).thenApply(ignored -> result);
        });
    }

    public AsyncResult<T, E> tapError(Consumer<? super E> action) {
        Objects.requireNonNull(action, "action must not be null");
        return tapErrorAsync(error -> {
            action.accept(error);
            return DONE;
        });
    }

    public AsyncResult<T, E> tapErrorAsync(Function<? super E, ? extends CompletionStage<?>> action) {
        Objects.requireNonNull(action, "action must not be null");
        return this.<T, E>then(result -> {
            if (result.isSuccess()) {
                return CompletableFuture.completedStage(result);
            }
            return action.apply(result.error()).thenApply(ignored -> result);
        });
    }

    // The single await point of every combinator.
    private <U, F> AsyncResult<U, F> then(Function<? super Result<T, E>, ? extends CompletionStage<Result<U, F>>> step) {
        return new AsyncResult<>(future.thenCompose(step));
    }

    @SuppressWarnings("unchecked")
    private static <U, E> Result<U, E> passFailure(Result<?, E> failure) {
        return (Result<U, E>) failure;
    }

    @SuppressWarnings("unchecked")
    private static <T, F> Result<T, F> passSuccess(Result<T, ?> success) {
        return (Result<T, F>) success;
    }

    @Override
    public String toString() {
        return "AsyncResult" + (future.isDone() ? "[completed]" : "[pending]");
    }
}
