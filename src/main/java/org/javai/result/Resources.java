package org.javai.result;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Scoped use of a resource carried by a successful {@link Result}.
 *
 * <p>When the result is a success, the body runs with the resource and the resource is
 * closed exactly once afterwards, whatever the body did: returned a success, returned
 * a failure, or threw. When the result is a failure the body never runs, nothing is
 * closed, and the same failure is returned.
 *
 * <p>A body exception is rethrown after the resource has been closed; it is never turned
 * into a failure. If closing also fails, that exception is added to the body's exception
 * as suppressed. If only closing fails, a {@link RuntimeException} propagates as is and a
 * checked exception is wrapped in a {@link ResourceReleaseException}.
 *
 * <pre>{@code
 * Result<List<Row>, DbError> rows = Resources.using(pool.acquire(), connection ->
 *     Resources.using(connection.begin(), tx -> tx.query(sql)));
 * }</pre>
 *
 * <p>Nested calls close their own resource only, innermost first.
 */
public final class Resources {

    private Resources() {}

    /**
     * Runs {@code body} with the resource of a success and closes it before returning.
     */
    public static <R extends AutoCloseable, U, E> Result<U, E> using(
            Result<R, E> acquired,
            Function<? super R, ? extends Result<U, E>> body) {
        Objects.requireNonNull(acquired, "acquired must not be null");
        Objects.requireNonNull(body, "body must not be null");
        return acquired.bind(resource -> runAndRelease(resource, body));
    }

    public static <R extends AutoCloseable, U, E> AsyncResult<U, E> using(
            AsyncResult<R, E> acquired,
            Function<? super R, ? extends Result<U, E>> body) {
        Objects.requireNonNull(acquired, "acquired must not be null");
        Objects.requireNonNull(body, "body must not be null");
        return acquired.bind(resource -> runAndRelease(resource, body));
    }

    /**
     * Runs an asynchronous {@code body} with the resource of a success. The resource is
     * closed once the body's stage has completed, before the returned result completes.
     */
    public static <R extends AutoCloseable, U, E> AsyncResult<U, E> usingAsync(
            Result<R, E> acquired,
            Function<? super R, ? extends CompletionStage<Result<U, E>>> body) {
        Objects.requireNonNull(acquired, "acquired must not be null");
        return usingAsync(acquired.toAsync(), body);
    }

    public static <R extends AutoCloseable, U, E> AsyncResult<U, E> usingAsync(
            AsyncResult<R, E> acquired,
            Function<? super R, ? extends CompletionStage<Result<U, E>>> body) {
        Objects.requireNonNull(acquired, "acquired must not be null");
        Objects.requireNonNull(body, "body must not be null");
        return acquired.bindAsync(resource -> runAndReleaseAsync(resource, body));
    }

    private static <R extends AutoCloseable, U, E> Result<U, E> runAndRelease(
            R resource,
            Function<? super R, ? extends Result<U, E>> body) {
        Result<U, E> result;
        try {
            result = body.apply(resource);
        } catch (Throwable t) {
            releaseSuppressed(resource, t);
            throw t;
        }
        release(resource);
        return result;
    }

    private static <R extends AutoCloseable, U, E> CompletionStage<Result<U, E>> runAndReleaseAsync(
            R resource,
            Function<? super R, ? extends CompletionStage<Result<U, E>>> body) {
        CompletionStage<Result<U, E>> stage;
        try {
            stage = Objects.requireNonNull(body.apply(resource), "body must not return null");
        } catch (Throwable t) {
            releaseSuppressed(resource, t);
            throw t;
        }
        return stage.handle((result, failure) -> {
            if (failure != null) {
                releaseSuppressed(resource, unwrap(failure));
                throw failure instanceof CompletionException completion
                        ? completion
                        : new CompletionException(failure);
            }
            release(resource);
            return result;
        });
    }

    private static void release(AutoCloseable resource) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new ResourceReleaseException(resource, e);
        }
    }

    private static void releaseSuppressed(AutoCloseable resource, Throwable primary) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            if (t != primary) {
                primary.addSuppressed(t);
            }
        }
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }
}
