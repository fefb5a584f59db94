package org.javai.result.boundary;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;
import org.javai.result.AsyncResult;
import org.javai.result.Cleanup;
import org.javai.result.Result;
import org.javai.result.ops.Capture;
import org.javai.result.ops.OpReporter;

/**
 * The boundary adapter for work that may throw.
 * Catches exceptions, classifies them into errors, reports them, and returns a Result.
 *
 * <p>This is the single point where exceptions are translated into the Result world.
 * After passing through a Boundary, code operates entirely on Result values.</p>
 *
 * <p>Every {@link Exception} is captured, checked or not. {@link Error}s propagate.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * // Simple usage for testing or prototyping
 * Boundary boundary = Boundary.silent();
 *
 * // Production usage with reporting
 * Boundary boundary = Boundary.withReporter(new Log4jOpReporter());
 *
 * Result<String, Exception> body = boundary.call(
 *     "Files.readString",
 *     () -> Files.readString(path)
 * );
 *
 * Result<Config, String> config = boundary.call(
 *     "Config.parse",
 *     () -> mapper.readValue(json, Config.class),
 *     e -> "Invalid configuration: " + e.getMessage(),
 *     () -> log.info("parse attempted")
 * );
 * }</pre>
 *
 * <p>Forms taking a cleanup clause run it exactly once after the outcome has been
 * captured, on success and on failure alike. A cleanup clause that throws is never
 * suppressed: its exception propagates from {@code call}, or completes the
 * {@link AsyncResult} of {@code callAsync} exceptionally.</p>
 */
public final class Boundary {

    private final OpReporter reporter;

    /**
     * Creates a silent Boundary that captures failures but does not report them.
     *
     * <p>Useful for testing, prototyping, or simple scripts where operational
     * reporting is not needed.
     *
     * @return a Boundary with no reporting
     */
    public static Boundary silent() {
        return new Boundary(OpReporter.noOp());
    }

    /**
     * Creates a Boundary reporting every captured exception to {@code reporter}.
     *
     * @param reporter the reporter for captured exceptions
     * @return a Boundary with custom reporting
     */
    public static Boundary withReporter(OpReporter reporter) {
        return new Boundary(reporter);
    }

    public Boundary(OpReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    // Synchronous work

    /**
     * Executes work, keeping any exception it throws as the error.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute
     * @return Success with the result, or Failure holding the thrown exception itself
     */
    public <T> Result<T, Exception> call(String operation, ThrowingSupplier<T, ? extends Exception> work) {
        return call(operation, work, ExceptionClassifier.identity());
    }

    /**
     * Executes work, translating any exception it throws into an error.
     *
     * @param operation The operation name for context and reporting
     * @param work The work to execute
     * @param classifier Translates a captured exception into the error
     * @return Success with the result, or Failure with the classified error
     */
    public <T, E> Result<T, E> call(
            String operation,
            ThrowingSupplier<T, ? extends Exception> work,
            ExceptionClassifier<? extends E> classifier) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        Objects.requireNonNull(classifier, "classifier must not be null");

        try {
            return Result.success(work.get());
        } catch (Exception e) {
            return capture(operation, e, classifier);
        }
    }

    public <T> Result<T, Exception> call(
            String operation,
            ThrowingSupplier<T, ? extends Exception> work,
            Runnable cleanup) {
        return call(operation, work, ExceptionClassifier.identity(), cleanup);
    }

    /**
     * Executes work, then runs {@code cleanup} once the outcome has been captured.
     *
     * @param cleanup Runs exactly once; an exception it throws propagates
     */
    public <T, E> Result<T, E> call(
            String operation,
            ThrowingSupplier<T, ? extends Exception> work,
            ExceptionClassifier<? extends E> classifier,
            Runnable cleanup) {
        Objects.requireNonNull(cleanup, "cleanup must not be null");

        Result<T, E> result;
        try {
            result = call(operation, work, classifier);
        } catch (Throwable t) {
            runSuppressed(cleanup, t);
            throw t;
        }
        cleanup.run();
        return result;
    }

    // Asynchronous work

    public <T> AsyncResult<T, Exception> callAsync(String operation, Supplier<? extends CompletionStage<T>> work) {
        return callAsync(operation, work, ExceptionClassifier.identity());
    }

    /**
     * Starts asynchronous work, translating a synchronous throw from {@code work} or an
     * exceptional completion of its stage into an error. A cancelled stage is captured
     * as a {@link java.util.concurrent.CancellationException}.
     *
     * @param operation The operation name for context and reporting
     * @param work Starts the work and returns its stage
     * @param classifier Translates a captured exception into the error
     * @return an AsyncResult completing with the captured outcome
     */
    public <T, E> AsyncResult<T, E> callAsync(
            String operation,
            Supplier<? extends CompletionStage<T>> work,
            ExceptionClassifier<? extends E> classifier) {
        return AsyncResult.of(captureAsync(operation, work, classifier));
    }

    public <T> AsyncResult<T, Exception> callAsync(
            String operation,
            Supplier<? extends CompletionStage<T>> work,
            Cleanup cleanup) {
        return callAsync(operation, work, ExceptionClassifier.identity(), cleanup);
    }

    /**
     * Starts asynchronous work and runs {@code cleanup} once the outcome has been
     * captured. The returned AsyncResult completes only after the cleanup's stage has.
     */
    public <T, E> AsyncResult<T, E> callAsync(
            String operation,
            Supplier<? extends CompletionStage<T>> work,
            ExceptionClassifier<? extends E> classifier,
            Cleanup cleanup) {
        Objects.requireNonNull(cleanup, "cleanup must not be null");
        CompletionStage<Result<T, E>> captured = captureAsync(operation, work, classifier);
        return AsyncResult.of(captured
                .handle((result, failure) -> Boundary.<T, E>afterCleanup(cleanup, result, failure))
                .thenCompose(stage -> stage));
    }

    private static <T, E> CompletionStage<Result<T, E>> afterCleanup(Cleanup cleanup, Result<T, E> result, Throwable failure) {
        return startCleanup(cleanup).handle((ignored, cleanupFailure) -> {
            if (failure != null) {
                Throwable primary = unwrap(failure);
                if (cleanupFailure != null && unwrap(cleanupFailure) != primary) {
                    primary.addSuppressed(unwrap(cleanupFailure));
                }
                throw asCompletionException(failure);
            }
            if (cleanupFailure != null) {
                throw asCompletionException(cleanupFailure);
            }
            return result;
        });
    }

    private <T, E> CompletionStage<Result<T, E>> captureAsync(
            String operation,
            Supplier<? extends CompletionStage<T>> work,
            ExceptionClassifier<? extends E> classifier) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        Objects.requireNonNull(classifier, "classifier must not be null");

        return start(work).handle((value, failure) -> {
            if (failure == null) {
                return Result.<T, E>success(value);
            }
            Throwable cause = unwrap(failure);
            if (cause instanceof Exception exception) {
                return this.<T, E>capture(operation, exception, classifier);
            }
            throw asCompletionException(cause);
        });
    }

    private <T, E> Result<T, E> capture(String operation, Exception exception, ExceptionClassifier<? extends E> classifier) {
        if (exception instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        reporter.report(new Capture(operation, exception, Instant.now()));
        E error = Objects.requireNonNull(classifier.classify(exception), "classifier must not return null");
        return Result.failure(error);
    }

    // Anything thrown while starting becomes a failed stage so a cleanup clause still runs.
    private static <T> CompletionStage<T> start(Supplier<? extends CompletionStage<T>> work) {
        try {
            return Objects.requireNonNull(work.get(), "work must not return null");
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    private static CompletionStage<?> startCleanup(Cleanup cleanup) {
        try {
            return Objects.requireNonNull(cleanup.run(), "cleanup must not return null");
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    private static void runSuppressed(Runnable cleanup, Throwable primary) {
        try {
            cleanup.run();
        } catch (Throwable t) {
            if (t != primary) {
                primary.addSuppressed(t);
            }
        }
    }

    // CompletionException and ExecutionException only wrap; the classifier sees the cause.
    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static CompletionException asCompletionException(Throwable failure) {
        return failure instanceof CompletionException completion ? completion : new CompletionException(failure);
    }
}
