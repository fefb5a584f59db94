package org.javai.result.boundary;

/**
 * Translates a captured exception into the error type of a failure.
 * Implementations should be deterministic and must not return {@code null}.
 *
 * @param <E> The error type produced
 */
@FunctionalInterface
public interface ExceptionClassifier<E> {

    /**
     * Classifies an exception captured by a {@link Boundary}.
     *
     * @param exception the exception, already unwrapped from any completion wrapper
     * @return the error to carry in the failure
     */
    E classify(Exception exception);

    /**
     * Returns a classifier that keeps the exception itself as the error.
     */
    static ExceptionClassifier<Exception> identity() {
        return exception -> exception;
    }
}
