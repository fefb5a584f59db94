package org.javai.result;

/**
 * Thrown when {@link Result#value()} is called on a failure, or {@link Result#error()}
 * on a success. This is an unchecked exception because it indicates misuse of the API:
 * the caller should have checked {@link Result#isSuccess()} first, or used
 * {@link Result#match} or pattern matching.
 */
public class InvalidResultAccessException extends IllegalStateException {

    private final transient Result<?, ?> result;

    public InvalidResultAccessException(String message, Result<?, ?> result) {
        super(message);
        this.result = result;
    }

    /**
     * Returns the result that was accessed through the wrong channel.
     */
    public Result<?, ?> result() {
        return result;
    }
}
