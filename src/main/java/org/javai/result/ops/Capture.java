package org.javai.result.ops;

import java.time.Instant;
import java.util.Objects;

/**
 * An exception captured at a boundary, together with where and when it happened.
 *
 * @param operation the operation name given to the boundary
 * @param exception the captured exception, unwrapped from any completion wrapper
 * @param occurredAt when the exception was captured
 */
public record Capture(String operation, Exception exception, Instant occurredAt) {

	public Capture {
		Objects.requireNonNull(operation, "operation must not be null");
		Objects.requireNonNull(exception, "exception must not be null");
		Objects.requireNonNull(occurredAt, "occurredAt must not be null");
	}

	public String exceptionType() {
		return exception.getClass().getName();
	}

	/**
	 * Returns the exception's message, or its simple class name when it has none.
	 */
	public String message() {
		String message = exception.getMessage();
		return message != null ? message : exception.getClass().getSimpleName();
	}
}
