package org.javai.result.ops;

/**
 * Reports exceptions captured at a {@link org.javai.result.boundary.Boundary}.
 * Implementations might emit metrics, structured logs, or alerts.
 *
 * <p>A reporter is called on the thread that captured the exception, before the
 * failure is handed back to the caller.
 */
@FunctionalInterface
public interface OpReporter {

	/**
	 * Reports a captured exception.
	 */
	void report(Capture capture);

	/**
	 * A reporter that does nothing. Useful for testing.
	 */
	static OpReporter noOp() {
		return capture -> {};
	}

	/**
	 * Creates a composite reporter that fans out to all given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite reporter
	 */
	static OpReporter composite(OpReporter... reporters) {
		return CompositeOpReporter.of(reporters);
	}
}
