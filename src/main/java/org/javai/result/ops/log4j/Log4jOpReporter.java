package org.javai.result.ops.log4j;

import java.util.Objects;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.result.ops.Capture;
import org.javai.result.ops.OpReporter;

/**
 * Reports captured exceptions using Log4j2.
 *
 * <p>Each capture is logged once, with the {@code CAPTURED} marker, at the configured
 * level ({@code WARN} unless specified), and with the exception attached so appenders
 * can render its stack trace.
 */
public class Log4jOpReporter implements OpReporter {

	public static final String DEFAULT_LOGGER_NAME = "org.javai.result.OpReporter";

	static final Marker CAPTURED_MARKER = MarkerManager.getMarker("CAPTURED");

	private final Logger logger;
	private final Level level;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(DEFAULT_LOGGER_NAME);
	}

	/**
	 * Creates a Log4jOpReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jOpReporter(String loggerName) {
		this(loggerName, Level.WARN);
	}

	public Log4jOpReporter(String loggerName, Level level) {
		this(LogManager.getLogger(loggerName), level);
	}

	/**
	 * Creates a Log4jOpReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 * @param level the level captures are logged at
	 */
	public Log4jOpReporter(Logger logger, Level level) {
		this.logger = Objects.requireNonNull(logger, "logger must not be null");
		this.level = Objects.requireNonNull(level, "level must not be null");
	}

	@Override
	public void report(Capture capture) {
		logger.atLevel(level)
			.withMarker(CAPTURED_MARKER)
			.withThrowable(capture.exception())
			.log(formatMessage(capture));
	}

	static String formatMessage(Capture capture) {
		return "Captured exception in operation [%s]: %s | type=%s, occurredAt=%s".formatted(
				capture.operation(),
				capture.message(),
				capture.exceptionType(),
				capture.occurredAt());
	}
}
