package org.javai.result.ops.metrics;

import java.time.format.DateTimeFormatter;
import java.util.Objects;
import org.javai.result.ops.Capture;
import org.javai.result.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports captured exceptions as JSON-lines metrics via SLF4J.
 *
 * <p>Outputs one JSON object per capture, suitable for metrics aggregation and
 * analysis pipelines. The tracking key is the operation name, prefixed with a
 * configurable namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"capture","timestamp":"2024-01-20T10:30:00Z","trackingKey":"checkout.Payment.charge","operation":"Payment.charge","exceptionType":"java.net.SocketTimeoutException","message":"Read timed out"}
 * }</pre>
 *
 * <ul>
 *   <li>{@link #MetricsOpReporter()} - no namespace, default logger</li>
 *   <li>{@link #MetricsOpReporter(String)} - with namespace, default logger</li>
 *   <li>{@link #MetricsOpReporter(String, String)} - with namespace and custom logger name</li>
 * </ul>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.result.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;

	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	public MetricsOpReporter(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName));
	}

	// Package-private for testing.
	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = Objects.requireNonNull(logger, "logger must not be null");
	}

	@Override
	public void report(Capture capture) {
		logger.info(buildCaptureJson(capture));
	}

	String buildCaptureJson(Capture capture) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "capture", true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(capture.occurredAt()), false);
		appendField(sb, "trackingKey", buildTrackingKey(capture), false);
		appendField(sb, "operation", capture.operation(), false);
		appendField(sb, "exceptionType", capture.exceptionType(), false);
		appendField(sb, "message", capture.message(), false);
		sb.append("}");
		return sb.toString();
	}

	String buildTrackingKey(Capture capture) {
		if (namespace == null) {
			return capture.operation();
		}
		return namespace + "." + capture.operation();
	}

	private static void appendField(StringBuilder sb, String key, String value, boolean first) {
		if (!first) {
			sb.append(",");
		}
		sb.append("\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		return s.replace("\\", "\\\\")
				.replace("\"", "\\\"")
				.replace("\n", "\\n")
				.replace("\r", "\\r")
				.replace("\t", "\\t");
	}
}
