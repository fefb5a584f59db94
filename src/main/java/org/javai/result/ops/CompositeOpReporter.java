package org.javai.result.ops;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every capture. If a reporter throws an exception,
 * it is logged at ERROR and the remaining reporters still execute.
 *
 * <p>Example usage:
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.of(
 *     new Log4jOpReporter(),
 *     new MetricsOpReporter("checkout")
 * );
 *
 * // Or using the builder for more control:
 * OpReporter reporter = CompositeOpReporter.builder()
 *     .add(new Log4jOpReporter())
 *     .addIf(metricsEnabled, new MetricsOpReporter("checkout"))
 *     .build();
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private static final Logger LOG = LogManager.getLogger(CompositeOpReporter.class);

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	/**
	 * Creates a composite reporter from the given reporters.
	 *
	 * @param reporters the reporters to delegate to
	 * @return a composite that fans out to all given reporters
	 */
	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(Capture capture) {
		for (OpReporter reporter : reporters) {
			try {
				reporter.report(capture);
			} catch (RuntimeException e) {
				LOG.error("OpReporter {} failed to report operation [{}]",
						reporter.getClass().getName(), capture.operation(), e);
			}
		}
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	/**
	 * Builder for creating a {@link CompositeOpReporter}. Null reporters are ignored.
	 */
	public static final class Builder {
		private final List<OpReporter> reporters = new ArrayList<>();

		private Builder() {}

		public Builder add(OpReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends OpReporter> reporters) {
			for (OpReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		/**
		 * Adds {@code reporter} only when {@code condition} is true.
		 */
		public Builder addIf(boolean condition, OpReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeOpReporter build() {
			return new CompositeOpReporter(reporters);
		}
	}
}
