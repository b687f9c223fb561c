package org.tyl.errors.ops;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tyl.errors.ErrorContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * A {@link ContextReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws, the exception is
 * logged and the remaining reporters still run.
 * <pre>{@code
 * ContextReporter reporter = CompositeContextReporter.builder()
 *     .add(new Log4jContextReporter())
 *     .addIf(metricsEnabled, new MetricsContextReporter("myapp"))
 *     .build();
 * }</pre>
 */
public final class CompositeContextReporter implements ContextReporter {

	private static final Logger LOGGER = LogManager.getLogger(CompositeContextReporter.class);

	private final List<ContextReporter> reporters;

	private CompositeContextReporter(List<ContextReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeContextReporter of(ContextReporter... reporters) {
		return new CompositeContextReporter(Arrays.asList(reporters));
	}

	public static CompositeContextReporter of(Collection<? extends ContextReporter> reporters) {
		return new CompositeContextReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(ErrorContext context) {
		for (ContextReporter reporter : reporters) {
			try {
				reporter.report(context);
			} catch (RuntimeException e) {
				logReporterError("report", reporter, e);
			}
		}
	}

	@Override
	public void reportRetryAttempt(ErrorContext context, Duration delay) {
		for (ContextReporter reporter : reporters) {
			try {
				reporter.reportRetryAttempt(context, delay);
			} catch (RuntimeException e) {
				logReporterError("reportRetryAttempt", reporter, e);
			}
		}
	}

	public int size() {
		return reporters.size();
	}

	private static void logReporterError(String method, ContextReporter reporter, RuntimeException e) {
		LOGGER.warn("ContextReporter.{} failed for {}", method, reporter.getClass().getName(), e);
	}

	public static final class Builder {
		private final List<ContextReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter; null is ignored.
		 */
		public Builder add(ContextReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addAll(Collection<? extends ContextReporter> reporters) {
			for (ContextReporter reporter : reporters) {
				add(reporter);
			}
			return this;
		}

		public Builder addIf(boolean condition, ContextReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeContextReporter build() {
			return new CompositeContextReporter(reporters);
		}
	}
}
