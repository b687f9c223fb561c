package org.tyl.errors.ops;

import org.tyl.errors.ErrorContext;

import java.time.Duration;

/**
 * Publishes error contexts for observability.
 * Implementations might write structured logs or emit metrics.
 */
public interface ContextReporter {

	/**
	 * Reports an error occurrence.
	 */
	void report(ErrorContext context);

	/**
	 * Reports that the caller is about to retry the failed operation.
	 *
	 * @param context the context of the failed attempt; its attempt count is the attempt that failed
	 * @param delay the delay the caller will wait before retrying
	 */
	default void reportRetryAttempt(ErrorContext context, Duration delay) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * A reporter that does nothing.
	 */
	static ContextReporter noOp() {
		return context -> {};
	}

	/**
	 * Creates a reporter that fans out to all given reporters.
	 */
	static ContextReporter composite(ContextReporter... reporters) {
		return CompositeContextReporter.of(reporters);
	}
}
