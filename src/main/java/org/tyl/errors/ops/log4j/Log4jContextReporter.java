package org.tyl.errors.ops.log4j;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.tyl.errors.ErrorContext;
import org.tyl.errors.ops.ContextReporter;

import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reports error contexts using Log4j2.
 *
 * <p>Contexts whose category is retriable are logged at WARN, all others at ERROR.
 * Retry attempts are logged at INFO. Entries carry the {@code ERROR_CONTEXT} or {@code RETRY}
 * marker so they can be routed separately.
 */
public class Log4jContextReporter implements ContextReporter {

	private static final Marker ERROR_CONTEXT_MARKER = MarkerManager.getMarker("ERROR_CONTEXT");
	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");

	private final Logger logger;

	/**
	 * Creates a Log4jContextReporter using the default logger name.
	 */
	public Log4jContextReporter() {
		this(LogManager.getLogger("org.tyl.errors.ContextReporter"));
	}

	public Log4jContextReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jContextReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(ErrorContext context) {
		logger.atLevel(levelFor(context))
			.withMarker(ERROR_CONTEXT_MARKER)
			.log(formatContext(context));
	}

	@Override
	public void reportRetryAttempt(ErrorContext context, Duration delay) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retrying operation [{}] after attempt {} in {} ms. Category: {}, Message: {}",
				context.operation(),
				context.attemptCount(),
				delay.toMillis(),
				context.category().categoryName(),
				context.message());
	}

	static String formatContext(ErrorContext context) {
		return """
			Error in operation [%s]: %s \
			| id=%s, category=%s, attempt=%d%s\
			""".formatted(
				context.operation(),
				context.message(),
				context.errorId(),
				context.category().categoryName(),
				context.attemptCount(),
				formatMetadata(context.metadata())
			).trim();
	}

	private static String formatMetadata(Map<String, JsonNode> metadata) {
		if (metadata.isEmpty()) {
			return "";
		}
		return ", metadata={" + metadata.entrySet().stream()
				.map(e -> e.getKey() + "=" + e.getValue())
				.sorted()
				.collect(Collectors.joining(", ")) + "}";
	}

	static Level levelFor(ErrorContext context) {
		return context.category().isRetriable() ? Level.WARN : Level.ERROR;
	}
}
