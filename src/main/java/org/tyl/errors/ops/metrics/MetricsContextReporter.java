package org.tyl.errors.ops.metrics;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tyl.errors.ErrorContext;
import org.tyl.errors.codec.ErrorCodec;
import org.tyl.errors.ops.ContextReporter;

import java.time.Duration;

/**
 * Reports error contexts as JSON-lines metrics via SLF4J.
 *
 * <p>Each event is the {@link ErrorCodec JSON encoding} of the context, extended with the event
 * type, the category name and a tracking key ({@code namespace.operation}, or just the operation
 * when no namespace is set).
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"error_id":"...","operation":"order.fetch","message":"Network error: timeout",...,
 *  "event_type":"error","category":"Network","tracking_key":"myapp.order.fetch"}
 * }</pre>
 */
public class MetricsContextReporter implements ContextReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.tyl.errors.Metrics";

	private final String namespace;
	private final Logger logger;

	/**
	 * Creates a MetricsContextReporter with no namespace and the default logger.
	 */
	public MetricsContextReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsContextReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a MetricsContextReporter with explicit configuration.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 * @param logger the SLF4J logger to use
	 */
	public MetricsContextReporter(String namespace, Logger logger) {
		this.namespace = namespace;
		this.logger = logger;
	}

	@Override
	public void report(ErrorContext context) {
		logger.info(toEvent("error", context).toString());
	}

	@Override
	public void reportRetryAttempt(ErrorContext context, Duration delay) {
		ObjectNode event = toEvent("retry", context);
		event.put("delay_ms", delay.toMillis());
		logger.info(event.toString());
	}

	private ObjectNode toEvent(String eventType, ErrorContext context) {
		ObjectNode event = (ObjectNode) ErrorCodec.toTree(context);
		event.put("event_type", eventType);
		event.put("category", context.category().categoryName());
		event.put("tracking_key", trackingKey(context));
		return event;
	}

	private String trackingKey(ErrorContext context) {
		if (namespace == null || namespace.isBlank()) {
			return context.operation();
		}
		return namespace + "." + context.operation();
	}
}
