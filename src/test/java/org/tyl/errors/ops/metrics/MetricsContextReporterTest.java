package org.tyl.errors.ops.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.LegacyAbstractLogger;
import org.tyl.errors.ErrorContext;
import org.tyl.errors.TylError;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MetricsContextReporterTest {

	private final ObjectMapper mapper = new ObjectMapper();

	private List<String> capturedMessages;
	private CapturingLogger capturingLogger;
	private ErrorContext context;

	@BeforeEach
	void setUp() {
		capturedMessages = new ArrayList<>();
		capturingLogger = new CapturingLogger(capturedMessages);
		context = TylError.network("timeout").toContext("order.fetch")
				.withMetadata("endpoint", "/orders/42");
	}

	@Test
	void report_emitsErrorEventAsJsonLine() throws Exception {
		new MetricsContextReporter(null, capturingLogger).report(context);

		assertThat(capturedMessages).hasSize(1);
		String line = capturedMessages.get(0);
		assertThat(line).doesNotContain("\n");

		JsonNode event = mapper.readTree(line);
		assertThat(event.get("event_type").asText()).isEqualTo("error");
		assertThat(event.get("category").asText()).isEqualTo("Network");
		assertThat(event.get("tracking_key").asText()).isEqualTo("order.fetch");
		assertThat(event.get("error_id").asText()).isEqualTo(context.errorId().toString());
		assertThat(event.get("message").asText()).isEqualTo("Network error: timeout");
		assertThat(event.get("attempt_count").asInt()).isEqualTo(1);
		assertThat(event.get("metadata").get("endpoint").asText()).isEqualTo("/orders/42");
	}

	@Test
	void report_withNamespace_prependsToTrackingKey() throws Exception {
		new MetricsContextReporter("myapp", capturingLogger).report(context);

		JsonNode event = mapper.readTree(capturedMessages.get(0));
		assertThat(event.get("tracking_key").asText()).isEqualTo("myapp.order.fetch");
	}

	@Test
	void report_withBlankNamespace_usesOperationOnly() throws Exception {
		new MetricsContextReporter("  ", capturingLogger).report(context);

		JsonNode event = mapper.readTree(capturedMessages.get(0));
		assertThat(event.get("tracking_key").asText()).isEqualTo("order.fetch");
	}

	@Test
	void reportRetryAttempt_includesDelay() throws Exception {
		context.incrementAttempt();

		new MetricsContextReporter(null, capturingLogger).reportRetryAttempt(context, Duration.ofMillis(1500));

		JsonNode event = mapper.readTree(capturedMessages.get(0));
		assertThat(event.get("event_type").asText()).isEqualTo("retry");
		assertThat(event.get("delay_ms").asLong()).isEqualTo(1500);
		assertThat(event.get("attempt_count").asInt()).isEqualTo(2);
	}

	@Test
	void report_logsAtInfo() {
		new MetricsContextReporter(null, capturingLogger).report(context);

		assertThat(capturingLogger.levels).containsExactly(Level.INFO);
	}

	private static class CapturingLogger extends LegacyAbstractLogger {
		private final List<String> messages;
		private final List<Level> levels = new ArrayList<>();

		CapturingLogger(List<String> messages) {
			this.messages = messages;
			this.name = "test";
		}

		@Override
		public boolean isTraceEnabled() { return true; }

		@Override
		public boolean isDebugEnabled() { return true; }

		@Override
		public boolean isInfoEnabled() { return true; }

		@Override
		public boolean isWarnEnabled() { return true; }

		@Override
		public boolean isErrorEnabled() { return true; }

		@Override
		protected String getFullyQualifiedCallerName() { return null; }

		@Override
		protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
												   Object[] arguments, Throwable throwable) {
			levels.add(level);
			messages.add(messagePattern);
		}
	}
}
