package org.tyl.errors.ops;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tyl.errors.ErrorContext;
import org.tyl.errors.TylError;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositeContextReporterTest {

	private List<String> events;
	private ErrorContext context;

	@BeforeEach
	void setUp() {
		events = new ArrayList<>();
		context = TylError.network("timeout").toContext("fetch");
	}

	private ContextReporter recording(String name) {
		return new ContextReporter() {
			@Override
			public void report(ErrorContext context) {
				events.add(name + ":report:" + context.operation());
			}

			@Override
			public void reportRetryAttempt(ErrorContext context, Duration delay) {
				events.add(name + ":retry:" + delay.toMillis());
			}
		};
	}

	@Test
	void report_fansOutToAllReporters() {
		ContextReporter reporter = ContextReporter.composite(recording("a"), recording("b"));

		reporter.report(context);

		assertThat(events).containsExactly("a:report:fetch", "b:report:fetch");
	}

	@Test
	void reportRetryAttempt_fansOutToAllReporters() {
		CompositeContextReporter reporter = CompositeContextReporter.of(List.of(recording("a"), recording("b")));

		reporter.reportRetryAttempt(context, Duration.ofMillis(250));

		assertThat(events).containsExactly("a:retry:250", "b:retry:250");
	}

	@Test
	void report_failingReporterDoesNotStopOthers() {
		ContextReporter failing = ctx -> {
			throw new IllegalStateException("reporter down");
		};
		ContextReporter reporter = ContextReporter.composite(failing, recording("b"));

		assertThatCode(() -> reporter.report(context)).doesNotThrowAnyException();
		assertThat(events).containsExactly("b:report:fetch");
	}

	@Test
	void builder_skipsNullAndConditionalReporters() {
		CompositeContextReporter reporter = CompositeContextReporter.builder()
				.add(recording("a"))
				.add(null)
				.addIf(false, recording("skipped"))
				.addIf(true, recording("c"))
				.addAll(List.of(ContextReporter.noOp()))
				.build();

		reporter.report(context);

		assertThat(reporter.size()).isEqualTo(3);
		assertThat(events).containsExactly("a:report:fetch", "c:report:fetch");
	}

	@Test
	void noOp_ignoresEverything() {
		ContextReporter reporter = ContextReporter.noOp();

		assertThatCode(() -> {
			reporter.report(context);
			reporter.reportRetryAttempt(context, Duration.ofSeconds(1));
		}).doesNotThrowAnyException();
	}
}
