package org.tyl.errors.ops;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tyl.errors.TylError;
import org.tyl.errors.settings.ErrorSettings;
import org.tyl.errors.settings.LogLevel;

import java.util.Objects;

/**
 * Writes errors to the diagnostic log as {@code [LEVEL] <error>} lines, through Log4j2.
 *
 * <p>A line is written only when {@link ErrorSettings#logErrors()} is on and the message level
 * is at or below {@link ErrorSettings#logLevel()}. Where the line ends up is decided by the
 * Log4j2 configuration of the logger {@value #LOGGER_NAME}; route it to {@code SYSTEM_ERR}
 * with pattern {@code %m%n} to get the plain line on stderr.
 */
public final class DiagnosticLog {

	public static final String LOGGER_NAME = "org.tyl.errors.Diagnostics";

	private final ErrorSettings settings;
	private final Logger logger;

	/**
	 * Creates a diagnostic log using the default logger.
	 *
	 * @param settings the settings deciding what gets written
	 */
	public DiagnosticLog(ErrorSettings settings) {
		this(settings, LogManager.getLogger(LOGGER_NAME));
	}

	/**
	 * Creates a diagnostic log with a specific logger instance.
	 *
	 * @param settings the settings deciding what gets written
	 * @param logger the Log4j logger to use
	 */
	public DiagnosticLog(ErrorSettings settings, Logger logger) {
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
		this.logger = Objects.requireNonNull(logger, "logger must not be null");
	}

	/**
	 * The diagnostic log driven by {@link ErrorSettings#global()}.
	 */
	public static DiagnosticLog global() {
		return Holder.INSTANCE;
	}

	/**
	 * Writes the error if the settings allow it.
	 *
	 * @param level the level of this message
	 * @param error the error to write
	 * @return true if the settings allowed the line; Log4j's own level threshold may still drop it
	 */
	public boolean log(LogLevel level, TylError error) {
		Objects.requireNonNull(level, "level must not be null");
		Objects.requireNonNull(error, "error must not be null");
		if (!isEnabled(level)) {
			return false;
		}
		logger.log(levelFor(level), formatLine(level, error));
		return true;
	}

	public boolean isEnabled(LogLevel level) {
		return settings.logErrors() && level.isEnabledAt(settings.logLevel());
	}

	/**
	 * Formats a diagnostic line, e.g. {@code [WARN] Network error: timeout}.
	 */
	public static String formatLine(LogLevel level, TylError error) {
		return "[" + level.name() + "] " + error;
	}

	private static Level levelFor(LogLevel level) {
		return switch (level) {
			case ERROR -> Level.ERROR;
			case WARN -> Level.WARN;
			case INFO -> Level.INFO;
			case DEBUG -> Level.DEBUG;
		};
	}

	private static final class Holder {
		private static final DiagnosticLog INSTANCE = new DiagnosticLog(ErrorSettings.global());
	}
}
