package org.tyl.errors.settings;

import java.util.Locale;
import java.util.Objects;

/**
 * Process-wide error configuration.
 *
 * <p>{@link #global()} reads the settings once, on first access, and keeps them for the
 * lifetime of the process. Later changes to system properties or the environment are not seen.
 *
 * <table>
 *   <caption>Inputs</caption>
 *   <tr><th>Environment variable</th><th>System property</th><th>Default</th></tr>
 *   <tr><td>{@code TYL_ERROR_BACKTRACE}</td><td>{@code tyl.error.backtrace}</td><td>false</td></tr>
 *   <tr><td>{@code TYL_BACKTRACE}</td><td>{@code tyl.backtrace}</td><td>fallback, presence enables</td></tr>
 *   <tr><td>{@code TYL_ERROR_MAX_RETRIES}</td><td>{@code tyl.error.max-retries}</td><td>3</td></tr>
 *   <tr><td>{@code TYL_ERROR_LOG_ERRORS}</td><td>{@code tyl.error.log-errors}</td><td>true</td></tr>
 *   <tr><td>{@code TYL_ERROR_LOG_LEVEL}</td><td>{@code tyl.error.log-level}</td><td>INFO</td></tr>
 * </table>
 *
 * @param backtraceEnabled whether backtraces are enabled
 * @param maxRetries maximum retry attempts for retriable errors
 * @param logErrors whether errors are written to the diagnostic log
 * @param logLevel minimum level of diagnostic output
 */
public record ErrorSettings(
        boolean backtraceEnabled,
        int maxRetries,
        boolean logErrors,
        LogLevel logLevel
) {

    public static final int DEFAULT_MAX_RETRIES = 3;

    public ErrorSettings {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        Objects.requireNonNull(logLevel, "logLevel must not be null");
    }

    /**
     * The settings of this process, loaded from {@link SettingsSource#environment()} on first use.
     */
    public static ErrorSettings global() {
        return Holder.INSTANCE;
    }

    /**
     * Backtraces off, 3 retries, logging on at INFO.
     */
    public static ErrorSettings defaults() {
        return new ErrorSettings(false, DEFAULT_MAX_RETRIES, true, LogLevel.INFO);
    }

    /**
     * Builds settings from the given source. Unparseable values fall back to their defaults.
     */
    public static ErrorSettings load(SettingsSource source) {
        Objects.requireNonNull(source, "source must not be null");

        boolean backtrace = source.lookup(SettingKey.BACKTRACE)
                .map(value -> value.trim().equalsIgnoreCase("true"))
                .orElseGet(() -> source.lookup(SettingKey.BACKTRACE_FALLBACK).isPresent());

        int maxRetries = source.lookup(SettingKey.MAX_RETRIES)
                .map(ErrorSettings::parseRetries)
                .orElse(DEFAULT_MAX_RETRIES);

        boolean logErrors = source.lookup(SettingKey.LOG_ERRORS)
                .map(value -> !value.trim().toLowerCase(Locale.ROOT).equals("false"))
                .orElse(true);

        LogLevel logLevel = source.lookup(SettingKey.LOG_LEVEL)
                .flatMap(LogLevel::parse)
                .orElse(LogLevel.INFO);

        return new ErrorSettings(backtrace, maxRetries, logErrors, logLevel);
    }

    private static int parseRetries(String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed < 0 ? DEFAULT_MAX_RETRIES : parsed;
        } catch (NumberFormatException e) {
            return DEFAULT_MAX_RETRIES;
        }
    }

    // Initialized by the JVM on first access to global(), exactly once.
    private static final class Holder {
        private static final ErrorSettings INSTANCE = load(SettingsSource.environment());
    }
}
