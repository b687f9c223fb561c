package org.tyl.errors.settings;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity of a diagnostic message, from most to least severe.
 * A message is written when its level is at or below the configured minimum.
 */
public enum LogLevel {
    ERROR,
    WARN,
    INFO,
    DEBUG;

    /**
     * Parses a level name, case-insensitively. {@code WARNING} is accepted as an alias of {@link #WARN}.
     *
     * @param value the text to parse (may be null)
     * @return the level, or empty if the text is not recognized
     */
    public static Optional<LogLevel> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "ERROR" -> Optional.of(ERROR);
            case "WARN", "WARNING" -> Optional.of(WARN);
            case "INFO" -> Optional.of(INFO);
            case "DEBUG" -> Optional.of(DEBUG);
            default -> Optional.empty();
        };
    }

    /**
     * Whether a message at this level passes the given minimum.
     */
    public boolean isEnabledAt(LogLevel minimum) {
        return compareTo(minimum) <= 0;
    }
}
