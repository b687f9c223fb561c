package org.tyl.errors.settings;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Where {@link ErrorSettings} reads its raw values from.
 */
@FunctionalInterface
public interface SettingsSource {

    /**
     * Looks up the raw value of a setting.
     *
     * @return the value, or empty if the setting is not present
     */
    Optional<String> lookup(SettingKey key);

    /**
     * Reads the JVM system property first and falls back to the environment variable.
     * A value that is set but empty still counts as present, so an empty
     * {@code TYL_ERROR_BACKTRACE} disables backtraces and blocks the {@code TYL_BACKTRACE} fallback.
     */
    static SettingsSource environment() {
        return key -> {
            String value = System.getProperty(key.systemProperty());
            if (value == null) {
                value = System.getenv(key.environmentVariable());
            }
            return Optional.ofNullable(value);
        };
    }

    /**
     * A fixed set of values, mainly for tests and embedding.
     */
    static SettingsSource of(Map<SettingKey, String> values) {
        Map<SettingKey, String> copy = Map.copyOf(Objects.requireNonNull(values, "values must not be null"));
        return key -> Optional.ofNullable(copy.get(key));
    }
}
