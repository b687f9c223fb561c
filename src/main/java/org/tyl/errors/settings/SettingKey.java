package org.tyl.errors.settings;

/**
 * The configuration inputs read by {@link ErrorSettings}, each available as a JVM system
 * property or an environment variable.
 */
public enum SettingKey {
    BACKTRACE("tyl.error.backtrace", "TYL_ERROR_BACKTRACE"),
    /**
     * Consulted only when {@link #BACKTRACE} is absent; its mere presence enables backtraces.
     */
    BACKTRACE_FALLBACK("tyl.backtrace", "TYL_BACKTRACE"),
    MAX_RETRIES("tyl.error.max-retries", "TYL_ERROR_MAX_RETRIES"),
    LOG_ERRORS("tyl.error.log-errors", "TYL_ERROR_LOG_ERRORS"),
    LOG_LEVEL("tyl.error.log-level", "TYL_ERROR_LOG_LEVEL");

    private final String systemProperty;
    private final String environmentVariable;

    SettingKey(String systemProperty, String environmentVariable) {
        this.systemProperty = systemProperty;
        this.environmentVariable = environmentVariable;
    }

    public String systemProperty() {
        return systemProperty;
    }

    public String environmentVariable() {
        return environmentVariable;
    }
}
