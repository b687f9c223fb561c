package org.tyl.errors.settings;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class LogLevelTest {

    @Test
    void levels_orderedBySeverity() {
        assertThat(LogLevel.ERROR.compareTo(LogLevel.WARN)).isNegative();
        assertThat(LogLevel.WARN.compareTo(LogLevel.INFO)).isNegative();
        assertThat(LogLevel.INFO.compareTo(LogLevel.DEBUG)).isNegative();
    }

    @Test
    void parse_isCaseInsensitive() {
        assertThat(LogLevel.parse("ERROR")).hasValue(LogLevel.ERROR);
        assertThat(LogLevel.parse("warn")).hasValue(LogLevel.WARN);
        assertThat(LogLevel.parse("WARNING")).hasValue(LogLevel.WARN);
        assertThat(LogLevel.parse("Info")).hasValue(LogLevel.INFO);
        assertThat(LogLevel.parse("debug")).hasValue(LogLevel.DEBUG);
    }

    @Test
    void parse_unrecognized_isEmpty() {
        assertThat(LogLevel.parse("invalid")).isEmpty();
        assertThat(LogLevel.parse("")).isEmpty();
        assertThat(LogLevel.parse(null)).isEmpty();
    }

    @Test
    void isEnabledAt_allowsMoreSevereLevels() {
        assertThat(LogLevel.ERROR.isEnabledAt(LogLevel.INFO)).isTrue();
        assertThat(LogLevel.INFO.isEnabledAt(LogLevel.INFO)).isTrue();
        assertThat(LogLevel.DEBUG.isEnabledAt(LogLevel.INFO)).isFalse();
        assertThat(LogLevel.WARN.isEnabledAt(LogLevel.ERROR)).isFalse();
    }
}
