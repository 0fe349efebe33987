package com.markettracker.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RunTimeFormatterTest {

    @Test
    @DisplayName("formats hours, minutes and seconds with two decimals")
    void formatsDuration() {
        Duration d = Duration.ofHours(1).plusMinutes(2).plusMillis(3_450);
        assertThat(RunTimeFormatter.format(d)).isEqualTo("1h 2m 3.45s");
    }

    @Test
    void hoursAreNotWrappedAtOneDay() {
        assertThat(RunTimeFormatter.format(Duration.ofHours(26))).isEqualTo("26h 0m 0.00s");
    }

    @Test
    void negativeOrNullIsZero() {
        assertThat(RunTimeFormatter.format(Duration.ofSeconds(-5))).isEqualTo("0h 0m 0.00s");
        assertThat(RunTimeFormatter.format(null)).isEqualTo("0h 0m 0.00s");
    }
}
