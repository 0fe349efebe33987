package com.markettracker.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScheduleFrequencyTest {

    @Test
    @DisplayName("wire values and enum names both parse, case-insensitively")
    void fromWire() {
        assertThat(ScheduleFrequency.fromWire("recurring_daily_am")).contains(ScheduleFrequency.RECURRING_DAILY_AM);
        assertThat(ScheduleFrequency.fromWire(" CUSTOM_SCHEDULE ")).contains(ScheduleFrequency.CUSTOM_SCHEDULE);
        assertThat(ScheduleFrequency.fromWire("weekly")).isEmpty();
        assertThat(ScheduleFrequency.fromWire(null)).isEmpty();
    }

    @Test
    @DisplayName("only AM and PM slots carry a missed-run window")
    void dailyWindow() {
        assertThat(ScheduleFrequency.RECURRING_DAILY.isDaily()).isTrue();
        assertThat(ScheduleFrequency.RECURRING_DAILY.isDailyWindow()).isFalse();
        assertThat(ScheduleFrequency.RECURRING_DAILY_PM.isDailyWindow()).isTrue();
        assertThat(ScheduleFrequency.CUSTOM_SCHEDULE.isDaily()).isFalse();
    }

    @Test
    @DisplayName("job kinds resolve from type and service")
    void jobKinds() {
        assertThat(JobKind.of("data_scrape", "stock_analysis_ticker_data")).contains(JobKind.TICKER_PROFILE_SCRAPE);
        assertThat(JobKind.of("api_fetch", "stock_analysis")).isEmpty();
    }
}
