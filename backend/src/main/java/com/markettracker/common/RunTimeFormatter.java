package com.markettracker.common;

import java.time.Duration;
import java.util.Locale;

/**
 * Formats job run durations for the run_time audit column, e.g. {@code 1h 2m 3.45s}.
 */
public final class RunTimeFormatter {

    private RunTimeFormatter() {
    }

    public static String format(Duration duration) {
        if (duration == null || duration.isNegative()) {
            duration = Duration.ZERO;
        }
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        double seconds = duration.toSecondsPart() + duration.toNanosPart() / 1_000_000_000.0;
        return String.format(Locale.ROOT, "%dh %dm %.2fs", hours, minutes, seconds);
    }
}
