package com.markettracker.schedule.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bounded retry around job schedule store calls.
 */
@ConfigurationProperties(prefix = "markettracker.store.retry")
@NoArgsConstructor
@Getter
@Setter
public class StoreRetryProperties {

    /** Total attempts including the first. */
    private int maxAttempts = 3;

    /** Fixed delay between attempts. */
    private long delayMs = 1000;
}
