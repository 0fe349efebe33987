package com.markettracker.schedule.config;

import com.markettracker.common.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Schedule module configuration: properties and the store retry policy.
 */
@Configuration
@EnableConfigurationProperties({ SchedulerProperties.class, StoreRetryProperties.class })
public class ScheduleConfig {

    @Bean(name = "storeRetryPolicy")
    public RetryPolicy storeRetryPolicy(StoreRetryProperties properties) {
        return RetryPolicy.fixed(Math.max(0L, properties.getDelayMs()), Math.max(1, properties.getMaxAttempts()));
    }
}
