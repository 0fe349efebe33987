package com.markettracker.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    @Test
    void fixed_sameDelayEveryAttempt() {
        RetryPolicy policy = RetryPolicy.fixed(1000L, 3);
        assertThat(policy.delayMs(0)).isEqualTo(1000L);
        assertThat(policy.delayMs(1)).isEqualTo(1000L);
        assertThat(policy.delayMs(2)).isEqualTo(1000L);
        assertThat(policy.getMaxAttempts()).isEqualTo(3);
    }

    @Test
    void exponential_doublesUntilCap() {
        RetryPolicy policy = RetryPolicy.exponential(100L, 0, 10, 500L);
        assertThat(policy.delayMs(0)).isEqualTo(100L);
        assertThat(policy.delayMs(1)).isEqualTo(200L);
        assertThat(policy.delayMs(2)).isEqualTo(400L);
        assertThat(policy.delayMs(3)).isEqualTo(500L);
        assertThat(policy.delayMs(30)).isEqualTo(500L);
    }

    @Test
    void exponential_jitterStaysWithinBoundsAndCap() {
        RetryPolicy policy = RetryPolicy.exponential(1000L, 0.2, 5, 600_000L);
        for (int i = 0; i < 20; i++) {
            assertThat(policy.delayMs(0)).isBetween(800L, 1200L);
        }
    }
}
