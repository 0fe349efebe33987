package com.markettracker.schedule.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of an armed trigger. period is null for one-shot triggers.
 */
public record TriggerSnapshot(TriggerId id, Instant nextFireAt, Duration period) {

    public String label() {
        return id.label();
    }

    public TriggerRole role() {
        return id.role();
    }
}
