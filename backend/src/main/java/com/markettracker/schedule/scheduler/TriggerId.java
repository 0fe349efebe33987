package com.markettracker.schedule.scheduler;

import com.markettracker.domain.JobKey;

/**
 * Identity of a runtime trigger. At most one live trigger per id.
 */
public record TriggerId(TriggerRole role, JobKey key) {

    public static TriggerId job(JobKey key) {
        return new TriggerId(TriggerRole.JOB, key);
    }

    public static TriggerId enable(JobKey key) {
        return new TriggerId(TriggerRole.ENABLE, key);
    }

    public static TriggerId disable(JobKey key) {
        return new TriggerId(TriggerRole.DISABLE, key);
    }

    public static TriggerId poll(JobKey key) {
        return new TriggerId(TriggerRole.POLL, key);
    }

    public String label() {
        return role.labelPrefix() + key.label();
    }

    @Override
    public String toString() {
        return label();
    }
}
