package com.markettracker.schedule.scheduler;

public enum TriggerRole {
    JOB(""),
    ENABLE("enable-"),
    DISABLE("disable-"),
    POLL("poll-");

    private final String labelPrefix;

    TriggerRole(String labelPrefix) {
        this.labelPrefix = labelPrefix;
    }

    public String labelPrefix() {
        return labelPrefix;
    }
}
