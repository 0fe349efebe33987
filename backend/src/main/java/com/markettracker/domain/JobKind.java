package com.markettracker.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Job kinds known to the scheduler, identified by (jobType, service).
 */
public enum JobKind {
    /** Daily grouped aggregates, one request per calendar day over the data fetch range. */
    DAILY_AGGREGATES_FETCH("api_fetch", "polygon_io"),
    /** Full-universe screener snapshot; custom_schedule rows poll it inside their window. */
    SCREENER_SCRAPE("data_scrape", "stock_analysis"),
    TICKER_PROFILE_SCRAPE("data_scrape", "stock_analysis_ticker_data");

    private final String jobType;
    private final String service;

    JobKind(String jobType, String service) {
        this.jobType = jobType;
        this.service = service;
    }

    public String jobType() {
        return jobType;
    }

    public String service() {
        return service;
    }

    public static Optional<JobKind> of(String jobType, String service) {
        if (jobType == null || service == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(k -> k.jobType.equalsIgnoreCase(jobType.strip()) && k.service.equalsIgnoreCase(service.strip()))
                .findFirst();
    }
}
