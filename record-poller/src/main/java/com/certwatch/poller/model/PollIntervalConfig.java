package com.certwatch.poller.model;

import java.time.Duration;

/**
 * How often a job polls its date range, and whether failed dates get a retry sweep.
 */
public record PollIntervalConfig(Duration interval, boolean retryFailedDates) {

    public PollIntervalConfig {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
    }

    public static PollIntervalConfig everyMinutes(long minutes) {
        return new PollIntervalConfig(Duration.ofMinutes(minutes), true);
    }
}
