package com.certwatch.poller.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Read-only copy of a job's state at one instant.
 *
 * All collections are unmodifiable copies; the contained records, matches and
 * errors are immutable values.
 */
public record JobSnapshot(
        String jobId,
        JobStatus status,
        List<LocalDate> dateRange,
        List<String> targetNames,
        String gender,
        PollIntervalConfig pollIntervalConfig,
        Instant startTime,
        Instant lastUpdateTime,
        long totalRequests,
        Map<LocalDate, List<DeathRecord>> recordsByDate,
        Map<LocalDate, List<RecordMatch>> matchesByDate,
        Map<LocalDate, List<FetchError>> errorsByDate,
        SortedSet<LocalDate> pendingRetryDates,
        boolean retryingErrors
) {

    public int totalRecords() {
        return recordsByDate.values().stream().mapToInt(List::size).sum();
    }
}
