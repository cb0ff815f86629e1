package com.certwatch.poller.tracker;

import com.certwatch.poller.match.NameMatcher;
import com.certwatch.poller.model.DeathRecord;
import com.certwatch.poller.model.FetchError;
import com.certwatch.poller.model.FetchResult;
import com.certwatch.poller.model.JobSnapshot;
import com.certwatch.poller.model.JobStatus;
import com.certwatch.poller.model.PollIntervalConfig;
import com.certwatch.poller.model.RecordMatch;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * State of one polling run over a fixed date range.
 *
 * The tracker never fetches or schedules anything. A scheduler hands it one
 * {@link FetchResult} per attempt; the tracker accumulates records, recomputes
 * matches for the date, logs errors, and keeps the set of dates a retry sweep
 * should revisit.
 *
 * Every mutation and every {@link #snapshot()} runs under one lock, so a reader
 * never sees a date's records without its recomputed matches.
 */
@Slf4j
public class JobTracker {

    private final String id;
    private final List<LocalDate> dateRange;
    private final List<String> targetNames;
    private final String gender;
    private final PollIntervalConfig pollIntervalConfig;
    private final NameMatcher matcher;
    private final Clock clock;
    private final Instant startTime;

    private final Object lock = new Object();

    private JobStatus status = JobStatus.RUNNING;
    private Instant lastUpdateTime;
    private long totalRequests;
    private final Map<LocalDate, LinkedHashMap<DeathRecord.NaturalKey, DeathRecord>> recordsByDate = new TreeMap<>();
    private final Map<LocalDate, List<RecordMatch>> matchesByDate = new TreeMap<>();
    private final Map<LocalDate, List<FetchError>> errorsByDate = new TreeMap<>();
    private final SortedSet<LocalDate> pendingRetryDates = new TreeSet<>();
    private boolean retryingErrors;

    private JobTracker(String id,
                       List<LocalDate> dateRange,
                       List<String> targetNames,
                       String gender,
                       PollIntervalConfig pollIntervalConfig,
                       NameMatcher matcher,
                       Clock clock) {
        this.id = id;
        this.dateRange = dateRange;
        this.targetNames = targetNames;
        this.gender = gender;
        this.pollIntervalConfig = pollIntervalConfig;
        this.matcher = matcher;
        this.clock = clock;
        this.startTime = clock.instant();
    }

    /**
     * Creates a running job.
     *
     * @throws InvalidRangeException if the range is empty or out of order
     */
    public static JobTracker create(String id,
                                    List<LocalDate> dateRange,
                                    List<String> targetNames,
                                    String gender,
                                    PollIntervalConfig pollIntervalConfig,
                                    NameMatcher matcher,
                                    Clock clock) {
        List<LocalDate> range = DateRange.validate(dateRange);
        List<String> names = targetNames == null
                ? List.of()
                : targetNames.stream().filter(n -> n != null && !n.isBlank()).map(String::trim).toList();
        return new JobTracker(id, range, names, gender, pollIntervalConfig, matcher, clock);
    }

    public String id() {
        return id;
    }

    public List<LocalDate> dateRange() {
        return dateRange;
    }

    public String gender() {
        return gender;
    }

    public PollIntervalConfig pollIntervalConfig() {
        return pollIntervalConfig;
    }

    /**
     * Records the outcome of one fetch attempt for a date. Never throws for
     * fetch-level failures; they become error entries and retry eligibility.
     */
    public void recordResult(LocalDate date, FetchResult result) {
        synchronized (lock) {
            totalRequests++;
            lastUpdateTime = clock.instant();
            if (status == JobStatus.STOPPED) {
                log.debug("Job {}: result for {} arrived after stop, recording only", id, date);
            }

            if (result instanceof FetchResult.Success success) {
                recordSuccess(date, success.records());
            } else if (result instanceof FetchResult.Failure failure) {
                recordFailure(date, failure.message());
            }
        }
    }

    private void recordSuccess(LocalDate date, List<DeathRecord> records) {
        LinkedHashMap<DeathRecord.NaturalKey, DeathRecord> existing =
                recordsByDate.computeIfAbsent(date, d -> new LinkedHashMap<>());
        int added = 0;
        for (DeathRecord record : records) {
            if (existing.putIfAbsent(record.naturalKey(), record) == null) {
                added++;
            }
        }
        pendingRetryDates.remove(date);

        if (!targetNames.isEmpty()) {
            List<RecordMatch> matches = new ArrayList<>();
            for (DeathRecord record : existing.values()) {
                matches.addAll(matcher.matchAll(record, targetNames));
            }
            if (matches.isEmpty()) {
                matchesByDate.remove(date);
            } else {
                matchesByDate.put(date, List.copyOf(matches));
            }
        }
        log.debug("Job {}: {} new of {} records for {} ({} total)", id, added, records.size(), date, existing.size());
    }

    private void recordFailure(LocalDate date, String message) {
        errorsByDate.computeIfAbsent(date, d -> new ArrayList<>())
                .add(new FetchError(date, message, lastUpdateTime));
        // confirmed records are never retracted by a later failure
        Map<DeathRecord.NaturalKey, DeathRecord> confirmed = recordsByDate.get(date);
        if (confirmed == null || confirmed.isEmpty()) {
            pendingRetryDates.add(date);
        }
    }

    /** Marks a retry sweep as in progress. No-op if one already is. */
    public void beginRetrySweep() {
        synchronized (lock) {
            retryingErrors = true;
        }
    }

    public void endRetrySweep() {
        synchronized (lock) {
            retryingErrors = false;
        }
    }

    /**
     * Stops the job. Accumulated state stays readable.
     *
     * @return true if this call moved the job from running to stopped
     */
    public boolean stop() {
        synchronized (lock) {
            if (status == JobStatus.STOPPED) {
                return false;
            }
            status = JobStatus.STOPPED;
            return true;
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return status == JobStatus.RUNNING;
        }
    }

    /** Dates currently awaiting a retry sweep, ascending. */
    public List<LocalDate> pendingRetryDates() {
        synchronized (lock) {
            return List.copyOf(pendingRetryDates);
        }
    }

    public JobSnapshot snapshot() {
        synchronized (lock) {
            Map<LocalDate, List<DeathRecord>> records = new TreeMap<>();
            recordsByDate.forEach((date, byKey) -> records.put(date, List.copyOf(byKey.values())));

            Map<LocalDate, List<FetchError>> errors = new TreeMap<>();
            errorsByDate.forEach((date, list) -> errors.put(date, List.copyOf(list)));

            return new JobSnapshot(
                    id,
                    status,
                    dateRange,
                    targetNames,
                    gender,
                    pollIntervalConfig,
                    startTime,
                    lastUpdateTime,
                    totalRequests,
                    Collections.unmodifiableMap(records),
                    Collections.unmodifiableMap(new TreeMap<>(matchesByDate)),
                    Collections.unmodifiableMap(errors),
                    Collections.unmodifiableSortedSet(new TreeSet<>(pendingRetryDates)),
                    retryingErrors
            );
        }
    }
}
