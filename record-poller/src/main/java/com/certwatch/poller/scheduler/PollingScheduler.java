package com.certwatch.poller.scheduler;

import com.certwatch.poller.model.FetchResult;
import com.certwatch.poller.service.RecordFetcher;
import com.certwatch.poller.tracker.JobTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Drives the fetch timing of every running job.
 *
 * Each job gets a fixed-delay task: one cycle fetches every date of the range
 * in order, then sweeps the dates that failed and still have no records.
 * Fixed delay means cycles of one job never overlap, so a date never has more
 * than one fetch in flight. Different jobs run in parallel on the pool.
 */
@Component
@Slf4j
public class PollingScheduler {

    private final TaskScheduler taskScheduler;
    private final RecordFetcher fetcher;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> scheduled = new ConcurrentHashMap<>();

    public PollingScheduler(TaskScheduler pollingTaskScheduler, RecordFetcher fetcher, Clock clock) {
        this.taskScheduler = pollingTaskScheduler;
        this.fetcher = fetcher;
        this.clock = clock;
    }

    /** Start polling a job now, then every {@code pollIntervalConfig.interval} after each cycle ends. */
    public void schedule(JobTracker tracker) {
        ScheduledFuture<?> future = taskScheduler.scheduleWithFixedDelay(
                () -> runCycle(tracker),
                clock.instant(),
                tracker.pollIntervalConfig().interval());
        ScheduledFuture<?> previous = scheduled.put(tracker.id(), future);
        if (previous != null) {
            previous.cancel(false);
        }
    }

    /**
     * Stop scheduling new cycles. An in-flight fetch is not interrupted; the
     * cycle notices the stopped job before its next fetch.
     */
    public void cancel(String jobId) {
        ScheduledFuture<?> future = scheduled.remove(jobId);
        if (future != null) {
            future.cancel(false);
        }
    }

    public boolean isScheduled(String jobId) {
        return scheduled.containsKey(jobId);
    }

    /**
     * One poll cycle for a job.
     */
    public CycleSummary runCycle(JobTracker tracker) {
        if (!tracker.isRunning()) {
            cancel(tracker.id());
            return CycleSummary.EMPTY;
        }

        int fetched = 0;
        int failed = 0;
        for (LocalDate date : tracker.dateRange()) {
            if (!tracker.isRunning()) {
                break;
            }
            fetched++;
            if (!fetchAndRecord(tracker, date)) {
                failed++;
            }
        }

        int retried = 0;
        int recovered = 0;
        List<LocalDate> pending = tracker.pendingRetryDates();
        if (tracker.pollIntervalConfig().retryFailedDates() && !pending.isEmpty() && tracker.isRunning()) {
            log.info("Job {}: retrying {} failed dates", tracker.id(), pending.size());
            tracker.beginRetrySweep();
            try {
                for (LocalDate date : pending) {
                    if (!tracker.isRunning()) {
                        break;
                    }
                    retried++;
                    if (fetchAndRecord(tracker, date)) {
                        recovered++;
                    }
                }
            } finally {
                tracker.endRetrySweep();
            }
        }

        CycleSummary summary = new CycleSummary(fetched, failed, retried, recovered);
        log.info("Job {} cycle complete: {} fetched, {} failed, {} retried, {} recovered",
                tracker.id(), fetched, failed, retried, recovered);
        return summary;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /** @return true if the fetch succeeded */
    private boolean fetchAndRecord(JobTracker tracker, LocalDate date) {
        FetchResult result;
        try {
            result = fetcher.fetch(date, tracker.gender());
        } catch (Exception e) {
            log.error("Job {}: fetcher threw for {}: {}", tracker.id(), date, e.getMessage(), e);
            result = FetchResult.failure(e.getMessage());
        }
        if (result == null) {
            result = FetchResult.failure("Fetcher returned no result");
        }
        tracker.recordResult(date, result);
        return result instanceof FetchResult.Success;
    }

    public record CycleSummary(int fetched, int failed, int retried, int recovered) {
        static final CycleSummary EMPTY = new CycleSummary(0, 0, 0, 0);
    }
}
