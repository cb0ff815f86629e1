package com.certwatch.poller.service;

import com.certwatch.poller.config.CertWatchProperties;
import com.certwatch.poller.match.NameMatcher;
import com.certwatch.poller.model.JobSnapshot;
import com.certwatch.poller.model.PollIntervalConfig;
import com.certwatch.poller.model.StartPollingRequest;
import com.certwatch.poller.scheduler.PollingScheduler;
import com.certwatch.poller.tracker.DateRange;
import com.certwatch.poller.tracker.JobTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of polling jobs: creates them, hands them to the scheduler, stops
 * them, and evicts stopped jobs once their retention period has passed.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PollingJobService {

    private final PollingScheduler pollingScheduler;
    private final NameMatcher nameMatcher;
    private final CertWatchProperties properties;
    private final Clock clock;

    private final Map<String, RegisteredJob> jobs = new ConcurrentHashMap<>();

    /**
     * Create a job for the request's date range and start polling immediately.
     *
     * @return the new job id
     */
    public String startJob(StartPollingRequest request) {
        List<LocalDate> dates = DateRange.between(request.getStartDate(), request.getEndDate(),
                properties.getPolling().getMaxRangeDays());
        PollIntervalConfig interval = resolveInterval(request.getIntervalMinutes());

        JobTracker tracker = JobTracker.create(
                UUID.randomUUID().toString(),
                dates,
                request.resolvedTargetNames(),
                blankToNull(request.getGender()),
                interval,
                nameMatcher,
                clock);
        jobs.put(tracker.id(), new RegisteredJob(tracker));

        log.info("Job {} created: {} dates ({} to {}), targets={}, every {} min",
                tracker.id(), dates.size(), dates.get(0), dates.get(dates.size() - 1),
                request.resolvedTargetNames(), interval.interval().toMinutes());

        pollingScheduler.schedule(tracker);
        return tracker.id();
    }

    public JobSnapshot getJob(String jobId) {
        return find(jobId).tracker().snapshot();
    }

    public List<JobSnapshot> listJobs() {
        return jobs.values().stream()
                .map(job -> job.tracker().snapshot())
                .sorted(Comparator.comparing(JobSnapshot::startTime))
                .toList();
    }

    /**
     * Stop a job. Its state stays readable until evicted. Stopping twice is harmless.
     */
    public JobSnapshot stopJob(String jobId) {
        RegisteredJob job = find(jobId);
        pollingScheduler.cancel(jobId);
        if (job.tracker().stop()) {
            job.markStopped(clock.instant());
            log.info("Job {} stopped after {} requests", jobId, job.tracker().snapshot().totalRequests());
        }
        return job.tracker().snapshot();
    }

    /**
     * Remove stopped jobs whose retention period has elapsed.
     *
     * @return number of jobs evicted
     */
    public int evictExpiredJobs() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(properties.getRetention().getStoppedJobTtlHours()));
        int evicted = 0;
        for (Map.Entry<String, RegisteredJob> entry : jobs.entrySet()) {
            Instant stoppedAt = entry.getValue().stoppedAt();
            if (stoppedAt != null && !stoppedAt.isAfter(cutoff) && jobs.remove(entry.getKey(), entry.getValue())) {
                evicted++;
                log.info("Job {} evicted (stopped at {})", entry.getKey(), stoppedAt);
            }
        }
        return evicted;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RegisteredJob find(String jobId) {
        RegisteredJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    private PollIntervalConfig resolveInterval(Integer requestedMinutes) {
        CertWatchProperties.Polling polling = properties.getPolling();
        int minutes = requestedMinutes == null ? polling.getDefaultIntervalMinutes() : requestedMinutes;
        if (minutes < polling.getMinIntervalMinutes()) {
            throw new IllegalArgumentException(
                    "intervalMinutes must be at least " + polling.getMinIntervalMinutes());
        }
        return new PollIntervalConfig(Duration.ofMinutes(minutes), polling.isRetryFailedDates());
    }

    private String blankToNull(String val) {
        return (val == null || val.isBlank()) ? null : val.trim();
    }

    private static final class RegisteredJob {
        private final JobTracker tracker;
        private volatile Instant stoppedAt;

        RegisteredJob(JobTracker tracker) {
            this.tracker = tracker;
        }

        JobTracker tracker() {
            return tracker;
        }

        Instant stoppedAt() {
            return stoppedAt;
        }

        void markStopped(Instant at) {
            this.stoppedAt = at;
        }
    }
}
