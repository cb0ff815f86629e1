package com.certwatch.poller.tracker;

import com.certwatch.poller.match.NameMatcher;
import com.certwatch.poller.model.DeathRecord;
import com.certwatch.poller.model.FetchError;
import com.certwatch.poller.model.FetchResult;
import com.certwatch.poller.model.JobSnapshot;
import com.certwatch.poller.model.JobStatus;
import com.certwatch.poller.model.MatchedField;
import com.certwatch.poller.model.PollIntervalConfig;
import com.certwatch.poller.model.RecordMatch;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobTrackerTest {

    private static final Instant NOW = Instant.parse("2024-02-01T10:00:00Z");
    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate JAN_2 = LocalDate.of(2024, 1, 2);
    private static final LocalDate JAN_3 = LocalDate.of(2024, 1, 3);

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final NameMatcher matcher = new NameMatcher();

    @Test
    void newJobStartsRunningWithEmptyState() {
        JobSnapshot snapshot = tracker(List.of("Smith")).snapshot();

        assertThat(snapshot.jobId()).isEqualTo("job-1");
        assertThat(snapshot.status()).isEqualTo(JobStatus.RUNNING);
        assertThat(snapshot.dateRange()).containsExactly(JAN_1, JAN_2, JAN_3);
        assertThat(snapshot.startTime()).isEqualTo(NOW);
        assertThat(snapshot.lastUpdateTime()).isNull();
        assertThat(snapshot.totalRequests()).isZero();
        assertThat(snapshot.recordsByDate()).isEmpty();
        assertThat(snapshot.matchesByDate()).isEmpty();
        assertThat(snapshot.errorsByDate()).isEmpty();
        assertThat(snapshot.pendingRetryDates()).isEmpty();
        assertThat(snapshot.retryingErrors()).isFalse();
    }

    @Test
    void createRejectsInvalidRanges() {
        assertThatThrownBy(() -> create(List.of(), List.of())).isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> create(List.of(JAN_3, JAN_1), List.of())).isInstanceOf(InvalidRangeException.class);
    }

    @Test
    void createDropsBlankTargetNames() {
        JobTracker tracker = create(List.of(JAN_1), java.util.Arrays.asList(" Smith ", "", null, "  "));

        assertThat(tracker.snapshot().targetNames()).containsExactly("Smith");
    }

    @Test
    void threeDayScenarioWithOneMatchOneFailureOneEmptyDay() {
        JobTracker tracker = tracker(List.of("Smith"));

        tracker.recordResult(JAN_1, FetchResult.success(List.of(record("John Smith", "Robert Smith"))));
        tracker.recordResult(JAN_2, FetchResult.failure("timeout"));
        tracker.recordResult(JAN_3, FetchResult.success(List.of()));

        JobSnapshot snapshot = tracker.snapshot();
        assertThat(snapshot.totalRequests()).isEqualTo(3);
        assertThat(snapshot.lastUpdateTime()).isEqualTo(NOW);
        assertThat(snapshot.matchesByDate().get(JAN_1)).hasSize(1);
        assertThat(snapshot.matchesByDate().get(JAN_1).get(0).field()).isEqualTo(MatchedField.NAME);
        assertThat(snapshot.pendingRetryDates()).containsExactly(JAN_2);
        assertThat(snapshot.errorsByDate().get(JAN_2))
                .containsExactly(new FetchError(JAN_2, "timeout", NOW));
        assertThat(snapshot.recordsByDate().get(JAN_3)).isEmpty();
        assertThat(snapshot.matchesByDate()).doesNotContainKey(JAN_3);
    }

    @Test
    void recordingSameSuccessTwiceKeepsRecordsAndMatchesUnchanged() {
        JobTracker tracker = tracker(List.of("Smith"));
        List<DeathRecord> records = List.of(record("John Smith", "Robert"), record("Jane Doe", "Mark"));

        tracker.recordResult(JAN_1, FetchResult.success(records));
        JobSnapshot first = tracker.snapshot();
        tracker.recordResult(JAN_1, FetchResult.success(records));
        JobSnapshot second = tracker.snapshot();

        assertThat(second.recordsByDate().get(JAN_1)).isEqualTo(first.recordsByDate().get(JAN_1)).hasSize(2);
        assertThat(second.matchesByDate().get(JAN_1)).isEqualTo(first.matchesByDate().get(JAN_1)).hasSize(1);
        assertThat(second.totalRequests()).isEqualTo(2);
    }

    @Test
    void duplicatesAreDetectedByNaturalKeyIgnoringGender() {
        JobTracker tracker = tracker(List.of());
        DeathRecord male = record("John Smith", "Robert");
        DeathRecord sameKey = DeathRecord.builder()
                .name("John Smith").gender("female").dateOfDeath("2023-12-30")
                .fathersName("Robert").mothersName("Anne")
                .build();
        DeathRecord otherDeath = male.toBuilder().dateOfDeath("2023-12-31").build();

        tracker.recordResult(JAN_1, FetchResult.success(List.of(male)));
        tracker.recordResult(JAN_1, FetchResult.success(List.of(sameKey, otherDeath)));

        assertThat(tracker.snapshot().recordsByDate().get(JAN_1)).containsExactly(male, otherDeath);
    }

    @Test
    void newRecordsAppendInArrivalOrderAndMatchesAreRecomputedForWholeDate() {
        JobTracker tracker = tracker(List.of("Smith"));

        tracker.recordResult(JAN_1, FetchResult.success(List.of(record("John Smith", "Robert"))));
        tracker.recordResult(JAN_1, FetchResult.success(List.of(
                record("John Smith", "Robert"), record("Ann Smith", "Paul"))));

        JobSnapshot snapshot = tracker.snapshot();
        assertThat(snapshot.recordsByDate().get(JAN_1))
                .extracting(DeathRecord::getName)
                .containsExactly("John Smith", "Ann Smith");
        assertThat(snapshot.matchesByDate().get(JAN_1))
                .extracting(m -> m.record().getName())
                .containsExactly("John Smith", "Ann Smith");
    }

    @Test
    void failedDateIsPendingUntilSuccessAndNeverRequeuedAfterRecords() {
        JobTracker tracker = tracker(List.of());

        tracker.recordResult(JAN_2, FetchResult.failure("HTTP 503"));
        assertThat(tracker.pendingRetryDates()).containsExactly(JAN_2);

        tracker.recordResult(JAN_2, FetchResult.success(List.of(record("Ida Berg", "Olof"))));
        assertThat(tracker.pendingRetryDates()).isEmpty();

        tracker.recordResult(JAN_2, FetchResult.failure("HTTP 503"));
        JobSnapshot snapshot = tracker.snapshot();
        assertThat(snapshot.pendingRetryDates()).isEmpty();
        assertThat(snapshot.recordsByDate().get(JAN_2)).hasSize(1);
        // errors are a history and survive the recovery
        assertThat(snapshot.errorsByDate().get(JAN_2)).hasSize(2);
    }

    @Test
    void emptySuccessClearsPendingRetry() {
        JobTracker tracker = tracker(List.of());

        tracker.recordResult(JAN_1, FetchResult.failure("timeout"));
        tracker.recordResult(JAN_1, FetchResult.success(List.of()));

        assertThat(tracker.snapshot().pendingRetryDates()).isEmpty();
        assertThat(tracker.snapshot().errorsByDate().get(JAN_1)).hasSize(1);
    }

    @Test
    void dateNeverHasRecordsAndPendingRetryAtOnce() {
        JobTracker tracker = tracker(List.of());

        tracker.recordResult(JAN_1, FetchResult.success(List.of(record("A B", "C"))));
        tracker.recordResult(JAN_1, FetchResult.failure("boom"));
        tracker.recordResult(JAN_2, FetchResult.failure("boom"));

        JobSnapshot snapshot = tracker.snapshot();
        for (LocalDate pending : snapshot.pendingRetryDates()) {
            assertThat(snapshot.recordsByDate().getOrDefault(pending, List.of())).isEmpty();
        }
        assertThat(snapshot.pendingRetryDates()).containsExactly(JAN_2);
    }

    @Test
    void collectAllModeNeverComputesMatches() {
        JobTracker tracker = tracker(List.of());

        tracker.recordResult(JAN_1, FetchResult.success(List.of(record("John Smith", "Robert"))));

        assertThat(tracker.snapshot().matchesByDate()).isEmpty();
        assertThat(tracker.snapshot().recordsByDate().get(JAN_1)).hasSize(1);
    }

    @Test
    void datesOutsideRangeAreStillRecorded() {
        JobTracker tracker = tracker(List.of());
        LocalDate outside = LocalDate.of(2023, 6, 1);

        tracker.recordResult(outside, FetchResult.failure("not in range"));

        assertThat(tracker.snapshot().errorsByDate()).containsKey(outside);
        assertThat(tracker.snapshot().pendingRetryDates()).containsExactly(outside);
    }

    @Test
    void resultsAfterStopAreRecordedAndCounted() {
        JobTracker tracker = tracker(List.of("Smith"));

        assertThat(tracker.stop()).isTrue();
        assertThat(tracker.stop()).isFalse();
        tracker.recordResult(JAN_1, FetchResult.success(List.of(record("John Smith", "Robert"))));

        JobSnapshot snapshot = tracker.snapshot();
        assertThat(snapshot.status()).isEqualTo(JobStatus.STOPPED);
        assertThat(snapshot.totalRequests()).isEqualTo(1);
        assertThat(snapshot.matchesByDate().get(JAN_1)).hasSize(1);
        assertThat(tracker.isRunning()).isFalse();
    }

    @Test
    void jobFailingEveryDateStaysRunning() {
        JobTracker tracker = tracker(List.of());

        for (int i = 0; i < 3; i++) {
            tracker.dateRange().forEach(d -> tracker.recordResult(d, FetchResult.failure("down")));
        }

        JobSnapshot snapshot = tracker.snapshot();
        assertThat(snapshot.status()).isEqualTo(JobStatus.RUNNING);
        assertThat(snapshot.totalRequests()).isEqualTo(9);
        assertThat(snapshot.pendingRetryDates()).containsExactly(JAN_1, JAN_2, JAN_3);
    }

    @Test
    void retrySweepFlagToggles() {
        JobTracker tracker = tracker(List.of());

        tracker.beginRetrySweep();
        tracker.beginRetrySweep();
        assertThat(tracker.snapshot().retryingErrors()).isTrue();

        tracker.endRetrySweep();
        assertThat(tracker.snapshot().retryingErrors()).isFalse();
    }

    @Test
    void snapshotIsUnmodifiableAndUnaffectedByLaterResults() {
        JobTracker tracker = tracker(List.of("Smith"));
        tracker.recordResult(JAN_1, FetchResult.success(List.of(record("John Smith", "Robert"))));
        tracker.recordResult(JAN_2, FetchResult.failure("timeout"));

        JobSnapshot before = tracker.snapshot();

        assertThatThrownBy(() -> before.recordsByDate().get(JAN_1).add(record("X", "Y")))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> before.recordsByDate().remove(JAN_1))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> before.matchesByDate().clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> before.errorsByDate().get(JAN_2).clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> before.pendingRetryDates().add(JAN_3))
                .isInstanceOf(UnsupportedOperationException.class);

        tracker.recordResult(JAN_1, FetchResult.success(List.of(record("Ann Smith", "Paul"))));
        tracker.recordResult(JAN_2, FetchResult.success(List.of()));
        tracker.recordResult(JAN_3, FetchResult.failure("timeout"));

        assertThat(before.recordsByDate().get(JAN_1)).hasSize(1);
        assertThat(before.matchesByDate().get(JAN_1)).hasSize(1);
        assertThat(before.pendingRetryDates()).containsExactly(JAN_2);
        assertThat(before.totalRequests()).isEqualTo(2);

        JobSnapshot after = tracker.snapshot();
        assertThat(after.recordsByDate().get(JAN_1)).hasSize(2);
        assertThat(after.pendingRetryDates()).containsExactly(JAN_3);
    }

    @Test
    void concurrentResultsForDistinctDatesAreAllCounted() throws Exception {
        List<LocalDate> dates = DateRange.between(JAN_1, LocalDate.of(2024, 1, 20), 31);
        JobTracker tracker = create(dates, List.of("Smith"));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (LocalDate date : dates) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 10; i++) {
                        FetchResult result = i % 3 == 0
                                ? FetchResult.failure("flaky")
                                : FetchResult.success(List.of(record("Smith " + i, "Father")));
                        tracker.recordResult(date, result);
                        tracker.snapshot();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        JobSnapshot snapshot = tracker.snapshot();
        assertThat(snapshot.totalRequests()).isEqualTo(200);
        assertThat(snapshot.pendingRetryDates()).isEmpty();
        for (LocalDate date : dates) {
            List<DeathRecord> records = snapshot.recordsByDate().get(date);
            List<RecordMatch> matches = snapshot.matchesByDate().get(date);
            assertThat(records).hasSize(6);
            assertThat(matches).hasSameSizeAs(records);
            assertThat(snapshot.errorsByDate().get(date)).hasSize(4);
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private JobTracker tracker(List<String> targetNames) {
        return create(List.of(JAN_1, JAN_2, JAN_3), targetNames);
    }

    private JobTracker create(List<LocalDate> dates, List<String> targetNames) {
        return JobTracker.create("job-1", dates, targetNames, "male",
                PollIntervalConfig.everyMinutes(60), matcher, clock);
    }

    private static DeathRecord record(String name, String father) {
        return DeathRecord.builder()
                .name(name)
                .gender("male")
                .dateOfDeath("2023-12-30")
                .fathersName(father)
                .mothersName("Anne")
                .build();
    }
}
