package com.certwatch.poller.service;

import com.certwatch.poller.model.DeathRecord;
import com.certwatch.poller.model.FetchError;
import com.certwatch.poller.model.JobSnapshot;
import com.certwatch.poller.model.JobStatusResponse;
import com.certwatch.poller.model.RecordMatch;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Maps a {@link JobSnapshot} to the status payload the web client polls.
 */
@Component
public class JobStatusMapper {

    public JobStatusResponse toResponse(JobSnapshot snapshot) {
        return JobStatusResponse.builder()
                .jobId(snapshot.jobId())
                .status(snapshot.status())
                .searchName(snapshot.targetNames().isEmpty() ? null : snapshot.targetNames().get(0))
                .targetNames(snapshot.targetNames())
                .startTime(snapshot.startTime())
                .lastUpdate(snapshot.lastUpdateTime())
                .totalRequests(snapshot.totalRequests())
                .foundDates(foundDates(snapshot))
                .allRecords(allRecords(snapshot))
                .errors(errors(snapshot))
                .errorDates(List.copyOf(snapshot.pendingRetryDates()))
                .retryingErrors(snapshot.retryingErrors())
                .build();
    }

    public JobStatusResponse.JobSummary toSummary(JobSnapshot snapshot) {
        return new JobStatusResponse.JobSummary(
                snapshot.jobId(), snapshot.status(), snapshot.startTime(), snapshot.totalRequests());
    }

    private List<JobStatusResponse.FoundDate> foundDates(JobSnapshot snapshot) {
        List<JobStatusResponse.FoundDate> found = new ArrayList<>();
        for (Map.Entry<LocalDate, List<RecordMatch>> entry : snapshot.matchesByDate().entrySet()) {
            LocalDate date = entry.getKey();
            List<JobStatusResponse.MatchedRecord> records = entry.getValue().stream()
                    .map(match -> toMatchedRecord(date, match))
                    .toList();
            int totalOnDate = snapshot.recordsByDate().getOrDefault(date, List.of()).size();
            found.add(new JobStatusResponse.FoundDate(date, records, totalOnDate));
        }
        return found;
    }

    private JobStatusResponse.MatchedRecord toMatchedRecord(LocalDate date, RecordMatch match) {
        DeathRecord r = match.record();
        return JobStatusResponse.MatchedRecord.builder()
                .name(r.getName())
                .gender(r.getGender())
                .dateOfDeath(r.getDateOfDeath())
                .fathersName(r.getFathersName())
                .mothersName(r.getMothersName())
                .date(date)
                .matchScore(match.score())
                .matchedField(match.field())
                .matchedPart(match.matchedPart())
                .matchedName(match.targetName())
                .highlights(match.highlights())
                .build();
    }

    private List<JobStatusResponse.DatedRecord> allRecords(JobSnapshot snapshot) {
        List<JobStatusResponse.DatedRecord> all = new ArrayList<>(snapshot.totalRecords());
        snapshot.recordsByDate().forEach((date, records) -> {
            for (DeathRecord r : records) {
                all.add(new JobStatusResponse.DatedRecord(
                        date, r.getName(), r.getGender(), r.getDateOfDeath(), r.getFathersName(), r.getMothersName()));
            }
        });
        return all;
    }

    /** Oldest first, so the client's tail of the list is the latest failures. */
    private List<FetchError> errors(JobSnapshot snapshot) {
        List<FetchError> errors = new ArrayList<>();
        snapshot.errorsByDate().values().forEach(errors::addAll);
        errors.sort(Comparator.comparing(FetchError::timestamp).thenComparing(FetchError::date));
        return errors;
    }
}
