package com.certwatch.poller.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Wire shape of {@code GET /api/job/{id}}. Field names are relied on by the web client.
 */
@Value
@Builder
public class JobStatusResponse {

    String jobId;
    JobStatus status;
    String searchName;
    List<String> targetNames;
    Instant startTime;
    Instant lastUpdate;
    long totalRequests;
    List<FoundDate> foundDates;
    List<DatedRecord> allRecords;
    List<FetchError> errors;
    List<LocalDate> errorDates;
    boolean retryingErrors;

    /** Matches found on one registration date. */
    public record FoundDate(LocalDate date, List<MatchedRecord> records, int totalRecordsOnDate) {}

    @Value
    @Builder
    public static class MatchedRecord {
        String name;
        String gender;
        String dateOfDeath;
        String fathersName;
        String mothersName;
        LocalDate date;
        Integer matchScore;
        MatchedField matchedField;
        String matchedPart;
        String matchedName;
        List<HighlightSpan> highlights;
    }

    public record DatedRecord(
            LocalDate date,
            String name,
            String gender,
            String dateOfDeath,
            String fathersName,
            String mothersName
    ) {}

    public record JobSummary(String jobId, JobStatus status, Instant startTime, long totalRequests) {}
}
