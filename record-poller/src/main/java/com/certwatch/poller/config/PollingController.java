package com.certwatch.poller.config;

import com.certwatch.poller.model.JobSnapshot;
import com.certwatch.poller.model.JobStatusResponse;
import com.certwatch.poller.model.StartPollingRequest;
import com.certwatch.poller.output.RecordCsvExporter;
import com.certwatch.poller.service.JobStatusMapper;
import com.certwatch.poller.service.PollingJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class PollingController {

    private final PollingJobService jobService;
    private final JobStatusMapper statusMapper;
    private final RecordCsvExporter csvExporter;

    // ── Job control ──────────────────────────────────────────────────────────

    /**
     * Start polling a date range.
     *
     * POST /api/start-polling {"startDate":"2024-01-01","endDate":"2024-01-31","searchName":"Smith"}
     */
    @PostMapping("/start-polling")
    public ResponseEntity<Map<String, String>> startPolling(@RequestBody StartPollingRequest request) {
        String jobId = jobService.startJob(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("jobId", jobId, "message", "Polling started"));
    }

    @DeleteMapping("/job/{jobId}")
    public ResponseEntity<Map<String, String>> stopPolling(@PathVariable String jobId) {
        jobService.stopJob(jobId);
        return ResponseEntity.ok(Map.of("jobId", jobId, "message", "Polling stopped"));
    }

    // ── Status ───────────────────────────────────────────────────────────────

    @GetMapping("/job/{jobId}")
    public ResponseEntity<JobStatusResponse> getJob(@PathVariable String jobId) {
        return ResponseEntity.ok(statusMapper.toResponse(jobService.getJob(jobId)));
    }

    @GetMapping("/jobs")
    public ResponseEntity<List<JobStatusResponse.JobSummary>> listJobs() {
        return ResponseEntity.ok(jobService.listJobs().stream()
                .map(statusMapper::toSummary)
                .toList());
    }

    /**
     * Download every record collected so far.
     *
     * GET /api/job/{jobId}/export
     */
    @GetMapping("/job/{jobId}/export")
    public ResponseEntity<String> export(@PathVariable String jobId) {
        JobSnapshot snapshot = jobService.getJob(jobId);
        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv"))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"records_" + jobId + ".csv\"")
                .body(csvExporter.export(snapshot));
    }
}
