package com.certwatch.poller.scheduler;

import com.certwatch.poller.service.PollingJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Evicts stopped jobs once they have been readable for the retention period.
 *
 * Default: every 15 minutes. Override with cert-watch.retention.reap-cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StoppedJobReaper {

    private final PollingJobService jobService;

    @Scheduled(cron = "${cert-watch.retention.reap-cron:0 */15 * * * *}", zone = "UTC")
    public void reap() {
        try {
            int evicted = jobService.evictExpiredJobs();
            if (evicted > 0) {
                log.info("Reaped {} stopped jobs", evicted);
            }
        } catch (Exception e) {
            log.error("Job reaping failed: {}", e.getMessage(), e);
        }
    }
}
