package com.certwatch.poller.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "cert-watch")
@Data
public class CertWatchProperties {

    private Registry registry = new Registry();
    private Polling polling = new Polling();
    private Retention retention = new Retention();
    private Output output = new Output();

    @Data
    public static class Registry {
        private String baseUrl = "http://localhost:8090";
        private String searchPath = "/api/death-records";
        private long rateLimitDelayMs = 1000;
        private int connectTimeoutMs = 10_000;
        private int readTimeoutMs = 30_000;
    }

    @Data
    public static class Polling {
        private int defaultIntervalMinutes = 60;
        private int minIntervalMinutes = 1;
        private boolean retryFailedDates = true;
        private int schedulerPoolSize = 4;
        private int maxRangeDays = 3660;
    }

    @Data
    public static class Retention {
        private long stoppedJobTtlHours = 24;
        private String reapCron = "0 */15 * * * *";
    }

    @Data
    public static class Output {
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private boolean includeHeader = true;
        }
    }
}
