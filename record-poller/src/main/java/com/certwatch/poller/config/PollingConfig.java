package com.certwatch.poller.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class PollingConfig {

    @Bean
    public RestTemplate registryRestTemplate(RestTemplateBuilder builder, CertWatchProperties properties) {
        CertWatchProperties.Registry registry = properties.getRegistry();
        return builder
                .setConnectTimeout(Duration.ofMillis(registry.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(registry.getReadTimeoutMs()))
                .build();
    }

    /** Runs poll cycles; also picked up by {@code @Scheduled} for the retention reaper. */
    @Bean
    public ThreadPoolTaskScheduler pollingTaskScheduler(CertWatchProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getPolling().getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("poll-cycle-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
