package com.certwatch.poller.service;

import com.certwatch.poller.config.CertWatchProperties;
import com.certwatch.poller.model.RegistryRecordDto;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Thin client over the death record registry's search endpoint.
 *
 * The registry is a public service, so a configurable delay is applied before
 * every call (default 1 second). A 429 or 5xx triggers the Resilience4j retry
 * with exponential backoff; anything still failing is thrown to the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RegistryApiClient {

    private final RestTemplate registryRestTemplate;
    private final CertWatchProperties properties;

    /**
     * Fetch every record registered on a date.
     *
     * @param date   registration date
     * @param gender "male" / "female", or null for both
     * @return records (may be empty, never null)
     */
    @Retry(name = "registry")
    public List<RegistryRecordDto> fetchRecords(LocalDate date, String gender) {
        CertWatchProperties.Registry registry = properties.getRegistry();
        UriComponentsBuilder uri = UriComponentsBuilder
                .fromHttpUrl(registry.getBaseUrl() + registry.getSearchPath())
                .queryParam("date", date.toString());
        if (gender != null && !gender.isBlank()) {
            uri.queryParam("gender", gender);
        }
        return callApi(uri.toUriString());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<RegistryRecordDto> callApi(String url) {
        log.debug("Calling registry: {}", url);
        try {
            applyRateLimit();
            RegistryRecordDto[] response = registryRestTemplate.getForObject(url, RegistryRecordDto[].class);
            if (response == null) {
                return Collections.emptyList();
            }
            log.debug("Registry returned {} records for URL: {}", response.length, url);
            return Arrays.asList(response);

        } catch (HttpClientErrorException.NotFound e) {
            // 404 means nothing registered that day
            log.debug("No records (404) for URL: {}", url);
            return Collections.emptyList();

        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Rate limited (429) by registry, backing off");
            sleepMs(5000);
            throw e;
        }
    }

    private void applyRateLimit() {
        sleepMs(properties.getRegistry().getRateLimitDelayMs());
    }

    private void sleepMs(long ms) {
        if (ms <= 0) {
            return;
        }
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
