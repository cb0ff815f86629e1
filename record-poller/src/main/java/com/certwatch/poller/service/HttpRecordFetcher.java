package com.certwatch.poller.service;

import com.certwatch.poller.model.FetchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * {@link RecordFetcher} backed by the registry HTTP API.
 *
 * Retries happen inside {@link RegistryApiClient}; whatever still fails here
 * becomes a {@link FetchResult.Failure} for the tracker to log and re-queue.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HttpRecordFetcher implements RecordFetcher {

    private final RegistryApiClient client;
    private final DeathRecordMapper mapper;

    @Override
    public FetchResult fetch(LocalDate date, String gender) {
        try {
            return FetchResult.success(mapper.mapAll(client.fetchRecords(date, gender)));
        } catch (Exception e) {
            log.warn("Fetch for {} failed: {}", date, e.getMessage());
            return FetchResult.failure(e.getMessage());
        }
    }
}
