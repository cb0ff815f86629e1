package com.certwatch.poller.service;

import com.certwatch.poller.model.FetchResult;

import java.time.LocalDate;

/**
 * Source of death records for one registration date.
 *
 * Implementations must not throw: transport and parsing problems are reported
 * as {@link FetchResult.Failure}. May be called concurrently for distinct dates.
 */
public interface RecordFetcher {

    /**
     * @param gender optional registry filter, null for all
     */
    FetchResult fetch(LocalDate date, String gender);
}
