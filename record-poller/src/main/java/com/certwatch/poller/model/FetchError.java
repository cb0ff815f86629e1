package com.certwatch.poller.model;

import java.time.Instant;
import java.time.LocalDate;

/** A failed fetch for one date. Errors are kept as a history and never cleared. */
public record FetchError(LocalDate date, String error, Instant timestamp) {}
