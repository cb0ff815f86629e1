package com.certwatch.poller.model;

import java.util.List;

/**
 * Outcome of fetching one registration date from the registry.
 */
public interface FetchResult {

    static FetchResult success(List<DeathRecord> records) {
        return new Success(records);
    }

    static FetchResult failure(String message) {
        return new Failure(message);
    }

    record Success(List<DeathRecord> records) implements FetchResult {
        public Success {
            records = records == null ? List.of() : List.copyOf(records);
        }
    }

    record Failure(String message) implements FetchResult {
        public Failure {
            message = message == null || message.isBlank() ? "Unknown error" : message;
        }
    }
}
