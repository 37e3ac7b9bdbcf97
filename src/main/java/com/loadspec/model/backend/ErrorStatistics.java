package com.loadspec.model.backend;

import com.loadspec.exception.AiErrorType;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Per-type failure counters kept by a backend adapter.
 *
 * @param counts         Occurrences per error type.
 * @param lastOccurrence Most recent occurrence per error type.
 * @param recentErrors   The latest diagnostic lines, oldest first.
 */
public record ErrorStatistics(Map<AiErrorType, Long> counts,
                              Map<AiErrorType, Instant> lastOccurrence,
                              List<String> recentErrors) {

    public ErrorStatistics {
        counts = Map.copyOf(counts);
        lastOccurrence = Map.copyOf(lastOccurrence);
        recentErrors = List.copyOf(recentErrors);
    }

    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }
}
