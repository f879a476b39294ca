package com.fintech.pricefeed.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Aggregate of one fetch cycle. A cycle always completes with a report, even when
 * every instrument failed.
 *
 * @param startedAt When the cycle began
 * @param duration How long the cycle took
 * @param results One result per instrument in the watchlist snapshot
 */
public record FetchCycleReport(Instant startedAt, Duration duration, List<FetchResult> results) {

    public FetchCycleReport {
        results = List.copyOf(results);
    }

    public static FetchCycleReport empty(Instant startedAt) {
        return new FetchCycleReport(startedAt, Duration.ZERO, List.of());
    }

    public long count(FetchResult.Outcome outcome) {
        return results.stream().filter(r -> r.outcome() == outcome).count();
    }

    public long updated() {
        return count(FetchResult.Outcome.UPDATED);
    }

    public long skipped() {
        return count(FetchResult.Outcome.NO_DATA);
    }

    public FetchResult.Outcome outcomeOf(String instrumentId) {
        return results.stream()
            .filter(r -> r.instrumentId().equals(instrumentId))
            .map(FetchResult::outcome)
            .findFirst()
            .orElse(null);
    }

    public int size() {
        return results.size();
    }
}
