package com.fintech.pricefeed.domain;

import java.time.Instant;

/**
 * Observability snapshot of the feed. Counts are approximate under concurrent updates.
 *
 * @param watchlistSize Instruments currently polled
 * @param trackedInstruments Instruments with history
 * @param totalHistoryEntries Entries across all histories
 * @param oldestTimestamp Oldest entry across all histories, null when empty
 * @param newestTimestamp Newest entry across all histories, null when empty
 */
public record FeedStats(
    int watchlistSize,
    int trackedInstruments,
    long totalHistoryEntries,
    Instant oldestTimestamp,
    Instant newestTimestamp
) {
}
