package com.fintech.pricefeed.storage;

import com.fintech.pricefeed.domain.HistoryEntry;
import com.fintech.pricefeed.domain.Observation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Owner of every instrument's price history and current price.
 * Abstracts the storage mechanism so the distributor and the janitor do not
 * depend on a particular implementation.
 *
 * Implementations must keep the current price and the history tail consistent per
 * instrument: a reader never sees a current price that is missing from the history.
 */
public interface PriceHistoryStore {

    /**
     * Records an observation: overwrites the current price and appends its history entry
     * in one per-instrument step, then trims the head down to the configured maximum.
     *
     * @param observation The accepted observation
     * @return false if the observation is older than the history tail and was not recorded
     */
    boolean append(Observation observation);

    /**
     * Returns every entry for an instrument in chronological order.
     *
     * @param instrumentId The instrument
     * @return Copy of the history, empty if none
     */
    List<HistoryEntry> readRecent(String instrumentId);

    /**
     * Returns the most recent {@code limit} entries in chronological order.
     *
     * @param instrumentId The instrument
     * @param limit Maximum entries to return (must be positive)
     * @return Copy of the newest entries, empty if none
     */
    List<HistoryEntry> readRecent(String instrumentId, int limit);

    /**
     * Removes all entries observed strictly before the cutoff.
     *
     * @param instrumentId The instrument
     * @param cutoff Entries with observedAt < cutoff are removed
     * @return Number of entries removed
     */
    int evictOlderThan(String instrumentId, Instant cutoff);

    /**
     * Applies {@link #evictOlderThan(String, Instant)} to every tracked instrument.
     *
     * @param cutoff Entries with observedAt < cutoff are removed
     * @return Total number of entries removed
     */
    int evictAllOlderThan(Instant cutoff);

    /**
     * Returns the most recent observation for an instrument.
     */
    Optional<Observation> currentPrice(String instrumentId);

    /**
     * Returns the instruments that currently have history.
     */
    Set<String> trackedInstruments();

    /**
     * Returns an approximate summary of all histories without locking the whole store.
     */
    HistorySummary summary();

    /**
     * Aggregate counts over all instrument histories.
     *
     * @param trackedInstruments Instruments with history
     * @param totalEntries Entries across all instruments
     * @param oldest Oldest entry time, null when empty
     * @param newest Newest entry time, null when empty
     */
    record HistorySummary(int trackedInstruments, long totalEntries, Instant oldest, Instant newest) {
    }
}
