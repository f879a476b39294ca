package com.fintech.pricefeed.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * One point of an instrument's price history.
 *
 * @param price Observed price
 * @param volume Volume reported with the observation, null if absent
 * @param observedAt Time the price was observed
 */
public record HistoryEntry(
    BigDecimal price,
    BigDecimal volume,
    Instant observedAt
) {

    public HistoryEntry {
        Objects.requireNonNull(price, "Price cannot be null");
        Objects.requireNonNull(observedAt, "Observation time cannot be null");
    }

    /** Returns volume, treating an absent value as zero. */
    public BigDecimal volumeOrZero() {
        return volume != null ? volume : BigDecimal.ZERO;
    }

    /** Returns observation time as epoch millis. */
    public long epochMillis() {
        return observedAt.toEpochMilli();
    }
}
