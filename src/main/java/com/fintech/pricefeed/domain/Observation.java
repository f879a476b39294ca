package com.fintech.pricefeed.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable price sample for one instrument, produced by a source adapter.
 * Adapter-specific payloads are decoded into this type at the adapter boundary.
 *
 * @param instrumentId Token contract address or market id
 * @param price Observed price (never negative)
 * @param volume24h Trailing 24h volume, null when the source does not report it
 * @param priceChange24h Trailing 24h price change, null when the source does not report it
 * @param observedAt Time the sample was taken
 * @param source Source that produced the sample
 */
public record Observation(
    String instrumentId,
    BigDecimal price,
    BigDecimal volume24h,
    BigDecimal priceChange24h,
    Instant observedAt,
    PriceSource source
) {

    public Observation {
        Objects.requireNonNull(instrumentId, "Instrument id cannot be null");
        Objects.requireNonNull(price, "Price cannot be null");
        Objects.requireNonNull(observedAt, "Observation time cannot be null");
        Objects.requireNonNull(source, "Source cannot be null");

        if (instrumentId.isBlank()) {
            throw new IllegalArgumentException("Instrument id cannot be blank");
        }
        if (price.signum() < 0) {
            throw new IllegalArgumentException("Price (" + price + ") cannot be negative");
        }
        if (volume24h != null && volume24h.signum() < 0) {
            throw new IllegalArgumentException("Volume (" + volume24h + ") cannot be negative");
        }
    }

    /** Creates an observation with price only (no volume or change data). */
    public static Observation of(String instrumentId, BigDecimal price, Instant observedAt, PriceSource source) {
        return new Observation(instrumentId, price, null, null, observedAt, source);
    }

    /** Returns the trimmed projection kept in price history. */
    public HistoryEntry toHistoryEntry() {
        return new HistoryEntry(price, volume24h, observedAt);
    }
}
