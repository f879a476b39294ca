package com.fintech.pricefeed.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable OHLCV candle for one bucket of an instrument's price history.
 * Derived on request, never stored.
 *
 * @param instrumentId Instrument the candle belongs to
 * @param open First price in bucket
 * @param high Maximum price (must be >= open, close, low)
 * @param low Minimum price (must be <= open, close, high)
 * @param close Last price in bucket
 * @param volume Sum of entry volumes in bucket (absent volume counts as zero)
 * @param bucketStart Inclusive start of the bucket
 * @param interval Bucket width
 */
public record Candle(
    String instrumentId,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    Instant bucketStart,
    Interval interval
) {

    /**
     * Validates OHLC invariants: high >= {open,close,low}, low <= {open,close,high}, volume >= 0.
     */
    public Candle {
        Objects.requireNonNull(instrumentId, "Instrument id cannot be null");
        Objects.requireNonNull(open, "Open cannot be null");
        Objects.requireNonNull(high, "High cannot be null");
        Objects.requireNonNull(low, "Low cannot be null");
        Objects.requireNonNull(close, "Close cannot be null");
        Objects.requireNonNull(volume, "Volume cannot be null");
        Objects.requireNonNull(bucketStart, "Bucket start cannot be null");
        Objects.requireNonNull(interval, "Interval cannot be null");

        if (high.compareTo(low) < 0) {
            throw new IllegalArgumentException(
                "High price (" + high + ") cannot be less than low price (" + low + ")"
            );
        }
        if (high.compareTo(open) < 0 || high.compareTo(close) < 0) {
            throw new IllegalArgumentException(
                "High price (" + high + ") must be >= open (" + open + ") and close (" + close + ")"
            );
        }
        if (low.compareTo(open) > 0 || low.compareTo(close) > 0) {
            throw new IllegalArgumentException(
                "Low price (" + low + ") must be <= open (" + open + ") and close (" + close + ")"
            );
        }
        if (volume.signum() < 0) {
            throw new IllegalArgumentException("Volume (" + volume + ") cannot be negative");
        }
    }
}
