package com.fintech.pricefeed.aggregation;

import com.fintech.pricefeed.domain.Candle;
import com.fintech.pricefeed.domain.HistoryEntry;
import com.fintech.pricefeed.domain.Interval;
import com.fintech.pricefeed.util.TimeWindowManager;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds OHLCV candles from a price history snapshot.
 *
 * Stateless: the same history, interval, count and query time always produce the
 * same candles. Buckets without observations are omitted, never zero-filled, so a
 * quiet market shows gaps instead of flat zero-price candles.
 */
@Component
public class CandleAggregator {

    /**
     * Partitions the trailing {@code count * interval} window ending at {@code now} into
     * {@code count} contiguous buckets and returns one candle per non-empty bucket,
     * oldest first.
     *
     * @param instrumentId Instrument the history belongs to
     * @param history Entries in non-decreasing observation order
     * @param interval Bucket width
     * @param count Number of trailing buckets (must be positive)
     * @param now Query time; the newest bucket ends here (exclusive)
     * @return Candles for non-empty buckets, empty if history is empty
     */
    public List<Candle> buildCandles(
            String instrumentId,
            List<HistoryEntry> history,
            Interval interval,
            int count,
            Instant now) {

        Objects.requireNonNull(interval, "Interval cannot be null");
        Objects.requireNonNull(now, "Query time cannot be null");
        if (count < 1) {
            throw new IllegalArgumentException("Candle count must be positive, got " + count);
        }
        if (history == null || history.isEmpty()) {
            return List.of();
        }

        long windowStart = TimeWindowManager.trailingWindowStart(now.toEpochMilli(), interval, count);
        MutableCandle[] buckets = new MutableCandle[count];

        // History is chronological, so the first entry seen per bucket is its open
        // and the last one its close.
        for (HistoryEntry entry : history) {
            int index = TimeWindowManager.bucketIndex(entry.epochMillis(), windowStart, interval, count);
            if (index < 0) {
                continue;
            }
            MutableCandle bucket = buckets[index];
            if (bucket == null) {
                buckets[index] = new MutableCandle(entry);
            } else {
                bucket.update(entry);
            }
        }

        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            MutableCandle bucket = buckets[i];
            if (bucket != null) {
                long bucketStart = TimeWindowManager.bucketStart(windowStart, interval, i);
                candles.add(bucket.toCandle(instrumentId, Instant.ofEpochMilli(bucketStart), interval));
            }
        }
        return candles;
    }

    /**
     * Running OHLCV accumulator for one bucket. Confined to a single call.
     */
    private static final class MutableCandle {

        final BigDecimal open;
        BigDecimal high;
        BigDecimal low;
        BigDecimal close;
        BigDecimal volume;

        MutableCandle(HistoryEntry first) {
            this.open = first.price();
            this.high = first.price();
            this.low = first.price();
            this.close = first.price();
            this.volume = first.volumeOrZero();
        }

        void update(HistoryEntry entry) {
            BigDecimal price = entry.price();
            this.high = high.max(price);
            this.low = low.min(price);
            this.close = price;
            this.volume = volume.add(entry.volumeOrZero());
        }

        Candle toCandle(String instrumentId, Instant bucketStart, Interval interval) {
            return new Candle(instrumentId, open, high, low, close, volume, bucketStart, interval);
        }
    }
}
