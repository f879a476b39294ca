package com.fintech.pricefeed.util;

import com.fintech.pricefeed.domain.Interval;

/**
 * Time window calculations for trailing candle buckets.
 * Buckets are anchored at {@code now - count * width}, not at epoch boundaries,
 * so the newest bucket always ends at the query time.
 *
 * Thread-safe and stateless - all methods are pure functions.
 */
public final class TimeWindowManager {

    private TimeWindowManager() {
    }

    /**
     * Returns the inclusive start of a trailing window of {@code count} buckets ending at {@code now}.
     *
     * @param nowMs Query time (epoch millis)
     * @param interval Bucket width
     * @param count Number of buckets
     * @return Window start (epoch millis)
     */
    public static long trailingWindowStart(long nowMs, Interval interval, int count) {
        return nowMs - count * interval.toMillis();
    }

    /**
     * Returns the bucket index of a timestamp inside a trailing window,
     * or -1 if the timestamp falls outside {@code [windowStart, windowStart + count * width)}.
     *
     * @param timestamp The timestamp to place
     * @param windowStart Start of bucket 0
     * @param interval Bucket width
     * @param count Number of buckets
     * @return Bucket index in [0, count), or -1
     */
    public static int bucketIndex(long timestamp, long windowStart, Interval interval, int count) {
        if (timestamp < windowStart) {
            return -1;
        }
        long index = (timestamp - windowStart) / interval.toMillis();
        return index < count ? (int) index : -1;
    }

    /**
     * Returns the start of bucket {@code index} in a trailing window.
     */
    public static long bucketStart(long windowStart, Interval interval, int index) {
        return windowStart + index * interval.toMillis();
    }
}
