package com.fintech.pricefeed.domain;

/**
 * Candle granularities served by the aggregator.
 * Each interval carries its short code ("5m") and its width in milliseconds.
 */
public enum Interval {

    M1("1m", 60_000L),
    M5("5m", 300_000L),
    M15("15m", 900_000L),
    H1("1h", 3_600_000L),
    H4("4h", 14_400_000L),
    D1("1d", 86_400_000L);

    private final String code;
    private final long milliseconds;

    Interval(String code, long milliseconds) {
        this.code = code;
        this.milliseconds = milliseconds;
    }

    /** Returns the short code, e.g. "15m". */
    public String code() {
        return code;
    }

    /** Returns interval duration in milliseconds. */
    public long toMillis() {
        return milliseconds;
    }

    /**
     * Parses a short code ("1m", "4h") or an enum name ("M1", "h4"), case-insensitive.
     *
     * @throws IllegalArgumentException if the value is not a supported interval
     */
    public static Interval fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Interval is required");
        }
        String normalized = value.trim();
        for (Interval interval : values()) {
            if (interval.code.equalsIgnoreCase(normalized) || interval.name().equalsIgnoreCase(normalized)) {
                return interval;
            }
        }
        throw new IllegalArgumentException(
            "Unsupported interval '" + value + "'. Allowed: 1m, 5m, 15m, 1h, 4h, 1d");
    }
}
