package com.fintech.pricefeed.scheduler;

/**
 * Outcome of fetching one instrument during a fetch cycle.
 */
public record FetchResult(String instrumentId, Outcome outcome) {

    public enum Outcome {
        /** An adapter returned data and it was distributed. */
        UPDATED,
        /** Every adapter failed or had nothing; the sample is missed. */
        NO_DATA,
        /** A previous fetch for the instrument had not finished; skipped. */
        IN_FLIGHT,
        /** Data arrived but was older than the stored history. */
        REJECTED
    }

    public static FetchResult of(String instrumentId, Outcome outcome) {
        return new FetchResult(instrumentId, outcome);
    }
}
