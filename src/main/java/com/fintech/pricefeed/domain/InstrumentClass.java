package com.fintech.pricefeed.domain;

/**
 * Instrument families that select the source adapter priority order.
 */
public enum InstrumentClass {

    /** Prediction-market outcome tokens (condition ids, slugged market ids). */
    PREDICTION_MARKET,

    /** Fungible tokens priced on DEX aggregators. */
    TOKEN;

    /**
     * Classifies an instrument id: ids starting with "0x" or containing '-' are
     * prediction-market instruments, everything else is a token.
     */
    public static InstrumentClass classify(String instrumentId) {
        if (instrumentId.startsWith("0x") || instrumentId.contains("-")) {
            return PREDICTION_MARKET;
        }
        return TOKEN;
    }
}
