package com.fintech.pricefeed.api;

/**
 * No current price exists for the requested instrument.
 */
public class InstrumentNotFoundException extends RuntimeException {

    public InstrumentNotFoundException(String instrumentId) {
        super("No price for instrument '" + instrumentId + "'");
    }
}
