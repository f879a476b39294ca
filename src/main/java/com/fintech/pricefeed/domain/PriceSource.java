package com.fintech.pricefeed.domain;

/**
 * Origin of an observation.
 */
public enum PriceSource {
    POLYMARKET,
    DEXSCREENER,
    MANUAL,
    SIMULATED
}
