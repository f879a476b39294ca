package com.fintech.pricefeed.distribution;

/**
 * Result of distributing one observation.
 */
public enum DistributionOutcome {
    /** Stored and fanned out. */
    ACCEPTED,
    /** Older than the instrument's latest stored entry; nothing was done. */
    REJECTED
}
