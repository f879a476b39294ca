package com.fintech.pricefeed.distribution;

import com.fintech.pricefeed.domain.Observation;

/**
 * Transport that pushes observations to remote live subscribers.
 * Delivery is best-effort and at-most-once; no acknowledgment is expected.
 */
@FunctionalInterface
public interface BroadcastChannel {

    /**
     * Delivers an observation to connected clients.
     *
     * @param observation The observation to push
     */
    void publish(Observation observation);
}
