package com.fintech.pricefeed.distribution;

import com.fintech.pricefeed.domain.Observation;

/**
 * In-process publish/subscribe for "price updated" events.
 * Topics are keyed by instrument id; global subscribers receive every instrument.
 */
public interface PriceUpdateBus {

    /**
     * Subscribes to updates of one instrument.
     *
     * @return Handle used to cancel the subscription
     */
    Subscription subscribe(String instrumentId, PriceUpdateListener listener);

    /**
     * Subscribes to updates of every instrument.
     *
     * @return Handle used to cancel the subscription
     */
    Subscription subscribeAll(PriceUpdateListener listener);

    /**
     * Delivers an observation to the instrument's subscribers and to global subscribers.
     * A failing listener does not prevent delivery to the others.
     */
    void publish(Observation observation);

    /**
     * Cancellable subscription handle.
     */
    interface Subscription {

        /** Stops delivery to the listener. Idempotent. */
        void cancel();

        /** Returns false once cancelled. */
        boolean isActive();
    }
}
