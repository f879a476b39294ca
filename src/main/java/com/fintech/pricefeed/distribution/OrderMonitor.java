package com.fintech.pricefeed.distribution;

import java.math.BigDecimal;

/**
 * Order-monitoring collaborator notified of every accepted price.
 * Implemented outside the feed (limit/stop order checks).
 */
@FunctionalInterface
public interface OrderMonitor {

    /**
     * Called once per accepted observation, in per-instrument order.
     *
     * @param instrumentId The instrument
     * @param price The new price
     */
    void onPriceUpdate(String instrumentId, BigDecimal price);
}
