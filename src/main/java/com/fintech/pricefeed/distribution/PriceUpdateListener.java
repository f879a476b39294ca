package com.fintech.pricefeed.distribution;

import com.fintech.pricefeed.domain.Observation;

/**
 * In-process reaction to an accepted price update.
 */
@FunctionalInterface
public interface PriceUpdateListener {

    void onPriceUpdate(Observation observation);
}
