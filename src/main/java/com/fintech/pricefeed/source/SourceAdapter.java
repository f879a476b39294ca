package com.fintech.pricefeed.source;

import com.fintech.pricefeed.domain.Observation;
import com.fintech.pricefeed.domain.PriceSource;
import reactor.core.publisher.Mono;

/**
 * A single external price source.
 *
 * Implementations decode their source-specific payload into an {@link Observation}
 * and never leak the raw response shape. "No data" is an empty Mono; transport
 * or decoding failures are error signals, which the registry treats the same way.
 */
public interface SourceAdapter {

    /** Name used in the priority configuration, e.g. "dexscreener". */
    String name();

    /** Source recorded on produced observations. */
    PriceSource source();

    /**
     * Attempts to fetch one observation.
     *
     * @param instrumentId The instrument to price
     * @return The observation, or an empty Mono if the source has no data for it
     */
    Mono<Observation> fetch(String instrumentId);
}
