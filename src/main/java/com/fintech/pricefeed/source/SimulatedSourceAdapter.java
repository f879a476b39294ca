package com.fintech.pricefeed.source;

import com.fintech.pricefeed.config.PriceFeedProperties;
import com.fintech.pricefeed.domain.Observation;
import com.fintech.pricefeed.domain.PriceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Simulates prices for demos and local runs.
 *
 * Each instrument follows an independent random walk starting at the configured
 * initial price: change = price * volatility * U[-1, 1]. Volume is a random
 * positive amount per sample.
 */
public class SimulatedSourceAdapter implements SourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(SimulatedSourceAdapter.class);

    public static final String NAME = "simulated";

    private final double initialPrice;
    private final double volatility;
    private final Clock clock;
    private final Map<String, Double> currentPrices = new ConcurrentHashMap<>();

    public SimulatedSourceAdapter(PriceFeedProperties.Simulation simulation, Clock clock) {
        this.initialPrice = simulation.getInitialPrice();
        this.volatility = simulation.getVolatility();
        this.clock = clock;
        log.info("Simulated price source enabled: initialPrice={}, volatility={}", initialPrice, volatility);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PriceSource source() {
        return PriceSource.SIMULATED;
    }

    @Override
    public Mono<Observation> fetch(String instrumentId) {
        return Mono.fromSupplier(() -> {
            double price = currentPrices.compute(instrumentId,
                (id, current) -> current == null ? initialPrice : nextPrice(current));
            double volume = ThreadLocalRandom.current().nextDouble(100.0, 10_000.0);
            return new Observation(
                instrumentId,
                BigDecimal.valueOf(price).setScale(8, RoundingMode.HALF_UP),
                BigDecimal.valueOf(volume).setScale(2, RoundingMode.HALF_UP),
                null,
                clock.instant(),
                PriceSource.SIMULATED
            );
        });
    }

    private double nextPrice(double current) {
        double maxChange = current * volatility;
        if (maxChange <= 0) {
            return current;
        }
        double next = current + ThreadLocalRandom.current().nextDouble(-maxChange, maxChange);
        // Prevent negative prices
        return next < 0 ? current : next;
    }
}
