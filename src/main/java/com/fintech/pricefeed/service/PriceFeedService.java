package com.fintech.pricefeed.service;

import com.fintech.pricefeed.aggregation.CandleAggregator;
import com.fintech.pricefeed.config.PriceFeedProperties;
import com.fintech.pricefeed.distribution.DistributionOutcome;
import com.fintech.pricefeed.distribution.PriceDistributor;
import com.fintech.pricefeed.distribution.PriceUpdateBus;
import com.fintech.pricefeed.distribution.PriceUpdateListener;
import com.fintech.pricefeed.domain.Candle;
import com.fintech.pricefeed.domain.FeedStats;
import com.fintech.pricefeed.domain.HistoryEntry;
import com.fintech.pricefeed.domain.Interval;
import com.fintech.pricefeed.domain.Observation;
import com.fintech.pricefeed.domain.PriceSource;
import com.fintech.pricefeed.scheduler.FetchCycleReport;
import com.fintech.pricefeed.scheduler.PriceFeedScheduler;
import com.fintech.pricefeed.scheduler.Watchlist;
import com.fintech.pricefeed.storage.PriceHistoryStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Public entry point of the price feed.
 *
 * Responsibilities:
 * - Watchlist management and feed lifecycle
 * - Read access to current prices, history and candles
 * - Manual price updates
 * - Input validation and metrics
 *
 * Owned by the application context; there is exactly one per application.
 */
@Service
public class PriceFeedService {

    private static final Logger log = LoggerFactory.getLogger(PriceFeedService.class);

    private final Watchlist watchlist;
    private final PriceFeedScheduler scheduler;
    private final PriceHistoryStore store;
    private final CandleAggregator aggregator;
    private final PriceDistributor distributor;
    private final PriceUpdateBus bus;
    private final PriceFeedProperties properties;
    private final Clock clock;

    private final AtomicLong validationErrors = new AtomicLong(0);
    private final AtomicLong serviceErrors = new AtomicLong(0);
    private final AtomicLong manualUpdates = new AtomicLong(0);

    public PriceFeedService(
            Watchlist watchlist,
            PriceFeedScheduler scheduler,
            PriceHistoryStore store,
            CandleAggregator aggregator,
            PriceDistributor distributor,
            PriceUpdateBus bus,
            PriceFeedProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.watchlist = watchlist;
        this.scheduler = scheduler;
        this.store = store;
        this.aggregator = aggregator;
        this.distributor = distributor;
        this.bus = bus;
        this.properties = properties;
        this.clock = clock;

        meterRegistry.gauge("price.feed.service.validation.errors", validationErrors);
        meterRegistry.gauge("price.feed.service.errors", serviceErrors);
        meterRegistry.gauge("price.feed.manual.updates", manualUpdates);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getScheduler().isAutoStart()) {
            start();
        } else {
            log.info("Price feed auto-start disabled; watching {} instruments", watchlist.size());
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    // Lifecycle

    public void start() {
        scheduler.start();
    }

    public void stop() {
        scheduler.stop();
    }

    public boolean isRunning() {
        return scheduler.isRunning();
    }

    /**
     * Runs one fetch cycle now, independently of the schedule.
     */
    public Mono<FetchCycleReport> runFetchCycle() {
        return scheduler.runFetchCycle();
    }

    // Watchlist

    /**
     * @return true if the instrument was added
     * @throws ValidationException if the id is blank
     */
    public boolean watch(String instrumentId) {
        validateInstrumentId(instrumentId);
        boolean added = watchlist.watch(instrumentId);
        if (added) {
            log.info("Watching {}", instrumentId);
        }
        return added;
    }

    /**
     * Stops polling an instrument. Its history stays readable until the janitor evicts it.
     *
     * @return true if the instrument was watched
     */
    public boolean unwatch(String instrumentId) {
        boolean removed = watchlist.unwatch(instrumentId);
        if (removed) {
            log.info("Stopped watching {}", instrumentId);
        }
        return removed;
    }

    public Set<String> getWatchlist() {
        return watchlist.snapshot();
    }

    // Reads

    public Optional<Observation> getCurrentPrice(String instrumentId) {
        validateInstrumentId(instrumentId);
        return store.currentPrice(instrumentId);
    }

    /** Returns the full history of an instrument, oldest first. */
    public List<HistoryEntry> getHistory(String instrumentId) {
        return getHistory(instrumentId, null);
    }

    /**
     * Returns the most recent entries of an instrument, oldest first.
     *
     * @param limit Maximum entries, or null for all
     * @throws ValidationException if the limit is not positive
     */
    public List<HistoryEntry> getHistory(String instrumentId, Integer limit) {
        validateInstrumentId(instrumentId);
        if (limit != null && limit < 1) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Limit must be positive, got " + limit);
        }

        try {
            return limit == null ? store.readRecent(instrumentId) : store.readRecent(instrumentId, limit);
        } catch (RuntimeException e) {
            serviceErrors.incrementAndGet();
            log.error("History read failed: instrument={}, limit={}", instrumentId, limit, e);
            throw new ServiceException("Failed to read price history", e);
        }
    }

    /**
     * Builds candles over the trailing {@code count} intervals ending now.
     *
     * @throws ValidationException if the interval is missing or the count is out of range
     */
    public List<Candle> getCandles(String instrumentId, Interval interval, int count) {
        validateInstrumentId(instrumentId);
        if (interval == null) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Interval cannot be null");
        }
        int maxCount = properties.getCandles().getMaxCount();
        if (count < 1 || count > maxCount) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Count must be between 1 and " + maxCount + ", got " + count);
        }

        try {
            List<HistoryEntry> history = store.readRecent(instrumentId);
            return aggregator.buildCandles(instrumentId, history, interval, count, clock.instant());
        } catch (RuntimeException e) {
            serviceErrors.incrementAndGet();
            log.error("Candle build failed: instrument={}, interval={}, count={}",
                    instrumentId, interval, count, e);
            throw new ServiceException("Failed to build candles", e);
        }
    }

    /**
     * Same as {@link #getCandles(String, Interval, int)} with the interval given by code ("5m") or name ("M5").
     */
    public List<Candle> getCandles(String instrumentId, String intervalCode, int count) {
        Interval interval;
        try {
            interval = Interval.fromCode(intervalCode);
        } catch (IllegalArgumentException e) {
            validationErrors.incrementAndGet();
            throw new ValidationException(e.getMessage());
        }
        return getCandles(instrumentId, interval, count);
    }

    public FeedStats getStats() {
        PriceHistoryStore.HistorySummary summary = store.summary();
        return new FeedStats(
            watchlist.size(),
            summary.trackedInstruments(),
            summary.totalEntries(),
            summary.oldest(),
            summary.newest());
    }

    // Updates

    /**
     * Distributes an externally supplied observation as if an adapter had produced it.
     *
     * @return REJECTED if the observation is older than the stored history
     * @throws ValidationException if the observation is dated after the service clock
     */
    public DistributionOutcome updatePrice(Observation observation) {
        if (observation == null) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Observation cannot be null");
        }
        Instant now = clock.instant();
        if (observation.observedAt().isAfter(now)) {
            validationErrors.incrementAndGet();
            throw new ValidationException(
                "Observation time " + observation.observedAt() + " is in the future (now " + now + ")");
        }
        DistributionOutcome outcome = distributor.distribute(observation);
        manualUpdates.incrementAndGet();
        log.debug("Manual update {}: instrument={}, price={}",
                outcome, observation.instrumentId(), observation.price());
        return outcome;
    }

    /**
     * Builds a {@link PriceSource#MANUAL} observation and distributes it.
     *
     * @param observedAt Sample time, or null for now
     */
    public DistributionOutcome updatePrice(String instrumentId, BigDecimal price, BigDecimal volume24h, Instant observedAt) {
        validateInstrumentId(instrumentId);
        if (price == null || price.signum() < 0) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Price must be a non-negative number");
        }
        if (volume24h != null && volume24h.signum() < 0) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Volume cannot be negative");
        }
        Instant at = observedAt != null ? observedAt : clock.instant();
        return updatePrice(new Observation(instrumentId, price, volume24h, null, at, PriceSource.MANUAL));
    }

    // Subscriptions

    public PriceUpdateBus.Subscription subscribe(String instrumentId, PriceUpdateListener listener) {
        validateInstrumentId(instrumentId);
        return bus.subscribe(instrumentId, listener);
    }

    public PriceUpdateBus.Subscription subscribeAll(PriceUpdateListener listener) {
        return bus.subscribeAll(listener);
    }

    private void validateInstrumentId(String instrumentId) {
        if (instrumentId == null || instrumentId.isBlank()) {
            validationErrors.incrementAndGet();
            throw new ValidationException("Instrument id cannot be null or blank");
        }
    }

    /**
     * Caller error: bad instrument id, interval, count or price.
     */
    public static class ValidationException extends RuntimeException {
        public ValidationException(String message) {
            super(message);
        }
    }

    /**
     * Service layer exception (wraps storage/aggregation errors).
     */
    public static class ServiceException extends RuntimeException {
        public ServiceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
