package com.fintech.pricefeed.scheduler;

import com.fintech.pricefeed.config.PriceFeedProperties;
import com.fintech.pricefeed.distribution.DistributionOutcome;
import com.fintech.pricefeed.distribution.PriceDistributor;
import com.fintech.pricefeed.source.SourceAdapterRegistry;
import com.fintech.pricefeed.storage.PriceHistoryStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives the two periodic activities of the feed.
 *
 * <p>Fetch cycle: every {@code fetch-interval}, starting immediately, fetches each watched
 * instrument concurrently through the adapter registry and distributes what comes back.
 * An instrument whose previous fetch is still running is skipped for that cycle.
 *
 * <p>Janitor: every {@code janitor-interval}, evicts history older than the retention
 * window. It has its own thread so a slow fetch cycle never delays it.
 *
 * <p>A tick that throws is logged; the next tick still runs.
 */
@Component
public class PriceFeedScheduler {

    private static final Logger log = LoggerFactory.getLogger(PriceFeedScheduler.class);

    private final Watchlist watchlist;
    private final SourceAdapterRegistry registry;
    private final PriceDistributor distributor;
    private final PriceHistoryStore store;
    private final PriceFeedProperties.Scheduler config;
    private final long retentionMs;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private final AtomicLong cyclesCompleted = new AtomicLong(0);
    private final AtomicLong fetchSkips = new AtomicLong(0);
    private final AtomicLong entriesEvicted = new AtomicLong(0);

    private ScheduledExecutorService executor;

    public PriceFeedScheduler(
            Watchlist watchlist,
            SourceAdapterRegistry registry,
            PriceDistributor distributor,
            PriceHistoryStore store,
            PriceFeedProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.watchlist = watchlist;
        this.registry = registry;
        this.distributor = distributor;
        this.store = store;
        this.config = properties.getScheduler();
        this.retentionMs = properties.getHistory().getRetentionMs();
        this.clock = clock;

        meterRegistry.gauge("price.feed.fetch.cycles", cyclesCompleted);
        meterRegistry.gauge("price.feed.fetch.skips", fetchSkips);
        meterRegistry.gauge("price.feed.janitor.evicted", entriesEvicted);
    }

    public synchronized void start() {
        if (executor != null) {
            log.warn("Price feed scheduler already running, ignoring start");
            return;
        }

        executor = Executors.newScheduledThreadPool(2, new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("price-feed-scheduler-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        });

        executor.scheduleAtFixedRate(this::fetchTick,
                0, config.getFetchIntervalMs(), TimeUnit.MILLISECONDS);
        executor.scheduleAtFixedRate(this::janitorTick,
                config.getJanitorIntervalMs(), config.getJanitorIntervalMs(), TimeUnit.MILLISECONDS);

        log.info("Price feed scheduler started: fetchInterval={}ms, janitorInterval={}ms, retention={}ms",
                config.getFetchIntervalMs(), config.getJanitorIntervalMs(), retentionMs);
    }

    public synchronized void stop() {
        if (executor == null) {
            return;
        }

        log.info("Stopping price feed scheduler...");
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Scheduler threads did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
        log.info("Price feed scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    /**
     * Fetches every instrument of the current watchlist once, concurrently.
     * Completes with a report; never errors because some or all instruments failed.
     */
    public Mono<FetchCycleReport> runFetchCycle() {
        return Mono.defer(() -> {
            Instant startedAt = clock.instant();
            Set<String> instruments = watchlist.snapshot();
            if (instruments.isEmpty()) {
                return Mono.just(FetchCycleReport.empty(startedAt));
            }

            return Flux.fromIterable(instruments)
                .flatMap(this::fetchInstrument)
                .collectList()
                .map(results -> new FetchCycleReport(
                    startedAt, Duration.between(startedAt, clock.instant()), results))
                .doOnNext(this::recordCycle);
        });
    }

    /**
     * Evicts history older than the retention window for every instrument.
     *
     * @return Number of entries removed
     */
    public int runJanitor() {
        Instant cutoff = clock.instant().minusMillis(retentionMs);
        int evicted = store.evictAllOlderThan(cutoff);
        entriesEvicted.addAndGet(evicted);
        if (evicted > 0) {
            log.info("Janitor evicted {} entries older than {}", evicted, cutoff);
        } else {
            log.debug("Janitor found nothing older than {}", cutoff);
        }
        return evicted;
    }

    Mono<FetchResult> fetchInstrument(String instrumentId) {
        return Mono.defer(() -> {
            if (!inFlight.add(instrumentId)) {
                log.debug("Fetch still in flight, skipping {}", instrumentId);
                return Mono.just(FetchResult.of(instrumentId, FetchResult.Outcome.IN_FLIGHT));
            }

            return registry.fetch(instrumentId)
                .publishOn(Schedulers.boundedElastic())
                .map(observation -> distributor.distribute(observation) == DistributionOutcome.ACCEPTED
                    ? FetchResult.of(instrumentId, FetchResult.Outcome.UPDATED)
                    : FetchResult.of(instrumentId, FetchResult.Outcome.REJECTED))
                .defaultIfEmpty(FetchResult.of(instrumentId, FetchResult.Outcome.NO_DATA))
                .onErrorResume(e -> {
                    log.warn("Fetch failed for {}: {}", instrumentId, e.getMessage());
                    return Mono.just(FetchResult.of(instrumentId, FetchResult.Outcome.NO_DATA));
                })
                .doFinally(signal -> inFlight.remove(instrumentId));
        });
    }

    private void recordCycle(FetchCycleReport report) {
        cyclesCompleted.incrementAndGet();
        long skipped = report.skipped();
        fetchSkips.addAndGet(skipped);
        if (skipped > 0) {
            log.debug("Fetch cycle: {} updated, {} without data, {} in flight",
                    report.updated(), skipped, report.count(FetchResult.Outcome.IN_FLIGHT));
        }
    }

    private void fetchTick() {
        try {
            runFetchCycle().subscribe(
                report -> log.trace("Fetch cycle done: {} instruments in {}", report.size(), report.duration()),
                error -> log.error("Fetch cycle failed", error));
        } catch (RuntimeException e) {
            log.error("Fetch tick failed", e);
        }
    }

    private void janitorTick() {
        try {
            runJanitor();
        } catch (RuntimeException e) {
            log.error("Janitor tick failed", e);
        }
    }

    public long getCyclesCompleted() {
        return cyclesCompleted.get();
    }

    public long getFetchSkips() {
        return fetchSkips.get();
    }

    public long getEntriesEvicted() {
        return entriesEvicted.get();
    }
}
