package com.fintech.pricefeed.storage;

import com.fintech.pricefeed.config.PriceFeedProperties;
import com.fintech.pricefeed.domain.HistoryEntry;
import com.fintech.pricefeed.domain.Observation;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Heap-backed implementation of PriceHistoryStore.
 *
 * Each instrument owns a bounded deque plus its current price. Mutations run inside
 * {@link ConcurrentMap#compute}, so appends and evictions for one instrument are
 * serialized while different instruments proceed in parallel. Readers lock only the
 * instrument they read.
 */
@Repository
public class InMemoryPriceHistoryStore implements PriceHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPriceHistoryStore.class);

    private final int maxEntries;
    private final ConcurrentMap<String, InstrumentHistory> histories = new ConcurrentHashMap<>();

    private final AtomicLong appendCounter = new AtomicLong(0);
    private final AtomicLong rejectedCounter = new AtomicLong(0);
    private final AtomicLong evictedCounter = new AtomicLong(0);

    @Autowired
    public InMemoryPriceHistoryStore(PriceFeedProperties properties, MeterRegistry meterRegistry) {
        this(properties.getHistory().getMaxEntries());

        meterRegistry.gauge("price.feed.history.appended", appendCounter);
        meterRegistry.gauge("price.feed.history.rejected", rejectedCounter);
        meterRegistry.gauge("price.feed.history.evicted", evictedCounter);
        meterRegistry.gauge("price.feed.history.instruments", histories, ConcurrentMap::size);
    }

    public InMemoryPriceHistoryStore(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Max history entries must be positive, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    @Override
    public boolean append(Observation observation) {
        Objects.requireNonNull(observation, "Observation cannot be null");

        boolean[] accepted = new boolean[1];
        histories.compute(observation.instrumentId(), (id, history) -> {
            InstrumentHistory target = history != null ? history : new InstrumentHistory();
            accepted[0] = target.append(observation, maxEntries);
            // Never publish an empty history for a rejected first observation
            return target.isEmpty() ? null : target;
        });

        if (accepted[0]) {
            appendCounter.incrementAndGet();
        } else {
            rejectedCounter.incrementAndGet();
            log.debug("Rejected out-of-order observation: instrument={}, observedAt={}",
                     observation.instrumentId(), observation.observedAt());
        }
        return accepted[0];
    }

    @Override
    public List<HistoryEntry> readRecent(String instrumentId) {
        return readRecent(instrumentId, Integer.MAX_VALUE);
    }

    @Override
    public List<HistoryEntry> readRecent(String instrumentId, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("History limit must be positive, got " + limit);
        }
        InstrumentHistory history = histories.get(instrumentId);
        return history != null ? history.tail(limit) : List.of();
    }

    @Override
    public int evictOlderThan(String instrumentId, Instant cutoff) {
        Objects.requireNonNull(cutoff, "Cutoff cannot be null");

        int[] removed = new int[1];
        histories.computeIfPresent(instrumentId, (id, history) -> {
            removed[0] = history.evictBefore(cutoff);
            // Dropping the emptied history also drops its current price
            return history.isEmpty() ? null : history;
        });

        if (removed[0] > 0) {
            evictedCounter.addAndGet(removed[0]);
            if (log.isTraceEnabled()) {
                log.trace("Evicted {} entries: instrument={}, cutoff={}", removed[0], instrumentId, cutoff);
            }
        }
        return removed[0];
    }

    @Override
    public int evictAllOlderThan(Instant cutoff) {
        int total = 0;
        for (String instrumentId : histories.keySet()) {
            total += evictOlderThan(instrumentId, cutoff);
        }
        return total;
    }

    @Override
    public Optional<Observation> currentPrice(String instrumentId) {
        InstrumentHistory history = histories.get(instrumentId);
        return history != null ? Optional.ofNullable(history.current()) : Optional.empty();
    }

    @Override
    public Set<String> trackedInstruments() {
        return Set.copyOf(histories.keySet());
    }

    @Override
    public HistorySummary summary() {
        int tracked = 0;
        long total = 0;
        Instant oldest = null;
        Instant newest = null;

        // Reads volatile per-instrument fields only; no instrument is locked
        for (InstrumentHistory history : histories.values()) {
            int size = history.size;
            if (size == 0) {
                continue;
            }
            tracked++;
            total += size;
            Instant first = history.oldest;
            Instant last = history.newest;
            if (first != null && (oldest == null || first.isBefore(oldest))) {
                oldest = first;
            }
            if (last != null && (newest == null || last.isAfter(newest))) {
                newest = last;
            }
        }
        return new HistorySummary(tracked, total, oldest, newest);
    }

    public long getRejectedCount() {
        return rejectedCounter.get();
    }

    public long getEvictedCount() {
        return evictedCounter.get();
    }

    /**
     * One instrument's history and current price. All mutators are synchronized;
     * the volatile summary fields are refreshed on every change for lock-free stats.
     */
    private static final class InstrumentHistory {

        private final ArrayDeque<HistoryEntry> entries = new ArrayDeque<>();
        private Observation current;

        volatile int size;
        volatile Instant oldest;
        volatile Instant newest;

        synchronized boolean append(Observation observation, int maxEntries) {
            HistoryEntry last = entries.peekLast();
            if (last != null && observation.observedAt().isBefore(last.observedAt())) {
                return false;
            }
            entries.addLast(observation.toHistoryEntry());
            current = observation;
            while (entries.size() > maxEntries) {
                entries.pollFirst();
            }
            refreshSummary();
            return true;
        }

        synchronized List<HistoryEntry> tail(int limit) {
            int skip = Math.max(0, entries.size() - limit);
            List<HistoryEntry> result = new ArrayList<>(entries.size() - skip);
            Iterator<HistoryEntry> iterator = entries.iterator();
            for (int i = 0; i < skip; i++) {
                iterator.next();
            }
            while (iterator.hasNext()) {
                result.add(iterator.next());
            }
            return result;
        }

        synchronized int evictBefore(Instant cutoff) {
            int removed = 0;
            // Chronological order makes head-first eviction exact
            while (!entries.isEmpty() && entries.peekFirst().observedAt().isBefore(cutoff)) {
                entries.pollFirst();
                removed++;
            }
            if (entries.isEmpty()) {
                current = null;
            }
            if (removed > 0) {
                refreshSummary();
            }
            return removed;
        }

        synchronized Observation current() {
            return current;
        }

        boolean isEmpty() {
            return size == 0;
        }

        private void refreshSummary() {
            size = entries.size();
            HistoryEntry first = entries.peekFirst();
            HistoryEntry last = entries.peekLast();
            oldest = first != null ? first.observedAt() : null;
            newest = last != null ? last.observedAt() : null;
        }
    }
}
