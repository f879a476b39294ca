package com.fintech.pricefeed.distribution;

import com.fintech.pricefeed.domain.Observation;
import com.fintech.pricefeed.storage.PriceHistoryStore;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fans an accepted observation out to its consumers, in this order:
 * <ol>
 *   <li>history store (write-through)</li>
 *   <li>order-monitoring hook, time-limited</li>
 *   <li>broadcast channel, via the ring buffer</li>
 *   <li>in-process price update bus</li>
 * </ol>
 * Steps for one instrument run under that instrument's lock stripe, so consumers
 * observe its updates in store order. Instruments on other stripes are not blocked. A failure in any
 * step after the store write is logged and counted and never undoes the write.
 */
@Component
public class PriceDistributor {

    private static final Logger log = LoggerFactory.getLogger(PriceDistributor.class);

    private final PriceHistoryStore store;
    private final OrderMonitor orderMonitor;
    private final TimeLimiter orderMonitorTimeLimiter;
    private final ExecutorService orderMonitorExecutor;
    private final DisruptorBroadcastPublisher broadcastPublisher;
    private final PriceUpdateBus bus;

    static final int LOCK_STRIPES = 64;

    private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

    private final AtomicLong distributed = new AtomicLong(0);
    private final AtomicLong rejected = new AtomicLong(0);
    private final AtomicLong hookFailures = new AtomicLong(0);
    private final AtomicLong hookTimeouts = new AtomicLong(0);

    public PriceDistributor(
            PriceHistoryStore store,
            OrderMonitor orderMonitor,
            @Qualifier("orderMonitorTimeLimiter") TimeLimiter orderMonitorTimeLimiter,
            @Qualifier("orderMonitorExecutor") ExecutorService orderMonitorExecutor,
            DisruptorBroadcastPublisher broadcastPublisher,
            PriceUpdateBus bus,
            MeterRegistry meterRegistry) {
        this.store = store;
        this.orderMonitor = orderMonitor;
        this.orderMonitorTimeLimiter = orderMonitorTimeLimiter;
        this.orderMonitorExecutor = orderMonitorExecutor;
        this.broadcastPublisher = broadcastPublisher;
        this.bus = bus;
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new ReentrantLock();
        }

        meterRegistry.gauge("price.feed.distribution.accepted", distributed);
        meterRegistry.gauge("price.feed.distribution.rejected", rejected);
        meterRegistry.gauge("price.feed.order.monitor.failures", hookFailures);
        meterRegistry.gauge("price.feed.order.monitor.timeouts", hookTimeouts);
    }

    /**
     * Stores and fans out one observation.
     *
     * @param observation The observation to distribute
     * @return REJECTED if the store refused it (older than the latest entry), ACCEPTED otherwise
     */
    public DistributionOutcome distribute(Observation observation) {
        ReentrantLock lock = lockFor(observation.instrumentId());
        lock.lock();
        try {
            if (!store.append(observation)) {
                rejected.incrementAndGet();
                log.debug("Rejected out-of-order observation: instrument={}, observedAt={}",
                        observation.instrumentId(), observation.observedAt());
                return DistributionOutcome.REJECTED;
            }

            notifyOrderMonitor(observation);
            broadcastPublisher.tryPublish(observation);
            bus.publish(observation);

            distributed.incrementAndGet();
            return DistributionOutcome.ACCEPTED;
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(String instrumentId) {
        return locks[Math.floorMod(instrumentId.hashCode(), locks.length)];
    }

    private void notifyOrderMonitor(Observation observation) {
        try {
            orderMonitorTimeLimiter.executeFutureSupplier(() -> CompletableFuture.runAsync(
                () -> orderMonitor.onPriceUpdate(observation.instrumentId(), observation.price()),
                orderMonitorExecutor));
        } catch (TimeoutException e) {
            hookTimeouts.incrementAndGet();
            log.warn("Order monitor timed out: instrument={}, price={}",
                    observation.instrumentId(), observation.price());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            hookFailures.incrementAndGet();
            log.warn("Interrupted while notifying order monitor: instrument={}", observation.instrumentId());
        } catch (Exception e) {
            hookFailures.incrementAndGet();
            log.error("Order monitor failed: instrument={}, price={}",
                    observation.instrumentId(), observation.price(), e);
        }
    }

    public long getDistributed() {
        return distributed.get();
    }

    public long getRejected() {
        return rejected.get();
    }

    public long getHookFailures() {
        return hookFailures.get();
    }

    public long getHookTimeouts() {
        return hookTimeouts.get();
    }
}
