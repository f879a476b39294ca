package com.fintech.pricefeed.distribution;

import com.fintech.pricefeed.domain.Observation;
import com.fintech.pricefeed.domain.PriceSource;
import com.fintech.pricefeed.storage.InMemoryPriceHistoryStore;
import com.fintech.pricefeed.storage.PriceHistoryStore;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("PriceDistributor Tests")
class PriceDistributorTest {

    private static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");

    private PriceHistoryStore store;
    private OrderMonitor orderMonitor;
    private DisruptorBroadcastPublisher broadcastPublisher;
    private PriceUpdateBus bus;
    private ExecutorService hookExecutor;
    private PriceDistributor distributor;

    @BeforeEach
    void setUp() {
        store = mock(PriceHistoryStore.class);
        when(store.append(any())).thenReturn(true);
        orderMonitor = mock(OrderMonitor.class);
        broadcastPublisher = mock(DisruptorBroadcastPublisher.class);
        bus = mock(PriceUpdateBus.class);
        hookExecutor = Executors.newFixedThreadPool(2);
        distributor = distributor(store, 200);
    }

    @AfterEach
    void tearDown() {
        hookExecutor.shutdownNow();
    }

    private PriceDistributor distributor(PriceHistoryStore historyStore, long hookTimeoutMs) {
        TimeLimiter timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
            .timeoutDuration(Duration.ofMillis(hookTimeoutMs))
            .build());
        return new PriceDistributor(historyStore, orderMonitor, timeLimiter, hookExecutor,
            broadcastPublisher, bus, new SimpleMeterRegistry());
    }

    private static Observation observation(String id, String price, Instant at) {
        return Observation.of(id, new BigDecimal(price), at, PriceSource.MANUAL);
    }

    @Test
    @DisplayName("Store, order monitor, broadcast and bus are called in that order")
    void testFanOutOrder() {
        Observation observation = observation("TKN", "1.23", T0);

        DistributionOutcome outcome = distributor.distribute(observation);

        assertThat(outcome).isEqualTo(DistributionOutcome.ACCEPTED);
        InOrder order = inOrder(store, orderMonitor, broadcastPublisher, bus);
        order.verify(store).append(observation);
        order.verify(orderMonitor).onPriceUpdate("TKN", new BigDecimal("1.23"));
        order.verify(broadcastPublisher).tryPublish(observation);
        order.verify(bus).publish(observation);
        assertThat(distributor.getDistributed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Rejected store write stops the fan-out")
    void testRejected() {
        when(store.append(any())).thenReturn(false);

        DistributionOutcome outcome = distributor.distribute(observation("TKN", "1", T0));

        assertThat(outcome).isEqualTo(DistributionOutcome.REJECTED);
        verifyNoInteractions(orderMonitor, broadcastPublisher, bus);
        assertThat(distributor.getRejected()).isEqualTo(1);
    }

    @Test
    @DisplayName("Order monitor failure keeps the store write and the remaining steps")
    void testHookFailureKeepsStoreWrite() {
        InMemoryPriceHistoryStore realStore = new InMemoryPriceHistoryStore(10);
        PriceDistributor withRealStore = distributor(realStore, 200);
        doThrow(new IllegalStateException("monitor down")).when(orderMonitor).onPriceUpdate(any(), any());
        Observation observation = observation("TKN", "2.5", T0);

        DistributionOutcome outcome = withRealStore.distribute(observation);

        assertThat(outcome).isEqualTo(DistributionOutcome.ACCEPTED);
        assertThat(realStore.currentPrice("TKN")).contains(observation);
        verify(broadcastPublisher).tryPublish(observation);
        verify(bus).publish(observation);
        assertThat(withRealStore.getHookFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("Slow order monitor is abandoned after the time limit")
    void testHookTimeout() {
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(orderMonitor).onPriceUpdate(any(), any());
        PriceDistributor fastTimeout = distributor(store, 50);
        Observation observation = observation("TKN", "1", T0);

        long started = System.nanoTime();
        DistributionOutcome outcome = fastTimeout.distribute(observation);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        release.countDown();

        assertThat(outcome).isEqualTo(DistributionOutcome.ACCEPTED);
        assertThat(elapsedMs).isLessThan(2_000);
        assertThat(fastTimeout.getHookTimeouts()).isEqualTo(1);
        verify(bus).publish(observation);
    }

    @Test
    @DisplayName("Concurrent updates for one instrument reach the bus in store order")
    void testPerInstrumentOrdering() throws InterruptedException {
        InMemoryPriceHistoryStore realStore = new InMemoryPriceHistoryStore(1_000);
        List<Instant> delivered = new CopyOnWriteArrayList<>();
        PriceUpdateBus recordingBus = new InProcessPriceUpdateBus(new SimpleMeterRegistry());
        recordingBus.subscribe("TKN", o -> delivered.add(o.observedAt()));
        PriceDistributor ordered = new PriceDistributor(realStore, orderMonitor,
            TimeLimiter.of(Duration.ofSeconds(1)), hookExecutor, broadcastPublisher, recordingBus,
            new SimpleMeterRegistry());

        ExecutorService writers = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 200; i++) {
            Instant at = T0.plusMillis(i);
            writers.submit(() -> ordered.distribute(observation("TKN", "1", at)));
        }
        writers.shutdown();
        assertThat(writers.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(delivered).isSorted();
        assertThat(delivered).hasSize(realStore.readRecent("TKN").size());
    }

    @Test
    @DisplayName("More instruments than lock stripes are all distributed")
    void testManyInstruments() throws InterruptedException {
        int instruments = PriceDistributor.LOCK_STRIPES * 4;
        ExecutorService writers = Executors.newFixedThreadPool(4);
        for (int i = 0; i < instruments; i++) {
            String id = "TKN-" + i;
            writers.submit(() -> distributor.distribute(observation(id, "1", T0)));
        }
        writers.shutdown();
        assertThat(writers.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(distributor.getDistributed()).isEqualTo(instruments);
        verify(store, times(instruments)).append(any());
    }
}
