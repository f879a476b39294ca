package com.fintech.pricefeed.service;

import com.fintech.pricefeed.aggregation.CandleAggregator;
import com.fintech.pricefeed.config.PriceFeedProperties;
import com.fintech.pricefeed.distribution.DistributionOutcome;
import com.fintech.pricefeed.distribution.InProcessPriceUpdateBus;
import com.fintech.pricefeed.distribution.PriceDistributor;
import com.fintech.pricefeed.domain.Candle;
import com.fintech.pricefeed.domain.FeedStats;
import com.fintech.pricefeed.domain.Interval;
import com.fintech.pricefeed.domain.Observation;
import com.fintech.pricefeed.domain.PriceSource;
import com.fintech.pricefeed.scheduler.PriceFeedScheduler;
import com.fintech.pricefeed.scheduler.Watchlist;
import com.fintech.pricefeed.storage.InMemoryPriceHistoryStore;
import com.fintech.pricefeed.storage.PriceHistoryStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("PriceFeedService Tests")
class PriceFeedServiceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private PriceFeedScheduler scheduler;
    private PriceDistributor distributor;
    private InMemoryPriceHistoryStore store;
    private Watchlist watchlist;
    private PriceFeedProperties properties;
    private PriceFeedService service;

    @BeforeEach
    void setUp() {
        scheduler = mock(PriceFeedScheduler.class);
        distributor = mock(PriceDistributor.class);
        store = new InMemoryPriceHistoryStore(100);
        watchlist = new Watchlist(List.of());
        properties = new PriceFeedProperties();
        properties.getCandles().setMaxCount(50);
        service = createService(store);
    }

    private PriceFeedService createService(PriceHistoryStore historyStore) {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        return new PriceFeedService(watchlist, scheduler, historyStore, new CandleAggregator(), distributor,
            new InProcessPriceUpdateBus(registry), properties, Clock.fixed(NOW, ZoneOffset.UTC), registry);
    }

    private void observe(String price, long secondsAgo) {
        store.append(Observation.of("TKN", new BigDecimal(price), NOW.minusSeconds(secondsAgo), PriceSource.MANUAL));
    }

    @Test
    @DisplayName("Candles are built over the trailing window ending now")
    void testGetCandles() {
        observe("1.0", 150);
        observe("1.5", 140);
        observe("1.2", 30);

        List<Candle> candles = service.getCandles("TKN", "1m", 5);

        assertThat(candles).hasSize(2);
        assertThat(candles.get(0).open()).isEqualByComparingTo("1.0");
        assertThat(candles.get(0).close()).isEqualByComparingTo("1.5");
        assertThat(candles.get(1).open()).isEqualByComparingTo("1.2");
        assertThat(candles.get(1).interval()).isEqualTo(Interval.M1);
    }

    @Test
    @DisplayName("Unknown instrument yields no candles and no current price")
    void testUnknownInstrument() {
        assertThat(service.getCandles("NOPE", Interval.H1, 10)).isEmpty();
        assertThat(service.getCurrentPrice("NOPE")).isEmpty();
        assertThat(service.getHistory("NOPE")).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 51})
    @DisplayName("Count outside the allowed range is rejected")
    void testInvalidCount(int count) {
        assertThatThrownBy(() -> service.getCandles("TKN", Interval.M1, count))
            .isInstanceOf(PriceFeedService.ValidationException.class)
            .hasMessageContaining("Count");
    }

    @Test
    @DisplayName("Unknown interval code is a validation error")
    void testInvalidInterval() {
        assertThatThrownBy(() -> service.getCandles("TKN", "7m", 10))
            .isInstanceOf(PriceFeedService.ValidationException.class);
        assertThatThrownBy(() -> service.getCandles("TKN", (Interval) null, 10))
            .isInstanceOf(PriceFeedService.ValidationException.class);
    }

    @Test
    @DisplayName("History honours the limit and rejects non-positive limits")
    void testHistoryLimit() {
        observe("1.0", 30);
        observe("2.0", 20);
        observe("3.0", 10);

        assertThat(service.getHistory("TKN", 2))
            .extracting(entry -> entry.price().toPlainString())
            .containsExactly("2.0", "3.0");
        assertThat(service.getHistory("TKN")).hasSize(3);
        assertThatThrownBy(() -> service.getHistory("TKN", 0))
            .isInstanceOf(PriceFeedService.ValidationException.class);
    }

    @Test
    @DisplayName("Store failure surfaces as a service exception")
    void testStoreFailure() {
        PriceHistoryStore failing = mock(PriceHistoryStore.class);
        when(failing.readRecent(anyString())).thenThrow(new IllegalStateException("store unavailable"));
        when(failing.readRecent(anyString(), anyInt())).thenThrow(new IllegalStateException("store unavailable"));
        PriceFeedService failingService = createService(failing);

        assertThatThrownBy(() -> failingService.getHistory("TKN", 5))
            .isInstanceOf(PriceFeedService.ServiceException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> failingService.getCandles("TKN", Interval.M1, 5))
            .isInstanceOf(PriceFeedService.ServiceException.class);
    }

    @Test
    @DisplayName("Manual update builds a MANUAL observation stamped now")
    void testManualUpdate() {
        when(distributor.distribute(any())).thenReturn(DistributionOutcome.ACCEPTED);

        DistributionOutcome outcome = service.updatePrice("TKN", new BigDecimal("4.2"), null, null);

        ArgumentCaptor<Observation> captor = ArgumentCaptor.forClass(Observation.class);
        verify(distributor).distribute(captor.capture());
        assertThat(outcome).isEqualTo(DistributionOutcome.ACCEPTED);
        assertThat(captor.getValue().source()).isEqualTo(PriceSource.MANUAL);
        assertThat(captor.getValue().observedAt()).isEqualTo(NOW);
        assertThat(captor.getValue().price()).isEqualByComparingTo("4.2");
    }

    @Test
    @DisplayName("Manual update with invalid values never reaches the distributor")
    void testManualUpdateValidation() {
        assertThatThrownBy(() -> service.updatePrice("TKN", new BigDecimal("-1"), null, null))
            .isInstanceOf(PriceFeedService.ValidationException.class);
        assertThatThrownBy(() -> service.updatePrice("TKN", BigDecimal.ONE, new BigDecimal("-5"), null))
            .isInstanceOf(PriceFeedService.ValidationException.class);
        assertThatThrownBy(() -> service.updatePrice(" ", BigDecimal.ONE, null, null))
            .isInstanceOf(PriceFeedService.ValidationException.class);

        verify(distributor, never()).distribute(any());
    }

    @Test
    @DisplayName("Manual update dated after the clock is rejected and later updates still apply")
    void testFutureObservationRejected() {
        when(distributor.distribute(any())).thenReturn(DistributionOutcome.ACCEPTED);

        assertThatThrownBy(() -> service.updatePrice("TKN", BigDecimal.ONE, null, NOW.plusSeconds(1)))
            .isInstanceOf(PriceFeedService.ValidationException.class)
            .hasMessageContaining("future");
        assertThatThrownBy(() -> service.updatePrice(
                Observation.of("TKN", BigDecimal.TEN, NOW.plusSeconds(3600), PriceSource.MANUAL)))
            .isInstanceOf(PriceFeedService.ValidationException.class);
        verify(distributor, never()).distribute(any());

        assertThat(service.updatePrice("TKN", new BigDecimal("2.0"), null, NOW))
            .isEqualTo(DistributionOutcome.ACCEPTED);
        verify(distributor).distribute(any());
    }

    @Test
    @DisplayName("Watchlist changes go through the service")
    void testWatchlist() {
        assertThat(service.watch("TKN")).isTrue();
        assertThat(service.watch("TKN")).isFalse();
        assertThat(service.getWatchlist()).containsExactly("TKN");
        assertThat(service.unwatch("TKN")).isTrue();
        assertThat(service.getWatchlist()).isEmpty();
        assertThatThrownBy(() -> service.watch(""))
            .isInstanceOf(PriceFeedService.ValidationException.class);
    }

    @Test
    @DisplayName("Stats reflect watchlist and stored history")
    void testStats() {
        watchlist.watch("TKN");
        observe("1.0", 60);
        observe("2.0", 10);

        FeedStats stats = service.getStats();

        assertThat(stats.watchlistSize()).isEqualTo(1);
        assertThat(stats.trackedInstruments()).isEqualTo(1);
        assertThat(stats.totalHistoryEntries()).isEqualTo(2);
        assertThat(stats.oldestTimestamp()).isEqualTo(NOW.minusSeconds(60));
        assertThat(stats.newestTimestamp()).isEqualTo(NOW.minusSeconds(10));
    }

    @Test
    @DisplayName("Lifecycle calls are delegated to the scheduler")
    void testLifecycle() {
        properties.getScheduler().setAutoStart(false);
        service.onApplicationReady();
        verify(scheduler, never()).start();

        properties.getScheduler().setAutoStart(true);
        service.onApplicationReady();
        verify(scheduler).start();

        service.shutdown();
        verify(scheduler).stop();
    }
}
