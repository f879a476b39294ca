package com.fintech.pricefeed.distribution;

import com.fintech.pricefeed.domain.Observation;
import com.fintech.pricefeed.domain.PriceSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InProcessPriceUpdateBus Tests")
class InProcessPriceUpdateBusTest {

    private static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");

    private InProcessPriceUpdateBus bus;

    @BeforeEach
    void setUp() {
        bus = new InProcessPriceUpdateBus(new SimpleMeterRegistry());
    }

    private static Observation observation(String id) {
        return Observation.of(id, BigDecimal.ONE, T0, PriceSource.MANUAL);
    }

    @Test
    @DisplayName("Topic subscribers get only their instrument; global subscribers get all")
    void testTopicAndGlobal() {
        List<String> tkn = new ArrayList<>();
        List<String> all = new ArrayList<>();
        bus.subscribe("TKN", o -> tkn.add(o.instrumentId()));
        bus.subscribeAll(o -> all.add(o.instrumentId()));

        bus.publish(observation("TKN"));
        bus.publish(observation("OTHER"));

        assertThat(tkn).containsExactly("TKN");
        assertThat(all).containsExactly("TKN", "OTHER");
    }

    @Test
    @DisplayName("Cancelled subscription stops delivery")
    void testCancel() {
        List<Observation> received = new ArrayList<>();
        PriceUpdateBus.Subscription subscription = bus.subscribe("TKN", received::add);

        bus.publish(observation("TKN"));
        subscription.cancel();
        subscription.cancel();
        bus.publish(observation("TKN"));

        assertThat(received).hasSize(1);
        assertThat(subscription.isActive()).isFalse();
        assertThat(bus.subscriberCount("TKN")).isZero();
    }

    @Test
    @DisplayName("Topic is dropped with its last subscription")
    void testTopicDroppedWithLastSubscription() {
        PriceUpdateBus.Subscription first = bus.subscribe("TKN", o -> { });
        PriceUpdateBus.Subscription second = bus.subscribe("TKN", o -> { });
        bus.subscribe("OTHER", o -> { });

        first.cancel();
        assertThat(bus.topicCount()).isEqualTo(2);

        second.cancel();
        assertThat(bus.topicCount()).isEqualTo(1);
        assertThat(bus.subscriberCount("TKN")).isZero();

        List<Observation> received = new ArrayList<>();
        bus.subscribe("TKN", received::add);
        bus.publish(observation("TKN"));
        assertThat(received).hasSize(1);
    }

    @Test
    @DisplayName("Failing listener does not prevent delivery to the others")
    void testListenerIsolation() {
        List<Observation> received = new ArrayList<>();
        bus.subscribe("TKN", o -> {
            throw new IllegalStateException("listener bug");
        });
        bus.subscribe("TKN", received::add);
        bus.subscribeAll(received::add);

        bus.publish(observation("TKN"));

        assertThat(received).hasSize(2);
        assertThat(bus.getListenerErrors()).isEqualTo(1);
    }
}
