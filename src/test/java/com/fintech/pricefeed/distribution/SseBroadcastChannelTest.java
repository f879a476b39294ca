package com.fintech.pricefeed.distribution;

import com.fintech.pricefeed.config.PriceFeedProperties;
import com.fintech.pricefeed.domain.Observation;
import com.fintech.pricefeed.domain.PriceSource;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SseBroadcastChannel Tests")
class SseBroadcastChannelTest {

    private SseBroadcastChannel channel;

    @BeforeEach
    void setUp() {
        channel = new SseBroadcastChannel(new PriceFeedProperties(), new SimpleMeterRegistry());
    }

    private static Observation observation(String instrumentId) {
        return Observation.of(instrumentId, BigDecimal.ONE, Instant.parse("2026-01-15T10:00:00Z"), PriceSource.MANUAL);
    }

    @Test
    @DisplayName("Clients are counted per instrument and for all instruments")
    void testConnect() {
        channel.connect("A");
        channel.connect("A");
        channel.connect("B");
        channel.connect(null);

        assertThat(channel.clientCount()).isEqualTo(4);
        assertThat(channel.streamedInstrumentCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Completed clients are dropped on publish and the instrument goes with its last client")
    void testClosedClientsDropped() {
        SseEmitter first = channel.connect("A");
        SseEmitter second = channel.connect("A");

        first.complete();
        channel.publish(observation("A"));

        assertThat(channel.clientCount()).isEqualTo(1);
        assertThat(channel.streamedInstrumentCount()).isEqualTo(1);

        second.complete();
        channel.publish(observation("A"));

        assertThat(channel.clientCount()).isZero();
        assertThat(channel.streamedInstrumentCount()).isZero();
    }

    @Test
    @DisplayName("Completed all-instrument client is dropped on publish")
    void testClosedGlobalClientDropped() {
        SseEmitter emitter = channel.connect(null);
        channel.connect("B");

        emitter.complete();
        channel.publish(observation("A"));

        assertThat(channel.clientCount()).isEqualTo(1);
        assertThat(channel.streamedInstrumentCount()).isEqualTo(1);
    }
}
