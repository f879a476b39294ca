package com.fintech.pricefeed.api;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Human-readable JSON view of the feed counters. The same values are exported to
 * Prometheus at /actuator/prometheus.
 */
@RestController
@RequestMapping("/api/v1/metrics")
public class MetricsController {

    private static final Map<String, String> FEED_GAUGES = feedGauges();

    private final MeterRegistry meterRegistry;

    public MetricsController(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * EXAMPLE RESPONSE:
     * {
     *   "fetch_cycles": 360,
     *   "fetch_skips": 4,
     *   "observations_fetched": 1436,
     *   "adapter_failures": 12,
     *   ...
     *   "candle_requests": { "count": 20, "mean_ms": 0.8, "max_ms": 3.1 }
     * }
     */
    @GetMapping("/feed")
    public Map<String, Object> getFeedMetrics() {
        Map<String, Object> response = new LinkedHashMap<>();

        FEED_GAUGES.forEach((key, meterName) -> {
            Gauge gauge = meterRegistry.find(meterName).gauge();
            if (gauge != null) {
                response.put(key, (long) gauge.value());
            }
        });

        Timer candleTimer = meterRegistry.find("api.candles.request.time").timer();
        if (candleTimer != null) {
            Map<String, Object> timing = new LinkedHashMap<>();
            timing.put("count", candleTimer.count());
            timing.put("mean_ms", round(candleTimer.mean(TimeUnit.MICROSECONDS) / 1000.0));
            timing.put("max_ms", round(candleTimer.max(TimeUnit.MICROSECONDS) / 1000.0));
            response.put("candle_requests", timing);
        }

        return response;
    }

    private static Map<String, String> feedGauges() {
        Map<String, String> gauges = new LinkedHashMap<>();
        gauges.put("fetch_cycles", "price.feed.fetch.cycles");
        gauges.put("fetch_skips", "price.feed.fetch.skips");
        gauges.put("observations_fetched", "price.feed.source.observations");
        gauges.put("adapter_failures", "price.feed.source.failures");
        gauges.put("distribution_accepted", "price.feed.distribution.accepted");
        gauges.put("distribution_rejected", "price.feed.distribution.rejected");
        gauges.put("order_monitor_failures", "price.feed.order.monitor.failures");
        gauges.put("order_monitor_timeouts", "price.feed.order.monitor.timeouts");
        gauges.put("broadcast_delivered", "price.feed.broadcast.delivered");
        gauges.put("broadcast_dropped", "price.feed.broadcast.dropped");
        gauges.put("broadcast_channel_failures", "price.feed.broadcast.channel.failures");
        gauges.put("broadcast_remaining_capacity", "price.feed.broadcast.remaining.capacity");
        gauges.put("stream_clients", "price.feed.stream.clients");
        gauges.put("bus_topics", "price.feed.bus.topics");
        gauges.put("bus_listener_errors", "price.feed.bus.listener.errors");
        gauges.put("janitor_evicted", "price.feed.janitor.evicted");
        gauges.put("history_appended", "price.feed.history.appended");
        gauges.put("history_rejected", "price.feed.history.rejected");
        gauges.put("history_evicted", "price.feed.history.evicted");
        gauges.put("manual_updates", "price.feed.manual.updates");
        return gauges;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
