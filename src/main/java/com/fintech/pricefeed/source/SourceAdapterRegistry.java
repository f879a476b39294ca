package com.fintech.pricefeed.source;

import com.fintech.pricefeed.config.PriceFeedProperties;
import com.fintech.pricefeed.domain.InstrumentClass;
import com.fintech.pricefeed.domain.Observation;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Resolves and runs source adapters in priority order.
 *
 * Each instrument class has a fixed, configured adapter order. Adapters are tried
 * lazily and the first one that emits wins; later adapters are never called. Every
 * attempt is bounded by the adapter timeout and guarded by a per-adapter circuit
 * breaker. Failures never propagate: they are logged at debug and count as "no data".
 */
@Component
public class SourceAdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(SourceAdapterRegistry.class);

    private final Map<InstrumentClass, List<SourceAdapter>> priority;
    private final Map<String, CircuitBreaker> circuitBreakers;
    private final Duration adapterTimeout;

    private final AtomicLong adapterFailures = new AtomicLong(0);
    private final AtomicLong observationsFetched = new AtomicLong(0);

    public SourceAdapterRegistry(
            List<SourceAdapter> adapters,
            PriceFeedProperties properties,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MeterRegistry meterRegistry) {
        this.adapterTimeout = Duration.ofMillis(properties.getSources().getAdapterTimeoutMs());

        Map<String, SourceAdapter> byName = new LinkedHashMap<>();
        Map<String, CircuitBreaker> breakers = new LinkedHashMap<>();
        for (SourceAdapter adapter : adapters) {
            byName.put(adapter.name(), adapter);
            CircuitBreaker breaker = circuitBreakerRegistry.circuitBreaker("source-" + adapter.name());
            breaker.getEventPublisher()
                .onStateTransition(event ->
                    log.warn("Source circuit breaker {} state changed: {} -> {}",
                        event.getCircuitBreakerName(),
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState())
                );
            breakers.put(adapter.name(), breaker);
        }
        this.circuitBreakers = Collections.unmodifiableMap(breakers);

        PriceFeedProperties.Sources.Priority configured = properties.getSources().getPriority();
        Map<InstrumentClass, List<SourceAdapter>> resolved = new EnumMap<>(InstrumentClass.class);
        resolved.put(InstrumentClass.PREDICTION_MARKET, resolve(InstrumentClass.PREDICTION_MARKET,
            configured.getPredictionMarket(), byName));
        resolved.put(InstrumentClass.TOKEN, resolve(InstrumentClass.TOKEN, configured.getToken(), byName));
        this.priority = Collections.unmodifiableMap(resolved);

        meterRegistry.gauge("price.feed.source.failures", adapterFailures);
        meterRegistry.gauge("price.feed.source.observations", observationsFetched);

        log.info("Source adapters registered: available={}, predictionMarket={}, token={}",
                byName.keySet(), names(priority.get(InstrumentClass.PREDICTION_MARKET)),
                names(priority.get(InstrumentClass.TOKEN)));
    }

    /**
     * Fetches one observation for an instrument, trying adapters in priority order.
     *
     * @param instrumentId The instrument
     * @return First observation produced, or empty if every adapter had no data or failed
     */
    public Mono<Observation> fetch(String instrumentId) {
        return Flux.fromIterable(adaptersFor(instrumentId))
            .concatMap(adapter -> attempt(adapter, instrumentId))
            .next();
    }

    /**
     * Returns the ordered adapters for an instrument's class.
     */
    public List<SourceAdapter> adaptersFor(String instrumentId) {
        return priority.getOrDefault(InstrumentClass.classify(instrumentId), List.of());
    }

    private Mono<Observation> attempt(SourceAdapter adapter, String instrumentId) {
        CircuitBreaker breaker = circuitBreakers.get(adapter.name());
        return Mono.defer(() -> adapter.fetch(instrumentId))
            .timeout(adapterTimeout)
            .transformDeferred(CircuitBreakerOperator.of(breaker))
            .doOnNext(observation -> {
                observationsFetched.incrementAndGet();
                if (log.isTraceEnabled()) {
                    log.trace("Fetched {} from {}: price={}", instrumentId, adapter.name(), observation.price());
                }
            })
            .onErrorResume(e -> {
                adapterFailures.incrementAndGet();
                log.debug("Source adapter {} failed for {}: {}", adapter.name(), instrumentId, e.toString());
                return Mono.empty();
            });
    }

    private List<SourceAdapter> resolve(
            InstrumentClass instrumentClass,
            List<String> configuredNames,
            Map<String, SourceAdapter> byName) {
        List<SourceAdapter> ordered = new ArrayList<>();
        for (String name : configuredNames) {
            SourceAdapter adapter = byName.get(name);
            if (adapter == null) {
                log.warn("Unknown source adapter '{}' in {} priority, ignoring", name, instrumentClass);
            } else {
                ordered.add(adapter);
            }
        }
        if (ordered.isEmpty()) {
            log.warn("No source adapters available for {} instruments", instrumentClass);
        }
        return List.copyOf(ordered);
    }

    private static List<String> names(List<SourceAdapter> adapters) {
        return adapters.stream().map(SourceAdapter::name).toList();
    }

    /** Returns total adapter attempts that failed (errors, timeouts, open breakers). */
    public long getAdapterFailures() {
        return adapterFailures.get();
    }

    /** Returns total observations produced by adapters. */
    public long getObservationsFetched() {
        return observationsFetched.get();
    }
}
