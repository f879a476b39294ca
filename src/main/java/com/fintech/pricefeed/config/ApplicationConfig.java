package com.fintech.pricefeed.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.pricefeed.distribution.OrderMonitor;
import com.fintech.pricefeed.source.DexScreenerSourceAdapter;
import com.fintech.pricefeed.source.PolymarketSourceAdapter;
import com.fintech.pricefeed.source.SimulatedSourceAdapter;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    private static final Logger log = LoggerFactory.getLogger(ApplicationConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DexScreenerSourceAdapter dexScreenerSourceAdapter(
            @Qualifier("dexScreenerWebClient") WebClient webClient, ObjectMapper objectMapper, Clock clock) {
        return new DexScreenerSourceAdapter(webClient, objectMapper, clock);
    }

    @Bean
    public PolymarketSourceAdapter polymarketSourceAdapter(
            @Qualifier("polymarketWebClient") WebClient webClient, ObjectMapper objectMapper, Clock clock) {
        return new PolymarketSourceAdapter(webClient, objectMapper, clock);
    }

    /**
     * Offline random-walk source. Add "simulated" to a priority list to use it.
     */
    @Bean
    @ConditionalOnProperty(prefix = "price-feed.simulation", name = "enabled", havingValue = "true")
    public SimulatedSourceAdapter simulatedSourceAdapter(PriceFeedProperties properties, Clock clock) {
        return new SimulatedSourceAdapter(properties.getSimulation(), clock);
    }

    @Bean
    public TimeLimiter orderMonitorTimeLimiter(PriceFeedProperties properties) {
        return TimeLimiter.of("order-monitor", TimeLimiterConfig.custom()
            .timeoutDuration(Duration.ofMillis(properties.getDistribution().getOrderMonitorTimeoutMs()))
            .cancelRunningFuture(true)
            .build());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService orderMonitorExecutor(PriceFeedProperties properties) {
        AtomicInteger counter = new AtomicInteger(0);
        ThreadFactory threadFactory = r -> {
            Thread thread = new Thread(r);
            thread.setName("order-monitor-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.getDistribution().getOrderMonitorThreads(), threadFactory);
    }

    /**
     * Placeholder used when no order-monitoring system is wired in.
     */
    @Bean
    @ConditionalOnMissingBean
    public OrderMonitor orderMonitor() {
        return (instrumentId, price) -> log.trace("Price update for order monitor: {} -> {}", instrumentId, price);
    }
}
