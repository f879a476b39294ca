package com.fintech.pricefeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Price Feed Service
 *
 * Real-time market data aggregation and distribution for tokens and prediction markets.
 *
 * Key Features:
 * - Scheduled polling of DexScreener and Polymarket with per-class source fallback
 * - Bounded in-memory price history with retention cleanup
 * - On-demand OHLCV candles (1m to 1d)
 * - Fan-out to order monitoring, live SSE clients and in-process listeners
 * - Prometheus metrics and circuit breakers per source
 *
 * @since 1.0.0
 */
@SpringBootApplication
public class PriceFeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(PriceFeedApplication.class, args);
    }
}
