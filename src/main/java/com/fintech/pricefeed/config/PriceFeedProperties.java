package com.fintech.pricefeed.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Externalized configuration for the price feed.
 * Maps to 'price-feed.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "price-feed")
public class PriceFeedProperties {

    private History history = new History();
    private Scheduler scheduler = new Scheduler();
    private Sources sources = new Sources();
    private Distribution distribution = new Distribution();
    private Candles candles = new Candles();
    private Simulation simulation = new Simulation();

    @Data
    public static class History {
        private int maxEntries = 10_000;
        private long retentionMs = 24L * 60 * 60 * 1000;
    }

    @Data
    public static class Scheduler {
        private long fetchIntervalMs = 10_000L;
        private long janitorIntervalMs = 60L * 60 * 1000;
        private boolean autoStart = true;
        private List<String> watchlist = new ArrayList<>();
    }

    @Data
    public static class Sources {
        private long adapterTimeoutMs = 5_000L;
        private Endpoint dexscreener = new Endpoint("https://api.dexscreener.com");
        private Endpoint polymarket = new Endpoint("https://gamma-api.polymarket.com");
        private Priority priority = new Priority();

        @Data
        public static class Endpoint {
            private String baseUrl;

            public Endpoint() {
            }

            public Endpoint(String baseUrl) {
                this.baseUrl = baseUrl;
            }
        }

        /** Adapter names tried in order, per instrument class. */
        @Data
        public static class Priority {
            private List<String> predictionMarket = new ArrayList<>(List.of("polymarket", "dexscreener"));
            private List<String> token = new ArrayList<>(List.of("dexscreener"));
        }
    }

    @Data
    public static class Distribution {
        private long orderMonitorTimeoutMs = 2_000L;
        private int orderMonitorThreads = 4;
        private Broadcast broadcast = new Broadcast();

        @Data
        public static class Broadcast {
            private int bufferSize = 1024;
            private String waitStrategy = "BLOCKING";
            private long sseTimeoutMs = 0L;  // 0 = never time out
        }
    }

    @Data
    public static class Candles {
        private int defaultCount = 100;
        private int maxCount = 1_000;
    }

    @Data
    public static class Simulation {
        private boolean enabled = false;
        private double volatility = 0.0005;
        private double initialPrice = 1.0;
    }
}
