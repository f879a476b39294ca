package com.fintech.pricefeed.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Access the interactive API documentation at:
 * - Swagger UI: http://localhost:8080/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI priceFeedOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Price Feed Service API")
                        .description("""
                                Real-time market data aggregation and distribution.

                                **Features:**
                                - Polls DexScreener and Polymarket with per-class source fallback
                                - Bounded per-instrument price history with retention cleanup
                                - On-demand OHLCV candles (1m, 5m, 15m, 1h, 4h, 1d)
                                - Live price stream over Server-Sent Events

                                **Tech Stack:**
                                - Spring WebClient + Project Reactor for concurrent polling
                                - Resilience4j circuit breakers per source
                                - LMAX Disruptor ring buffer for broadcast hand-off
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
