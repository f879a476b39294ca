package com.fintech.pricefeed.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.pricefeed.domain.PriceSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DexScreenerSourceAdapter Tests")
class DexScreenerSourceAdapterTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private DexScreenerSourceAdapter adapter(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
            .baseUrl("https://dex.test")
            .exchangeFunction(request -> {
                lastRequest.set(request);
                return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
        return new DexScreenerSourceAdapter(webClient, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Uses price, 24h volume and 24h change of the first pair")
    void testFirstPair() {
        String body = """
            {"pairs": [
              {"priceUsd": "1.23", "volume": {"h24": 5000}, "priceChange": {"h24": -2.5}},
              {"priceUsd": "9.99", "volume": {"h24": 1}}
            ]}
            """;

        StepVerifier.create(adapter(HttpStatus.OK, body).fetch("TKN"))
            .assertNext(observation -> {
                assertThat(observation.instrumentId()).isEqualTo("TKN");
                assertThat(observation.price()).isEqualByComparingTo("1.23");
                assertThat(observation.volume24h()).isEqualByComparingTo("5000");
                assertThat(observation.priceChange24h()).isEqualByComparingTo("-2.5");
                assertThat(observation.observedAt()).isEqualTo(NOW);
                assertThat(observation.source()).isEqualTo(PriceSource.DEXSCREENER);
            })
            .verifyComplete();

        assertThat(lastRequest.get().url().getPath()).isEqualTo("/latest/dex/tokens/TKN");
    }

    @Test
    @DisplayName("No pairs means no data")
    void testNoPairs() {
        StepVerifier.create(adapter(HttpStatus.OK, "{\"pairs\": null}").fetch("TKN")).verifyComplete();
        StepVerifier.create(adapter(HttpStatus.OK, "{\"pairs\": []}").fetch("TKN")).verifyComplete();
    }

    @Test
    @DisplayName("Pair without a price means no data; missing volume stays absent")
    void testMissingFields() {
        StepVerifier.create(adapter(HttpStatus.OK, "{\"pairs\": [{\"volume\": {\"h24\": 3}}]}").fetch("TKN"))
            .verifyComplete();

        StepVerifier.create(adapter(HttpStatus.OK, "{\"pairs\": [{\"priceUsd\": \"0.5\"}]}").fetch("TKN"))
            .assertNext(observation -> {
                assertThat(observation.volume24h()).isNull();
                assertThat(observation.priceChange24h()).isNull();
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Server errors and malformed payloads surface as errors")
    void testErrors() {
        StepVerifier.create(adapter(HttpStatus.INTERNAL_SERVER_ERROR, "{}").fetch("TKN"))
            .expectError(WebClientResponseException.class)
            .verify();

        StepVerifier.create(adapter(HttpStatus.OK, "not json").fetch("TKN"))
            .expectError(SourceDataException.class)
            .verify();

        StepVerifier.create(adapter(HttpStatus.OK, "{\"pairs\": [{\"priceUsd\": \"abc\"}]}").fetch("TKN"))
            .expectError(SourceDataException.class)
            .verify();
    }
}
