package com.fintech.pricefeed.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.pricefeed.domain.Observation;
import com.fintech.pricefeed.domain.PriceSource;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;

/**
 * Prediction-market prices from the Polymarket Gamma API.
 *
 * GET /markets/{id}; the first outcome price (the "Yes" share) is the instrument
 * price. Gamma serializes outcomePrices either as a JSON array or as a string
 * holding a JSON array, so both forms are accepted.
 */
public class PolymarketSourceAdapter extends HttpSourceAdapter {

    public static final String NAME = "polymarket";

    public PolymarketSourceAdapter(WebClient webClient, ObjectMapper objectMapper, Clock clock) {
        super(webClient, objectMapper, clock);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PriceSource source() {
        return PriceSource.POLYMARKET;
    }

    @Override
    public Mono<Observation> fetch(String instrumentId) {
        return getJson("/markets/{id}", instrumentId)
            .flatMap(root -> Mono.justOrEmpty(decode(instrumentId, root)));
    }

    Optional<Observation> decode(String instrumentId, JsonNode market) {
        JsonNode outcomePrices = market.path("outcomePrices");
        if (outcomePrices.isTextual()) {
            outcomePrices = readTree(outcomePrices.asText());
        }
        if (!outcomePrices.isArray() || outcomePrices.isEmpty()) {
            return Optional.empty();
        }

        BigDecimal price = decimal(outcomePrices.get(0));
        if (price == null) {
            return Optional.empty();
        }

        BigDecimal volume = decimal(market.path("volume24hr"));
        if (volume == null) {
            volume = decimal(market.path("volume"));
        }

        return Optional.of(new Observation(
            instrumentId,
            price,
            volume,
            decimal(market.path("oneDayPriceChange")),
            clock.instant(),
            PriceSource.POLYMARKET
        ));
    }
}
