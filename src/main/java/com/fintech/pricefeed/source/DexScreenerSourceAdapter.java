package com.fintech.pricefeed.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.pricefeed.domain.Observation;
import com.fintech.pricefeed.domain.PriceSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;

/**
 * DEX aggregator prices from the DexScreener token endpoint.
 *
 * GET /latest/dex/tokens/{address} returns the pairs trading the token; the first
 * pair is the most liquid and provides price, 24h volume and 24h change.
 */
public class DexScreenerSourceAdapter extends HttpSourceAdapter {

    private static final Logger log = LoggerFactory.getLogger(DexScreenerSourceAdapter.class);

    public static final String NAME = "dexscreener";

    public DexScreenerSourceAdapter(WebClient webClient, ObjectMapper objectMapper, Clock clock) {
        super(webClient, objectMapper, clock);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public PriceSource source() {
        return PriceSource.DEXSCREENER;
    }

    @Override
    public Mono<Observation> fetch(String instrumentId) {
        return getJson("/latest/dex/tokens/{address}", instrumentId)
            .flatMap(root -> Mono.justOrEmpty(decode(instrumentId, root)));
    }

    Optional<Observation> decode(String instrumentId, JsonNode root) {
        JsonNode pairs = root.path("pairs");
        if (!pairs.isArray() || pairs.isEmpty()) {
            log.debug("DexScreener has no pairs for {}", instrumentId);
            return Optional.empty();
        }

        JsonNode pair = pairs.get(0);
        BigDecimal price = decimal(pair.path("priceUsd"));
        if (price == null) {
            return Optional.empty();
        }

        return Optional.of(new Observation(
            instrumentId,
            price,
            decimal(pair.path("volume").path("h24")),
            decimal(pair.path("priceChange").path("h24")),
            clock.instant(),
            PriceSource.DEXSCREENER
        ));
    }
}
