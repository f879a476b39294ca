package com.fintech.pricefeed.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.pricefeed.domain.Candle;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Candles in the columnar TradingView format: one array per OHLCV component,
 * times in Unix seconds at bucket start.
 *
 * Example response:
 * {
 *   "s": "ok",
 *   "t": [1760000000, 1760000060],
 *   "o": [0.52, 0.53],
 *   "h": [0.55, 0.53],
 *   "l": [0.52, 0.51],
 *   "c": [0.53, 0.51],
 *   "v": [1200.5, 0]
 * }
 */
public record CandleResponse(
    @JsonProperty("s") String status,
    @JsonProperty("t") List<Long> time,
    @JsonProperty("o") List<BigDecimal> open,
    @JsonProperty("h") List<BigDecimal> high,
    @JsonProperty("l") List<BigDecimal> low,
    @JsonProperty("c") List<BigDecimal> close,
    @JsonProperty("v") List<BigDecimal> volume
) {

    public static CandleResponse fromCandles(List<Candle> candles) {
        int size = candles.size();

        List<Long> time = new ArrayList<>(size);
        List<BigDecimal> open = new ArrayList<>(size);
        List<BigDecimal> high = new ArrayList<>(size);
        List<BigDecimal> low = new ArrayList<>(size);
        List<BigDecimal> close = new ArrayList<>(size);
        List<BigDecimal> volume = new ArrayList<>(size);

        for (Candle candle : candles) {
            time.add(candle.bucketStart().getEpochSecond());
            open.add(candle.open());
            high.add(candle.high());
            low.add(candle.low());
            close.add(candle.close());
            volume.add(candle.volume());
        }

        return new CandleResponse("ok", time, open, high, low, close, volume);
    }

    public static CandleResponse empty() {
        return new CandleResponse("ok", List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
