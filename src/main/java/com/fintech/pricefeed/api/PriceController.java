package com.fintech.pricefeed.api;

import com.fintech.pricefeed.config.PriceFeedProperties;
import com.fintech.pricefeed.distribution.DistributionOutcome;
import com.fintech.pricefeed.distribution.SseBroadcastChannel;
import com.fintech.pricefeed.domain.Candle;
import com.fintech.pricefeed.domain.HistoryEntry;
import com.fintech.pricefeed.domain.Observation;
import com.fintech.pricefeed.service.PriceFeedService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;

/**
 * REST API for current prices, history, candles and the live price stream.
 */
@RestController
@RequestMapping("/api/v1/prices")
@Validated
@Tag(name = "Prices", description = "Current prices, history, candles and live updates")
public class PriceController {

    private static final Logger log = LoggerFactory.getLogger(PriceController.class);

    private final PriceFeedService priceFeedService;
    private final SseBroadcastChannel broadcastChannel;
    private final MeterRegistry meterRegistry;
    private final int defaultCandleCount;

    public PriceController(
            PriceFeedService priceFeedService,
            SseBroadcastChannel broadcastChannel,
            PriceFeedProperties properties,
            MeterRegistry meterRegistry) {
        this.priceFeedService = priceFeedService;
        this.broadcastChannel = broadcastChannel;
        this.meterRegistry = meterRegistry;
        this.defaultCandleCount = properties.getCandles().getDefaultCount();
    }

    @Operation(summary = "Get the current price of an instrument")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Latest accepted observation"),
        @ApiResponse(
            responseCode = "404",
            description = "No price recorded for the instrument",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/{instrumentId}")
    public ResponseEntity<Observation> getCurrentPrice(
            @Parameter(description = "Token address or market id", example = "0x1234")
            @PathVariable String instrumentId) {
        return priceFeedService.getCurrentPrice(instrumentId)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new InstrumentNotFoundException(instrumentId));
    }

    @Operation(summary = "Get recent price history, oldest first")
    @GetMapping("/{instrumentId}/history")
    public ResponseEntity<List<HistoryEntry>> getHistory(
            @PathVariable String instrumentId,

            @Parameter(description = "Maximum number of most recent entries; all when omitted", example = "100")
            @RequestParam(required = false)
            @Min(value = 1, message = "Limit must be at least 1")
            Integer limit) {
        return ResponseEntity.ok(priceFeedService.getHistory(instrumentId, limit));
    }

    /**
     * GET /api/v1/prices/{instrumentId}/candles
     *
     * Builds candles over the trailing {@code count} intervals ending now.
     * Intervals without observations are left out.
     */
    @Operation(
        summary = "Get OHLCV candles",
        description = """
            Aggregates stored history into candles over the trailing `count` intervals.
            Returns data in TradingView Lightweight Charts compatible format.

            **Supported Intervals:** 1m, 5m, 15m, 1h, 4h, 1d

            **Example Request:**
            ```
            GET /api/v1/prices/0x1234/candles?interval=5m&count=50
            ```
            """
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Candles, oldest first",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = CandleResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "s": "ok",
                          "t": [1760000000, 1760000060],
                          "o": [0.52, 0.53],
                          "h": [0.55, 0.53],
                          "l": [0.52, 0.51],
                          "c": [0.53, 0.51],
                          "v": [1200.5, 0]
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Unsupported interval or count out of range",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/{instrumentId}/candles")
    public ResponseEntity<CandleResponse> getCandles(
            @PathVariable String instrumentId,

            @Parameter(description = "Candle interval: 1m, 5m, 15m, 1h, 4h, 1d", example = "1m")
            @RequestParam(defaultValue = "1m") String interval,

            @Parameter(description = "Number of trailing intervals", example = "100")
            @RequestParam(required = false) Integer count) {

        Timer.Sample sample = Timer.start(meterRegistry);
        String normalized = interval.trim().toLowerCase();
        try {
            int candleCount = count != null ? count : defaultCandleCount;
            List<Candle> candles = priceFeedService.getCandles(instrumentId, normalized, candleCount);

            log.debug("Candle query: instrument={}, interval={}, count={}, results={}",
                    instrumentId, normalized, candleCount, candles.size());

            return ResponseEntity.ok(candles.isEmpty() ? CandleResponse.empty() : CandleResponse.fromCandles(candles));
        } finally {
            sample.stop(meterRegistry.timer("api.candles.request.time", "interval", normalized));
        }
    }

    @Operation(summary = "Push a manual price update", description = "Distributed like a fetched price, with source MANUAL.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Stored and distributed"),
        @ApiResponse(responseCode = "409", description = "Older than the stored history; ignored"),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid price or volume",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @PostMapping(value = "/{instrumentId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PriceUpdateResponse> updatePrice(
            @PathVariable String instrumentId,
            @Valid @RequestBody PriceUpdateRequest request) {

        DistributionOutcome outcome = priceFeedService.updatePrice(
            instrumentId, request.price(), request.volume24h(), request.observedAt());

        PriceUpdateResponse response = new PriceUpdateResponse(instrumentId, outcome);
        return outcome == DistributionOutcome.ACCEPTED
            ? ResponseEntity.ok(response)
            : ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }

    @Operation(
        summary = "Stream live price updates",
        description = "Server-Sent Events; each `price` event carries one observation as JSON. "
            + "Omit `instrument` to receive every instrument."
    )
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(
            @Parameter(description = "Only stream this instrument", example = "0x1234")
            @RequestParam(required = false) String instrument) {
        String instrumentId = instrument == null || instrument.isBlank() ? null : instrument.trim();
        return broadcastChannel.connect(instrumentId);
    }
}
