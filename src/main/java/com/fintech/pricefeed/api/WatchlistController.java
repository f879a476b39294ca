package com.fintech.pricefeed.api;

import com.fintech.pricefeed.service.PriceFeedService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

/**
 * Watchlist management. Every call returns the resulting watchlist.
 */
@RestController
@RequestMapping("/api/v1/watchlist")
@Tag(name = "Watchlist", description = "Instruments polled by the feed")
public class WatchlistController {

    private final PriceFeedService priceFeedService;

    public WatchlistController(PriceFeedService priceFeedService) {
        this.priceFeedService = priceFeedService;
    }

    @Operation(summary = "List watched instruments")
    @GetMapping
    public ResponseEntity<Set<String>> getWatchlist() {
        return ResponseEntity.ok(priceFeedService.getWatchlist());
    }

    @Operation(summary = "Start polling an instrument", description = "Idempotent.")
    @PutMapping("/{instrumentId}")
    public ResponseEntity<Set<String>> watch(
            @Parameter(description = "Token address or market id", example = "0x1234")
            @PathVariable String instrumentId) {
        priceFeedService.watch(instrumentId);
        return ResponseEntity.ok(priceFeedService.getWatchlist());
    }

    @Operation(summary = "Stop polling an instrument", description = "History is kept until retention evicts it.")
    @DeleteMapping("/{instrumentId}")
    public ResponseEntity<Set<String>> unwatch(@PathVariable String instrumentId) {
        priceFeedService.unwatch(instrumentId);
        return ResponseEntity.ok(priceFeedService.getWatchlist());
    }
}
