package com.fintech.pricefeed.api;

import com.fintech.pricefeed.domain.FeedStats;
import com.fintech.pricefeed.scheduler.FetchCycleReport;
import com.fintech.pricefeed.service.PriceFeedService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;

/**
 * Feed lifecycle and statistics.
 */
@RestController
@RequestMapping("/api/v1/feed")
@Tag(name = "Feed", description = "Scheduler lifecycle and feed statistics")
public class FeedController {

    private static final Logger log = LoggerFactory.getLogger(FeedController.class);
    private static final Duration FETCH_CYCLE_TIMEOUT = Duration.ofSeconds(30);

    private final PriceFeedService priceFeedService;

    public FeedController(PriceFeedService priceFeedService) {
        this.priceFeedService = priceFeedService;
    }

    @Operation(summary = "Get feed statistics")
    @GetMapping("/stats")
    public ResponseEntity<FeedStats> getStats() {
        return ResponseEntity.ok(priceFeedService.getStats());
    }

    @Operation(summary = "Start the fetch and janitor schedules", description = "No-op when already running.")
    @PostMapping("/start")
    public ResponseEntity<FeedStatus> start() {
        priceFeedService.start();
        return ResponseEntity.ok(new FeedStatus(priceFeedService.isRunning()));
    }

    @Operation(summary = "Stop the fetch and janitor schedules", description = "No-op when not running.")
    @PostMapping("/stop")
    public ResponseEntity<FeedStatus> stop() {
        priceFeedService.stop();
        return ResponseEntity.ok(new FeedStatus(priceFeedService.isRunning()));
    }

    @Operation(summary = "Get scheduler state")
    @GetMapping("/status")
    public ResponseEntity<FeedStatus> status() {
        return ResponseEntity.ok(new FeedStatus(priceFeedService.isRunning()));
    }

    @Operation(summary = "Run one fetch cycle now", description = "Returns the per-instrument outcomes.")
    @PostMapping("/fetch")
    public ResponseEntity<FetchCycleReport> fetchNow() {
        FetchCycleReport report = priceFeedService.runFetchCycle().block(FETCH_CYCLE_TIMEOUT);
        log.info("Manual fetch cycle: {} instruments, {} updated", report.size(), report.updated());
        return ResponseEntity.ok(report);
    }

    @Schema(description = "Scheduler state")
    public record FeedStatus(
        @Schema(description = "True while the fetch and janitor schedules run", example = "true")
        boolean running
    ) {}
}
