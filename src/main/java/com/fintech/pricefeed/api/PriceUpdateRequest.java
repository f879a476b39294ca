package com.fintech.pricefeed.api;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Body of a manual price update.
 */
@Schema(description = "Manually supplied price sample")
public record PriceUpdateRequest(
    @Schema(description = "Price", example = "0.53", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotNull(message = "Price is required")
    @DecimalMin(value = "0", message = "Price cannot be negative")
    BigDecimal price,

    @Schema(description = "Trailing 24h volume", example = "15000")
    @DecimalMin(value = "0", message = "Volume cannot be negative")
    BigDecimal volume24h,

    @Schema(description = "Sample time; defaults to now, must not be in the future", example = "2026-01-15T10:30:00Z")
    @PastOrPresent(message = "Observation time cannot be in the future")
    Instant observedAt
) {}
