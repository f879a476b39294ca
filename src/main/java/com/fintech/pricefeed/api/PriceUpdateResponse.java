package com.fintech.pricefeed.api;

import com.fintech.pricefeed.distribution.DistributionOutcome;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of a manual price update")
public record PriceUpdateResponse(
    @Schema(description = "Instrument id", example = "0x1234")
    String instrumentId,

    @Schema(description = "ACCEPTED, or REJECTED when older than the stored history", example = "ACCEPTED")
    DistributionOutcome outcome
) {}
