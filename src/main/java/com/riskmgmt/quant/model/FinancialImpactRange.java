package com.riskmgmt.quant.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Historical financial-impact range observed for a risk")
public class FinancialImpactRange {

    @Schema(description = "Lowest observed loss", example = "50000")
    double min;

    @Schema(description = "Highest observed loss", example = "750000")
    double max;

    @Schema(description = "ISO currency code", example = "USD")
    String currency;
}
