package com.riskmgmt.quant.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@AllArgsConstructor
@Schema(description = "Value of the simulated distribution at a percentile rank")
public class PercentileValue {

    @Schema(description = "Percentile rank (0-100)", example = "95")
    double percentile;

    @Schema(description = "Severity at that rank", example = "0.91")
    double value;
}
