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
@Schema(description = "Loss threshold not exceeded with the given confidence")
public class ValueAtRisk {

    @Schema(description = "Confidence level in percent", example = "99")
    double confidence;

    @Schema(description = "Loss threshold", example = "0.96")
    double value;
}
