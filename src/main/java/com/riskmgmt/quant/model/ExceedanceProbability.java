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
@Schema(description = "Share of simulated outcomes above a threshold")
public class ExceedanceProbability {

    @Schema(description = "Severity threshold", example = "0.85")
    double threshold;

    @Schema(description = "Fraction of samples strictly above the threshold", example = "0.16")
    double probability;
}
