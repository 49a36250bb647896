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
@Schema(description = "Normal-approximation confidence interval of the expected value")
public class ConfidenceInterval {

    @Schema(description = "Confidence level in percent", example = "95")
    double level;

    @Schema(description = "Lower bound", example = "0.735")
    double lower;

    @Schema(description = "Upper bound", example = "0.748")
    double upper;
}
