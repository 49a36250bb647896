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
@Schema(description = "Histogram bin of the simulated distribution")
public class HistogramBin {

    @Schema(description = "Bin midpoint", example = "0.74")
    double value;

    @Schema(description = "Number of samples in the bin", example = "112")
    int frequency;

    @Schema(description = "Cumulative share of samples up to and including this bin", example = "0.52")
    double cumulative;
}
