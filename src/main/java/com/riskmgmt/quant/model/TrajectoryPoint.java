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
@Schema(description = "Simulated probability and impact at a day within the timeframe")
public class TrajectoryPoint {

    @Schema(description = "Day offset from the start of the simulation", example = "9")
    int day;

    @Schema(description = "Mean simulated probability (0-100)", example = "79.4")
    double probability;

    @Schema(description = "Mean simulated impact (0-100)", example = "95.8")
    double impact;
}
