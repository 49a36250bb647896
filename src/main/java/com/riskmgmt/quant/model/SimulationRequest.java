package com.riskmgmt.quant.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Request to simulate a single risk")
public class SimulationRequest {

    RiskInput risk;

    SimulationParameters parameters;

    @Schema(description = "Seed for reproducible results; defaults to quant.simulation.default-seed", example = "42")
    Long seed;
}
