package com.riskmgmt.quant.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Request to assess one or more risks")
public class AssessmentRequest {

    @Schema(description = "Risks to assess; two or more enable correlation and cluster analysis")
    List<RiskInput> risks;

    @Schema(description = "Simulation parameters applied to every risk")
    SimulationParameters parameters;

    @Schema(description = "Reporting framework; defaults to COSO", example = "COSO")
    RiskFramework framework;

    @Schema(description = "Seed for reproducible results; defaults to quant.simulation.default-seed", example = "42")
    Long seed;
}
