package com.riskmgmt.quant.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
@Schema(description = "Monte Carlo simulation parameters")
public class SimulationParameters {

    public static final String SEVERITY = "severity";
    public static final String LIKELIHOOD = "likelihood";
    public static final String IMPACT = "impact";

    @Schema(description = "Simulation horizon in days (> 0)", example = "90")
    int timeframeDays;

    @Schema(description = "Number of Monte Carlo iterations (> 0, bounded by quant.simulation.max-iterations)", example = "1000")
    int iterations;

    @Singular
    @Schema(description = "Named variable distributions overriding the default model. Recognised names: severity, likelihood, impact")
    Map<String, VariableDistribution> variables;
}
