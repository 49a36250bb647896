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
@Schema(description = "Indicators of exposure arising from interconnection between risks")
public class SystemicRiskIndicators {

    @Schema(description = "Likelihood of propagation between correlated risks (0-1)", example = "0.52")
    double contagionRisk;

    @Schema(description = "Share of risks sitting in high-risk clusters (0-1)", example = "0.4")
    double vulnerabilityIndex;

    @Schema(description = "1 - weighted(contagion, vulnerability) (0-1)", example = "0.53")
    double resilience;

    @Schema(description = "Combined cluster risk relative to mean member severity (>= 1)", example = "1.35")
    double amplificationFactor;

    @Singular("riskImportance")
    @Schema(description = "Per-risk importance in the network (0-1)")
    Map<String, Double> systemicImportance;
}
