package com.riskmgmt.quant.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "Group of correlated risks (always two or more members)")
public class RiskCluster {

    @Schema(example = "CLUSTER-1")
    String id;

    @Schema(example = "Cybersecurity cluster (third-party)")
    String name;

    @Singular
    List<String> riskIds;

    @Singular
    @Schema(description = "Factor tags carried by at least two members, most shared first")
    List<String> commonFactors;

    @Schema(description = "Non-additive combined risk, 1 - prod(1 - severity)", example = "0.89")
    double aggregateRisk;

    @Schema(description = "Most frequent member category", example = "CYBERSECURITY")
    RiskCategory dominantCategory;

    @Schema(description = "Mean correlation over member pairs", example = "0.71")
    double averageCorrelation;

    @Schema(description = "Suggested cluster-level strategy")
    String mitigationStrategy;
}
