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
@Schema(description = "Ranked risk treatment recommendation")
public class RiskRecommendation {

    @Schema(example = "REC-RISK-001-MITIGATION")
    String id;

    @Singular
    @Schema(description = "Risks the recommendation targets")
    List<String> riskIds;

    @Schema(example = "MITIGATION")
    RecommendationType type;

    @Schema(example = "HIGH")
    RiskLevel priority;

    @Schema(example = "Mitigate: Ransomware attack on core banking")
    String title;

    @Schema(description = "Estimated cost", example = "120000")
    double estimatedCost;

    @Schema(description = "Implementation time in days", example = "60")
    int implementationTime;

    @Schema(description = "Expected reduction of the targeted exposure (0-1)", example = "0.65")
    double effectiveness;

    String rationale;

    String expectedBenefit;

    @Schema(description = "True when the estimated cost exceeds the configured cap; priority is then CRITICAL")
    boolean exceedsCostCap;
}
