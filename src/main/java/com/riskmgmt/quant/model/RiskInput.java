package com.riskmgmt.quant.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
@Schema(description = "A qualitative risk record submitted for quantitative analysis")
public class RiskInput {

    @Schema(description = "Unique risk identifier", example = "RISK-001")
    String id;

    @Schema(description = "Risk title", example = "Ransomware attack on core banking")
    String title;

    @Schema(description = "Risk category", example = "CYBERSECURITY")
    RiskCategory category;

    @Schema(description = "Likelihood on a 0-100 scale", example = "78")
    double probability;

    @Schema(description = "Impact on a 0-100 scale", example = "95")
    double impact;

    @Singular
    @Schema(description = "Qualitative factor tags used for correlation", example = "[\"third-party\", \"legacy-systems\"]")
    List<String> factors;

    @Schema(description = "Optional historical financial-impact range")
    FinancialImpactRange financialImpact;

    @Schema(description = "Risk owner, carried through unchanged", example = "ciso@example.com")
    String owner;

    /**
     * Unit severity: probability/100 x impact/100.
     */
    @JsonIgnore
    public double severityScore() {
        return (probability / 100.0) * (impact / 100.0);
    }
}
