package com.riskmgmt.quant.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Immutable outcome of one assessment. Re-running an assessment yields a new report;
 * {@link #toBuilder()} produces a modified copy (e.g. to attach an executive summary).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@Schema(description = "Quantitative risk assessment report")
public class RiskAssessmentReport {

    @Schema(example = "RA-3f9a1c0d2b7e4a61")
    String id;

    @Schema(example = "COSO")
    RiskFramework framework;

    @Schema(description = "Assessment timestamp")
    Instant assessedAt;

    @Schema(description = "SHA-256 fingerprint of risks, parameters, framework and seed")
    String fingerprint;

    @Schema(description = "Seed the assessment was run with", example = "42")
    long seed;

    @Singular
    List<RiskInput> risks;

    @Singular
    @Schema(description = "One simulation per risk, in input order")
    List<SimulationResult> simulations;

    @Schema(description = "Correlation analysis; null for single-risk assessments", nullable = true)
    CorrelationAnalysis correlation;

    @Singular
    List<RiskCluster> clusters;

    @Schema(description = "Systemic indicators; null for single-risk assessments", nullable = true)
    SystemicRiskIndicators systemicRisk;

    @Schema(description = "Narrative summary supplied by an external generator", nullable = true)
    String executiveSummary;

    @Singular
    @Schema(description = "Recommendations, highest priority first")
    List<RiskRecommendation> recommendations;
}
