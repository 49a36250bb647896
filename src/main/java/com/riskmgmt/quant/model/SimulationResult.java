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
@Schema(description = "Monte Carlo simulation outcome for a single risk")
public class SimulationResult {

    @Schema(description = "Risk the simulation was run for", example = "RISK-001")
    String riskId;

    @Schema(description = "Number of samples drawn", example = "1000")
    int iterations;

    @Schema(description = "Simulated horizon in days", example = "90")
    int timeframeDays;

    @Schema(description = "Seed the simulation was run with", example = "42")
    long seed;

    @Schema(description = "Sample mean of the simulated severity", example = "0.741")
    double expectedValue;

    @Schema(description = "Sample standard deviation", example = "0.108")
    double standardDeviation;

    @Schema(description = "Sample variance (0 for a single iteration)", example = "0.0117")
    double variance;

    @Schema(description = "5th percentile of simulated severity", example = "0.55")
    double bestCase;

    @Schema(description = "99th percentile of simulated severity", example = "0.97")
    double worstCase;

    @Singular
    @Schema(description = "Percentiles ordered by rank")
    List<PercentileValue> percentiles;

    @Singular
    @Schema(description = "Confidence intervals of the expected value, ordered by level")
    List<ConfidenceInterval> confidenceIntervals;

    @Singular("valueAtRiskEntry")
    @Schema(description = "Value-at-Risk entries ordered by confidence")
    List<ValueAtRisk> valueAtRisk;

    @Singular("exceedance")
    @Schema(description = "Probabilities of exceeding mean, mean+1sd and mean+2sd")
    List<ExceedanceProbability> probabilityOfExceedance;

    @Schema(description = "Distribution shape statistics")
    DistributionStatistics distribution;

    @Singular("trajectoryPoint")
    @Schema(description = "Time-indexed trajectory of probability and impact")
    List<TrajectoryPoint> trajectory;
}
